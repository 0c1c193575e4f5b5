package com.legal.citation.rules;

import com.legal.citation.registry.LawRegistry;
import com.legal.citation.scope.Scope;

import java.util.Objects;
import java.util.Optional;

/**
 * Applies the scope established earlier in the sentence, e.g. the second citation of
 * {@code 民法第一条及び第二条}.
 */
public class SentenceScopeRule extends AbstractCitationRule {

    public static final String NAME = "sentence-scope";

    private final LawRegistry registry;

    public SentenceScopeRule(LawRegistry registry) {
        super(NAME, 60);
        this.registry = Objects.requireNonNull(registry, "registry is required");
    }

    @Override
    public Optional<Resolution> evaluate(CitationSite site) {
        Scope scope = site.scopeResolver().governingLawInWindow(site.window(), site.currentLawName());
        return switch (scope.type()) {
            case SELF -> Optional.of(Resolution.self(getName()));
            case NAMED -> Optional.of(registry.isSelf(scope.lawName(), site.currentLawName())
                    ? Resolution.self(getName())
                    : Resolution.crossLink(scope.lawName(), getName()));
            case EXTERNAL -> Optional.of(Resolution.suppress(getName()));
            case NONE -> Optional.empty();
        };
    }
}
