package com.legal.citation.rules;

import com.legal.citation.registry.LawRegistry;

import java.util.Objects;
import java.util.Optional;

/**
 * A linkable law named directly before the citation ({@code 民法第七百九条},
 * {@code 民法（改正前）第二十七条}) takes the citation.
 */
public class ImmediateNamedLawRule extends AbstractCitationRule {

    public static final String NAME = "immediate-named-law";

    private final LawRegistry registry;

    public ImmediateNamedLawRule(LawRegistry registry) {
        super(NAME, 40);
        this.registry = Objects.requireNonNull(registry, "registry is required");
    }

    @Override
    public Optional<Resolution> evaluate(CitationSite site) {
        return site.immediateNamedLaw().map(folder -> registry.isSelf(folder, site.currentLawName())
                ? Resolution.self(getName())
                : Resolution.crossLink(folder, getName()));
    }
}
