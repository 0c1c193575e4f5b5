package com.legal.citation.rules;

import com.legal.citation.registry.LawRegistry;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In amendment fragments, {@code 第N条の規定による} without a law prefix refers to an
 * article of the amending act rather than the amended law; such citations are left alone.
 */
public class AmendmentSelfNumberingGuardRule extends AbstractCitationRule {

    public static final String NAME = "amendment-self-numbering-guard";

    private static final List<String> GUARDED_SUFFIXES = List.of("の規定による", "の規定に");

    private final LawRegistry registry;
    private final int lookbehind;
    private final int lookahead;

    public AmendmentSelfNumberingGuardRule(LawRegistry registry, int lookbehind, int lookahead) {
        super(NAME, 20);
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.lookbehind = lookbehind;
        this.lookahead = lookahead;
    }

    @Override
    public Optional<Resolution> evaluate(CitationSite site) {
        if (!site.context().isAmendmentFragment()) {
            return Optional.empty();
        }
        String following = site.following(lookahead);
        boolean guarded = GUARDED_SUFFIXES.stream().anyMatch(following::startsWith);
        if (!guarded) {
            return Optional.empty();
        }
        if (site.selfTokenImmediate() || site.immediateNamedLaw().isPresent() || namesCurrentLaw(site)) {
            return Optional.empty();
        }
        return Optional.of(Resolution.suppress(getName()));
    }

    private boolean namesCurrentLaw(CitationSite site) {
        return ExplicitActNumberRule.findActLawName(site.preceding(lookbehind))
                .map(name -> registry.resolveAlias(name).orElse(name))
                .filter(name -> registry.isSelf(name, site.currentLawName()))
                .isPresent();
    }
}
