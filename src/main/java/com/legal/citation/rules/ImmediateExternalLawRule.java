package com.legal.citation.rules;

import java.util.Optional;

/**
 * A law outside the store named directly before the citation: nothing is linked.
 */
public class ImmediateExternalLawRule extends AbstractCitationRule {

    public static final String NAME = "immediate-external-law";

    public ImmediateExternalLawRule() {
        super(NAME, 50);
    }

    @Override
    public Optional<Resolution> evaluate(CitationSite site) {
        return site.scopeResolver()
                .immediateExternalLaw(site.window(), site.currentLawName())
                .map(law -> Resolution.suppress(getName()));
    }
}
