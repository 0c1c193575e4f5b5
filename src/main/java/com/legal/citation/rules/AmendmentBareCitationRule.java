package com.legal.citation.rules;

import java.util.Optional;

/**
 * Bare citations inside amendment fragments are not attributed to the current law.
 */
public class AmendmentBareCitationRule extends AbstractCitationRule {

    public static final String NAME = "amendment-bare-citation";

    public AmendmentBareCitationRule() {
        super(NAME, 80);
    }

    @Override
    public Optional<Resolution> evaluate(CitationSite site) {
        return site.context().isAmendmentFragment()
                ? Optional.of(Resolution.suppress(getName()))
                : Optional.empty();
    }
}
