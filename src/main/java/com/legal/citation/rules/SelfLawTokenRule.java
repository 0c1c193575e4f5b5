package com.legal.citation.rules;

import java.util.Optional;

/**
 * {@code 本法第N条}, {@code この法律第N条、第M条}: the citation belongs to the current law.
 */
public class SelfLawTokenRule extends AbstractCitationRule {

    public static final String NAME = "self-law-token";

    public SelfLawTokenRule() {
        super(NAME, 30);
    }

    @Override
    public Optional<Resolution> evaluate(CitationSite site) {
        return site.selfTokenImmediate()
                ? Optional.of(Resolution.self(getName()))
                : Optional.empty();
    }
}
