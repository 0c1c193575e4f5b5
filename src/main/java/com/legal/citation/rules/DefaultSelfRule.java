package com.legal.citation.rules;

import java.util.Optional;

/**
 * Fallback: a bare citation refers to the current law.
 */
public class DefaultSelfRule extends AbstractCitationRule {

    public static final String NAME = "default-self";

    public DefaultSelfRule() {
        super(NAME, 1000);
    }

    @Override
    public Optional<Resolution> evaluate(CitationSite site) {
        return Optional.of(Resolution.self(getName()));
    }
}
