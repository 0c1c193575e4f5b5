package com.legal.citation.rules;

import java.util.Optional;

/**
 * Suppresses a bare citation when an external law is mentioned earlier in the same
 * sentence outside parentheses or quotations.
 */
public class SentenceExternalCooccurrenceRule extends AbstractCitationRule {

    public static final String NAME = "sentence-external-cooccurrence";

    public SentenceExternalCooccurrenceRule() {
        super(NAME, 70);
    }

    @Override
    public Optional<Resolution> evaluate(CitationSite site) {
        return site.scopeResolver().externalLawInSentence(site.window(), site.currentLawName())
                ? Optional.of(Resolution.suppress(getName()))
                : Optional.empty();
    }
}
