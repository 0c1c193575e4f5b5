package com.legal.citation.rules;

import java.util.Optional;

/**
 * One step of the citation cascade. Rules are evaluated in priority order
 * (lower number first); the first rule returning a verdict decides the citation.
 */
public interface CitationRule {

    /**
     * Returns a verdict for the citation, or empty to let later rules decide.
     */
    Optional<Resolution> evaluate(CitationSite site);

    /**
     * Returns the name of this rule, recorded on every verdict it produces.
     */
    String getName();

    /**
     * Returns the evaluation priority; lower values run first.
     */
    int getPriority();
}
