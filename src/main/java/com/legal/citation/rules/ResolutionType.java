package com.legal.citation.rules;

/**
 * Outcome of the citation rule cascade.
 */
public enum ResolutionType {
    /** Link and edge into the current law. */
    SELF,

    /** Link and edge into another law of the store. */
    CROSS_LINK,

    /** No link; a single edge to an external id. */
    EXTERNAL_EDGE,

    /** Text left untouched, nothing emitted. */
    SUPPRESS
}
