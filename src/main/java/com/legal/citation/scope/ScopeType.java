package com.legal.citation.scope;

/**
 * Which kind of law governs a bare citation.
 */
public enum ScopeType {
    /** The law that owns the document. */
    SELF,

    /** A registered, linkable law named earlier in the sentence. */
    NAMED,

    /** A law outside the registry named earlier in the sentence. */
    EXTERNAL,

    /** No scope could be established. */
    NONE
}
