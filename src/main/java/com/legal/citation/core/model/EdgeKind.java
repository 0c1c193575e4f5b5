package com.legal.citation.core.model;

/**
 * Kind of a reference edge.
 */
public enum EdgeKind {
    /** Target article belongs to a law present in the store. */
    INTERNAL,

    /** Target law could not be confirmed present; the edge points at an external id. */
    EXTERNAL
}
