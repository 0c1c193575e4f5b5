package com.legal.citation.scope;

/**
 * A boundary-checked occurrence of a law name inside a scope window.
 *
 * @param name       the law name as listed (alias or canonical)
 * @param start      offset of the name in the window
 * @param end        offset just past the name's trailing context: past {@code 第} for the
 *                   prefix form, the window length for the suffix form
 * @param suffixForm true when the name (plus separator) ends the window
 */
public record LawNameMatch(String name, int start, int end, boolean suffixForm) {
}
