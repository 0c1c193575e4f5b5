package com.legal.citation.rules;

import java.util.Objects;

/**
 * Verdict of a {@link CitationRule}.
 *
 * @param type    the outcome
 * @param lawName target folder for {@link ResolutionType#CROSS_LINK}, law name for
 *                {@link ResolutionType#EXTERNAL_EDGE}, null otherwise
 * @param rule    name of the rule that produced the verdict
 */
public record Resolution(ResolutionType type, String lawName, String rule) {

    public Resolution {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(rule, "rule is required");
        if ((type == ResolutionType.CROSS_LINK || type == ResolutionType.EXTERNAL_EDGE) && lawName == null) {
            throw new IllegalArgumentException(type + " requires a law name");
        }
    }

    public static Resolution self(String rule) {
        return new Resolution(ResolutionType.SELF, null, rule);
    }

    public static Resolution crossLink(String lawName, String rule) {
        return new Resolution(ResolutionType.CROSS_LINK, lawName, rule);
    }

    public static Resolution externalEdge(String lawName, String rule) {
        return new Resolution(ResolutionType.EXTERNAL_EDGE, lawName, rule);
    }

    public static Resolution suppress(String rule) {
        return new Resolution(ResolutionType.SUPPRESS, null, rule);
    }

    public boolean isLinked() {
        return type == ResolutionType.SELF || type == ResolutionType.CROSS_LINK;
    }
}
