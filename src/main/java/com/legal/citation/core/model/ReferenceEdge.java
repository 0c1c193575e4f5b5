package com.legal.citation.core.model;

import java.util.Objects;

/**
 * A directed "refers to" edge between an article node and the article it cites.
 *
 * @param from             node id of the citing article
 * @param to               node id of the cited article, or an {@code external:} id
 * @param kind             internal or external
 * @param evidence         the literal citation text the edge was derived from
 * @param confidence       extractor confidence in [0, 1]
 * @param extractorVersion identifier of the extractor that produced the edge
 */
public record ReferenceEdge(
        String from,
        String to,
        EdgeKind kind,
        String evidence,
        double confidence,
        String extractorVersion
) {

    public ReferenceEdge {
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(evidence, "evidence is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }

    public static ReferenceEdge internal(String from, String to, String evidence,
                                         double confidence, String extractorVersion) {
        return new ReferenceEdge(from, to, EdgeKind.INTERNAL, evidence, confidence, extractorVersion);
    }

    public static ReferenceEdge external(String from, String to, String evidence,
                                         double confidence, String extractorVersion) {
        return new ReferenceEdge(from, to, EdgeKind.EXTERNAL, evidence, confidence, extractorVersion);
    }

    public boolean isExternal() {
        return kind == EdgeKind.EXTERNAL;
    }

    public boolean isSelfLoop() {
        return from.equals(to);
    }
}
