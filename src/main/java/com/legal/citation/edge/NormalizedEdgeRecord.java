package com.legal.citation.edge;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.legal.citation.core.model.EdgeKind;
import com.legal.citation.core.model.ReferenceEdge;

/**
 * Normalized (v2) edge record. The extractor tag is not part of this layout.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"source", "target", "type", "relation", "evidence", "confidence"})
public record NormalizedEdgeRecord(
        @JsonProperty("source") String source,
        @JsonProperty("target") String target,
        @JsonProperty("type") String type,
        @JsonProperty("relation") String relation,
        @JsonProperty("evidence") String evidence,
        @JsonProperty("confidence") double confidence
) {

    public static final String TYPE = "refs";
    public static final String INTERNAL_RELATION = "internal";
    public static final String EXTERNAL_RELATION = "external";

    public static NormalizedEdgeRecord from(ReferenceEdge edge) {
        return new NormalizedEdgeRecord(edge.from(), edge.to(), TYPE,
                edge.isExternal() ? EXTERNAL_RELATION : INTERNAL_RELATION,
                edge.evidence(), edge.confidence());
    }

    public ReferenceEdge toEdge(String extractorVersion) {
        EdgeKind kind = EXTERNAL_RELATION.equals(relation) ? EdgeKind.EXTERNAL : EdgeKind.INTERNAL;
        return new ReferenceEdge(source, target, kind, evidence, confidence, extractorVersion);
    }
}
