package com.legal.citation.edge;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.legal.citation.core.model.EdgeKind;
import com.legal.citation.core.model.ReferenceEdge;

/**
 * Flat (v1) edge record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"from", "to", "type", "evidence", "confidence", "source", "kind"})
public record FlatEdgeRecord(
        @JsonProperty("from") String from,
        @JsonProperty("to") String to,
        @JsonProperty("type") String type,
        @JsonProperty("evidence") String evidence,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("source") String source,
        @JsonProperty("kind") String kind
) {

    public static final String TYPE = "refers_to";
    public static final String EXTERNAL_KIND = "external_ref";

    public static FlatEdgeRecord from(ReferenceEdge edge) {
        return new FlatEdgeRecord(edge.from(), edge.to(), TYPE, edge.evidence(), edge.confidence(),
                edge.extractorVersion(), edge.isExternal() ? EXTERNAL_KIND : null);
    }

    public ReferenceEdge toEdge() {
        EdgeKind edgeKind = EXTERNAL_KIND.equals(kind) ? EdgeKind.EXTERNAL : EdgeKind.INTERNAL;
        return new ReferenceEdge(from, to, edgeKind, evidence, confidence, source);
    }
}
