package com.legal.citation.batch;

import com.legal.citation.core.model.ReferenceEdge;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a batch run. Documents appear in request order.
 */
public record BatchResult(List<DocumentResult> documents) {

    public BatchResult {
        documents = documents != null ? List.copyOf(documents) : List.of();
    }

    /**
     * All edges of the successful documents, in request order.
     */
    public List<ReferenceEdge> edges() {
        List<ReferenceEdge> edges = new ArrayList<>();
        for (DocumentResult document : documents) {
            if (document.isSuccess()) {
                edges.addAll(document.result().getEdges());
            }
        }
        return edges;
    }

    public List<DocumentResult> failures() {
        return documents.stream().filter(d -> !d.isSuccess()).toList();
    }

    public int totalLinks() {
        return documents.stream()
                .filter(DocumentResult::isSuccess)
                .mapToInt(d -> d.result().getLinkCount())
                .sum();
    }

    /**
     * Returns true if every document was resolved.
     */
    public boolean isSuccess() {
        return documents.stream().allMatch(DocumentResult::isSuccess);
    }

    public boolean hasErrors() {
        return !isSuccess();
    }

    @Override
    public String toString() {
        return "BatchResult{" +
                "documents=" + documents.size() +
                ", links=" + totalLinks() +
                ", edges=" + edges().size() +
                ", errors=" + failures().size() +
                '}';
    }
}
