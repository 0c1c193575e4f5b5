package com.legal.citation.api;

import com.legal.citation.core.model.ReferenceEdge;

import java.util.List;
import java.util.Objects;

/**
 * Result of resolving the citations of one text.
 *
 * <p>{@link #getText()} is the input with resolved citations wrapped as wiki links;
 * {@link #getEdges()} holds one edge per linked or external citation, in text order,
 * with self-loops removed.</p>
 */
public final class ResolutionResult {

    private final String text;
    private final List<ReferenceEdge> edges;
    private final List<CitationDecision> decisions;

    public ResolutionResult(String text, List<ReferenceEdge> edges, List<CitationDecision> decisions) {
        this.text = Objects.requireNonNull(text, "text is required");
        this.edges = List.copyOf(edges);
        this.decisions = List.copyOf(decisions);
    }

    public String getText() {
        return text;
    }

    public List<ReferenceEdge> getEdges() {
        return edges;
    }

    /**
     * Per-citation decisions, in text order.
     */
    public List<CitationDecision> getDecisions() {
        return decisions;
    }

    public int getLinkCount() {
        return (int) decisions.stream().filter(CitationDecision::isLinked).count();
    }

    @Override
    public String toString() {
        return "ResolutionResult{" +
                "citations=" + decisions.size() +
                ", links=" + getLinkCount() +
                ", edges=" + edges.size() +
                '}';
    }
}
