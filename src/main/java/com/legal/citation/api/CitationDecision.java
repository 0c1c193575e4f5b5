package com.legal.citation.api;

import com.legal.citation.core.model.CitationOccurrence;
import com.legal.citation.core.model.ReferenceEdge;
import com.legal.citation.rules.Resolution;

import java.util.Objects;
import java.util.Optional;

/**
 * What was done with one citation: the verdict, the link target written into the text
 * (if any) and the edge emitted (if any).
 *
 * @param occurrence the citation
 * @param resolution verdict of the rule cascade
 * @param linkTarget vault-relative path the citation was linked to, or null
 * @param edge       emitted edge, or null when none was emitted
 */
public record CitationDecision(
        CitationOccurrence occurrence,
        Resolution resolution,
        String linkTarget,
        ReferenceEdge edge
) {

    public CitationDecision {
        Objects.requireNonNull(occurrence, "occurrence is required");
        Objects.requireNonNull(resolution, "resolution is required");
    }

    public boolean isLinked() {
        return linkTarget != null;
    }

    public Optional<ReferenceEdge> getEdge() {
        return Optional.ofNullable(edge);
    }
}
