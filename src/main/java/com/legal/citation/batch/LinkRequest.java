package com.legal.citation.batch;

import com.legal.citation.core.model.ResolutionContext;

import java.util.Objects;

/**
 * One document of a batch: an identifier for error reporting and the context to resolve.
 */
public record LinkRequest(String documentId, ResolutionContext context) {

    public LinkRequest {
        Objects.requireNonNull(context, "context is required");
        if (documentId == null || documentId.isBlank()) {
            documentId = context.getSourceNodeId();
        }
    }

    public static LinkRequest of(ResolutionContext context) {
        return new LinkRequest(null, context);
    }
}
