package com.legal.citation.batch;

import com.legal.citation.api.ResolutionResult;

import java.util.Objects;

/**
 * Outcome of one document of a batch: either a result or the error that prevented it.
 */
public record DocumentResult(String documentId, ResolutionResult result, String error) {

    public DocumentResult {
        Objects.requireNonNull(documentId, "documentId is required");
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of result and error must be set");
        }
    }

    public static DocumentResult success(String documentId, ResolutionResult result) {
        return new DocumentResult(documentId, result, null);
    }

    public static DocumentResult failure(String documentId, String error) {
        return new DocumentResult(documentId, null, error);
    }

    public boolean isSuccess() {
        return result != null;
    }
}
