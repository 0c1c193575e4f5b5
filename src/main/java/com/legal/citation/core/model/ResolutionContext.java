package com.legal.citation.core.model;

import java.util.Objects;

/**
 * Immutable per-call context for resolving the citations of one paragraph or item.
 */
public final class ResolutionContext {

    private final String fullText;
    private final String currentLawName;
    private final String sourceLawId;
    private final String sourceNodeId;
    private final boolean amendmentFragment;

    private ResolutionContext(Builder builder) {
        this.fullText = builder.fullText != null ? builder.fullText : "";
        this.currentLawName = Objects.requireNonNull(builder.currentLawName, "currentLawName is required");
        this.sourceLawId = Objects.requireNonNull(builder.sourceLawId, "sourceLawId is required");
        this.sourceNodeId = Objects.requireNonNull(builder.sourceNodeId, "sourceNodeId is required");
        this.amendmentFragment = builder.amendmentFragment;
    }

    public String getFullText() {
        return fullText;
    }

    public String getCurrentLawName() {
        return currentLawName;
    }

    public String getSourceLawId() {
        return sourceLawId;
    }

    public String getSourceNodeId() {
        return sourceNodeId;
    }

    public boolean isAmendmentFragment() {
        return amendmentFragment;
    }

    /**
     * Returns a copy of this context carrying a different text.
     */
    public ResolutionContext withText(String text) {
        return toBuilder().fullText(text).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .fullText(fullText)
                .currentLawName(currentLawName)
                .sourceLawId(sourceLawId)
                .sourceNodeId(sourceNodeId)
                .amendmentFragment(amendmentFragment);
    }

    @Override
    public String toString() {
        return "ResolutionContext{" +
                "currentLawName='" + currentLawName + '\'' +
                ", sourceNodeId='" + sourceNodeId + '\'' +
                ", amendmentFragment=" + amendmentFragment +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String fullText;
        private String currentLawName;
        private String sourceLawId;
        private String sourceNodeId;
        private boolean amendmentFragment;

        public Builder fullText(String fullText) {
            this.fullText = fullText;
            return this;
        }

        public Builder currentLawName(String currentLawName) {
            this.currentLawName = currentLawName;
            return this;
        }

        public Builder sourceLawId(String sourceLawId) {
            this.sourceLawId = sourceLawId;
            return this;
        }

        public Builder sourceNodeId(String sourceNodeId) {
            this.sourceNodeId = sourceNodeId;
            return this;
        }

        public Builder amendmentFragment(boolean amendmentFragment) {
            this.amendmentFragment = amendmentFragment;
            return this;
        }

        public ResolutionContext build() {
            return new ResolutionContext(this);
        }
    }
}
