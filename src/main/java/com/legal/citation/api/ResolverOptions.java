package com.legal.citation.api;

import com.legal.citation.rules.DefaultCitationRules;

/**
 * Options for citation resolution: edge confidences, extractor tag and rule window sizes.
 */
public class ResolverOptions {

    private static final double DEFAULT_INTERNAL_CONFIDENCE = 0.9;
    private static final double DEFAULT_EXTERNAL_CONFIDENCE = 0.8;
    private static final String DEFAULT_EXTRACTOR_VERSION = "regex_v2";

    private final double internalConfidence;
    private final double externalConfidence;
    private final String extractorVersion;
    private final int actNumberLookbehind;
    private final int guardLookahead;

    private ResolverOptions(Builder builder) {
        this.internalConfidence = builder.internalConfidence;
        this.externalConfidence = builder.externalConfidence;
        this.extractorVersion = builder.extractorVersion;
        this.actNumberLookbehind = builder.actNumberLookbehind;
        this.guardLookahead = builder.guardLookahead;
    }

    public double getInternalConfidence() {
        return internalConfidence;
    }

    public double getExternalConfidence() {
        return externalConfidence;
    }

    public String getExtractorVersion() {
        return extractorVersion;
    }

    public int getActNumberLookbehind() {
        return actNumberLookbehind;
    }

    public int getGuardLookahead() {
        return guardLookahead;
    }

    /**
     * Creates default options.
     */
    public static ResolverOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double internalConfidence = DEFAULT_INTERNAL_CONFIDENCE;
        private double externalConfidence = DEFAULT_EXTERNAL_CONFIDENCE;
        private String extractorVersion = DEFAULT_EXTRACTOR_VERSION;
        private int actNumberLookbehind = DefaultCitationRules.DEFAULT_ACT_NUMBER_LOOKBEHIND;
        private int guardLookahead = DefaultCitationRules.DEFAULT_GUARD_LOOKAHEAD;

        public Builder internalConfidence(double internalConfidence) {
            validateConfidence(internalConfidence, "internalConfidence");
            this.internalConfidence = internalConfidence;
            return this;
        }

        public Builder externalConfidence(double externalConfidence) {
            validateConfidence(externalConfidence, "externalConfidence");
            this.externalConfidence = externalConfidence;
            return this;
        }

        public Builder extractorVersion(String extractorVersion) {
            if (extractorVersion == null || extractorVersion.isBlank()) {
                throw new IllegalArgumentException("extractorVersion must not be blank");
            }
            this.extractorVersion = extractorVersion;
            return this;
        }

        public Builder actNumberLookbehind(int actNumberLookbehind) {
            if (actNumberLookbehind <= 0) {
                throw new IllegalArgumentException("actNumberLookbehind must be positive");
            }
            this.actNumberLookbehind = actNumberLookbehind;
            return this;
        }

        public Builder guardLookahead(int guardLookahead) {
            if (guardLookahead <= 0) {
                throw new IllegalArgumentException("guardLookahead must be positive");
            }
            this.guardLookahead = guardLookahead;
            return this;
        }

        public ResolverOptions build() {
            return new ResolverOptions(this);
        }

        private void validateConfidence(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "ResolverOptions{" +
                "internalConfidence=" + internalConfidence +
                ", externalConfidence=" + externalConfidence +
                ", extractorVersion='" + extractorVersion + '\'' +
                ", actNumberLookbehind=" + actNumberLookbehind +
                ", guardLookahead=" + guardLookahead +
                '}';
    }
}
