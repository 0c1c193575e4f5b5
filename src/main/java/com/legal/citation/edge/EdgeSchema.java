package com.legal.citation.edge;

import java.util.Locale;

/**
 * Serialized layouts of a {@link com.legal.citation.core.model.ReferenceEdge}.
 */
public enum EdgeSchema {

    /**
     * {@code {"from","to","type":"refers_to","evidence","confidence","source","kind"?}},
     * {@code kind="external_ref"} only on external edges.
     */
    FLAT("v1"),

    /**
     * {@code {"source","target","type":"refs","relation":"internal|external","evidence","confidence"}}.
     */
    NORMALIZED("v2");

    private final String version;

    EdgeSchema(String version) {
        this.version = version;
    }

    public String getVersion() {
        return version;
    }

    /**
     * Parses a schema by version tag ({@code v1}, {@code v2}) or by name.
     */
    public static EdgeSchema fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Edge schema must not be blank");
        }
        String normalized = value.trim();
        for (EdgeSchema schema : values()) {
            if (schema.version.equalsIgnoreCase(normalized) || schema.name().equals(normalized.toUpperCase(Locale.ROOT))) {
                return schema;
            }
        }
        throw new IllegalArgumentException("Unknown edge schema: " + value);
    }
}
