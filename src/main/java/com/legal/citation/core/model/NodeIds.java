package com.legal.citation.core.model;

/**
 * Builders for graph node identifiers.
 *
 * <p>Article nodes are addressed as {@code JPLAW:<lawId>#<part>#<articleKey>}; citations
 * whose law is not in the store are addressed as {@code external:<lawName>#main#<articleKey>}.</p>
 */
public final class NodeIds {

    public static final String NAMESPACE = "JPLAW:";
    public static final String EXTERNAL_PREFIX = "external:";
    public static final String MAIN_PART = "main";

    private NodeIds() {
        // Utility class
    }

    /**
     * Node id of an article in the main provision of a law.
     */
    public static String article(String lawId, String articleKey) {
        return node(lawId, MAIN_PART, articleKey);
    }

    public static String node(String lawId, String part, String articleKey) {
        return qualify(lawId) + "#" + part + "#" + articleKey;
    }

    /**
     * Node id used when the cited law cannot be confirmed present.
     */
    public static String external(String lawName, String articleKey) {
        return EXTERNAL_PREFIX + lawName + "#" + MAIN_PART + "#" + articleKey;
    }

    /**
     * Adds the namespace prefix unless already present.
     */
    public static String qualify(String lawId) {
        return lawId.startsWith(NAMESPACE) ? lawId : NAMESPACE + lawId;
    }

    public static boolean isExternal(String nodeId) {
        return nodeId != null && nodeId.startsWith(EXTERNAL_PREFIX);
    }
}
