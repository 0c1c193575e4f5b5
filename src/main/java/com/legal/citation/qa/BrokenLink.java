package com.legal.citation.qa;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A wiki link whose target file does not exist.
 *
 * @param sourceFile vault-relative path of the file containing the link
 * @param linkText   the whole {@code [[...]]} text
 * @param targetPath vault-relative path the link points at
 * @param lineNo     1-based line number
 */
public record BrokenLink(
        @JsonProperty("source_file") String sourceFile,
        @JsonProperty("link_text") String linkText,
        @JsonProperty("target_path") String targetPath,
        @JsonProperty("line_no") int lineNo
) {
}
