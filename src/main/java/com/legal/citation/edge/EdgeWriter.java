package com.legal.citation.edge;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.legal.citation.core.model.ReferenceEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Objects;

/**
 * Writes reference edges as JSON Lines in the chosen {@link EdgeSchema}.
 *
 * <p>Output is UTF-8 with non-ASCII characters written as is:</p>
 * <pre>
 * {"from":"JPLAW:129AC0000000089#main#1","to":"JPLAW:129AC0000000089#main#2","type":"refers_to","evidence":"第二条","confidence":0.9,"source":"regex_v2"}
 * </pre>
 */
public class EdgeWriter {
    private static final Logger log = LoggerFactory.getLogger(EdgeWriter.class);

    private final EdgeSchema schema;
    private final ObjectMapper mapper;

    public EdgeWriter(EdgeSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema is required");
        this.mapper = new ObjectMapper();
        this.mapper.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    public EdgeSchema getSchema() {
        return schema;
    }

    /**
     * Converts an edge to the record written for this writer's schema.
     */
    public Object convert(ReferenceEdge edge) {
        Objects.requireNonNull(edge, "edge is required");
        return switch (schema) {
            case FLAT -> FlatEdgeRecord.from(edge);
            case NORMALIZED -> NormalizedEdgeRecord.from(edge);
        };
    }

    /**
     * Serializes one edge to a single JSON line (without line terminator).
     */
    public String toJson(ReferenceEdge edge) {
        try {
            return mapper.writeValueAsString(convert(edge));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize edge " + edge, e);
        }
    }

    /**
     * Writes the edges to {@code writer}, one per line. The writer is flushed, not closed.
     *
     * @return number of edges written
     */
    public long writeJsonl(Collection<ReferenceEdge> edges, Writer writer) {
        long count = 0;
        try {
            for (ReferenceEdge edge : edges) {
                writer.write(toJson(edge));
                writer.write('\n');
                count++;
            }
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write edges", e);
        }
        return count;
    }

    /**
     * Writes the edges to {@code file}, replacing its content.
     *
     * @return number of edges written
     */
    public long writeJsonl(Collection<ReferenceEdge> edges, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                long count = writeJsonl(edges, writer);
                log.info("edges.written file={} schema={} count={}", file, schema.getVersion(), count);
                return count;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write edges to " + file, e);
        }
    }
}
