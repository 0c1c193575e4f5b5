package com.legal.citation.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.legal.citation.core.model.NodeIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link LawStoreProvider} over an Obsidian-style vault directory.
 *
 * <p>Layout:</p>
 * <pre>
 * &lt;vault&gt;/laws/&lt;lawName&gt;/&lt;lawName&gt;.md   law node with YAML frontmatter
 * &lt;vault&gt;/laws/&lt;lawName&gt;/本文/第N条.md        article nodes
 * </pre>
 *
 * <p>The law identifier is read from the frontmatter key {@code egov_law_id}, falling back to
 * {@code id} with its {@code JPLAW:} namespace removed.</p>
 */
public class VaultLawStore implements LawStoreProvider {
    private static final Logger log = LoggerFactory.getLogger(VaultLawStore.class);

    public static final String LAWS_DIR = "laws";
    private static final String FRONTMATTER_DELIMITER = "---";

    private final Path vaultRoot;
    private final Path lawsDir;
    private final ObjectMapper yaml;

    public VaultLawStore(Path vaultRoot) {
        this.vaultRoot = Objects.requireNonNull(vaultRoot, "vaultRoot is required");
        this.lawsDir = vaultRoot.resolve(LAWS_DIR);
        this.yaml = new ObjectMapper(new YAMLFactory());
    }

    public Path getVaultRoot() {
        return vaultRoot;
    }

    @Override
    public Set<String> listExistingLaws() {
        if (!Files.isDirectory(lawsDir)) {
            log.warn("vault.laws.missing dir={}", lawsDir);
            return Set.of();
        }
        try (Stream<Path> children = Files.list(lawsDir)) {
            Set<String> names = children
                    .filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .collect(Collectors.toCollection(HashSet::new));
            log.debug("vault.laws.listed count={}", names.size());
            return names;
        } catch (IOException e) {
            throw new RegistryUnavailableException("Failed to list laws under " + lawsDir, e);
        }
    }

    @Override
    public Optional<String> readLawId(String canonicalName) {
        Path lawDir = lawsDir.resolve(canonicalName);
        if (!Files.isDirectory(lawDir)) {
            return Optional.empty();
        }
        Optional<Path> lawNode = findLawNodeFile(lawDir, canonicalName);
        if (lawNode.isEmpty()) {
            return Optional.empty();
        }
        String content;
        try {
            content = Files.readString(lawNode.get(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RegistryUnavailableException("Failed to read " + lawNode.get(), e);
        }
        return extractFrontmatter(content).flatMap(fm -> lawIdFrom(fm, lawNode.get()));
    }

    private Optional<Path> findLawNodeFile(Path lawDir, String canonicalName) {
        Path preferred = lawDir.resolve(canonicalName + ".md");
        if (Files.isRegularFile(preferred)) {
            return Optional.of(preferred);
        }
        try (Stream<Path> children = Files.list(lawDir)) {
            List<Path> candidates = children
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".md"))
                    .sorted()
                    .toList();
            return candidates.stream().findFirst();
        } catch (IOException e) {
            throw new RegistryUnavailableException("Failed to list " + lawDir, e);
        }
    }

    private Optional<String> lawIdFrom(String frontmatter, Path source) {
        JsonNode root;
        try {
            root = yaml.readTree(frontmatter);
        } catch (JsonProcessingException e) {
            log.warn("vault.frontmatter.invalid file={} error={}", source, e.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        JsonNode egovId = root.get("egov_law_id");
        if (egovId != null && !egovId.isNull() && !egovId.asText().isBlank()) {
            return Optional.of(egovId.asText());
        }
        JsonNode id = root.get("id");
        if (id != null && !id.isNull() && !id.asText().isBlank()) {
            String value = id.asText();
            return Optional.of(value.startsWith(NodeIds.NAMESPACE)
                    ? value.substring(NodeIds.NAMESPACE.length())
                    : value);
        }
        return Optional.empty();
    }

    static Optional<String> extractFrontmatter(String content) {
        if (content == null || !content.startsWith(FRONTMATTER_DELIMITER)) {
            return Optional.empty();
        }
        int start = content.indexOf('\n');
        if (start < 0) {
            return Optional.empty();
        }
        int end = content.indexOf("\n" + FRONTMATTER_DELIMITER, start);
        if (end < 0) {
            return Optional.empty();
        }
        return Optional.of(content.substring(start + 1, end + 1));
    }
}
