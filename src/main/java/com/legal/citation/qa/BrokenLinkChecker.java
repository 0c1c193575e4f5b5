package com.legal.citation.qa;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.legal.citation.logging.LogContext;
import com.legal.citation.markup.WikiLinks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds wiki links in a vault whose target file is missing.
 *
 * <p>A link path starting with a top-level vault directory is resolved from the vault root;
 * any other path is tried relative to the linking file, then from the vault root.
 * {@code .md} is appended when missing. Hidden files and directories are skipped.
 * A Markdown file that cannot be read fails the whole check.</p>
 */
public class BrokenLinkChecker {
    private static final Logger log = LoggerFactory.getLogger(BrokenLinkChecker.class);

    private static final String MARKDOWN_SUFFIX = ".md";

    private final Path vaultRoot;
    private final Set<String> ignorePatterns;

    public BrokenLinkChecker(Path vaultRoot) {
        this(vaultRoot, Set.of());
    }

    /**
     * @param vaultRoot      vault root directory
     * @param ignorePatterns targets containing any of these substrings are not reported
     */
    public BrokenLinkChecker(Path vaultRoot, Set<String> ignorePatterns) {
        this.vaultRoot = Objects.requireNonNull(vaultRoot, "vaultRoot is required").toAbsolutePath().normalize();
        this.ignorePatterns = Set.copyOf(ignorePatterns);
    }

    /**
     * Checks every Markdown file of the vault.
     */
    public LinkCheckReport check() {
        return check(null);
    }

    /**
     * Checks the Markdown files under {@code onlyPrefix} (e.g. {@code laws/}); the whole vault
     * when the prefix is null or does not exist.
     */
    public LinkCheckReport check(String onlyPrefix) {
        try (LogContext ignored = LogContext.forLinkCheck(vaultRoot.toString())) {
            Path searchRoot = vaultRoot;
            if (onlyPrefix != null && !onlyPrefix.isBlank()) {
                Path prefixed = vaultRoot.resolve(onlyPrefix);
                if (Files.isDirectory(prefixed)) {
                    searchRoot = prefixed;
                } else {
                    log.warn("linkcheck.prefix.missing prefix={}, checking whole vault", onlyPrefix);
                }
            }

            List<Path> files;
            try (Stream<Path> walk = Files.walk(searchRoot)) {
                files = walk.filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().endsWith(MARKDOWN_SUFFIX))
                        .filter(p -> !isHidden(vaultRoot.relativize(p)))
                        .sorted()
                        .collect(Collectors.toList());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to scan vault " + vaultRoot, e);
            }

            long totalLinks = 0;
            List<BrokenLink> broken = new ArrayList<>();
            for (Path file : files) {
                totalLinks += checkFile(file, broken);
            }

            LinkCheckReport report = new LinkCheckReport(files.size(), totalLinks, broken);
            log.info("linkcheck.completed report={}", report);
            return report;
        }
    }

    /**
     * Writes the report as JSON: {@code generated_at}, {@code broken_count}, {@code broken_links}.
     */
    public static void writeJsonReport(LinkCheckReport report, Path output) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("generated_at", OffsetDateTime.now().toString());
        document.put("broken_count", report.brokenLinks().size());
        document.put("broken_links", report.brokenLinks());
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            new ObjectMapper()
                    .enable(SerializationFeature.INDENT_OUTPUT)
                    .writeValue(output.toFile(), document);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write link check report to " + output, e);
        }
    }

    /**
     * Reads ignore patterns: one per line, {@code #} starts a comment, blank lines skipped.
     * A missing file yields no patterns.
     */
    public static Set<String> loadIgnorePatterns(Path ignoreFile) {
        Set<String> patterns = new LinkedHashSet<>();
        if (ignoreFile == null || !Files.isRegularFile(ignoreFile)) {
            return patterns;
        }
        try {
            for (String line : Files.readAllLines(ignoreFile, StandardCharsets.UTF_8)) {
                int hash = line.indexOf('#');
                String pattern = (hash >= 0 ? line.substring(0, hash) : line).strip();
                if (!pattern.isEmpty()) {
                    patterns.add(pattern);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ignore file " + ignoreFile, e);
        }
        return patterns;
    }

    private long checkFile(Path file, List<BrokenLink> broken) {
        String sourceRelative = toVaultPath(vaultRoot.relativize(file));
        long links = 0;
        try (BufferedReader reader = newLenientReader(file)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                for (String body : WikiLinks.bodies(line)) {
                    Optional<String> parsed = WikiLinks.targetPath(body);
                    if (parsed.isEmpty()) {
                        continue;
                    }
                    links++;
                    String linkPath = withMarkdownSuffix(parsed.get());
                    if (resolves(linkPath, file)) {
                        continue;
                    }
                    String target = reportPath(linkPath, file);
                    if (isIgnored(target)) {
                        continue;
                    }
                    broken.add(new BrokenLink(sourceRelative, "[[" + body + "]]", target, lineNo));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + sourceRelative, e);
        }
        return links;
    }

    private boolean resolves(String linkPath, Path sourceFile) {
        if (isVaultAbsolute(linkPath)) {
            return Files.exists(vaultRoot.resolve(linkPath));
        }
        return Files.exists(sourceFile.getParent().resolve(linkPath))
                || Files.exists(vaultRoot.resolve(linkPath));
    }

    private String reportPath(String linkPath, Path sourceFile) {
        if (isVaultAbsolute(linkPath)) {
            return linkPath;
        }
        Path relative = sourceFile.getParent().resolve(linkPath).normalize();
        if (relative.startsWith(vaultRoot)) {
            return toVaultPath(vaultRoot.relativize(relative));
        }
        return linkPath;
    }

    private boolean isVaultAbsolute(String linkPath) {
        int slash = linkPath.indexOf('/');
        String firstSegment = slash >= 0 ? linkPath.substring(0, slash) : linkPath;
        return !firstSegment.isEmpty() && Files.isDirectory(vaultRoot.resolve(firstSegment));
    }

    private boolean isIgnored(String target) {
        for (String pattern : ignorePatterns) {
            if (target.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    private static BufferedReader newLenientReader(Path file) throws IOException {
        return new BufferedReader(new InputStreamReader(Files.newInputStream(file),
                StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.IGNORE)
                        .onUnmappableCharacter(CodingErrorAction.IGNORE)));
    }

    private static String withMarkdownSuffix(String path) {
        return path.endsWith(MARKDOWN_SUFFIX) ? path : path + MARKDOWN_SUFFIX;
    }

    private static boolean isHidden(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private static String toVaultPath(Path relative) {
        return relative.toString().replace('\\', '/');
    }
}
