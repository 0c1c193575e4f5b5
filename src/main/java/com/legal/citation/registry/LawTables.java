package com.legal.citation.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.legal.citation.core.model.LawAliasEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static law-name tables: the alias table of laws that are always linkable and the
 * list of law names that are treated as external unless present in the store.
 *
 * <p>Names are kept sorted longest-first so that callers scanning text try
 * {@code 刑事訴訟法} before {@code 刑法}.</p>
 */
public final class LawTables {
    private static final Logger log = LoggerFactory.getLogger(LawTables.class);

    public static final String DEFAULT_RESOURCE = "/law-tables.yaml";

    private static final Comparator<String> LONGEST_FIRST =
            Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder());

    private final List<LawAliasEntry> aliases;
    private final Map<String, String> folderByName;
    private final List<String> aliasNamesLongestFirst;
    private final List<String> externalLawsLongestFirst;

    public LawTables(List<LawAliasEntry> aliases, Collection<String> externalLaws) {
        this.aliases = aliases != null ? List.copyOf(aliases) : List.of();

        Map<String, String> folders = new LinkedHashMap<>();
        for (LawAliasEntry entry : this.aliases) {
            folders.putIfAbsent(entry.canonicalName(), entry.folderName());
            for (String variant : entry.aliasVariants()) {
                folders.putIfAbsent(variant, entry.folderName());
            }
        }
        this.folderByName = Map.copyOf(folders);
        this.aliasNamesLongestFirst = sortLongestFirst(folders.keySet());

        Set<String> external = new LinkedHashSet<>(externalLaws != null ? externalLaws : List.of());
        external.removeAll(folders.keySet());
        this.externalLawsLongestFirst = sortLongestFirst(external);
    }

    /**
     * Loads the tables bundled with the library.
     */
    public static LawTables loadDefault() {
        try (InputStream in = LawTables.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            return fromYaml(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Parses tables from YAML with top-level keys {@code aliases} and {@code externalLaws}.
     */
    public static LawTables fromYaml(InputStream in) throws IOException {
        ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
        TablesDocument doc = yaml.readValue(in, TablesDocument.class);
        LawTables tables = new LawTables(doc.aliases, doc.externalLaws);
        log.debug("lawTables.loaded aliases={} externalLaws={}",
                tables.aliasNamesLongestFirst.size(), tables.externalLawsLongestFirst.size());
        return tables;
    }

    public List<LawAliasEntry> getAliases() {
        return aliases;
    }

    /**
     * All alias-table names (canonical names and variants), longest first.
     */
    public List<String> getAliasNames() {
        return aliasNamesLongestFirst;
    }

    /**
     * Names of laws treated as external unless present in the store, longest first.
     */
    public List<String> getExternalLaws() {
        return externalLawsLongestFirst;
    }

    /**
     * Returns the folder for an exact alias-table name, or null.
     */
    String folderFor(String name) {
        return folderByName.get(name);
    }

    static List<String> sortLongestFirst(Collection<String> names) {
        List<String> sorted = new ArrayList<>(names);
        sorted.sort(LONGEST_FIRST);
        return List.copyOf(sorted);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class TablesDocument {
        @JsonProperty("aliases")
        List<LawAliasEntry> aliases = new ArrayList<>();

        @JsonProperty("externalLaws")
        List<String> externalLaws = new ArrayList<>();
    }
}
