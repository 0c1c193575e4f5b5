package com.legal.citation.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A law known under one or more surface names.
 *
 * @param canonicalName  the official short title, e.g. {@code 日本国憲法}
 * @param aliasVariants  other names that cite the same law, e.g. {@code 憲法}
 * @param folderName     the store folder holding the law's articles
 */
public record LawAliasEntry(String canonicalName, List<String> aliasVariants, String folderName) {

    public LawAliasEntry {
        Objects.requireNonNull(canonicalName, "canonicalName is required");
        aliasVariants = aliasVariants != null ? List.copyOf(aliasVariants) : List.of();
        folderName = folderName != null ? folderName : canonicalName;
    }

    public static LawAliasEntry of(String canonicalName, String... aliases) {
        return new LawAliasEntry(canonicalName, List.of(aliases), canonicalName);
    }
}
