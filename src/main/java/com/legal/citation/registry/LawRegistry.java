package com.legal.citation.registry;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Law-name registry backed by the static {@link LawTables} and an injected {@link LawStoreProvider}.
 *
 * <p>Three caches are populated lazily and are read-only afterwards:</p>
 * <ul>
 *   <li>the set of laws present in the store, loaded once on first query;</li>
 *   <li>the linkable/external name lists derived from it (external-list laws present
 *       in the store are promoted to linkable);</li>
 *   <li>law identifiers, memoized per canonical name including negative results.</li>
 * </ul>
 *
 * <p>Lookups fail soft: unknown names yield {@code false} or {@code Optional.empty()}.
 * Store failures propagate as {@link RegistryUnavailableException} unless the registry
 * was built in degraded mode, in which case they are logged and treated as "not present".</p>
 *
 * <p>Instances are thread-safe.</p>
 */
public class LawRegistry {
    private static final Logger log = LoggerFactory.getLogger(LawRegistry.class);

    private static final String NEW_PREFIX = "新";
    private static final String OLD_PREFIX = "旧";

    private final LawStoreProvider store;
    private final LawTables tables;
    private final boolean degraded;
    private final Cache<String, Optional<String>> lawIdCache;
    private final Object loadLock = new Object();

    private volatile Snapshot snapshot;

    private LawRegistry(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store is required");
        this.tables = builder.tables != null ? builder.tables : LawTables.loadDefault();
        this.degraded = builder.degraded;
        RegistryCacheConfig cacheConfig = builder.cacheConfig != null
                ? builder.cacheConfig : RegistryCacheConfig.defaults();
        this.lawIdCache = Caffeine.newBuilder()
                .maximumSize(cacheConfig.maxSize())
                .build();
    }

    /**
     * Resolves a surface name to its canonical folder name.
     * Exact alias-table entries win; otherwise a leading 新/旧 is stripped and the lookup retried.
     * Promoted store laws resolve to themselves.
     */
    public Optional<String> resolveAlias(String variant) {
        if (variant == null || variant.isBlank()) {
            return Optional.empty();
        }
        String folder = tables.folderFor(variant);
        if (folder != null) {
            return Optional.of(folder);
        }
        if (variant.length() > 1 && (variant.startsWith(NEW_PREFIX) || variant.startsWith(OLD_PREFIX))) {
            folder = tables.folderFor(variant.substring(1));
            if (folder != null) {
                return Optional.of(folder);
            }
        }
        if (snapshot().promoted.contains(variant)) {
            return Optional.of(variant);
        }
        return Optional.empty();
    }

    /**
     * Returns true if the law is present in the store.
     */
    public boolean exists(String canonicalName) {
        if (canonicalName == null) {
            return false;
        }
        return snapshot().existing.contains(canonicalName);
    }

    /**
     * Looks up the identifier recorded in the law's metadata, memoized per name.
     */
    public Optional<String> resolveLawId(String canonicalName) {
        if (canonicalName == null || canonicalName.isBlank()) {
            return Optional.empty();
        }
        try {
            return lawIdCache.get(canonicalName, store::readLawId);
        } catch (RegistryUnavailableException e) {
            if (!degraded) {
                throw e;
            }
            log.warn("registry.lawId.unavailable law={} error={}", canonicalName, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Returns true if the canonical name denotes the law currently being processed.
     */
    public boolean isSelf(String canonicalName, String currentLawName) {
        return canonicalName != null && canonicalName.equals(currentLawName);
    }

    /**
     * Names that open a cross-link scope: alias-table names plus external-list laws
     * present in the store, longest first.
     */
    public List<String> linkableNames() {
        return snapshot().linkable;
    }

    /**
     * Names of laws that must not be linked, longest first.
     */
    public List<String> externalNames() {
        return snapshot().external;
    }

    /**
     * Number of laws present in the store.
     */
    public int storeSize() {
        return snapshot().existing.size();
    }

    /**
     * Drops every cached value; the next query reloads from the store.
     */
    public void clearCaches() {
        synchronized (loadLock) {
            snapshot = null;
        }
        lawIdCache.invalidateAll();
        log.debug("registry.caches.cleared");
    }

    private Snapshot snapshot() {
        Snapshot current = snapshot;
        if (current != null) {
            return current;
        }
        synchronized (loadLock) {
            if (snapshot == null) {
                snapshot = load();
            }
            return snapshot;
        }
    }

    private Snapshot load() {
        Set<String> existing;
        try {
            existing = Set.copyOf(store.listExistingLaws());
        } catch (RegistryUnavailableException e) {
            if (!degraded) {
                throw e;
            }
            log.warn("registry.listing.unavailable error={}, continuing with empty store", e.getMessage());
            existing = Set.of();
        }

        List<String> promoted = new ArrayList<>();
        List<String> external = new ArrayList<>();
        for (String name : tables.getExternalLaws()) {
            if (existing.contains(name)) {
                promoted.add(name);
            } else {
                external.add(name);
            }
        }
        List<String> linkable = new ArrayList<>(tables.getAliasNames());
        linkable.addAll(promoted);

        log.info("registry.loaded laws={} linkable={} external={}",
                existing.size(), linkable.size(), external.size());
        return new Snapshot(existing, Set.copyOf(promoted),
                LawTables.sortLongestFirst(linkable), LawTables.sortLongestFirst(external));
    }

    public static Builder builder() {
        return new Builder();
    }

    private record Snapshot(Set<String> existing, Set<String> promoted,
                            List<String> linkable, List<String> external) {
    }

    public static class Builder {
        private LawStoreProvider store;
        private LawTables tables;
        private RegistryCacheConfig cacheConfig;
        private boolean degraded;

        public Builder store(LawStoreProvider store) {
            this.store = store;
            return this;
        }

        public Builder tables(LawTables tables) {
            this.tables = tables;
            return this;
        }

        public Builder cacheConfig(RegistryCacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        /**
         * When true, store failures are logged and treated as "nothing exists".
         */
        public Builder degraded(boolean degraded) {
            this.degraded = degraded;
            return this;
        }

        public LawRegistry build() {
            return new LawRegistry(this);
        }
    }
}
