package com.legal.citation.registry;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link LawStoreProvider}. Suitable for testing and for callers that
 * already hold the law listing.
 */
public class InMemoryLawStore implements LawStoreProvider {

    private final Map<String, String> lawIds = new ConcurrentHashMap<>();
    private final Set<String> laws = ConcurrentHashMap.newKeySet();

    public InMemoryLawStore() {
    }

    public InMemoryLawStore(Map<String, String> lawIdsByName) {
        lawIdsByName.forEach(this::addLaw);
    }

    /**
     * Registers a law with its identifier.
     */
    public InMemoryLawStore addLaw(String canonicalName, String lawId) {
        laws.add(canonicalName);
        if (lawId != null) {
            lawIds.put(canonicalName, lawId);
        }
        return this;
    }

    /**
     * Registers a law whose metadata carries no identifier.
     */
    public InMemoryLawStore addLaw(String canonicalName) {
        return addLaw(canonicalName, null);
    }

    @Override
    public Set<String> listExistingLaws() {
        return Set.copyOf(laws);
    }

    @Override
    public Optional<String> readLawId(String canonicalName) {
        return Optional.ofNullable(lawIds.get(canonicalName));
    }
}
