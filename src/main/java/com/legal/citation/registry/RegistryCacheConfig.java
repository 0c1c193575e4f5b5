package com.legal.citation.registry;

/**
 * Configuration for the registry's law-id cache.
 *
 * @param maxSize maximum number of memoized law ids
 */
public record RegistryCacheConfig(int maxSize) {

    public RegistryCacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default configuration: 10,000 entries.
     */
    public static RegistryCacheConfig defaults() {
        return new RegistryCacheConfig(10_000);
    }
}
