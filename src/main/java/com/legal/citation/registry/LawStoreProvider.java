package com.legal.citation.registry;

import java.util.Optional;
import java.util.Set;

/**
 * Read access to the store holding the laws that can be linked to.
 *
 * <p>Implementations are queried lazily by {@link LawRegistry}; the listing is assumed
 * not to change for the duration of a run.</p>
 */
public interface LawStoreProvider {

    /**
     * Lists the canonical names (folder names) of every law present in the store.
     *
     * @throws RegistryUnavailableException if the store cannot be read
     */
    Set<String> listExistingLaws();

    /**
     * Reads the law identifier recorded in the law's own metadata.
     *
     * @param canonicalName the law's canonical (folder) name
     * @return the identifier, or empty if the law or its identifier is missing
     * @throws RegistryUnavailableException if the metadata exists but cannot be read
     */
    Optional<String> readLawId(String canonicalName);
}
