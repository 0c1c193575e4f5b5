package com.legal.citation.registry;

/**
 * Runtime exception thrown when the law store cannot be read.
 * Callers decide whether this is fatal for a batch or whether to continue
 * as if no law were present.
 */
public class RegistryUnavailableException extends RuntimeException {

    public RegistryUnavailableException(String message) {
        super(message);
    }

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
