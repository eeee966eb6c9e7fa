package com.fixfleet.orchestrator.registry;

/**
 * A registry entry (or the registry file itself) is malformed.
 * Entry-level failures are caught by the loader and turned into warnings.
 */
public class RegistryValidationException extends RuntimeException {

    public RegistryValidationException(String message) {
        super(message);
    }

    public RegistryValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
