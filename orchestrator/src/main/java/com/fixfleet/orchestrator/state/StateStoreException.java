package com.fixfleet.orchestrator.state;

/**
 * Orchestrator state could not be read or written.
 * A cycle that hits this stops before (or at) the next dispatch.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
