package com.fixfleet.orchestrator.state;

/**
 * Another dispatch cycle holds the cycle lock.
 */
public class CycleAlreadyRunningException extends RuntimeException {

    public CycleAlreadyRunningException(String message) {
        super(message);
    }
}
