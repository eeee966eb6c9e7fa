package com.fixfleet.orchestrator.state;

/**
 * Durable home of the orchestrator's state: dispatch history, sessions,
 * rate-limiter window and the meta row.
 */
public interface OrchestratorStateStore {

    /**
     * @throws StateStoreException when the state cannot be read or is corrupt
     */
    OrchestratorState load();

    /**
     * Write everything the state marks as changed, plus the rate window and
     * meta row, in one transaction. Nothing is written if any part fails.
     *
     * @throws StateStoreException on failure, including a concurrent writer
     *                             having updated the meta row since load
     */
    void save(OrchestratorState state);
}
