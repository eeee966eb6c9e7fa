package com.fixfleet.orchestrator.repository;

import com.fixfleet.orchestrator.model.DispatchHistoryEntry;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * CRUD for the dispatch_history table, keyed by fingerprint.
 */
public interface DispatchHistoryRepository extends JpaRepository<DispatchHistoryEntry, String> {
}
