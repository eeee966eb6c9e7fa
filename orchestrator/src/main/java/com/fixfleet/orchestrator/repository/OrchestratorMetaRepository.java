package com.fixfleet.orchestrator.repository;

import com.fixfleet.orchestrator.model.OrchestratorMeta;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Access to the single orchestrator_meta row (id = 1).
 */
public interface OrchestratorMetaRepository extends JpaRepository<OrchestratorMeta, Short> {
}
