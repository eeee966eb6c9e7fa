package com.fixfleet.orchestrator.repository;

import com.fixfleet.orchestrator.model.ScanRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + history queries for the scan_runs table.
 */
public interface ScanRunRepository extends JpaRepository<ScanRun, UUID> {

    /** Every scan of one repo, oldest first. */
    List<ScanRun> findByRepoUrlOrderByScannedAtAsc(String repoUrl);

    /** Every scan in the fleet, grouped by repo, oldest first within each repo. */
    List<ScanRun> findAllByOrderByRepoUrlAscScannedAtAsc();

    @Query("SELECT DISTINCT s.repoUrl FROM ScanRun s ORDER BY s.repoUrl")
    List<String> findDistinctRepoUrls();
}
