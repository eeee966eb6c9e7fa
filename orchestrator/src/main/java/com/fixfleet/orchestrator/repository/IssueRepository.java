package com.fixfleet.orchestrator.repository;

import com.fixfleet.orchestrator.model.Issue;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + history queries for the issues table.
 */
public interface IssueRepository extends JpaRepository<Issue, UUID> {

    /** All findings of one repo across every scan, oldest scan first. */
    List<Issue> findByRepoUrlOrderByScanTimestampAsc(String repoUrl);

    /** All findings in the fleet, oldest scan first. */
    List<Issue> findAllByOrderByScanTimestampAsc();

    List<Issue> findByFingerprintOrderByScanTimestampAsc(String fingerprint);
}
