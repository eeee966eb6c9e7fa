package com.fixfleet.orchestrator.repository;

import com.fixfleet.orchestrator.model.VerificationRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD for the verifications table.
 */
public interface VerificationRepository extends JpaRepository<VerificationRecord, UUID> {

    List<VerificationRecord> findAllByOrderByVerifiedAtAsc();

    List<VerificationRecord> findByFingerprintOrderByVerifiedAtAsc(String fingerprint);
}
