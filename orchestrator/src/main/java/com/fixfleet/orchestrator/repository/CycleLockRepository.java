package com.fixfleet.orchestrator.repository;

import com.fixfleet.orchestrator.model.CycleLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

/**
 * Lease rows for cycle mutual exclusion.
 *
 * The delete queries must run inside a transaction; CycleLockService wraps
 * each call in its own REQUIRES_NEW transaction.
 */
public interface CycleLockRepository extends JpaRepository<CycleLock, String> {

    /** Remove a lease whose TTL has passed so a new owner can insert one. */
    @Modifying
    @Query("DELETE FROM CycleLock l WHERE l.lockKey = :key AND l.expiresAt <= :now")
    int deleteExpired(@Param("key") String lockKey, @Param("now") Instant now);

    /** Release only if we still own it; a lease taken over after expiry stays. */
    @Modifying
    @Query("DELETE FROM CycleLock l WHERE l.lockKey = :key AND l.owner = :owner")
    int deleteByKeyAndOwner(@Param("key") String lockKey, @Param("owner") String owner);
}
