package com.fixfleet.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Row-level lease guarding the dispatch cycle.
 *
 * The primary key makes a second insert for the same lock_key fail, which is
 * how a competing process learns the lease is taken. Expired leases are
 * removed before every acquisition attempt.
 *
 * DB table: cycle_locks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "cycle_locks")
public class CycleLock {

    @Id
    @Column(name = "lock_key", nullable = false, updatable = false)
    private String lockKey;

    @Column(nullable = false)
    private String owner;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    protected CycleLock() {}   // required by JPA

    public CycleLock(String lockKey, String owner, Instant acquiredAt, Instant expiresAt) {
        this.lockKey    = lockKey;
        this.owner      = owner;
        this.acquiredAt = acquiredAt;
        this.expiresAt  = expiresAt;
    }

    public void extendTo(Instant newExpiry) {
        this.expiresAt = newExpiry;
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public String  getLockKey()    { return lockKey; }
    public String  getOwner()      { return owner; }
    public Instant getAcquiredAt() { return acquiredAt; }
    public Instant getExpiresAt()  { return expiresAt; }
}
