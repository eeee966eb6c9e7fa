package com.fixfleet.orchestrator.state;

import com.fixfleet.orchestrator.config.OrchestratorProperties;
import com.fixfleet.orchestrator.model.CycleLock;
import com.fixfleet.orchestrator.repository.CycleLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Cross-process mutual exclusion for dispatch cycles, backed by one row in cycle_locks.
 *
 * Acquire = delete the row if its lease expired, then insert ours. The primary
 * key makes a concurrent insert fail, and that loser gets nothing. Each step
 * runs in its own REQUIRES_NEW transaction so a failed insert never poisons
 * the caller's transaction.
 *
 * The lease has a TTL so a crashed process cannot block cycles forever; a
 * long cycle renews it between waves.
 */
@Service
public class CycleLockService {

    private static final Logger log = LoggerFactory.getLogger(CycleLockService.class);

    public static final String CYCLE_LOCK_KEY = "dispatch-cycle";

    private final CycleLockRepository lockRepository;
    private final TransactionTemplate requiresNew;
    private final Duration            ttl;
    private final Clock               clock;

    public CycleLockService(CycleLockRepository lockRepository,
                            PlatformTransactionManager transactionManager,
                            OrchestratorProperties properties,
                            Clock clock) {
        this.lockRepository = lockRepository;
        this.ttl            = properties.getLockTtl();
        this.clock          = clock;
        this.requiresNew    = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Try to take the cycle lease.
     *
     * @return owner token to pass to {@link #renew} / {@link #release}, or empty if held elsewhere
     */
    public Optional<String> tryAcquire() {
        String owner = UUID.randomUUID().toString();
        Instant now  = clock.instant();
        try {
            Boolean acquired = requiresNew.execute(status -> {
                int removed = lockRepository.deleteExpired(CYCLE_LOCK_KEY, now);
                if (removed > 0) {
                    log.info("Removed expired cycle lock");
                }
                if (lockRepository.existsById(CYCLE_LOCK_KEY)) {
                    return false;
                }
                lockRepository.saveAndFlush(new CycleLock(CYCLE_LOCK_KEY, owner, now, now.plus(ttl)));
                return true;
            });
            if (Boolean.TRUE.equals(acquired)) {
                log.info("Acquired cycle lock (owner {}, ttl {})", owner, ttl);
                return Optional.of(owner);
            }
            log.warn("Cycle lock is held by another cycle");
            return Optional.empty();
        } catch (DataIntegrityViolationException e) {
            // Lost the insert race to another process.
            log.warn("Cycle lock taken concurrently: {}", e.getMostSpecificCause().getMessage());
            return Optional.empty();
        }
    }

    /**
     * Take the lease or fail fast.
     *
     * @throws CycleAlreadyRunningException if another cycle holds it
     */
    public String acquire() {
        return tryAcquire().orElseThrow(() -> new CycleAlreadyRunningException("cycle already running"));
    }

    /**
     * Push the lease expiry out by another TTL.
     *
     * @return false if we no longer own the lease (it expired and was taken over)
     */
    public boolean renew(String owner) {
        Instant now = clock.instant();
        Boolean renewed = requiresNew.execute(status -> lockRepository.findById(CYCLE_LOCK_KEY)
                .filter(lock -> lock.getOwner().equals(owner))
                .map(lock -> {
                    lock.extendTo(now.plus(ttl));
                    lockRepository.save(lock);
                    return true;
                })
                .orElse(false));
        if (!Boolean.TRUE.equals(renewed)) {
            log.warn("Cycle lock lost by owner {}", owner);
            return false;
        }
        return true;
    }

    public void release(String owner) {
        Integer removed = requiresNew.execute(status -> lockRepository.deleteByKeyAndOwner(CYCLE_LOCK_KEY, owner));
        if (removed == null || removed == 0) {
            log.warn("Cycle lock for owner {} was already gone on release", owner);
        } else {
            log.info("Released cycle lock (owner {})", owner);
        }
    }

    /** Current holder, for status reporting. */
    public Optional<CycleLock> currentLock() {
        Instant now = clock.instant();
        return lockRepository.findById(CYCLE_LOCK_KEY).filter(l -> !l.isExpired(now));
    }
}
