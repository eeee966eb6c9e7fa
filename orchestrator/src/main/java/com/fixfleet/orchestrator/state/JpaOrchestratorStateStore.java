package com.fixfleet.orchestrator.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixfleet.orchestrator.config.OrchestratorProperties;
import com.fixfleet.orchestrator.model.AgentSession;
import com.fixfleet.orchestrator.model.DispatchHistoryEntry;
import com.fixfleet.orchestrator.model.OrchestratorMeta;
import com.fixfleet.orchestrator.ratelimit.RateLimiterWindow;
import com.fixfleet.orchestrator.repository.AgentSessionRepository;
import com.fixfleet.orchestrator.repository.DispatchHistoryRepository;
import com.fixfleet.orchestrator.repository.OrchestratorMetaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;

/**
 * {@link OrchestratorStateStore} on PostgreSQL via Spring Data JPA.
 *
 * The rate window lives as JSON in orchestrator_meta.rate_window_json. The
 * configured limit and period always win over the stored ones; only the
 * timestamps carry over, so a config change applies on the next cycle.
 *
 * History and session rows are versioned. When a signal wrote a row after the
 * cycle loaded it, the save rebases the cycle's copy on the stored row and
 * tries again. A conflict on the meta row means a second cycle and is fatal.
 */
@Component
public class JpaOrchestratorStateStore implements OrchestratorStateStore {

    private static final Logger log = LoggerFactory.getLogger(JpaOrchestratorStateStore.class);

    static final int MAX_SAVE_ATTEMPTS = 3;

    private final DispatchHistoryRepository  historyRepo;
    private final AgentSessionRepository     sessionRepo;
    private final OrchestratorMetaRepository metaRepo;
    private final ObjectMapper               json;
    private final OrchestratorProperties     properties;
    private final Clock                      clock;
    private final TransactionTemplate        requiresNew;

    public JpaOrchestratorStateStore(DispatchHistoryRepository historyRepo,
                                     AgentSessionRepository sessionRepo,
                                     OrchestratorMetaRepository metaRepo,
                                     ObjectMapper objectMapper,
                                     OrchestratorProperties properties,
                                     PlatformTransactionManager transactionManager,
                                     Clock clock) {
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.historyRepo = historyRepo;
        this.sessionRepo = sessionRepo;
        this.metaRepo    = metaRepo;
        this.json        = objectMapper;
        this.properties  = properties;
        this.clock       = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public OrchestratorState load() {
        try {
            OrchestratorMeta meta = metaRepo.findById(OrchestratorMeta.SINGLETON_ID)
                    .orElseGet(OrchestratorMeta::new);
            OrchestratorState state = new OrchestratorState(
                    historyRepo.findAll(), sessionRepo.findAll(), readWindow(meta), meta);
            log.debug("Loaded orchestrator state: {} history entries, {} sessions",
                    state.history().size(), state.sessions().size());
            return state;
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to load orchestrator state", e);
        }
    }

    @Override
    public void save(OrchestratorState state) {
        for (int attempt = 1; ; attempt++) {
            try {
                SavedRows saved = requiresNew.execute(status -> write(state));
                state.markClean(saved.meta(), saved.history(), saved.sessions());
                return;
            } catch (ObjectOptimisticLockingFailureException e) {
                if (OrchestratorMeta.class.equals(e.getPersistentClass())) {
                    throw new StateStoreException("Orchestrator state was modified by a concurrent writer", e);
                }
                if (attempt >= MAX_SAVE_ATTEMPTS) {
                    throw new StateStoreException("Orchestrator state kept changing underneath the checkpoint ("
                            + attempt + " attempts)", e);
                }
                log.info("{} {} changed since it was loaded, rebasing checkpoint (attempt {}/{})",
                        e.getPersistentClassName(), e.getIdentifier(), attempt, MAX_SAVE_ATTEMPTS);
                rebase(state);
            } catch (DataAccessException | TransactionException e) {
                throw new StateStoreException("Failed to save orchestrator state", e);
            }
        }
    }

    private SavedRows write(OrchestratorState state) {
        List<DispatchHistoryEntry> history  = historyRepo.saveAll(state.dirtyHistory());
        List<AgentSession>         sessions = sessionRepo.saveAll(state.dirtySessions());

        OrchestratorMeta meta = state.meta();
        meta.setRateWindowJson(toJson(RateWindowSnapshot.of(state.rateWindow())));
        meta.setUpdatedAt(clock.instant());
        // Flush here so constraint and version failures surface inside this method.
        OrchestratorMeta saved = metaRepo.saveAndFlush(meta);
        return new SavedRows(saved, history, sessions);
    }

    private void rebase(OrchestratorState state) {
        try {
            int rebased = state.rebase(
                    historyRepo.findAllById(state.dirtyHistoryKeys()),
                    sessionRepo.findAllById(state.dirtySessionKeys()));
            log.info("Rebased {} row(s) on the stored state", rebased);
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to reload orchestrator state for rebase", e);
        }
    }

    private record SavedRows(OrchestratorMeta meta,
                             List<DispatchHistoryEntry> history,
                             List<AgentSession> sessions) {}

    private RateLimiterWindow readWindow(OrchestratorMeta meta) {
        OrchestratorProperties.RateLimit limit = properties.getRateLimit();
        String raw = meta.getRateWindowJson();
        if (raw == null || raw.isBlank()) {
            return RateLimiterWindow.empty(limit.getMaxSessions(), limit.getPeriodHours());
        }
        try {
            RateWindowSnapshot snapshot = json.readValue(raw, RateWindowSnapshot.class);
            return new RateLimiterWindow(limit.getMaxSessions(), limit.getPeriodHours(),
                    snapshot.createdTimestamps() == null ? List.of() : snapshot.createdTimestamps());
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Stored rate-limiter window is corrupt", e);
        }
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("JSON serialization failed", e);
        }
    }
}
