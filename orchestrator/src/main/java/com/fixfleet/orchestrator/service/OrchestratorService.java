package com.fixfleet.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixfleet.orchestrator.config.OrchestratorProperties;
import com.fixfleet.orchestrator.dispatch.CycleCancellation;
import com.fixfleet.orchestrator.dispatch.DispatchPlan;
import com.fixfleet.orchestrator.dispatch.ExecutionContext;
import com.fixfleet.orchestrator.dispatch.ExecutionReport;
import com.fixfleet.orchestrator.dispatch.PlanningInput;
import com.fixfleet.orchestrator.dispatch.WaveDispatcher;
import com.fixfleet.orchestrator.model.AgentSession;
import com.fixfleet.orchestrator.model.DispatchHistoryEntry;
import com.fixfleet.orchestrator.model.IssueState;
import com.fixfleet.orchestrator.model.OrchestratorMeta;
import com.fixfleet.orchestrator.model.SeverityTier;
import com.fixfleet.orchestrator.ratelimit.CooldownPolicy;
import com.fixfleet.orchestrator.ratelimit.RateLimiterWindow;
import com.fixfleet.orchestrator.registry.Objective;
import com.fixfleet.orchestrator.registry.RegistryValidationException;
import com.fixfleet.orchestrator.registry.RepoRegistry;
import com.fixfleet.orchestrator.registry.RepoRegistryLoader;
import com.fixfleet.orchestrator.repository.AgentSessionRepository;
import com.fixfleet.orchestrator.repository.DispatchHistoryRepository;
import com.fixfleet.orchestrator.repository.VerificationRepository;
import com.fixfleet.orchestrator.scoring.FixLearning;
import com.fixfleet.orchestrator.scoring.ObjectiveProgress;
import com.fixfleet.orchestrator.state.CycleLockService;
import com.fixfleet.orchestrator.state.OrchestratorState;
import com.fixfleet.orchestrator.state.OrchestratorStateStore;
import com.fixfleet.orchestrator.state.RateWindowSnapshot;
import com.fixfleet.orchestrator.state.StateStoreException;
import com.fixfleet.orchestrator.tracking.IssueLifecycleTracker;
import com.fixfleet.orchestrator.tracking.LifecycleSignals;
import com.fixfleet.orchestrator.tracking.OutcomeRecorder;
import com.fixfleet.orchestrator.tracking.TrackedIssue;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for everything the API and the scheduler do with dispatch cycles.
 *
 * Cycle:
 *   acquire lease → load registry + state → reconcile session outcomes →
 *   aggregate scan history → plan → execute waves (checkpointing) →
 *   record the report in orchestrator_meta → release lease
 *
 * cycle() never throws for in-cycle failures; it returns a FAILED report. The
 * only exception that escapes is {@link com.fixfleet.orchestrator.state.CycleAlreadyRunningException}.
 */
@Service
public class OrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorService.class);

    private static final DateTimeFormatter CYCLE_ID_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);

    private final RepoRegistryLoader        registryLoader;
    private final CandidatePoolBuilder      candidates;
    private final OrchestratorStateStore    stateStore;
    private final CycleLockService          lockService;
    private final WaveDispatcher            dispatcher;
    private final IssueLifecycleTracker     tracker;
    private final OutcomeRecorder           outcomeRecorder;
    private final CooldownPolicy            cooldownPolicy;
    private final DispatchHistoryRepository historyRepo;
    private final AgentSessionRepository    sessionRepo;
    private final VerificationRepository    verificationRepo;
    private final OrchestratorProperties    properties;
    private final ObjectMapper              objectMapper;
    private final MeterRegistry             meterRegistry;
    private final Clock                     clock;

    private final AtomicReference<CycleCancellation> running = new AtomicReference<>();

    public OrchestratorService(RepoRegistryLoader registryLoader,
                               CandidatePoolBuilder candidates,
                               OrchestratorStateStore stateStore,
                               CycleLockService lockService,
                               WaveDispatcher dispatcher,
                               IssueLifecycleTracker tracker,
                               OutcomeRecorder outcomeRecorder,
                               CooldownPolicy cooldownPolicy,
                               DispatchHistoryRepository historyRepo,
                               AgentSessionRepository sessionRepo,
                               VerificationRepository verificationRepo,
                               OrchestratorProperties properties,
                               ObjectMapper objectMapper,
                               MeterRegistry meterRegistry,
                               Clock clock) {
        this.registryLoader   = registryLoader;
        this.candidates       = candidates;
        this.stateStore       = stateStore;
        this.lockService      = lockService;
        this.dispatcher       = dispatcher;
        this.tracker          = tracker;
        this.outcomeRecorder  = outcomeRecorder;
        this.cooldownPolicy   = cooldownPolicy;
        this.historyRepo      = historyRepo;
        this.sessionRepo      = sessionRepo;
        this.verificationRepo = verificationRepo;
        this.properties       = properties;
        this.objectMapper     = objectMapper;
        this.meterRegistry    = meterRegistry;
        this.clock            = clock;
    }

    // ------------------------------------------------------------------
    // Plan (read-only)
    // ------------------------------------------------------------------

    /**
     * What a cycle would do right now. Nothing is written: outcome
     * reconciliation happens on the in-memory copy only.
     *
     * @param repoUrl restrict to one repo, or null for the whole fleet
     */
    public DispatchPlan plan(String repoUrl) {
        RepoRegistry registry = registryLoader.load();
        OrchestratorState state = stateStore.load();
        Instant now = clock.instant();
        reconcile(state, now);
        return buildPlan(repoUrl, registry, state, now);
    }

    // ------------------------------------------------------------------
    // Cycle
    // ------------------------------------------------------------------

    /**
     * Run one dispatch cycle.
     *
     * @throws com.fixfleet.orchestrator.state.CycleAlreadyRunningException if another cycle holds the lease
     */
    public CycleReport cycle(String repoUrl) {
        String owner   = lockService.acquire();
        String cycleId = newCycleId();
        CycleCancellation cancellation = new CycleCancellation();
        running.set(cancellation);

        MDC.put("cycleId", cycleId);
        Timer.Sample sample = Timer.start(meterRegistry);
        CycleReport report = null;
        try {
            log.info("Cycle {} started{}", cycleId, repoUrl == null ? "" : " for " + repoUrl);
            report = runCycle(cycleId, owner, repoUrl, cancellation);
            log.info("Cycle {} finished: {} ({} dispatched, {} skipped, {} deferred)",
                    cycleId, report.status(), report.dispatchedCount(),
                    report.skippedCount(), report.deferredCount());
            return report;
        } finally {
            sample.stop(Timer.builder("fixfleet.cycle.duration")
                    .description("Wall time of one dispatch cycle")
                    .tag("status", report == null ? "ERROR" : report.status().name())
                    .register(meterRegistry));
            running.set(null);
            lockService.release(owner);
            MDC.remove("cycleId");
        }
    }

    /**
     * Ask the running cycle to stop after its current step.
     *
     * @return false if no cycle is running in this process
     */
    public boolean cancel() {
        CycleCancellation cancellation = running.get();
        if (cancellation == null) return false;
        cancellation.cancel();
        log.warn("Cancellation requested for the running cycle");
        return true;
    }

    private CycleReport runCycle(String cycleId, String owner, String repoUrl, CycleCancellation cancellation) {
        Instant startedAt = clock.instant();
        List<String> warnings = new ArrayList<>();

        RepoRegistry registry;
        try {
            registry = registryLoader.load();
        } catch (RegistryValidationException e) {
            log.error("Repo registry unusable, aborting cycle: {}", e.getMessage());
            return CycleReport.failed(cycleId, repoUrl, startedAt, clock.instant(), null, warnings,
                    "repo registry unusable: " + e.getMessage());
        }
        warnings.addAll(registry.warnings());
        registry.invalid().forEach((repo, reason) -> warnings.add("repo config invalid for " + repo + ": " + reason));

        OrchestratorState state;
        try {
            state = stateStore.load();
        } catch (StateStoreException e) {
            log.error("State store unreadable, aborting cycle: {}", e.getMessage());
            return CycleReport.failed(cycleId, repoUrl, startedAt, clock.instant(), null, warnings,
                    "state store unreadable: " + e.getMessage());
        }

        ExecutionReport execution = null;
        try {
            Instant now = clock.instant();
            reconcile(state, now);
            DispatchPlan plan = buildPlan(repoUrl, registry, state, now);

            FixLearning learning = FixLearning.fromSessions(state.sessions().values(), properties.getFixLearning());
            execution = dispatcher.execute(plan, new ExecutionContext(
                    cycleId, state, registry, learning, cancellation, () -> lockService.renew(owner)));
            warnings.addAll(execution.warnings());

            CycleStatus status = statusOf(execution);
            String error = null;
            if (status == CycleStatus.FAILED) {
                error = String.format(Locale.ROOT, "session creation failure rate %.2f above threshold %.2f",
                        execution.creationFailureRate(), properties.getCreationFailureThreshold());
                log.error("Cycle {} {}", cycleId, error);
            }

            CycleReport report = new CycleReport(cycleId, status, repoUrl, startedAt, clock.instant(),
                    execution.waves().stream().map(CycleReport.WaveSummary::from).toList(),
                    execution.created(), (int) plan.skippedCount(),
                    plan.deferred().size() + execution.deferred(), execution.creationFailures(),
                    execution.halted(), execution.haltReason(), warnings, error);

            recordCycle(state, report, registry, clock.instant());
            stateStore.save(state);
            return report;
        } catch (StateStoreException e) {
            // Sessions created before the failed checkpoint keep running on the platform.
            log.error("State store failed, cycle aborted: {}", e.getMessage(), e);
            return CycleReport.failed(cycleId, repoUrl, startedAt, clock.instant(), summaries(execution), warnings,
                    "state store failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Cycle {} aborted: {}", cycleId, e.getMessage(), e);
            return CycleReport.failed(cycleId, repoUrl, startedAt, clock.instant(), summaries(execution), warnings,
                    "cycle aborted: " + e);
        }
    }

    private static List<CycleReport.WaveSummary> summaries(ExecutionReport execution) {
        return execution == null ? List.of()
                : execution.waves().stream().map(CycleReport.WaveSummary::from).toList();
    }

    private CycleStatus statusOf(ExecutionReport execution) {
        if (execution.creationFailureRate() > properties.getCreationFailureThreshold()) return CycleStatus.FAILED;
        if (execution.cancelled()) return CycleStatus.CANCELLED;
        if (execution.halted())    return CycleStatus.HALTED;
        return CycleStatus.COMPLETED;
    }

    private void recordCycle(OrchestratorState state, CycleReport report, RepoRegistry registry, Instant now) {
        OrchestratorMeta meta = state.meta();
        meta.setLastCycleId(report.cycleId());
        meta.setLastCycleAt(now);
        meta.setLastCycleStatus(report.status().name());
        meta.setLastCycleReportJson(toJson(report));
        meta.setObjectiveProgressJson(toJson(objectiveProgress(registry, state)));
    }

    // ------------------------------------------------------------------
    // Status / export / lookup
    // ------------------------------------------------------------------

    public OrchestratorStatus status() {
        List<String> warnings = new ArrayList<>();
        RepoRegistry registry;
        try {
            registry = registryLoader.load();
        } catch (RegistryValidationException e) {
            warnings.add("repo registry unusable: " + e.getMessage());
            registry = RepoRegistry.empty();
        }

        OrchestratorState state = stateStore.load();
        Instant now = clock.instant();
        reconcile(state, now);

        List<TrackedIssue> issues = candidates.trackedIssues(null);
        LifecycleSignals signals = candidates.signals(state);

        Map<String, Long> byState = new LinkedHashMap<>();
        for (IssueState s : IssueState.values()) byState.put(s.label(), 0L);
        int coolingDown = 0;
        List<String> humanReview = new ArrayList<>();
        for (TrackedIssue issue : issues) {
            byState.merge(tracker.classify(issue, signals).label(), 1L, Long::sum);
            DispatchHistoryEntry entry = state.history().get(issue.fingerprint());
            if (cooldownPolicy.needsHumanReview(entry)) {
                humanReview.add(issue.fingerprint());
            } else if (cooldownPolicy.isCoolingDown(entry,
                    registry.configFor(issue.repoUrl()).cooldownHoursSchedule(), now)) {
                coolingDown++;
            }
        }

        RateLimiterWindow window = state.rateWindow();
        OrchestratorStatus.RateLimitUsage usage = new OrchestratorStatus.RateLimitUsage(
                window.maxSessions(), window.periodHours(), window.recentCount(now), window.remaining(now));

        OrchestratorMeta meta = state.meta();
        OrchestratorStatus.LastCycle lastCycle = meta.getLastCycleId() == null ? null
                : new OrchestratorStatus.LastCycle(meta.getLastCycleId(), meta.getLastCycleAt(),
                        meta.getLastCycleStatus(), readReport(meta.getLastCycleReportJson(), warnings));

        int active = (int) state.sessions().values().stream().filter(AgentSession::isActive).count();
        return new OrchestratorStatus(usage,
                new OrchestratorStatus.CooldownSummary(coolingDown, humanReview.size(), humanReview),
                ObjectiveProgress.of(registry.objectives(), openBySeverity(issues, signals)),
                byState, active, lockService.currentLock().isPresent(), lastCycle, warnings);
    }

    public StateExport exportState() {
        OrchestratorState state = stateStore.load();
        OrchestratorMeta meta = state.meta();
        List<AgentSession> sessions = state.sessions().values().stream()
                .sorted(Comparator.comparing(AgentSession::getCreatedAt).thenComparing(AgentSession::getSessionId))
                .toList();
        return new StateExport(clock.instant(),
                List.copyOf(state.sortedHistory().values()),
                sessions,
                RateWindowSnapshot.of(state.rateWindow()),
                meta.getLastCycleId(), meta.getLastCycleAt(), meta.getLastCycleStatus());
    }

    public Optional<FingerprintHistory> dispatchHistory(String fingerprint) {
        return historyRepo.findById(fingerprint).map(entry -> new FingerprintHistory(
                entry,
                sessionRepo.findByFingerprint(fingerprint),
                verificationRepo.findByFingerprintOrderByVerifiedAtAsc(fingerprint)));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private DispatchPlan buildPlan(String repoUrl, RepoRegistry registry, OrchestratorState state, Instant now) {
        List<TrackedIssue> fleet = candidates.trackedIssues(null);
        List<TrackedIssue> issues = repoUrl == null || repoUrl.isBlank()
                ? fleet
                : fleet.stream().filter(i -> i.repoUrl().equals(repoUrl)).toList();
        LifecycleSignals signals = candidates.signals(state);
        FixLearning learning = FixLearning.fromSessions(state.sessions().values(), properties.getFixLearning());

        // Objectives are fleet-wide even when planning a single repo.
        List<ObjectiveProgress> progress = ObjectiveProgress.of(registry.objectives(), openBySeverity(fleet, signals));
        List<Objective> unmet = registry.objectives().stream()
                .filter(o -> progress.stream().anyMatch(p -> p.objective().equals(o.name()) && !p.met()))
                .toList();

        return dispatcher.plan(new PlanningInput(issues, signals, registry, learning, unmet,
                state.rateWindow(), now));
    }

    /** Apply the outcome of every known session to its fingerprints' history. */
    private void reconcile(OrchestratorState state, Instant now) {
        for (AgentSession session : state.sessions().values()) {
            outcomeRecorder.apply(session, state, now);
        }
    }

    private List<ObjectiveProgress> objectiveProgress(RepoRegistry registry, OrchestratorState state) {
        List<TrackedIssue> fleet = candidates.trackedIssues(null);
        return ObjectiveProgress.of(registry.objectives(), openBySeverity(fleet, candidates.signals(state)));
    }

    private Map<SeverityTier, Integer> openBySeverity(List<TrackedIssue> issues, LifecycleSignals signals) {
        Map<SeverityTier, Integer> counts = new EnumMap<>(SeverityTier.class);
        for (TrackedIssue issue : issues) {
            if (tracker.classify(issue, signals).isOpen()) {
                counts.merge(issue.severityTier(), 1, Integer::sum);
            }
        }
        return counts;
    }

    private CycleReport readReport(String json, List<String> warnings) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, CycleReport.class);
        } catch (JsonProcessingException e) {
            log.warn("Stored cycle report is unreadable: {}", e.getOriginalMessage());
            warnings.add("last cycle report unreadable");
            return null;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("JSON serialization failed", e);
        }
    }

    private String newCycleId() {
        return "cycle-" + CYCLE_ID_TIME.format(clock.instant()) + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
