package com.fixfleet.orchestrator.dispatch;

import com.fixfleet.orchestrator.agent.AgentPlatformClient;
import com.fixfleet.orchestrator.agent.CreatedSession;
import com.fixfleet.orchestrator.agent.SessionSpec;
import com.fixfleet.orchestrator.config.OrchestratorProperties;
import com.fixfleet.orchestrator.model.AgentSession;
import com.fixfleet.orchestrator.model.IssueState;
import com.fixfleet.orchestrator.model.SeverityTier;
import com.fixfleet.orchestrator.ratelimit.RateLimiterWindow;
import com.fixfleet.orchestrator.registry.RepoConfig;
import com.fixfleet.orchestrator.registry.RepoRegistry;
import com.fixfleet.orchestrator.scoring.PriorityScorer;
import com.fixfleet.orchestrator.scoring.SlaPolicy;
import com.fixfleet.orchestrator.scoring.SlaStatus;
import com.fixfleet.orchestrator.state.OrchestratorState;
import com.fixfleet.orchestrator.state.OrchestratorStateStore;
import com.fixfleet.orchestrator.tracking.IssueLifecycleTracker;
import com.fixfleet.orchestrator.tracking.OutcomeRecorder;
import com.fixfleet.orchestrator.tracking.SkipReason;
import com.fixfleet.orchestrator.tracking.TrackedIssue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Plans and runs severity-ordered dispatch waves.
 *
 * plan() is pure: classify, filter, score, then form batches per wave
 *   (critical → low). Within a wave findings are grouped by (repo, CWE family),
 *   chunked by the repo's batch_size, capped by the repo's max_sessions_per_cycle
 *   across the whole cycle, and repos are interleaved round-robin by descending
 *   importance. The first batch the rate limiter refuses ends formation; it and
 *   everything after it is deferred.
 *
 * execute() does the side effects, one wave at a time:
 *   reserve a rate-limit slot → create sessions in parallel → checkpoint →
 *   poll until terminal / timeout / cancel → record outcomes → checkpoint.
 *   A wave whose fix rate (fixed / created) is below the threshold halts every
 *   later non-empty wave. One failed creation never aborts the wave.
 */
@Component
public class WaveDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WaveDispatcher.class);

    private final IssueLifecycleTracker  tracker;
    private final PriorityScorer         scorer;
    private final SlaPolicy              slaPolicy;
    private final SessionPromptBuilder   promptBuilder;
    private final AgentPlatformClient    agentPlatform;
    private final SessionPoller          poller;
    private final OutcomeRecorder        outcomeRecorder;
    private final OrchestratorStateStore stateStore;
    private final ExecutorService        creationPool;
    private final OrchestratorProperties properties;
    private final Clock                  clock;

    private final Counter sessionsCreated;
    private final Counter sessionsFailed;
    private final Counter batchesDeferred;

    public WaveDispatcher(IssueLifecycleTracker tracker,
                          PriorityScorer scorer,
                          SlaPolicy slaPolicy,
                          SessionPromptBuilder promptBuilder,
                          AgentPlatformClient agentPlatform,
                          SessionPoller poller,
                          OutcomeRecorder outcomeRecorder,
                          OrchestratorStateStore stateStore,
                          @Qualifier("sessionCreationExecutor") ExecutorService creationPool,
                          OrchestratorProperties properties,
                          MeterRegistry meterRegistry,
                          Clock clock) {
        this.tracker         = tracker;
        this.scorer          = scorer;
        this.slaPolicy       = slaPolicy;
        this.promptBuilder   = promptBuilder;
        this.agentPlatform   = agentPlatform;
        this.poller          = poller;
        this.outcomeRecorder = outcomeRecorder;
        this.stateStore      = stateStore;
        this.creationPool    = creationPool;
        this.properties      = properties;
        this.clock           = clock;

        this.sessionsCreated = Counter.builder("fixfleet.sessions.created")
                .description("Agent sessions created by the dispatcher")
                .register(meterRegistry);
        this.sessionsFailed = Counter.builder("fixfleet.sessions.failed")
                .description("Agent session creations that failed after retries")
                .register(meterRegistry);
        this.batchesDeferred = Counter.builder("fixfleet.sessions.deferred")
                .description("Batches deferred by the global rate limit")
                .register(meterRegistry);
    }

    // ------------------------------------------------------------------
    // Planning
    // ------------------------------------------------------------------

    public DispatchPlan plan(PlanningInput in) {
        List<PlanEntry> entries = new ArrayList<>(in.issues().size());
        for (TrackedIssue issue : in.issues()) {
            IssueState state = tracker.classify(issue, in.signals());
            Optional<SkipReason> skip = tracker.skipReason(
                    issue, state, in.signals(), in.registry(), in.fixLearning(), in.now());
            SlaStatus sla = slaPolicy.status(issue.severityTier(), issue.firstSeen(), in.now());
            double score = scorer.score(issue, in.registry().configFor(issue.repoUrl()),
                    sla, in.fixLearning(), in.unmetObjectives());
            entries.add(new PlanEntry(issue, state, score, sla, skip.isEmpty(),
                    skip.map(SkipReason::label).orElse(null)));
        }
        entries.sort(PlanEntry.DISPATCH_ORDER);

        RateLimiterWindow window = in.rateWindow().copy();
        Map<String, Integer> repoSessions = new HashMap<>();
        Map<String, String>  deferReason  = new HashMap<>();
        List<Wave>  waves    = new ArrayList<>();
        List<Batch> deferred = new ArrayList<>();
        boolean exhausted = false;
        int batchSeq = 0;

        for (SeverityTier tier : SeverityTier.values()) {
            List<PlanEntry> tierEntries = entries.stream()
                    .filter(e -> e.eligible() && e.wave() == tier)
                    .toList();
            if (tierEntries.isEmpty()) continue;

            // repo → family → entries, both in score order of first appearance
            Map<String, Map<String, List<PlanEntry>>> grouped = new LinkedHashMap<>();
            for (PlanEntry e : tierEntries) {
                grouped.computeIfAbsent(e.issue().repoUrl(), r -> new LinkedHashMap<>())
                       .computeIfAbsent(e.issue().cweFamily(), f -> new ArrayList<>())
                       .add(e);
            }

            Map<String, Deque<List<PlanEntry>>> chunksByRepo = new LinkedHashMap<>();
            grouped.forEach((repo, families) -> {
                int size = in.registry().configFor(repo).batchSize();
                Deque<List<PlanEntry>> chunks = new ArrayDeque<>();
                families.values().forEach(list -> {
                    for (int i = 0; i < list.size(); i += size) {
                        chunks.add(list.subList(i, Math.min(i + size, list.size())));
                    }
                });
                chunksByRepo.put(repo, chunks);
            });

            List<String> repoOrder = chunksByRepo.keySet().stream()
                    .sorted(Comparator.comparingInt((String r) -> in.registry().configFor(r).importanceScore())
                            .reversed()
                            .thenComparing(Comparator.naturalOrder()))
                    .toList();

            List<Batch> accepted = new ArrayList<>();
            boolean remaining = true;
            while (remaining) {
                remaining = false;
                for (String repo : repoOrder) {
                    List<PlanEntry> chunk = chunksByRepo.get(repo).poll();
                    if (chunk == null) continue;
                    remaining = true;

                    Batch batch = new Batch(tier.label() + "-" + (++batchSeq), repo,
                            chunk.get(0).issue().cweFamily(), tier, chunk);
                    RepoConfig config = in.registry().configFor(repo);
                    int used = repoSessions.getOrDefault(repo, 0);

                    if (used >= config.maxSessionsPerCycle()) {
                        batch.fingerprints().forEach(fp -> deferReason.put(fp, PlanEntry.REPO_CYCLE_LIMIT));
                        deferred.add(batch);
                    } else if (exhausted || !window.tryReserve(in.now())) {
                        exhausted = true;
                        batch.fingerprints().forEach(fp -> deferReason.put(fp, PlanEntry.DEFERRED_RATE_LIMIT));
                        deferred.add(batch);
                    } else {
                        repoSessions.merge(repo, 1, Integer::sum);
                        accepted.add(batch);
                    }
                }
            }
            if (!accepted.isEmpty()) waves.add(new Wave(tier, accepted));
        }

        List<PlanEntry> finalEntries = entries.stream()
                .map(e -> e.eligible() && deferReason.containsKey(e.fingerprint())
                        ? e.withSkipReason(deferReason.get(e.fingerprint()))
                        : e)
                .toList();
        DispatchPlan plan = new DispatchPlan(finalEntries, waves, deferred);
        log.info("Planned {} issue(s): {} skipped, {} wave(s), {} batch(es), {} deferred",
                finalEntries.size(), plan.skippedCount(), waves.size(), plan.batchCount(), deferred.size());
        return plan;
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    /**
     * Run the plan's waves in order.
     *
     * @throws com.fixfleet.orchestrator.state.StateStoreException if a checkpoint fails;
     *         sessions already created keep running on the platform
     */
    public ExecutionReport execute(DispatchPlan plan, ExecutionContext ctx) {
        List<WaveResult> results  = new ArrayList<>();
        List<String>     warnings = new ArrayList<>();
        boolean halted    = false;
        boolean cancelled = false;
        String  haltReason = null;

        List<Wave> waves = plan.waves();
        for (int i = 0; i < waves.size(); i++) {
            Wave wave = waves.get(i);
            if (halted || cancelled || ctx.cancellation().isCancelled()) {
                cancelled = cancelled || ctx.cancellation().isCancelled();
                results.add(WaveResult.notExecuted(wave));
                continue;
            }

            MDC.put("wave", wave.severity().label());
            try {
                WaveResult result = executeWave(wave, ctx, warnings);
                results.add(result);

                if (ctx.cancellation().isCancelled()) {
                    cancelled = true;
                    log.warn("Cycle cancelled during wave {}", wave.severity().label());
                    continue;
                }

                boolean laterWork = waves.subList(i + 1, waves.size()).stream().anyMatch(w -> !w.isEmpty());
                if (result.fixRate() != null && result.fixRate() < properties.getFixRateThreshold() && laterWork) {
                    halted = true;
                    haltReason = String.format(Locale.ROOT,
                            "wave %s fix rate %.2f (%d/%d) below threshold %.2f",
                            wave.severity().label(), result.fixRate(), result.fixed(), result.created(),
                            properties.getFixRateThreshold());
                    log.warn("Halting remaining waves: {}", haltReason);
                }
                if (ctx.afterWave() != null && !ctx.afterWave().getAsBoolean()) {
                    log.error("Cycle lease lost after wave {}, stopping", wave.severity().label());
                    warnings.add("cycle lease lost after wave " + wave.severity().label()
                            + ": remaining waves not executed");
                    ctx.cancellation().cancel();
                    cancelled = true;
                }
            } finally {
                MDC.remove("wave");
            }
        }
        return new ExecutionReport(results, halted, haltReason, cancelled, warnings);
    }

    private WaveResult executeWave(Wave wave, ExecutionContext ctx, List<String> warnings) {
        OrchestratorState state = ctx.state();
        Instant now = clock.instant();
        log.info("Wave {}: {} batch(es)", wave.severity().label(), wave.batches().size());

        // 1. reserve a slot per batch, hand creations to the pool
        Map<Batch, Future<BatchResult>> pending = new LinkedHashMap<>();
        Map<Batch, BatchResult>         results = new LinkedHashMap<>();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        for (Batch batch : wave.batches()) {
            if (ctx.cancellation().isCancelled()) {
                results.put(batch, BatchResult.skipped(batch));
            } else if (!state.rateWindow().tryReserve(now)) {
                log.warn("Rate limit reached, deferring batch {}", batch.batchId());
                batchesDeferred.increment();
                results.put(batch, BatchResult.deferred(batch));
            } else {
                try {
                    pending.put(batch, creationPool.submit(() -> createSession(batch, now, ctx, mdc)));
                } catch (RejectedExecutionException e) {
                    state.rateWindow().release(now);
                    results.put(batch, BatchResult.failed(batch, "session creation pool rejected the batch"));
                }
            }
        }

        // 2. collect creations, record sessions + dispatch history
        List<AgentSession> created = new ArrayList<>();
        boolean interrupted = false;
        for (Map.Entry<Batch, Future<BatchResult>> e : pending.entrySet()) {
            Batch batch = e.getKey();
            BatchResult result = null;
            while (result == null) {
                try {
                    result = e.getValue().get();
                } catch (InterruptedException ex) {
                    // A creation already sent to the platform must still be recorded, so keep waiting.
                    interrupted = true;
                } catch (ExecutionException ex) {
                    state.rateWindow().release(now);
                    result = BatchResult.failed(batch, String.valueOf(ex.getCause()));
                }
            }
            results.put(batch, result);
            if (result.status() == BatchStatus.CREATED) {
                created.add(recordCreated(batch, result, ctx, now));
            }
        }
        // get() on a finished future does not notice a pending interrupt
        if (interrupted || Thread.currentThread().isInterrupted()) {
            log.warn("Interrupted while creating sessions, cancelling cycle");
            ctx.cancellation().cancel();
            Thread.currentThread().interrupt();
        }

        int failures = 0;
        for (BatchResult result : results.values()) {
            if (result.status() != BatchStatus.FAILED) continue;
            failures++;
            Batch batch = result.batch();
            warnings.add("batch " + batch.batchId() + " (" + batch.repoUrl() + ", " + batch.cweFamily()
                    + "): session creation failed: " + result.error());
        }
        stateStore.save(state);   // checkpoint: sessions exist on the platform now

        // 3. wait for the wave's sessions, then turn their results into outcomes
        boolean timedOut = false;
        if (!created.isEmpty()) {
            SessionPoller.Result poll = poller.awaitTerminal(
                    created, properties.getPollInterval(), properties.getWaveTimeout(), ctx.cancellation());
            timedOut = poll == SessionPoller.Result.TIMED_OUT;
            if (timedOut) {
                warnings.add("wave " + wave.severity().label() + " timed out with sessions still running");
            }
            Instant polledAt = clock.instant();
            for (AgentSession session : created) {
                state.touch(session);
                outcomeRecorder.apply(session, state, polledAt);
            }
            stateStore.save(state);   // checkpoint: statuses and outcomes
        }

        int fixed = (int) created.stream().filter(AgentSession::producedFix).count();
        Double fixRate = created.isEmpty() ? null : (double) fixed / created.size();
        int deferredCount = (int) results.values().stream().filter(r -> r.status() == BatchStatus.DEFERRED).count();

        log.info("Wave {} done: {} created, {} fixed, {} failed, {} deferred{}",
                wave.severity().label(), created.size(), fixed, failures, deferredCount,
                timedOut ? " (timed out)" : "");
        List<BatchResult> ordered = wave.batches().stream().map(results::get).toList();
        return new WaveResult(wave.severity(), ordered, created.size(), fixed, failures,
                deferredCount, fixRate, timedOut, false);
    }

    private BatchResult createSession(Batch batch, Instant reservedAt, ExecutionContext ctx,
                                      Map<String, String> mdc) {
        if (mdc != null) MDC.setContextMap(mdc);
        try {
            if (ctx.cancellation().isCancelled()) {
                ctx.state().rateWindow().release(reservedAt);
                return BatchResult.skipped(batch);
            }
            RepoConfig repo = ctx.registry().configFor(batch.repoUrl());
            SessionSpec spec = promptBuilder.build(batch, repo, ctx.fixLearning(), ctx.cycleId());
            CreatedSession session = agentPlatform.createSession(spec);
            sessionsCreated.increment();
            log.info("Session {} created for batch {} ({} issue(s))",
                    session.sessionId(), batch.batchId(), batch.entries().size());
            return BatchResult.created(batch, session.sessionId(), session.url());
        } catch (RuntimeException e) {
            ctx.state().rateWindow().release(reservedAt);
            sessionsFailed.increment();
            log.error("Session creation failed for batch {}: {}", batch.batchId(), e.getMessage());
            return BatchResult.failed(batch, e.getMessage());
        } finally {
            MDC.clear();
        }
    }

    private AgentSession recordCreated(Batch batch, BatchResult result, ExecutionContext ctx, Instant now) {
        OrchestratorState state = ctx.state();
        AgentSession session = new AgentSession(result.sessionId(), result.sessionUrl(), batch.repoUrl(),
                batch.cweFamily(), batch.severity(), ctx.cycleId(),
                new LinkedHashSet<>(batch.fingerprints()), now);
        state.touch(session);
        for (String fp : batch.fingerprints()) {
            state.recordDispatch(fp, result.sessionId(), now);
        }
        return session;
    }
}
