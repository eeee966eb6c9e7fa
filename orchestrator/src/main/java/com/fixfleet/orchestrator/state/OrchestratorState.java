package com.fixfleet.orchestrator.state;

import com.fixfleet.orchestrator.model.AgentSession;
import com.fixfleet.orchestrator.model.DispatchHistoryEntry;
import com.fixfleet.orchestrator.model.OrchestratorMeta;
import com.fixfleet.orchestrator.ratelimit.RateLimiterWindow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * In-memory working copy of the orchestrator's durable state for one cycle.
 *
 * Loaded once by {@link OrchestratorStateStore#load()}, mutated by the
 * dispatcher, written back at every checkpoint. Only changed entries are
 * written, so a checkpoint costs what the wave changed.
 *
 * Resolution signals may update history and session rows while a cycle runs.
 * Every history change therefore goes through {@link #updateHistory}, which
 * keeps the change until the next checkpoint: when the store finds a row
 * newer than this copy it calls {@link #rebase}, which adopts the stored row
 * and replays the pending changes on top of it.
 */
public class OrchestratorState {

    private final Map<String, DispatchHistoryEntry> history;
    private final Map<String, AgentSession>         sessions;
    private final RateLimiterWindow                 rateWindow;
    private OrchestratorMeta                        meta;

    private final Set<String> dirtyHistory  = ConcurrentHashMap.newKeySet();
    private final Set<String> dirtySessions = ConcurrentHashMap.newKeySet();

    // fingerprint → changes applied since the last checkpoint, in order
    private final Map<String, List<Predicate<DispatchHistoryEntry>>> pendingChanges = new ConcurrentHashMap<>();

    public OrchestratorState(Collection<DispatchHistoryEntry> history,
                             Collection<AgentSession> sessions,
                             RateLimiterWindow rateWindow,
                             OrchestratorMeta meta) {
        this.history    = new ConcurrentHashMap<>();
        this.sessions   = new ConcurrentHashMap<>();
        history.forEach(h -> this.history.put(h.getFingerprint(), h));
        sessions.forEach(s -> this.sessions.put(s.getSessionId(), s));
        this.rateWindow = rateWindow;
        this.meta       = meta;
    }

    // ------------------------------------------------------------------
    // Dispatch history
    // ------------------------------------------------------------------

    public Map<String, DispatchHistoryEntry> history() {
        return Collections.unmodifiableMap(history);
    }

    /** A session was created for the fingerprint; creates its entry on the first dispatch. */
    public void recordDispatch(String fingerprint, String sessionId, Instant now) {
        history.computeIfAbsent(fingerprint, DispatchHistoryEntry::new);
        updateHistory(fingerprint, entry -> {
            entry.recordDispatch(sessionId, now);
            return true;
        });
    }

    /**
     * Apply a change to an existing entry. The change must report whether it
     * modified the entry and must be safe to run again on a newer copy.
     *
     * @return false if there is no entry or the change did nothing
     */
    public boolean updateHistory(String fingerprint, Predicate<DispatchHistoryEntry> change) {
        DispatchHistoryEntry entry = history.get(fingerprint);
        if (entry == null || !change.test(entry)) return false;
        pendingChanges.computeIfAbsent(fingerprint, fp -> Collections.synchronizedList(new ArrayList<>()))
                .add(change);
        dirtyHistory.add(fingerprint);
        return true;
    }

    // ------------------------------------------------------------------
    // Sessions
    // ------------------------------------------------------------------

    public Map<String, AgentSession> sessions() {
        return Collections.unmodifiableMap(sessions);
    }

    public void touch(AgentSession session) {
        sessions.put(session.getSessionId(), session);
        dirtySessions.add(session.getSessionId());
    }

    // ------------------------------------------------------------------
    // Checkpoint support
    // ------------------------------------------------------------------

    public List<DispatchHistoryEntry> dirtyHistory() {
        return dirtyHistory.stream().map(history::get).toList();
    }

    public List<AgentSession> dirtySessions() {
        return dirtySessions.stream().map(sessions::get).toList();
    }

    /**
     * Replace stale copies with the stored rows. Pending history changes are
     * replayed on the stored row; sessions keep what this copy learned.
     *
     * @return number of copies that were behind the store
     */
    int rebase(Collection<DispatchHistoryEntry> storedHistory, Collection<AgentSession> storedSessions) {
        int rebased = 0;
        for (DispatchHistoryEntry stored : storedHistory) {
            DispatchHistoryEntry local = history.get(stored.getFingerprint());
            if (local == null || sameVersion(local.getVersion(), stored.getVersion())) continue;
            local.copyFrom(stored);
            List<Predicate<DispatchHistoryEntry>> changes = pendingChanges.getOrDefault(stored.getFingerprint(), List.of());
            synchronized (changes) {
                changes.forEach(change -> change.test(local));
            }
            rebased++;
        }
        for (AgentSession stored : storedSessions) {
            AgentSession local = sessions.get(stored.getSessionId());
            if (local == null || sameVersion(local.getVersion(), stored.getVersion())) continue;
            local.rebaseOnto(stored);
            rebased++;
        }
        return rebased;
    }

    /**
     * Called by the store after a successful write. The in-memory copies stay
     * the ones callers hold; they only take over the new row versions.
     */
    void markClean(OrchestratorMeta savedMeta,
                   Collection<DispatchHistoryEntry> savedHistory,
                   Collection<AgentSession> savedSessions) {
        for (DispatchHistoryEntry saved : savedHistory) {
            DispatchHistoryEntry local = history.get(saved.getFingerprint());
            if (local != null && local != saved) local.copyFrom(saved);
        }
        for (AgentSession saved : savedSessions) {
            AgentSession local = sessions.get(saved.getSessionId());
            if (local != null && local != saved) local.copyFrom(saved);
        }
        dirtyHistory.clear();
        dirtySessions.clear();
        pendingChanges.clear();
        this.meta = savedMeta;
    }

    List<String> dirtyHistoryKeys() { return List.copyOf(dirtyHistory); }
    List<String> dirtySessionKeys() { return List.copyOf(dirtySessions); }

    private static boolean sameVersion(Long local, Long stored) {
        return local == null ? stored == null : local.equals(stored);
    }

    public RateLimiterWindow rateWindow() { return rateWindow; }
    public OrchestratorMeta  meta()       { return meta; }

    /** Ordered copy of the history, for export. */
    public Map<String, DispatchHistoryEntry> sortedHistory() {
        Map<String, DispatchHistoryEntry> sorted = new LinkedHashMap<>();
        history.keySet().stream().sorted().forEach(k -> sorted.put(k, history.get(k)));
        return sorted;
    }
}
