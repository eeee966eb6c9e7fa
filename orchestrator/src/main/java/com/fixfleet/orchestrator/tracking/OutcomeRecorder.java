package com.fixfleet.orchestrator.tracking;

import com.fixfleet.orchestrator.model.AgentSession;
import com.fixfleet.orchestrator.model.DispatchHistoryEntry;
import com.fixfleet.orchestrator.model.DispatchOutcome;
import com.fixfleet.orchestrator.model.PullRequestState;
import com.fixfleet.orchestrator.state.OrchestratorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns what we know about a session into dispatch outcomes for its fingerprints.
 *
 *   PR merged                          → PR_MERGED (awaits verification)
 *   PR closed unmerged                 → PR_FAILED
 *   session ended without opening a PR → UNKNOWN
 *   anything else                      → nothing yet
 *
 * The history entry itself drops signals from superseded sessions and makes
 * sure one session fails at most once, so calling this repeatedly is safe.
 */
@Component
public class OutcomeRecorder {

    private static final Logger log = LoggerFactory.getLogger(OutcomeRecorder.class);

    /** Outcome implied by the session's current status and PR, if any. */
    public Optional<DispatchOutcome> outcomeOf(AgentSession session) {
        if (session.getPrState() == PullRequestState.MERGED) return Optional.of(DispatchOutcome.PR_MERGED);
        if (session.getPrState() == PullRequestState.CLOSED) return Optional.of(DispatchOutcome.PR_FAILED);
        boolean hasPr = session.getPrUrl() != null && !session.getPrUrl().isBlank();
        if (session.getStatus().isTerminal() && !hasPr) return Optional.of(DispatchOutcome.UNKNOWN);
        return Optional.empty();
    }

    /**
     * Apply the session's outcome to the history of each of its fingerprints.
     *
     * @return the entries that changed
     */
    public List<DispatchHistoryEntry> apply(AgentSession session,
                                            Map<String, DispatchHistoryEntry> history,
                                            Instant now) {
        Optional<DispatchOutcome> outcome = outcomeOf(session);
        if (outcome.isEmpty()) return List.of();

        List<DispatchHistoryEntry> changed = new ArrayList<>();
        for (String fp : session.getFingerprints()) {
            DispatchHistoryEntry entry = history.get(fp);
            if (entry != null && entry.recordOutcome(session.getSessionId(), outcome.get(), now)) {
                changed.add(entry);
            }
        }
        if (!changed.isEmpty()) {
            log.info("Session {} → {} for {} fingerprint(s)",
                    session.getSessionId(), outcome.get(), changed.size());
        }
        return changed;
    }

    /**
     * Same as {@link #apply(AgentSession, Map, Instant)} on a cycle's working
     * copy. The changes are kept by the state so a checkpoint can replay them
     * on rows a signal updated in the meantime.
     *
     * @return number of entries that changed
     */
    public int apply(AgentSession session, OrchestratorState state, Instant now) {
        Optional<DispatchOutcome> outcome = outcomeOf(session);
        if (outcome.isEmpty()) return 0;

        String sessionId = session.getSessionId();
        int changed = 0;
        for (String fp : session.getFingerprints()) {
            if (state.updateHistory(fp, entry -> entry.recordOutcome(sessionId, outcome.get(), now))) {
                changed++;
            }
        }
        if (changed > 0) {
            log.info("Session {} → {} for {} fingerprint(s)", sessionId, outcome.get(), changed);
        }
        return changed;
    }
}
