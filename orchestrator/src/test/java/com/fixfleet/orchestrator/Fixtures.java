package com.fixfleet.orchestrator;

import com.fixfleet.orchestrator.model.AgentSession;
import com.fixfleet.orchestrator.model.IssueState;
import com.fixfleet.orchestrator.model.PullRequestState;
import com.fixfleet.orchestrator.model.SessionStatus;
import com.fixfleet.orchestrator.model.SeverityTier;
import com.fixfleet.orchestrator.registry.RepoConfig;
import com.fixfleet.orchestrator.tracking.TrackedIssue;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/** Builders shared by the unit tests. */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private Fixtures() {}

    public static TrackedIssue issue(String fp, String repo, SeverityTier severity, String family) {
        return issue(fp, repo, severity, family, NOW.minusSeconds(3600), 1);
    }

    public static TrackedIssue issue(String fp, String repo, SeverityTier severity, String family,
                                     Instant firstSeen, int appearances) {
        return new TrackedIssue(fp, repo, "rule/" + family, severity, family,
                "src/" + fp + ".js", 10, "finding " + fp,
                appearances, firstSeen, NOW.minusSeconds(60), true,
                appearances > 1 ? IssueState.RECURRING : IssueState.NEW);
    }

    public static RepoConfig repo(String url, int importance, int maxSessions, int batchSize) {
        return new RepoConfig(url, importance, maxSessions, List.of(24, 72, 168), true,
                List.of(), batchSize, "main", true);
    }

    public static AgentSession session(String id, String family, SessionStatus status,
                                       PullRequestState prState, String... fingerprints) {
        AgentSession s = new AgentSession(id, "https://app.example/sessions/" + id,
                "https://github.com/acme/api", family, SeverityTier.HIGH, "cycle-0",
                Set.of(fingerprints), NOW.minusSeconds(7200));
        String prUrl = prState == PullRequestState.NONE ? null : "https://github.com/acme/api/pull/" + id.hashCode();
        s.applyStatus(status, prUrl, NOW.minusSeconds(3600));
        s.applyPullRequestState(prState, NOW.minusSeconds(3600));
        return s;
    }
}
