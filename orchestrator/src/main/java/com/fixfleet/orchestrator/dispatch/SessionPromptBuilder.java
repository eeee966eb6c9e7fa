package com.fixfleet.orchestrator.dispatch;

import com.fixfleet.orchestrator.agent.SessionSpec;
import com.fixfleet.orchestrator.registry.RepoConfig;
import com.fixfleet.orchestrator.scoring.CweFixHints;
import com.fixfleet.orchestrator.scoring.FixLearning;
import com.fixfleet.orchestrator.tracking.TrackedIssue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Builds the agent session request for a batch: title, tags, compute budget
 * and the task prompt listing every finding to fix.
 *
 * The cycle id is part of the prompt. The platform deduplicates identical
 * prompts, so a retried creation within one cycle reuses its session while a
 * later cycle's re-dispatch gets a fresh one.
 */
@Component
public class SessionPromptBuilder {

    private static final int MAX_IDS_IN_TITLE = 6;

    public SessionSpec build(Batch batch, RepoConfig repo, FixLearning fixLearning, String cycleId) {
        String family   = batch.cweFamily();
        String severity = batch.severity().label();
        List<String> fps = batch.fingerprints();

        String idsTag  = String.join(",", fps.subList(0, Math.min(fps.size(), MAX_IDS_IN_TITLE)));
        String prTitle = "fix(" + idsTag + "): resolve " + family + " security issues";

        List<String> lines = new ArrayList<>();
        lines.add("Fix " + fps.size() + " security issue(s) in " + repo.repoUrl()
                + " (branch: " + repo.defaultBranch() + ").");
        lines.add("");
        lines.add("Dispatch cycle: " + cycleId);
        lines.add("Issue fingerprints: " + String.join(", ", fps));
        lines.add("Category: " + family + " | Severity: " + severity.toUpperCase(Locale.ROOT));
        lines.add("");
        CweFixHints.hintFor(family).ifPresent(hint -> {
            lines.add("Fix pattern hint: " + hint);
            lines.add("");
        });
        fixLearning.stats(family).ifPresent(s -> {
            lines.add(String.format(Locale.ROOT, "Historical fix rate for %s: %.0f%% (%d/%d sessions)",
                    family, s.fixRate() * 100, s.fixedSessions(), s.totalSessions()));
            lines.add("");
        });

        lines.add("Issues to fix:");
        lines.add("");
        TreeSet<String> files = new TreeSet<>();
        for (PlanEntry entry : batch.entries()) {
            TrackedIssue issue = entry.issue();
            String location = issue.file() == null || issue.file().isBlank()
                    ? "unknown" : issue.file() + ":" + issue.startLine();
            if (issue.file() != null && !issue.file().isBlank()) files.add(issue.file());
            lines.add("### " + issue.fingerprint() + ": " + issue.ruleId());
            lines.add("- Severity: " + issue.severityTier().label().toUpperCase(Locale.ROOT));
            lines.add("- Location: " + location);
            lines.add("- Description: " + (issue.message() == null || issue.message().isBlank()
                    ? "No description" : issue.message()));
            lines.add("");
        }

        lines.add("Instructions:");
        lines.add("1. Clone " + repo.repoUrl() + " and create a new branch from " + repo.defaultBranch() + ".");
        lines.add("2. Fix ALL the issues listed above.");
        lines.add("3. Keep existing behaviour intact and run the existing tests if there are any.");
        lines.add("4. Open a PR on " + repo.repoUrl() + " titled exactly: '" + prTitle + "'.");
        lines.add("5. In the PR body, list each fingerprint and the fix applied to it.");
        if (!files.isEmpty()) {
            lines.add("");
            lines.add("Files to focus on:");
            files.forEach(f -> lines.add("- " + f));
        }

        List<String> tags = new ArrayList<>();
        tags.add("fixfleet");
        tags.add("severity-" + severity);
        tags.add("cwe-" + family);
        tags.add("batch-" + batch.batchId());
        tags.addAll(fps);

        String title = "Security fix (" + idsTag + "): " + family + " (" + severity.toUpperCase(Locale.ROOT) + ")";
        return new SessionSpec(title, String.join("\n", lines), tags, fixLearning.acuBudget(family));
    }
}
