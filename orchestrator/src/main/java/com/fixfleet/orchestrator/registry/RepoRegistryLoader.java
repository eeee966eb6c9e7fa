package com.fixfleet.orchestrator.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fixfleet.orchestrator.config.OrchestratorProperties;
import com.fixfleet.orchestrator.model.SeverityTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the repo registry JSON file into a validated {@link RepoRegistry}.
 *
 * File layout:
 * <pre>
 * {
 *   "defaults":     { "importance_score": 50, "batch_size": 5, ... },
 *   "orchestrator": { "objectives": [ { "name": ..., "target_severity": "critical", ... } ] },
 *   "repos":        [ { "repo": "https://github.com/org/app", "importance_score": 90,
 *                       "overrides": { ... } } ]
 * }
 * </pre>
 * Each repo entry is merged as defaults, then the entry, then its overrides.
 * An entry that fails validation is rejected on its own; the rest still load.
 * A missing file yields an empty registry. A file that is not JSON at all
 * raises {@link RegistryValidationException}.
 */
@Component
public class RepoRegistryLoader {

    private static final Logger log = LoggerFactory.getLogger(RepoRegistryLoader.class);

    private final ObjectMapper           objectMapper;
    private final OrchestratorProperties properties;

    public RepoRegistryLoader(ObjectMapper objectMapper, OrchestratorProperties properties) {
        this.objectMapper = objectMapper;
        this.properties   = properties;
    }

    public RepoRegistry load() {
        return load(Path.of(properties.getRegistryPath()));
    }

    public RepoRegistry load(Path path) {
        if (!Files.exists(path)) {
            log.info("No repo registry at {}, using defaults for every repo", path);
            return RepoRegistry.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new RegistryValidationException("Cannot read repo registry " + path + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new RegistryValidationException("Repo registry " + path + " is not a JSON object");
        }
        return parse(root);
    }

    RepoRegistry parse(JsonNode root) {
        List<String> warnings = new ArrayList<>();
        Map<String, RepoConfig> repos   = new LinkedHashMap<>();
        Map<String, String>     invalid = new LinkedHashMap<>();

        JsonNode defaultsNode = root.path("defaults");
        ObjectNode defaults = defaultsNode.isObject()
                ? ((ObjectNode) defaultsNode).deepCopy()
                : objectMapper.createObjectNode();

        int index = 0;
        for (JsonNode entry : root.path("repos")) {
            index++;
            String repoUrl = entry.path("repo").asText("");
            if (repoUrl.isBlank()) {
                warnings.add("repos[" + index + "]: missing 'repo', entry skipped");
                continue;
            }
            if (repos.containsKey(repoUrl) || invalid.containsKey(repoUrl)) {
                warnings.add(repoUrl + ": duplicate registry entry ignored");
                continue;
            }
            try {
                repos.put(repoUrl, toRepoConfig(repoUrl, merge(defaults, entry)));
            } catch (RegistryValidationException e) {
                invalid.put(repoUrl, e.getMessage());
                warnings.add(repoUrl + ": " + e.getMessage());
            }
        }

        List<Objective> objectives = new ArrayList<>();
        for (JsonNode node : root.path("orchestrator").path("objectives")) {
            try {
                objectives.add(toObjective(node));
            } catch (RegistryValidationException e) {
                warnings.add("objective: " + e.getMessage());
            }
        }

        warnings.forEach(w -> log.warn("Repo registry: {}", w));
        log.info("Loaded repo registry: {} repos, {} rejected, {} objectives",
                repos.size(), invalid.size(), objectives.size());
        return new RepoRegistry(repos, invalid, objectives, warnings);
    }

    // ------------------------------------------------------------------
    // Entry validation
    // ------------------------------------------------------------------

    private ObjectNode merge(ObjectNode defaults, JsonNode entry) {
        ObjectNode merged = defaults.deepCopy();
        if (entry.isObject()) {
            merged.setAll((ObjectNode) entry);
            JsonNode overrides = entry.path("overrides");
            if (overrides.isObject()) merged.setAll((ObjectNode) overrides);
        }
        return merged;
    }

    private RepoConfig toRepoConfig(String repoUrl, JsonNode n) {
        int importance = intField(n, "importance_score", RepoConfig.DEFAULT_IMPORTANCE);
        if (importance < 0 || importance > 100) {
            throw new RegistryValidationException("importance_score " + importance + " out of range [0,100]");
        }
        int maxSessions = intField(n, "max_sessions_per_cycle", RepoConfig.DEFAULT_MAX_SESSIONS);
        if (maxSessions < 0) {
            throw new RegistryValidationException("max_sessions_per_cycle must be >= 0");
        }
        int batchSize = intField(n, "batch_size", RepoConfig.DEFAULT_BATCH_SIZE);
        if (batchSize < 1 || batchSize > 50) {
            throw new RegistryValidationException("batch_size " + batchSize + " out of range [1,50]");
        }

        List<Integer> schedule = RepoConfig.DEFAULT_COOLDOWN_HOURS;
        JsonNode scheduleNode = n.get("cooldown_hours_schedule");
        if (scheduleNode != null && !scheduleNode.isNull()) {
            if (!scheduleNode.isArray() || scheduleNode.isEmpty()) {
                throw new RegistryValidationException("cooldown_hours_schedule must be a non-empty list");
            }
            schedule = new ArrayList<>();
            for (JsonNode h : scheduleNode) {
                if (!h.canConvertToInt() || h.asInt() <= 0) {
                    throw new RegistryValidationException("cooldown_hours_schedule entries must be positive integers");
                }
                schedule.add(h.asInt());
            }
        }

        List<String> tags = new ArrayList<>();
        JsonNode tagsNode = n.get("tags");
        if (tagsNode != null && !tagsNode.isNull()) {
            if (!tagsNode.isArray()) throw new RegistryValidationException("tags must be a list");
            tagsNode.forEach(t -> tags.add(t.asText()));
        }

        String branch = n.path("default_branch").asText(RepoConfig.DEFAULT_BRANCH);
        if (branch.isBlank()) branch = RepoConfig.DEFAULT_BRANCH;

        return new RepoConfig(repoUrl, importance, maxSessions, schedule,
                boolField(n, "auto_dispatch", true), tags, batchSize, branch,
                boolField(n, "enabled", true));
    }

    private Objective toObjective(JsonNode n) {
        String name = n.path("name").asText("");
        if (name.isBlank()) throw new RegistryValidationException("missing name");
        SeverityTier severity = SeverityTier.parse(n.path("target_severity").asText(null));
        if (severity == null) {
            throw new RegistryValidationException(name + ": unknown target_severity");
        }
        int targetCount = intField(n, "target_count", 0);
        if (targetCount < 0) throw new RegistryValidationException(name + ": target_count must be >= 0");
        return new Objective(name, n.path("description").asText(""), severity,
                targetCount, intField(n, "priority", 1));
    }

    private static int intField(JsonNode n, String field, int fallback) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return fallback;
        if (!v.isIntegralNumber() || !v.canConvertToInt()) {
            throw new RegistryValidationException(field + " must be an integer, got '" + v.asText() + "'");
        }
        return v.asInt();
    }

    private static boolean boolField(JsonNode n, String field, boolean fallback) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return fallback;
        if (!v.isBoolean()) throw new RegistryValidationException(field + " must be true or false");
        return v.asBoolean();
    }
}
