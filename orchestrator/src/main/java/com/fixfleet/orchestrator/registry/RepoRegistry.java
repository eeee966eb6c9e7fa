package com.fixfleet.orchestrator.registry;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loaded registry: valid repo configs, rejected entries and fleet objectives.
 *
 * Repos that have scans but no entry get {@link RepoConfig#defaultsFor}.
 * Rejected entries stay listed so the planner can report repo_config_invalid
 * instead of silently falling back to defaults.
 */
public class RepoRegistry {

    private final Map<String, RepoConfig> repos;
    private final Map<String, String>     invalid;
    private final List<Objective>         objectives;
    private final List<String>            warnings;

    public RepoRegistry(Map<String, RepoConfig> repos,
                        Map<String, String> invalid,
                        List<Objective> objectives,
                        List<String> warnings) {
        this.repos      = Map.copyOf(repos);
        this.invalid    = Map.copyOf(invalid);
        this.objectives = List.copyOf(objectives);
        this.warnings   = List.copyOf(warnings);
    }

    public static RepoRegistry empty() {
        return new RepoRegistry(Map.of(), Map.of(), List.of(), List.of());
    }

    public RepoConfig configFor(String repoUrl) {
        RepoConfig config = repos.get(repoUrl);
        return config != null ? config : RepoConfig.defaultsFor(repoUrl);
    }

    public Optional<RepoConfig> find(String repoUrl) {
        return Optional.ofNullable(repos.get(repoUrl));
    }

    public boolean isInvalid(String repoUrl) {
        return invalid.containsKey(repoUrl);
    }

    /** Validation error of a rejected entry, or null. */
    public String invalidReason(String repoUrl) {
        return invalid.get(repoUrl);
    }

    public Collection<RepoConfig> repos()      { return repos.values(); }
    public Map<String, String>    invalid()    { return invalid; }
    public List<Objective>        objectives() { return objectives; }
    public List<String>           warnings()   { return warnings; }
}
