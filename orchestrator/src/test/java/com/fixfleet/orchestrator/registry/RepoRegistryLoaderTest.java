package com.fixfleet.orchestrator.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixfleet.orchestrator.config.OrchestratorProperties;
import com.fixfleet.orchestrator.model.SeverityTier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for RepoRegistryLoader.
 *
 * Registry files are written to a temp directory; invalid repo entries are
 * reported and dropped without failing the load.
 */
class RepoRegistryLoaderTest {

    @TempDir
    Path dir;

    private final RepoRegistryLoader loader =
            new RepoRegistryLoader(new ObjectMapper(), new OrchestratorProperties());

    @Test
    void missingFile_yieldsEmptyRegistry() {
        RepoRegistry registry = loader.load(dir.resolve("absent.json"));

        assertThat(registry.repos()).isEmpty();
        assertThat(registry.configFor("https://github.com/acme/x").importanceScore())
                .isEqualTo(RepoConfig.DEFAULT_IMPORTANCE);
    }

    @Test
    void entries_mergeDefaultsThenOverrides() throws IOException {
        Path file = write("""
                {
                  "defaults": { "importance_score": 40, "batch_size": 3, "max_sessions_per_cycle": 4 },
                  "repos": [
                    { "repo": "https://github.com/acme/api", "importance_score": 90,
                      "overrides": { "batch_size": 2, "cooldown_hours_schedule": [12, 48] },
                      "tags": ["payments"] },
                    { "repo": "https://github.com/acme/web", "auto_dispatch": false }
                  ]
                }
                """);

        RepoRegistry registry = loader.load(file);

        RepoConfig api = registry.configFor("https://github.com/acme/api");
        assertThat(api.importanceScore()).isEqualTo(90);
        assertThat(api.batchSize()).isEqualTo(2);
        assertThat(api.maxSessionsPerCycle()).isEqualTo(4);
        assertThat(api.cooldownHoursSchedule()).containsExactly(12, 48);
        assertThat(api.tags()).containsExactly("payments");

        RepoConfig web = registry.configFor("https://github.com/acme/web");
        assertThat(web.importanceScore()).isEqualTo(40);
        assertThat(web.isDispatchable()).isFalse();
        assertThat(registry.warnings()).isEmpty();
    }

    @Test
    void invalidEntry_isRejectedAlone() throws IOException {
        Path file = write("""
                {
                  "repos": [
                    { "repo": "https://github.com/acme/bad", "importance_score": 150 },
                    { "repo": "https://github.com/acme/odd", "batch_size": "five" },
                    { "repo": "https://github.com/acme/ok" },
                    { "importance_score": 10 }
                  ]
                }
                """);

        RepoRegistry registry = loader.load(file);

        assertThat(registry.repos()).extracting(RepoConfig::repoUrl)
                .containsExactly("https://github.com/acme/ok");
        assertThat(registry.isInvalid("https://github.com/acme/bad")).isTrue();
        assertThat(registry.invalidReason("https://github.com/acme/bad")).contains("importance_score");
        assertThat(registry.isInvalid("https://github.com/acme/odd")).isTrue();
        assertThat(registry.warnings()).hasSize(3);
    }

    @Test
    void objectives_areParsed_andBadOnesWarned() throws IOException {
        Path file = write("""
                {
                  "orchestrator": { "objectives": [
                    { "name": "zero-critical", "target_severity": "critical", "target_count": 0, "priority": 1 },
                    { "name": "bogus", "target_severity": "urgent" }
                  ] }
                }
                """);

        RepoRegistry registry = loader.load(file);

        List<Objective> objectives = registry.objectives();
        assertThat(objectives).hasSize(1);
        assertThat(objectives.get(0).targetSeverity()).isEqualTo(SeverityTier.CRITICAL);
        assertThat(objectives.get(0).boost()).isEqualTo(0.15);
        assertThat(registry.warnings()).singleElement().asString().contains("bogus");
    }

    @Test
    void nonJsonFile_isRejected() throws IOException {
        Path file = write("not json at all");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(RegistryValidationException.class);
    }

    private Path write(String content) throws IOException {
        Path file = dir.resolve("repo-registry.json");
        Files.writeString(file, content);
        return file;
    }
}
