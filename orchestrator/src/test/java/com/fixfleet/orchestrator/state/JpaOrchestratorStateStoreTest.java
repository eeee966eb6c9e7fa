package com.fixfleet.orchestrator.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixfleet.orchestrator.config.OrchestratorProperties;
import com.fixfleet.orchestrator.model.DispatchHistoryEntry;
import com.fixfleet.orchestrator.model.DispatchOutcome;
import com.fixfleet.orchestrator.model.OrchestratorMeta;
import com.fixfleet.orchestrator.model.PullRequestState;
import com.fixfleet.orchestrator.model.SessionStatus;
import com.fixfleet.orchestrator.ratelimit.RateLimiterWindow;
import com.fixfleet.orchestrator.repository.AgentSessionRepository;
import com.fixfleet.orchestrator.repository.DispatchHistoryRepository;
import com.fixfleet.orchestrator.repository.OrchestratorMetaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.fixfleet.orchestrator.Fixtures.NOW;
import static com.fixfleet.orchestrator.Fixtures.session;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link JpaOrchestratorStateStore}.
 *
 * Repositories and the transaction manager are mocked; the transaction
 * template runs its callback directly against them.
 */
@ExtendWith(MockitoExtension.class)
class JpaOrchestratorStateStoreTest {

    @Mock DispatchHistoryRepository  historyRepo;
    @Mock AgentSessionRepository     sessionRepo;
    @Mock OrchestratorMetaRepository metaRepo;
    @Mock PlatformTransactionManager transactionManager;

    private final ObjectMapper json = new ObjectMapper().findAndRegisterModules();
    private final OrchestratorProperties properties = new OrchestratorProperties();

    private JpaOrchestratorStateStore store;

    @BeforeEach
    void setUp() {
        store = new JpaOrchestratorStateStore(historyRepo, sessionRepo, metaRepo, json, properties,
                transactionManager, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void load_withoutStoredWindow_usesConfiguredLimits() {
        when(metaRepo.findById(OrchestratorMeta.SINGLETON_ID)).thenReturn(Optional.empty());
        when(historyRepo.findAll()).thenReturn(List.of(new DispatchHistoryEntry("fp1")));
        when(sessionRepo.findAll()).thenReturn(List.of());

        OrchestratorState state = store.load();

        assertThat(state.history()).containsKey("fp1");
        assertThat(state.rateWindow().maxSessions()).isEqualTo(20);
        assertThat(state.rateWindow().recentCount(NOW)).isZero();
    }

    @Test
    void load_keepsStoredTimestamps_butConfiguredLimit() {
        OrchestratorMeta meta = new OrchestratorMeta();
        meta.setRateWindowJson("{\"maxSessions\":99,\"periodHours\":1,"
                + "\"createdTimestamps\":[\"2026-03-01T11:00:00Z\",\"2026-02-20T11:00:00Z\"]}");
        when(metaRepo.findById(OrchestratorMeta.SINGLETON_ID)).thenReturn(Optional.of(meta));
        when(historyRepo.findAll()).thenReturn(List.of());
        when(sessionRepo.findAll()).thenReturn(List.of());

        OrchestratorState state = store.load();

        assertThat(state.rateWindow().maxSessions()).isEqualTo(20);
        assertThat(state.rateWindow().periodHours()).isEqualTo(24);
        assertThat(state.rateWindow().recentCount(NOW)).isEqualTo(1);
    }

    @Test
    void load_corruptWindow_fails() {
        OrchestratorMeta meta = new OrchestratorMeta();
        meta.setRateWindowJson("{not json");
        when(metaRepo.findById(OrchestratorMeta.SINGLETON_ID)).thenReturn(Optional.of(meta));
        when(historyRepo.findAll()).thenReturn(List.of());
        when(sessionRepo.findAll()).thenReturn(List.of());

        assertThatThrownBy(() -> store.load())
                .isInstanceOf(StateStoreException.class)
                .hasMessageContaining("corrupt");
    }

    @Test
    void load_databaseDown_fails() {
        when(metaRepo.findById(OrchestratorMeta.SINGLETON_ID))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> store.load()).isInstanceOf(StateStoreException.class);
    }

    @Test
    void save_writesDirtyRows_andWindow() {
        OrchestratorMeta meta = new OrchestratorMeta();
        RateLimiterWindow window = RateLimiterWindow.empty(20, 24);
        window.tryReserve(NOW);
        OrchestratorState state = new OrchestratorState(List.of(), List.of(), window, meta);
        state.recordDispatch("fp1", "s1", NOW);
        state.touch(session("s1", "xss", SessionStatus.RUNNING, PullRequestState.NONE, "fp1"));
        when(metaRepo.saveAndFlush(meta)).thenReturn(meta);

        store.save(state);

        verify(historyRepo).saveAll(List.of(state.history().get("fp1")));
        verify(sessionRepo).saveAll(List.of(state.sessions().get("s1")));
        assertThat(meta.getRateWindowJson()).contains("createdTimestamps");
        assertThat(meta.getUpdatedAt()).isEqualTo(NOW);
        assertThat(state.dirtyHistory()).isEmpty();
        assertThat(state.dirtySessions()).isEmpty();
    }

    @Test
    void save_concurrentWriter_fails() {
        OrchestratorState state = new OrchestratorState(List.of(), List.of(),
                RateLimiterWindow.empty(20, 24), new OrchestratorMeta());
        when(metaRepo.saveAndFlush(any()))
                .thenThrow(new ObjectOptimisticLockingFailureException(OrchestratorMeta.class, (short) 1));

        assertThatThrownBy(() -> store.save(state))
                .isInstanceOf(StateStoreException.class)
                .hasMessageContaining("concurrent writer");
    }

    @Test
    void save_historyRowChangedBySignal_rebasesAndKeepsVerifiedReset() {
        DispatchHistoryEntry local = new DispatchHistoryEntry("fpX");
        local.recordDispatch("S2", NOW.minusSeconds(3600));
        ReflectionTestUtils.setField(local, "version", 1L);
        OrchestratorMeta meta = new OrchestratorMeta();
        OrchestratorState state = new OrchestratorState(List.of(local), List.of(),
                RateLimiterWindow.empty(20, 24), meta);
        // the cycle polled S2 without a PR while a verification arrived for it
        state.updateHistory("fpX", e -> e.recordOutcome("S2", DispatchOutcome.UNKNOWN, NOW));

        DispatchHistoryEntry stored = new DispatchHistoryEntry("fpX");
        stored.recordDispatch("S2", NOW.minusSeconds(3600));
        stored.recordOutcome("S2", DispatchOutcome.VERIFIED, NOW.minusSeconds(60));
        ReflectionTestUtils.setField(stored, "version", 2L);

        when(historyRepo.saveAll(any()))
                .thenThrow(new ObjectOptimisticLockingFailureException(DispatchHistoryEntry.class, "fpX"))
                .thenAnswer(inv -> inv.getArgument(0));
        when(historyRepo.findAllById(List.of("fpX"))).thenReturn(List.of(stored));
        when(metaRepo.saveAndFlush(meta)).thenReturn(meta);

        store.save(state);

        DispatchHistoryEntry saved = state.history().get("fpX");
        assertThat(saved).isSameAs(local);
        assertThat(saved.getLastOutcome()).isEqualTo(DispatchOutcome.VERIFIED);
        assertThat(saved.getConsecutiveFailures()).isZero();
        assertThat(saved.getVersion()).isEqualTo(2L);
        assertThat(state.dirtyHistory()).isEmpty();
        verify(historyRepo, times(2)).saveAll(any());
    }

    @Test
    void save_rowKeepsChanging_givesUpAfterMaxAttempts() {
        OrchestratorState state = new OrchestratorState(List.of(), List.of(),
                RateLimiterWindow.empty(20, 24), new OrchestratorMeta());
        state.recordDispatch("fp1", "s1", NOW);
        when(historyRepo.saveAll(any()))
                .thenThrow(new ObjectOptimisticLockingFailureException(DispatchHistoryEntry.class, "fp1"));

        assertThatThrownBy(() -> store.save(state))
                .isInstanceOf(StateStoreException.class)
                .hasMessageContaining("kept changing");
        verify(historyRepo, times(JpaOrchestratorStateStore.MAX_SAVE_ATTEMPTS)).saveAll(any());
    }
}
