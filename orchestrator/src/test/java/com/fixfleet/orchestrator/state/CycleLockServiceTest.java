package com.fixfleet.orchestrator.state;

import com.fixfleet.orchestrator.config.OrchestratorProperties;
import com.fixfleet.orchestrator.model.CycleLock;
import com.fixfleet.orchestrator.repository.CycleLockRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Optional;

import static com.fixfleet.orchestrator.Fixtures.NOW;
import static com.fixfleet.orchestrator.state.CycleLockService.CYCLE_LOCK_KEY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/** Lease acquisition, renewal and release on the cycle lock row. */
@ExtendWith(MockitoExtension.class)
class CycleLockServiceTest {

    @Mock CycleLockRepository        lockRepository;
    @Mock PlatformTransactionManager transactionManager;

    private CycleLockService service;

    @BeforeEach
    void setUp() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.setLockTtl(Duration.ofHours(2));
        service = new CycleLockService(lockRepository, transactionManager, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void tryAcquire_freeLock_insertsLease() {
        when(lockRepository.existsById(CYCLE_LOCK_KEY)).thenReturn(false);

        Optional<String> owner = service.tryAcquire();

        ArgumentCaptor<CycleLock> captor = ArgumentCaptor.forClass(CycleLock.class);
        verify(lockRepository).deleteExpired(CYCLE_LOCK_KEY, NOW);
        verify(lockRepository).saveAndFlush(captor.capture());
        assertThat(owner).isPresent();
        assertThat(captor.getValue().getOwner()).isEqualTo(owner.get());
        assertThat(captor.getValue().getExpiresAt()).isEqualTo(NOW.plus(Duration.ofHours(2)));
    }

    @Test
    void tryAcquire_heldLock_returnsEmpty() {
        when(lockRepository.existsById(CYCLE_LOCK_KEY)).thenReturn(true);

        assertThat(service.tryAcquire()).isEmpty();
        verify(lockRepository, never()).saveAndFlush(any());
    }

    @Test
    void acquire_heldLock_throws() {
        when(lockRepository.existsById(CYCLE_LOCK_KEY)).thenReturn(true);

        assertThatThrownBy(() -> service.acquire())
                .isInstanceOf(CycleAlreadyRunningException.class)
                .hasMessage("cycle already running");
    }

    @Test
    void tryAcquire_lostInsertRace_returnsEmpty() {
        when(lockRepository.existsById(CYCLE_LOCK_KEY)).thenReturn(false);
        when(lockRepository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThat(service.tryAcquire()).isEmpty();
    }

    @Test
    void renew_extendsOwnLeaseOnly() {
        CycleLock lock = new CycleLock(CYCLE_LOCK_KEY, "me", NOW.minusSeconds(60), NOW.plusSeconds(60));
        when(lockRepository.findById(CYCLE_LOCK_KEY)).thenReturn(Optional.of(lock));

        assertThat(service.renew("me")).isTrue();
        assertThat(lock.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofHours(2)));
        assertThat(service.renew("someone-else")).isFalse();
    }

    @Test
    void release_deletesByOwner() {
        when(lockRepository.deleteByKeyAndOwner(CYCLE_LOCK_KEY, "me")).thenReturn(1);

        service.release("me");

        verify(lockRepository).deleteByKeyAndOwner(CYCLE_LOCK_KEY, "me");
    }

    @Test
    void currentLock_hidesExpiredLease() {
        CycleLock expired = new CycleLock(CYCLE_LOCK_KEY, "old", NOW.minusSeconds(7200), NOW.minusSeconds(1));
        when(lockRepository.findById(CYCLE_LOCK_KEY)).thenReturn(Optional.of(expired));

        assertThat(service.currentLock()).isEmpty();
    }
}
