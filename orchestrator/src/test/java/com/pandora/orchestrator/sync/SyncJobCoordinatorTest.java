package com.pandora.orchestrator.sync;

import com.pandora.orchestrator.model.SyncLog;
import com.pandora.orchestrator.model.SyncMode;
import com.pandora.orchestrator.model.SyncType;
import com.pandora.orchestrator.repository.SyncLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncJobCoordinatorTest {

    @Mock SyncLockManager   lockManager;
    @Mock SyncLogRepository syncLogs;

    SyncJobCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new SyncJobCoordinator(lockManager, syncLogs);
    }

    @Test
    void submit_admitted_returnsSubmission() {
        SyncSubmission expected = new SyncSubmission(UUID.randomUUID(), UUID.randomUUID(), SyncMode.FULL, List.of());
        when(lockManager.acquire(any())).thenReturn(expected);

        assertThat(coordinator.submit(SyncRequest.manual("ws-1", "hubspot"))).isSameAs(expected);
    }

    @Test
    void submit_lostInsertRace_translatedToConflictWithWinnerId() {
        SyncLog winner = new SyncLog("ws-1", "hubspot", SyncType.MANUAL, SyncMode.FULL, Instant.now());
        UUID winnerId = UUID.randomUUID();
        ReflectionTestUtils.setField(winner, "id", winnerId);
        when(lockManager.acquire(any())).thenThrow(new DataIntegrityViolationException("uq active_lock_key"));
        when(syncLogs.findByActiveLockKey("ws-1:hubspot")).thenReturn(Optional.of(winner));

        assertThatThrownBy(() -> coordinator.submit(SyncRequest.manual("ws-1", "hubspot")))
                .isInstanceOf(SyncConflictException.class)
                .extracting(e -> ((SyncConflictException) e).getExistingSyncId())
                .isEqualTo(winnerId);
    }

    @Test
    void submit_unrelatedConstraintViolation_isRethrown() {
        when(lockManager.acquire(any())).thenThrow(new DataIntegrityViolationException("not null"));
        when(syncLogs.findByActiveLockKey("ws-1:hubspot")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> coordinator.submit(SyncRequest.manual("ws-1", "hubspot")))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
