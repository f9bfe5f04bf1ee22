package com.pandora.orchestrator.sync;

import com.pandora.orchestrator.model.BackgroundJob;
import com.pandora.orchestrator.model.SyncLog;
import com.pandora.orchestrator.model.SyncMode;
import com.pandora.orchestrator.model.SyncType;
import com.pandora.orchestrator.trigger.PostSyncTrigger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncJobHandlerTest {

    private static final Instant T0 = Instant.parse("2026-03-04T10:00:00Z");

    @Mock SyncLockManager lockManager;
    @Mock PostSyncTrigger postSyncTrigger;
    @Mock ConnectorSyncer hubspot;

    SyncJobHandler handler;
    BackgroundJob  job;
    UUID           syncId;

    @BeforeEach
    void setUp() {
        when(hubspot.connectorType()).thenReturn("hubspot");
        handler = new SyncJobHandler(lockManager, postSyncTrigger, List.of(hubspot), "connector_sync");
        job = new BackgroundJob("ws-1", "connector_sync", "{}", 1, 3, T0);
        syncId = UUID.randomUUID();
    }

    @Test
    void handle_incremental_passesWatermarkAndFiresPostSync() throws Exception {
        SyncLog running = running("hubspot", SyncMode.INCREMENTAL);
        Instant watermark = T0.minusSeconds(86_400);
        when(lockManager.begin(syncId)).thenReturn(Optional.of(running));
        when(lockManager.watermarkFor("ws-1", "hubspot")).thenReturn(Optional.of(watermark));
        when(hubspot.sync("ws-1", SyncMode.INCREMENTAL, watermark)).thenReturn(new ConnectorSyncResult(7, List.of(), Map.of("deals", 7)));
        when(lockManager.complete(eq(syncId), any())).thenReturn(Optional.of(running));

        handler.handle(job, Map.of("syncId", syncId.toString()));

        ArgumentCaptor<SyncCompletedEvent> event = ArgumentCaptor.forClass(SyncCompletedEvent.class);
        verify(postSyncTrigger).onSyncCompleted(event.capture());
        assertThat(event.getValue().workspaceId()).isEqualTo("ws-1");
        assertThat(event.getValue().results()).singleElement()
                .satisfies(o -> assertThat(o.recordsSynced()).isEqualTo(7));
    }

    @Test
    void handle_fullMode_passesNoWatermark() throws Exception {
        SyncLog running = running("hubspot", SyncMode.FULL);
        when(lockManager.begin(syncId)).thenReturn(Optional.of(running));
        when(hubspot.sync(eq("ws-1"), eq(SyncMode.FULL), isNull())).thenReturn(new ConnectorSyncResult(1, List.of(), Map.of()));
        when(lockManager.complete(eq(syncId), any())).thenReturn(Optional.of(running));

        handler.handle(job, Map.of("syncId", syncId.toString()));

        verify(lockManager, never()).watermarkFor(anyString(), anyString());
    }

    @Test
    void handle_syncReapedWhileConnectorRan_doesNotFirePostSync() throws Exception {
        when(lockManager.begin(syncId)).thenReturn(Optional.of(running("hubspot", SyncMode.FULL)));
        when(hubspot.sync(eq("ws-1"), eq(SyncMode.FULL), isNull())).thenReturn(new ConnectorSyncResult(3, List.of(), Map.of()));
        when(lockManager.complete(eq(syncId), any())).thenReturn(Optional.empty());

        handler.handle(job, Map.of("syncId", syncId.toString()));

        verify(postSyncTrigger, never()).onSyncCompleted(any());
    }

    @Test
    void handle_connectorThrows_marksSyncFailedWithoutTriggering() throws Exception {
        when(lockManager.begin(syncId)).thenReturn(Optional.of(running("hubspot", SyncMode.FULL)));
        when(hubspot.sync(any(), any(), any())).thenThrow(new IllegalStateException("HubSpot 401"));

        handler.handle(job, Map.of("syncId", syncId.toString()));

        verify(lockManager).fail(syncId, "HubSpot 401");
        verify(lockManager, never()).complete(any(), any());
        verify(postSyncTrigger, never()).onSyncCompleted(any());
    }

    @Test
    void handle_unknownConnector_failsSync() throws Exception {
        when(lockManager.begin(syncId)).thenReturn(Optional.of(running("fireflies", SyncMode.FULL)));

        handler.handle(job, Map.of("syncId", syncId.toString()));

        verify(lockManager).fail(syncId, "No connector registered for 'fireflies'");
    }

    @Test
    void handle_syncNoLongerPending_isSkipped() throws Exception {
        when(lockManager.begin(syncId)).thenReturn(Optional.empty());

        handler.handle(job, Map.of("syncId", syncId.toString()));

        verify(hubspot, never()).sync(any(), any(), any());
        verify(lockManager, never()).fail(any(), any());
    }

    @Test
    void handle_payloadWithoutSyncId_throws() {
        assertThatThrownBy(() -> handler.handle(job, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private SyncLog running(String connector, SyncMode mode) {
        SyncLog log = new SyncLog("ws-1", connector, SyncType.MANUAL, mode, T0);
        ReflectionTestUtils.setField(log, "id", syncId);
        log.markRunning(T0);
        return log;
    }
}
