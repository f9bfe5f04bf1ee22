package com.pandora.orchestrator.queue;

import com.pandora.orchestrator.model.BackgroundJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobWorkerTest {

    @Mock JobQueueService queue;

    JobWorker worker;

    @AfterEach
    void tearDown() {
        if (worker != null) worker.shutdown();
    }

    @Test
    void process_handlerSucceeds_completesJob() throws Exception {
        JobHandler handler = handler("connector_sync");
        worker = new JobWorker(queue, List.of(handler), 1);
        BackgroundJob job = job("connector_sync");
        when(queue.payloadOf(job)).thenReturn(Map.of("syncId", "abc"));

        worker.process(job);

        verify(handler).handle(job, Map.of("syncId", "abc"));
        verify(queue).complete(job);
    }

    @Test
    void process_handlerThrows_recordsFailedAttempt() throws Exception {
        JobHandler handler = handler("connector_sync");
        worker = new JobWorker(queue, List.of(handler), 1);
        BackgroundJob job = job("connector_sync");
        when(queue.payloadOf(job)).thenReturn(Map.of());
        doThrow(new IllegalStateException("db down")).when(handler).handle(any(), any());

        worker.process(job);

        verify(queue).fail(job, "IllegalStateException: db down");
        verify(queue, never()).complete(any());
    }

    @Test
    void process_noHandler_failsWithoutRetry() {
        worker = new JobWorker(queue, List.of(), 1);
        BackgroundJob job = job("mystery");

        worker.process(job);

        verify(queue).failPermanently(job, "No handler for job type 'mystery'");
        verify(queue, never()).fail(any(), anyString());
    }

    @Test
    void constructor_twoHandlersForOneType_rejected() {
        assertThatThrownBy(() -> new JobWorker(queue, List.of(handler("x"), handler("x")), 1))
                .isInstanceOf(IllegalStateException.class);
    }

    private static JobHandler handler(String type) {
        JobHandler handler = mock(JobHandler.class);
        when(handler.jobType()).thenReturn(type);
        return handler;
    }

    private static BackgroundJob job(String type) {
        return new BackgroundJob("ws-1", type, "{}", 0, 3, Instant.parse("2026-03-04T10:00:00Z"));
    }
}
