package com.pandora.orchestrator.queue;

import com.pandora.orchestrator.model.BackgroundJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Polls the jobs table and hands claimed jobs to their {@link JobHandler}.
 *
 * Each tick claims at most one job; a fixed pool caps how many handlers run
 * at once.
 */
@Component
@EnableScheduling
public class JobWorker {

    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    private final JobQueueService          queue;
    private final Map<String, JobHandler>  handlers = new ConcurrentHashMap<>();
    private final ExecutorService          workers;

    public JobWorker(JobQueueService queue,
                     List<JobHandler> allHandlers,
                     @Value("${pandora.jobs.worker-count:4}") int workerCount) {
        this.queue   = queue;
        this.workers = Executors.newFixedThreadPool(workerCount);
        for (JobHandler handler : allHandlers) {
            if (handlers.putIfAbsent(handler.jobType(), handler) != null) {
                throw new IllegalStateException("Two job handlers registered for type '" + handler.jobType() + "'");
            }
            log.info("Registered job handler for '{}'", handler.jobType());
        }
    }

    @Scheduled(fixedDelayString = "${pandora.jobs.poll-interval-ms:2000}")
    public void tick() {
        String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);
        Optional<BackgroundJob> claimed = queue.claimNext(workerId);
        claimed.ifPresent(job -> workers.submit(() -> process(job)));
    }

    @Scheduled(fixedDelayString = "${pandora.jobs.stall-check-interval-ms:60000}")
    public void recoverStalled() {
        queue.recoverStalledJobs();
    }

    /** Run one claimed job to completion or failure. */
    void process(BackgroundJob job) {
        JobHandler handler = handlers.get(job.getJobType());
        if (handler == null) {
            queue.failPermanently(job, "No handler for job type '" + job.getJobType() + "'");
            return;
        }
        try {
            handler.handle(job, queue.payloadOf(job));
            queue.complete(job);
        } catch (Exception e) {
            log.error("Handler for {} job {} threw: {}", job.getJobType(), job.getId(), e.getMessage(), e);
            queue.fail(job, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    @PreDestroy
    void shutdown() {
        workers.shutdown();
    }
}
