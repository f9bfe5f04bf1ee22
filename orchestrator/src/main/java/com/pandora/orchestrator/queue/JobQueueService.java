package com.pandora.orchestrator.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pandora.orchestrator.model.BackgroundJob;
import com.pandora.orchestrator.model.JobStatus;
import com.pandora.orchestrator.repository.BackgroundJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Database-backed job queue: enqueue, claim, complete, fail, recover.
 *
 * All methods touching the jobs table are @Transactional so the row lock
 * taken by the claim query is held until the row is marked RUNNING.
 */
@Service
public class JobQueueService implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(JobQueueService.class);

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final BackgroundJobRepository jobRepo;
    private final ObjectMapper            json;
    private final Clock                   clock;
    private final int                     maxAttempts;
    private final Duration                stallTimeout;

    public JobQueueService(BackgroundJobRepository jobRepo,
                           ObjectMapper objectMapper,
                           Clock clock,
                           @Value("${pandora.jobs.max-attempts:3}") int maxAttempts,
                           @Value("${pandora.jobs.stall-timeout:PT15M}") Duration stallTimeout) {
        this.jobRepo      = jobRepo;
        this.json         = objectMapper;
        this.clock        = clock;
        this.maxAttempts  = maxAttempts;
        this.stallTimeout = stallTimeout;
    }

    // ------------------------------------------------------------------
    // Producer side
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public UUID createJob(JobRequest request) {
        String payload;
        try {
            payload = json.writeValueAsString(request.payload());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job payload is not serialisable: " + e.getOriginalMessage(), e);
        }
        BackgroundJob job = jobRepo.save(new BackgroundJob(request.workspaceId(), request.jobType(),
                payload, request.priority(), maxAttempts, clock.instant()));
        log.info("Enqueued {} job {} for workspace {} (priority={})",
                request.jobType(), job.getId(), request.workspaceId(), request.priority());
        return job.getId();
    }

    // ------------------------------------------------------------------
    // Worker side
    // ------------------------------------------------------------------

    @Transactional
    public Optional<BackgroundJob> claimNext(String workerId) {
        Optional<BackgroundJob> opt = jobRepo.claimNextPendingJob();
        opt.ifPresent(job -> {
            Instant now = clock.instant();
            job.setStatus(JobStatus.RUNNING);
            job.setWorkerId(workerId);
            job.setStartedAt(now);
            job.setHeartbeatAt(now);
            job.incrementAttempts();
            jobRepo.save(job);
            log.info("Worker '{}' claimed {} job {} (workspace={}, attempt={}/{})",
                    workerId, job.getJobType(), job.getId(), job.getWorkspaceId(),
                    job.getAttempts(), job.getMaxAttempts());
        });
        return opt;
    }

    @Transactional
    public void complete(BackgroundJob job) {
        job.setStatus(JobStatus.COMPLETED);
        job.setCompletedAt(clock.instant());
        job.setWorkerId(null);
        jobRepo.save(job);
        log.info("{} job {} completed", job.getJobType(), job.getId());
    }

    /**
     * Record a failed attempt. The job goes back to PENDING while it has
     * attempts left, otherwise it is marked FAILED for good.
     */
    @Transactional
    public void fail(BackgroundJob job, String reason) {
        job.setLastError(reason);
        job.setWorkerId(null);
        if (job.getAttempts() < job.getMaxAttempts()) {
            job.setStatus(JobStatus.PENDING);
            job.setStartedAt(null);
            job.setHeartbeatAt(null);
            log.warn("{} job {} failed (attempt {}/{}), will retry. Reason: {}",
                    job.getJobType(), job.getId(), job.getAttempts(), job.getMaxAttempts(), reason);
        } else {
            job.setStatus(JobStatus.FAILED);
            job.setCompletedAt(clock.instant());
            log.error("{} job {} permanently failed after {} attempts (workspace={}). Reason: {}",
                    job.getJobType(), job.getId(), job.getAttempts(), job.getWorkspaceId(), reason);
        }
        jobRepo.save(job);
    }

    /** Mark a job FAILED regardless of remaining attempts, e.g. when no handler exists. */
    @Transactional
    public void failPermanently(BackgroundJob job, String reason) {
        job.setLastError(reason);
        job.setWorkerId(null);
        job.setStatus(JobStatus.FAILED);
        job.setCompletedAt(clock.instant());
        jobRepo.save(job);
        log.error("{} job {} failed without retry: {}", job.getJobType(), job.getId(), reason);
    }

    /** Reset RUNNING jobs whose heartbeat is older than the stall timeout. */
    @Transactional
    public int recoverStalledJobs() {
        Instant cutoff = clock.instant().minus(stallTimeout);
        List<BackgroundJob> stalled = jobRepo.findByStatusAndHeartbeatAtBefore(JobStatus.RUNNING, cutoff);
        for (BackgroundJob job : stalled) {
            log.warn("Recovering stalled {} job {} (worker={}, last heartbeat={})",
                    job.getJobType(), job.getId(), job.getWorkerId(), job.getHeartbeatAt());
            fail(job, "Worker heartbeat timed out after " + stallTimeout);
        }
        return stalled.size();
    }

    public Map<String, Object> payloadOf(BackgroundJob job) {
        if (job.getPayload() == null || job.getPayload().isBlank()) return Map.of();
        try {
            return json.readValue(job.getPayload(), PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job " + job.getId() + " has an unreadable payload", e);
        }
    }
}
