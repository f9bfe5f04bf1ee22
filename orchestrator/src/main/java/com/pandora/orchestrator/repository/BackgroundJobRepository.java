package com.pandora.orchestrator.repository;

import com.pandora.orchestrator.model.BackgroundJob;
import com.pandora.orchestrator.model.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Queue operations on the jobs table.
 */
public interface BackgroundJobRepository extends JpaRepository<BackgroundJob, UUID> {

    /**
     * Highest priority first, then oldest. Must run inside a transaction; the
     * caller flips the row to RUNNING before the lock is released.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            SELECT j FROM BackgroundJob j
            WHERE j.status = com.pandora.orchestrator.model.JobStatus.PENDING
            ORDER BY j.priority DESC, j.createdAt ASC
            LIMIT 1
            """)
    Optional<BackgroundJob> claimNextPendingJob();

    /** RUNNING jobs whose heartbeat is older than {@code cutoff}. */
    List<BackgroundJob> findByStatusAndHeartbeatAtBefore(JobStatus status, Instant cutoff);
}
