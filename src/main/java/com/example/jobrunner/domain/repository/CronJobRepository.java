package com.example.jobrunner.domain.repository;

import com.example.jobrunner.domain.entity.CronJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for CronJob entity.
 * <p>
 * Claims are taken with a single conditional update so that two overlapping
 * runner invocations can never both execute the same job.
 */
@Repository
public interface CronJobRepository extends JpaRepository<CronJob, UUID> {

    /**
     * Find active jobs whose next execution has arrived, earliest-overdue first.
     * Read-only; safe to call repeatedly.
     */
    @Query("""
            SELECT j FROM CronJob j
            WHERE j.active = true
              AND j.nextExecution <= :now
            ORDER BY j.nextExecution ASC
            """)
    List<CronJob> findDueJobs(@Param("now") Instant now);

    /**
     * Count active jobs whose next execution has arrived
     */
    @Query("""
            SELECT COUNT(j) FROM CronJob j
            WHERE j.active = true
              AND j.nextExecution <= :now
            """)
    long countDueJobs(@Param("now") Instant now);

    /**
     * Claim a job for execution.
     * <p>
     * Succeeds only when no other instance holds an unexpired claim and,
     * unless forced, the job is due.
     *
     * @return number of rows updated (1 if claimed, 0 if someone else holds it or it is not due)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE CronJob j
            SET j.lockedBy = :instanceId,
                j.lockedUntil = :lockUntil,
                j.updatedAt = :now
            WHERE j.id = :jobId
              AND (j.lockedBy IS NULL OR j.lockedUntil < :now)
              AND (:forceRun = true OR j.nextExecution <= :now)
            """)
    int claimJob(
            @Param("jobId") UUID jobId,
            @Param("instanceId") String instanceId,
            @Param("lockUntil") Instant lockUntil,
            @Param("now") Instant now,
            @Param("forceRun") boolean forceRun);

    List<CronJob> findByActiveTrue();
}
