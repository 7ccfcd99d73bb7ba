package com.example.jobrunner.service.cron;

import com.example.jobrunner.config.JobRunnerProperties;
import com.example.jobrunner.domain.entity.CronExecution;
import com.example.jobrunner.domain.entity.CronJob;
import com.example.jobrunner.domain.enums.CronExecutionStatus;
import com.example.jobrunner.domain.repository.CronExecutionRepository;
import com.example.jobrunner.domain.repository.CronJobRepository;
import com.example.jobrunner.exception.CronJobNotFoundException;
import com.example.jobrunner.service.InstanceIdentity;
import com.example.jobrunner.service.schedule.CronScheduleCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists the claim and the outcome of cron job runs.
 * <p>
 * Each method is its own transaction; the job function itself is invoked
 * between them, outside any transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CronExecutionRecorder {

    private final CronJobRepository cronJobRepository;
    private final CronExecutionRepository executionRepository;
    private final CronScheduleCalculator scheduleCalculator;
    private final InstanceIdentity instanceIdentity;
    private final JobRunnerProperties properties;

    /**
     * Claim a job and open its execution record.
     *
     * @return the RUNNING execution, or empty if another runner holds the job or it is no longer due
     */
    @Transactional
    public Optional<CronExecution> claim(CronJob job, boolean forceRun, Instant now) {
        var instanceId = instanceIdentity.getInstanceId();
        var lockUntil = now.plus(Duration.ofMinutes(properties.getClaimTimeoutMinutes()));

        var updated = cronJobRepository.claimJob(job.getId(), instanceId, lockUntil, now, forceRun);
        if (updated != 1) {
            log.debug("Failed to claim cron job {} (held by another runner or no longer due)", job.getId());
            return Optional.empty();
        }

        var execution = CronExecution.builder()
                .jobId(job.getId())
                .status(CronExecutionStatus.RUNNING)
                .startedAt(now)
                .executorInstance(instanceId)
                .build();

        log.debug("Claimed cron job {} until {}", job.getId(), lockUntil);
        return Optional.of(executionRepository.save(execution));
    }

    /**
     * Close the execution as successful and advance the job schedule
     *
     * @return the updated job
     */
    @Transactional
    public CronJob recordSuccess(UUID jobId, UUID executionId, Map<String, Object> resultData, long executionTimeMs, Instant completedAt) {
        var execution = findExecution(executionId);
        execution.markSuccess(resultData, completedAt, executionTimeMs);
        executionRepository.save(execution);

        var job = cronJobRepository.findById(jobId).orElseThrow(() -> new CronJobNotFoundException(jobId));
        var next = scheduleCalculator.nextExecution(job.getScheduleExpression(), completedAt);
        job.recordSuccess(completedAt, next);
        return cronJobRepository.save(job);
    }

    /**
     * Close the execution as failed and count the failure. The schedule is not advanced.
     *
     * @return the updated job
     */
    @Transactional
    public CronJob recordFailure(UUID jobId, UUID executionId, String errorDetails, long executionTimeMs, Instant completedAt) {
        var execution = findExecution(executionId);
        execution.markFailed(errorDetails, completedAt, executionTimeMs);
        executionRepository.save(execution);

        var job = cronJobRepository.findById(jobId).orElseThrow(() -> new CronJobNotFoundException(jobId));
        job.recordFailure();
        return cronJobRepository.save(job);
    }

    private CronExecution findExecution(UUID executionId) {
        return executionRepository.findById(executionId)
                .orElseThrow(() -> new IllegalStateException("Cron execution not found: " + executionId));
    }
}
