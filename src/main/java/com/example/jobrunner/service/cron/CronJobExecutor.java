package com.example.jobrunner.service.cron;

import com.example.jobrunner.config.JobRunnerProperties;
import com.example.jobrunner.config.MetricsConfig;
import com.example.jobrunner.domain.entity.CronJob;
import com.example.jobrunner.domain.repository.CronJobRepository;
import com.example.jobrunner.dto.CronJobRunResult;
import com.example.jobrunner.service.alert.SlackAlertService;
import com.example.jobrunner.service.handler.ExecutionResult;
import com.example.jobrunner.service.handler.JobFunctionRegistry;
import com.example.jobrunner.service.schedule.CronScheduleCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Runs a single cron job with full lifecycle management.
 * <p>
 * Handles:
 * - Due check and dry runs
 * - Atomic claim
 * - Job function invocation
 * - Outcome recording, metrics and failure alerts
 * <p>
 * Job function errors never escape: they are recorded on the execution and
 * returned as a failed result. Store errors propagate to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CronJobExecutor {

    private final CronJobRepository cronJobRepository;
    private final CronExecutionRecorder recorder;
    private final JobFunctionRegistry functionRegistry;
    private final CronScheduleCalculator scheduleCalculator;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final JobRunnerProperties properties;
    private final Clock clock;

    public CronJobRunResult execute(UUID jobId, boolean forceRun, boolean dryRun) {
        var now = Instant.now(clock);

        var job = cronJobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.warn("Cron job {} not found", jobId);
            return CronJobRunResult.notFound(jobId);
        }

        if (!forceRun && !job.isDue(now)) {
            log.debug("Cron job {} is not due until {}", job.getName(), job.getNextExecution());
            return CronJobRunResult.notDue(job);
        }

        if (dryRun) {
            var wouldBeNext = scheduleCalculator.nextExecution(job.getScheduleExpression(), now);
            log.info("Dry run of cron job {} ({}), next execution would be {}", job.getName(), job.getFunctionName(), wouldBeNext);
            return CronJobRunResult.dryRun(job, job.buildInvocationInput(), wouldBeNext);
        }

        var claimed = recorder.claim(job, forceRun, now);
        if (claimed.isEmpty()) {
            metricsConfig.recordClaimLost("cron");
            log.info("Cron job {} already claimed by another runner, skipping", job.getName());
            return CronJobRunResult.alreadyClaimed(job);
        }
        var executionId = claimed.get().getId();

        log.info("Starting cron job {} (function: {}, execution: {})", job.getName(), job.getFunctionName(), executionId);

        var timerSample = metricsConfig.startTimer();
        var result = invoke(job);
        var completedAt = Instant.now(clock);
        var durationMs = Duration.between(now, completedAt).toMillis();

        metricsConfig.recordCronExecution(timerSample, job.getFunctionName(), result.isSuccess());

        if (result.isSuccess()) {
            CronJob updated;
            try {
                updated = recorder.recordSuccess(job.getId(), executionId, result.getResponseData(), durationMs, completedAt);
            } catch (RuntimeException e) {
                return recordUnsavedSuccess(job, executionId, durationMs, completedAt, e);
            }
            log.info("Cron job {} completed in {}ms, next execution {}", job.getName(), durationMs, updated.getNextExecution());
            return CronJobRunResult.succeeded(updated, executionId, durationMs, result.getResponseData());
        }

        var updated = recorder.recordFailure(job.getId(), executionId, result.describeError(), durationMs, completedAt);
        metricsConfig.recordCronFailure(job.getFunctionName(), result.getErrorType());
        log.warn("Cron job {} failed ({} failures so far): {}", job.getName(), updated.getFailureCount(), result.getErrorMessage());

        if (updated.getFailureCount() >= properties.getFailureAlertThreshold()) {
            slackAlertService.sendCronJobFailureAlert(updated, result.getErrorMessage());
        }
        return CronJobRunResult.failed(updated, executionId, durationMs, result.getErrorMessage());
    }

    /**
     * The function succeeded but the success write failed. Close the execution as failed so it does
     * not stay RUNNING and the lease is released. Store errors still propagate afterwards.
     */
    private CronJobRunResult recordUnsavedSuccess(CronJob job, UUID executionId, long durationMs,
                                                  Instant completedAt, RuntimeException cause) {
        log.error("Cron job {} succeeded but its outcome could not be recorded: {}", job.getName(), cause.getMessage(), cause);
        var errorMessage = "Failed to record successful outcome: " + cause.getMessage();
        CronJob updated;
        try {
            updated = recorder.recordFailure(job.getId(), executionId, errorMessage, durationMs, completedAt);
        } catch (RuntimeException fallbackError) {
            cause.addSuppressed(fallbackError);
            throw cause;
        }
        metricsConfig.recordCronFailure(job.getFunctionName(), "OUTCOME_NOT_RECORDED");
        if (cause instanceof DataAccessException) {
            throw cause;
        }
        return CronJobRunResult.failed(updated, executionId, durationMs, errorMessage);
    }

    private ExecutionResult invoke(CronJob job) {
        var function = functionRegistry.getFunction(job.getFunctionName());
        if (function.isEmpty()) {
            log.error("No job function registered for {} (job {})", job.getFunctionName(), job.getName());
            return ExecutionResult.failure("No job function registered for name: " + job.getFunctionName(),
                    CronJobRunResult.UNKNOWN_FUNCTION);
        }

        try {
            var result = function.get().invoke(job.buildInvocationInput());
            return result != null ? result : ExecutionResult.success();
        } catch (Exception e) {
            log.error("Job function {} threw for job {}: {}", job.getFunctionName(), job.getName(), e.getMessage(), e);
            return ExecutionResult.failure(e);
        }
    }
}
