package com.example.jobrunner.dto;

import com.example.jobrunner.domain.entity.CronJob;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of running a single cron job.
 * <p>
 * Expected non-runs (missing job, not due, claimed elsewhere) are reported with
 * {@code success = false} and one of the error codes below, never as an exception.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CronJobRunResult {

    public static final String JOB_NOT_FOUND = "JOB_NOT_FOUND";
    public static final String JOB_NOT_DUE = "JOB_NOT_DUE";
    public static final String JOB_ALREADY_CLAIMED = "JOB_ALREADY_CLAIMED";
    public static final String UNKNOWN_FUNCTION = "UNKNOWN_FUNCTION";

    private boolean success;
    private UUID jobId;
    private String jobName;
    private String functionName;
    private UUID executionId;
    private Long executionTimeMs;
    private Map<String, Object> result;
    private Instant nextExecution;

    /**
     * Error code for expected non-runs, or the handler's error for failed runs
     */
    private String error;

    /**
     * Human readable detail accompanying {@link #error}
     */
    private String message;

    private Boolean dryRun;

    /**
     * Parameters the job function would receive (dry runs only)
     */
    private Map<String, Object> parameters;

    public static CronJobRunResult notFound(UUID jobId) {
        return CronJobRunResult.builder()
                .success(false)
                .jobId(jobId)
                .error(JOB_NOT_FOUND)
                .message("Job not found: " + jobId)
                .build();
    }

    public static CronJobRunResult notFound(String rawJobId) {
        return CronJobRunResult.builder()
                .success(false)
                .error(JOB_NOT_FOUND)
                .message("Job not found: " + rawJobId)
                .build();
    }

    public static CronJobRunResult notDue(CronJob job) {
        return forJob(job)
                .success(false)
                .nextExecution(job.getNextExecution())
                .error(JOB_NOT_DUE)
                .message("Job is not due until " + job.getNextExecution())
                .build();
    }

    public static CronJobRunResult alreadyClaimed(CronJob job) {
        return forJob(job)
                .success(false)
                .error(JOB_ALREADY_CLAIMED)
                .message("Job is being executed by another runner")
                .build();
    }

    public static CronJobRunResult dryRun(CronJob job, Map<String, Object> parameters, Instant wouldBeNext) {
        return forJob(job)
                .success(true)
                .dryRun(true)
                .parameters(parameters)
                .nextExecution(wouldBeNext)
                .build();
    }

    public static CronJobRunResult succeeded(CronJob job, UUID executionId, long executionTimeMs, Map<String, Object> result) {
        return forJob(job)
                .success(true)
                .executionId(executionId)
                .executionTimeMs(executionTimeMs)
                .result(result)
                .nextExecution(job.getNextExecution())
                .build();
    }

    public static CronJobRunResult failed(CronJob job, UUID executionId, long executionTimeMs, String error) {
        return forJob(job)
                .success(false)
                .executionId(executionId)
                .executionTimeMs(executionTimeMs)
                .nextExecution(job.getNextExecution())
                .error(error)
                .build();
    }

    private static CronJobRunResultBuilder forJob(CronJob job) {
        return CronJobRunResult.builder()
                .jobId(job.getId())
                .jobName(job.getName())
                .functionName(job.getFunctionName());
    }
}
