package com.example.jobrunner.service.task;

import com.example.jobrunner.config.JobRunnerProperties;
import com.example.jobrunner.config.MetricsConfig;
import com.example.jobrunner.domain.entity.AutomatedTask;
import com.example.jobrunner.domain.enums.TaskStatus;
import com.example.jobrunner.service.alert.SlackAlertService;
import com.example.jobrunner.service.handler.ExecutionResult;
import com.example.jobrunner.service.handler.TaskHandlerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Service responsible for executing individual tasks.
 * <p>
 * Handles:
 * - Atomic claim (SCHEDULED to RUNNING)
 * - Handler lookup, validation and invocation
 * - Outcome recording, recurrence and alerts
 * <p>
 * Every handler error, an unknown task type included, is recorded as a failed
 * task. Store errors propagate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskExecutorService {

    private final TaskOutcomeRecorder recorder;
    private final TaskHandlerRegistry handlerRegistry;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final JobRunnerProperties properties;
    private final Clock clock;

    public TaskOutcome executeTask(AutomatedTask task) {
        var taskId = task.getId();
        var startedAt = Instant.now(clock);

        if (!recorder.claim(taskId, startedAt)) {
            metricsConfig.recordClaimLost("task");
            log.debug("Task {} already claimed by another runner, skipping", taskId);
            return TaskOutcome.SKIPPED;
        }
        task.setStatus(TaskStatus.RUNNING);
        task.setStartedAt(startedAt);

        log.info("Starting task {} (type: {}, priority: {})", taskId, task.getTaskType(), task.getPriority());

        var timerSample = metricsConfig.startTimer();
        var result = invoke(task);
        var completedAt = Instant.now(clock);
        var durationMs = Duration.between(startedAt, completedAt).toMillis();

        metricsConfig.recordTaskExecution(timerSample, task.getTaskType(), result.isSuccess());

        if (result.isSuccess()) {
            try {
                var next = recorder.recordSuccess(taskId, result.getResponseData(), completedAt);
                next.ifPresent(n -> metricsConfig.recordRecurrenceSpawned(task.getTaskType()));
            } catch (RuntimeException e) {
                recordUnsavedSuccess(task, completedAt, e);
                return TaskOutcome.FAILED;
            }
            log.info("Task {} completed successfully in {}ms", taskId, durationMs);
            return TaskOutcome.EXECUTED;
        }

        var errorMessage = result.getErrorMessage() != null ? result.getErrorMessage() : "Unknown error";
        recorder.recordFailure(taskId, errorMessage, completedAt);
        metricsConfig.recordTaskFailure(task.getTaskType(), result.getErrorType());
        log.warn("Task {} failed after {}ms: {}", taskId, durationMs, errorMessage);

        if (task.getPriority() >= properties.getAlertMinTaskPriority()) {
            slackAlertService.sendTaskFailureAlert(task, errorMessage);
        }
        return TaskOutcome.FAILED;
    }

    /**
     * The handler succeeded but its outcome could not be saved. Mark the task failed so the row
     * does not stay RUNNING; if that write fails too, the original error propagates.
     * Store errors still abort the pass once the fallback write has been attempted.
     */
    private void recordUnsavedSuccess(AutomatedTask task, Instant completedAt, RuntimeException cause) {
        log.error("Task {} succeeded but its outcome could not be recorded: {}", task.getId(), cause.getMessage(), cause);
        try {
            recorder.recordFailure(task.getId(), "Failed to record successful outcome: " + cause.getMessage(), completedAt);
            metricsConfig.recordTaskFailure(task.getTaskType(), "OUTCOME_NOT_RECORDED");
        } catch (RuntimeException fallbackError) {
            cause.addSuppressed(fallbackError);
            throw cause;
        }
        if (cause instanceof DataAccessException) {
            throw cause;
        }
    }

    private ExecutionResult invoke(AutomatedTask task) {
        try {
            var handler = handlerRegistry.resolve(task.getTaskType());

            try {
                handler.validate(task);
            } catch (IllegalArgumentException e) {
                log.error("Task {} validation failed: {}", task.getId(), e.getMessage());
                return ExecutionResult.failure(e.getMessage(), "VALIDATION_ERROR");
            }

            var result = handler.execute(task);
            return result != null ? result : ExecutionResult.success();
        } catch (Exception e) {
            log.error("Unexpected error executing task {}: {}", task.getId(), e.getMessage(), e);
            return ExecutionResult.failure(e);
        }
    }
}
