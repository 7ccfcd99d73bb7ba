package com.example.jobrunner.service.task;

import com.example.jobrunner.domain.entity.AutomatedTask;
import com.example.jobrunner.domain.enums.TaskStatus;
import com.example.jobrunner.domain.repository.AutomatedTaskRepository;
import com.example.jobrunner.service.schedule.TaskRecurrenceCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists the claim and the outcome of automated tasks.
 * <p>
 * Rows only move forward. A completed recurring task is left as is and its
 * next occurrence is inserted as a new row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskOutcomeRecorder {

    private final AutomatedTaskRepository taskRepository;
    private final TaskRecurrenceCalculator recurrenceCalculator;

    /**
     * Move a task from SCHEDULED to RUNNING.
     *
     * @return true if this caller won the claim
     */
    @Transactional
    public boolean claim(UUID taskId, Instant now) {
        return taskRepository.claimTask(taskId, TaskStatus.SCHEDULED, TaskStatus.RUNNING, now) == 1;
    }

    /**
     * Mark the task completed and, if it recurs, insert its next occurrence
     *
     * @return the spawned occurrence, if any
     */
    @Transactional
    public Optional<AutomatedTask> recordSuccess(UUID taskId, Map<String, Object> result, Instant completedAt) {
        var task = findTask(taskId);
        task.markCompleted(result, completedAt);
        taskRepository.save(task);

        var nextAt = recurrenceCalculator.nextScheduledAt(task.getRecurring(), completedAt);
        if (nextAt.isEmpty()) {
            return Optional.empty();
        }

        var next = taskRepository.save(task.nextOccurrence(nextAt.get()));
        log.info("Scheduled next {} occurrence of task {} as {} at {}",
                task.getRecurring().getCode(), taskId, next.getId(), next.getScheduledAt());
        return Optional.of(next);
    }

    /**
     * Mark the task failed. Recurring tasks are not rescheduled.
     */
    @Transactional
    public void recordFailure(UUID taskId, String errorMessage, Instant completedAt) {
        var task = findTask(taskId);
        task.markFailed(errorMessage, completedAt);
        taskRepository.save(task);

        if (task.getRecurring() != null && task.getRecurring().isRecurring()) {
            log.warn("Recurring task {} ({}) failed; its {} recurrence stops here", taskId, task.getTaskType(), task.getRecurring().getCode());
        }
    }

    private AutomatedTask findTask(UUID taskId) {
        return taskRepository.findById(taskId).orElseThrow(() -> new IllegalStateException("Automated task not found: " + taskId));
    }
}
