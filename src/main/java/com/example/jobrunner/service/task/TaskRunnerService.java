package com.example.jobrunner.service.task;

import com.example.jobrunner.config.JobRunnerProperties;
import com.example.jobrunner.domain.entity.AutomatedTask;
import com.example.jobrunner.domain.enums.Recurrence;
import com.example.jobrunner.domain.enums.TaskStatus;
import com.example.jobrunner.domain.enums.TaskType;
import com.example.jobrunner.domain.repository.AutomatedTaskRepository;
import com.example.jobrunner.dto.CreateTaskRequest;
import com.example.jobrunner.dto.PendingTasksResponse;
import com.example.jobrunner.dto.TaskResponse;
import com.example.jobrunner.dto.TaskRunSummary;
import com.example.jobrunner.mapper.RunnerMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;

/**
 * Entry point of the task queue runner.
 * <p>
 * Flow of one pass:
 * 1. Select up to {@code job-runner.task-batch-size} due tasks, highest priority first, FIFO within a priority
 * 2. Claim and execute them one at a time through {@link TaskExecutorService}
 * 3. Count executed, failed and skipped tasks
 * <p>
 * A failing task never stops the pass. Store errors abort it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskRunnerService {

    private final AutomatedTaskRepository taskRepository;
    private final TaskExecutorService taskExecutorService;
    private final RunnerMapper mapper;
    private final JobRunnerProperties properties;
    private final Clock clock;

    public TaskRunSummary runDueTasks() {
        var now = Instant.now(clock);
        var tasks = taskRepository.findDueTasks(TaskStatus.SCHEDULED, now, PageRequest.of(0, properties.getTaskBatchSize()));

        if (tasks.isEmpty()) {
            log.debug("No tasks ready for execution");
        } else {
            log.info("Found {} tasks ready for execution", tasks.size());
        }

        int executed = 0;
        int failed = 0;
        int skipped = 0;
        for (var task : tasks) {
            switch (runIsolated(task)) {
                case EXECUTED -> executed++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }

        if (!tasks.isEmpty()) {
            log.info("Task pass finished: {} executed, {} failed, {} skipped", executed, failed, skipped);
        }

        return TaskRunSummary.builder()
                .success(true)
                .executed(executed)
                .failed(failed)
                .skipped(skipped)
                .total(tasks.size())
                .timestamp(Instant.now(clock))
                .build();
    }

    /**
     * Due tasks in dispatch order, without claiming them
     */
    public PendingTasksResponse getPendingTasks() {
        var now = Instant.now(clock);
        var tasks = taskRepository.findDueTasks(TaskStatus.SCHEDULED, now, PageRequest.of(0, properties.getTaskBatchSize()));
        return PendingTasksResponse.builder()
                .success(true)
                .pendingTasks(mapper.toTaskResponses(tasks))
                .totalPending((int) taskRepository.countDueTasks(TaskStatus.SCHEDULED, now))
                .currentTime(now)
                .build();
    }

    /**
     * Enqueue a new task
     *
     * @throws IllegalArgumentException if the task type is unknown
     */
    @Transactional
    public TaskResponse enqueueTask(CreateTaskRequest request) {
        var taskType = TaskType.fromCode(request.getTaskType());
        var now = Instant.now(clock);

        var task = AutomatedTask.builder()
                .taskType(taskType.getCode())
                .taskName(request.getTaskName() != null ? request.getTaskName() : taskType.getDisplayName())
                .status(TaskStatus.SCHEDULED)
                .scheduledAt(request.getScheduledAt() != null ? request.getScheduledAt() : now)
                .priority(request.getPriority() != null ? request.getPriority() : 0)
                .recurring(request.getRecurring() != null ? request.getRecurring() : Recurrence.NONE)
                .metadata(request.getMetadata() != null ? new HashMap<>(request.getMetadata()) : new HashMap<>())
                .createdAt(now)
                .build();

        var saved = taskRepository.save(task);
        log.info("Enqueued task {} (type: {}, priority: {}, scheduled at: {})",
                saved.getId(), saved.getTaskType(), saved.getPriority(), saved.getScheduledAt());
        return mapper.toTaskResponse(saved);
    }

    /**
     * Periodic scan. ShedLock keeps overlapping triggers from running the same pass twice.
     */
    @Scheduled(fixedDelayString = "${job-runner.task-scan-interval-ms:60000}",
            initialDelayString = "${job-runner.task-scan-initial-delay-ms:30000}")
    @SchedulerLock(name = "taskQueueScan", lockAtLeastFor = "10s", lockAtMostFor = "30m")
    public void scheduledScan() {
        if (!properties.isSchedulingEnabled()) {
            return;
        }

        try {
            runDueTasks();
        } catch (Exception e) {
            log.error("Error in task queue scan: {}", e.getMessage(), e);
        }
    }

    private TaskOutcome runIsolated(AutomatedTask task) {
        try {
            return taskExecutorService.executeTask(task);
        } catch (DataAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Error processing task {}: {}", task.getId(), e.getMessage(), e);
            return TaskOutcome.FAILED;
        }
    }
}
