package com.example.jobrunner.config;

import com.example.jobrunner.domain.enums.TaskStatus;
import com.example.jobrunner.domain.repository.AutomatedTaskRepository;
import com.example.jobrunner.domain.repository.CronJobRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring the cron and task runners.
 * <p>
 * Exposes Prometheus metrics for:
 * - Due cron jobs and due tasks
 * - Tasks by status
 * - Execution times and outcomes
 * - Lost claims
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final CronJobRepository cronJobRepository;
    private final AutomatedTaskRepository taskRepository;
    private final Clock clock;

    private final ConcurrentHashMap<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var status : TaskStatus.values()) {
            var key = "task_status_" + status.getCode();
            gaugeValues.put(key, new AtomicLong(0));

            Gauge.builder("job_runner_tasks", gaugeValues.get(key), AtomicLong::get)
                    .tag("status", status.getCode())
                    .description("Number of automated tasks by status")
                    .register(meterRegistry);
        }

        gaugeValues.put("due_cron_jobs", new AtomicLong(0));
        Gauge.builder("job_runner_due_cron_jobs", gaugeValues.get("due_cron_jobs"), AtomicLong::get)
                .description("Number of active cron jobs whose next execution has arrived")
                .register(meterRegistry);

        gaugeValues.put("due_tasks", new AtomicLong(0));
        Gauge.builder("job_runner_due_tasks", gaugeValues.get("due_tasks"), AtomicLong::get)
                .description("Number of scheduled tasks whose time has arrived")
                .register(meterRegistry);
    }

    /**
     * Periodically update gauge metrics from database
     */
    @Scheduled(fixedDelayString = "${job-runner.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            var now = Instant.now(clock);
            for (var status : TaskStatus.values()) {
                gaugeValues.get("task_status_" + status.getCode()).set(taskRepository.countByStatus(status));
            }
            gaugeValues.get("due_cron_jobs").set(cronJobRepository.countDueJobs(now));
            gaugeValues.get("due_tasks").set(taskRepository.countDueTasks(TaskStatus.SCHEDULED, now));
        } catch (DataAccessException e) {
            log.warn("Failed to refresh runner gauges: {}", e.getMessage());
        }
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record cron job execution time
     */
    public void recordCronExecution(Timer.Sample sample, String functionName, boolean success) {
        sample.stop(Timer.builder("job_runner_cron_execution_time")
                .tag("function", functionName != null ? functionName : "unknown")
                .tag("success", String.valueOf(success))
                .description("Cron job execution time")
                .register(meterRegistry));
    }

    /**
     * Record task execution time
     */
    public void recordTaskExecution(Timer.Sample sample, String taskType, boolean success) {
        sample.stop(Timer.builder("job_runner_task_execution_time")
                .tag("type", taskType != null ? taskType : "unknown")
                .tag("success", String.valueOf(success))
                .description("Automated task execution time")
                .register(meterRegistry));
    }

    public void recordCronFailure(String functionName, String errorType) {
        meterRegistry.counter("job_runner_cron_failures",
                "function", functionName != null ? functionName : "unknown",
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    public void recordTaskFailure(String taskType, String errorType) {
        meterRegistry.counter("job_runner_task_failures",
                "type", taskType != null ? taskType : "unknown",
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    /**
     * Record a claim that another executor won
     *
     * @param kind "cron" or "task"
     */
    public void recordClaimLost(String kind) {
        meterRegistry.counter("job_runner_claims_lost", "kind", kind).increment();
    }

    public void recordRecurrenceSpawned(String taskType) {
        meterRegistry.counter("job_runner_task_recurrences", "type", taskType != null ? taskType : "unknown").increment();
    }
}
