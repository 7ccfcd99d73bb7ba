package com.example.jobrunner.service.cron;

import com.example.jobrunner.config.JobRunnerProperties;
import com.example.jobrunner.domain.entity.CronJob;
import com.example.jobrunner.domain.repository.CronExecutionRepository;
import com.example.jobrunner.domain.repository.CronJobRepository;
import com.example.jobrunner.dto.CronBatchResult;
import com.example.jobrunner.dto.CronExecutionResponse;
import com.example.jobrunner.dto.CronJobRunResult;
import com.example.jobrunner.dto.PendingJobsResponse;
import com.example.jobrunner.exception.CronJobNotFoundException;
import com.example.jobrunner.mapper.RunnerMapper;
import com.example.jobrunner.service.handler.JobFunctionRegistry;
import com.example.jobrunner.service.schedule.CronScheduleCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Entry point of the cron runner.
 * <p>
 * Flow of one pass:
 * 1. Find active jobs whose next execution has arrived, earliest-overdue first
 * 2. Run them one at a time through {@link CronJobExecutor}
 * 3. Aggregate the per-job results into a summary
 * <p>
 * A failing job never stops the pass. Store errors abort it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CronJobDispatcher {

    private final CronJobRepository cronJobRepository;
    private final CronExecutionRepository executionRepository;
    private final CronJobExecutor executor;
    private final JobFunctionRegistry functionRegistry;
    private final CronScheduleCalculator scheduleCalculator;
    private final RunnerMapper mapper;
    private final JobRunnerProperties properties;
    private final Clock clock;

    /**
     * Currently due jobs. Read-only.
     */
    public PendingJobsResponse getPendingJobs() {
        var now = Instant.now(clock);
        var due = cronJobRepository.findDueJobs(now);
        return PendingJobsResponse.builder()
                .success(true)
                .pendingJobs(mapper.toJobResponses(due))
                .totalPending(due.size())
                .currentTime(now)
                .build();
    }

    /**
     * Runs one job by the id given by the caller. An id that does not parse cannot name a job.
     */
    public CronJobRunResult runJob(String rawJobId, boolean forceRun, boolean dryRun) {
        UUID jobId;
        try {
            jobId = UUID.fromString(rawJobId.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Cron job id {} is not a UUID", rawJobId);
            return CronJobRunResult.notFound(rawJobId);
        }
        return runJob(jobId, forceRun, dryRun);
    }

    public CronJobRunResult runJob(UUID jobId, boolean forceRun, boolean dryRun) {
        log.info("Running cron job {} on demand (force: {}, dry run: {})", jobId, forceRun, dryRun);
        return executor.execute(jobId, forceRun, dryRun);
    }

    public CronBatchResult runDueJobs(boolean forceRun, boolean dryRun) {
        var due = cronJobRepository.findDueJobs(Instant.now(clock));
        if (due.isEmpty()) {
            log.debug("No cron jobs due");
            return CronBatchResult.of(List.of(), dryRun);
        }

        log.info("Found {} due cron jobs{}", due.size(), dryRun ? " (dry run)" : "");

        var results = new ArrayList<CronJobRunResult>(due.size());
        for (var job : due) {
            results.add(runIsolated(job, forceRun, dryRun));
        }

        var summary = CronBatchResult.of(results, dryRun);
        log.info("Cron pass finished: {} run, {} succeeded, {} failed",
                summary.getTotalExecuted(), summary.getTotalSucceeded(), summary.getTotalFailed());
        return summary;
    }

    public List<CronExecutionResponse> getExecutions(UUID jobId) {
        if (!cronJobRepository.existsById(jobId)) {
            throw new CronJobNotFoundException(jobId);
        }
        return mapper.toExecutionResponses(executionRepository.findByJobIdOrderByStartedAtDesc(jobId));
    }

    /**
     * Periodic scan. ShedLock keeps overlapping triggers from running the same pass twice.
     */
    @Scheduled(fixedDelayString = "${job-runner.cron-scan-interval-ms:60000}",
            initialDelayString = "${job-runner.cron-scan-initial-delay-ms:30000}")
    @SchedulerLock(name = "cronJobScan", lockAtLeastFor = "10s", lockAtMostFor = "30m")
    public void scheduledScan() {
        if (!properties.isSchedulingEnabled()) {
            return;
        }

        try {
            runDueJobs(false, false);
        } catch (Exception e) {
            log.error("Error in cron scan: {}", e.getMessage(), e);
        }
    }

    /**
     * Report active jobs that reference an unknown function or an unsupported schedule
     */
    @EventListener(ApplicationReadyEvent.class)
    public void verifyJobDefinitions() {
        try {
            for (var job : cronJobRepository.findByActiveTrue()) {
                if (!functionRegistry.hasFunction(job.getFunctionName())) {
                    log.warn("Active cron job {} references unknown function {}; its runs will fail",
                            job.getName(), job.getFunctionName());
                }
                if (!scheduleCalculator.isSupported(job.getScheduleExpression())) {
                    log.warn("Active cron job {} has unsupported schedule '{}'; it will run hourly",
                            job.getName(), job.getScheduleExpression());
                }
                if (job.getNextExecution() == null) {
                    log.warn("Active cron job {} has no next execution and only runs when forced", job.getName());
                }
            }
        } catch (DataAccessException e) {
            log.warn("Could not verify cron job definitions: {}", e.getMessage());
        }
    }

    private CronJobRunResult runIsolated(CronJob job, boolean forceRun, boolean dryRun) {
        try {
            return executor.execute(job.getId(), forceRun, dryRun);
        } catch (DataAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error running cron job {}: {}", job.getName(), e.getMessage(), e);
            return CronJobRunResult.builder()
                    .success(false)
                    .jobId(job.getId())
                    .jobName(job.getName())
                    .functionName(job.getFunctionName())
                    .error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
