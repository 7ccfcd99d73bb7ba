package com.example.jobrunner.controller;

import com.example.jobrunner.dto.CronExecutionResponse;
import com.example.jobrunner.dto.CronRunRequest;
import com.example.jobrunner.dto.PendingJobsResponse;
import com.example.jobrunner.service.cron.CronJobDispatcher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API of the cron runner.
 * <p>
 * Expected non-runs (unknown job, not due, claimed elsewhere) are answered with
 * 200 and {@code success: false}.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/cron-runner")
@Tag(name = "Cron Runner", description = "APIs for inspecting and running cron jobs")
public class CronRunnerController {

    private final CronJobDispatcher cronJobDispatcher;

    @GetMapping
    @Operation(summary = "List due jobs", description = "Active jobs whose next execution has arrived, earliest-overdue first. Nothing is claimed.")
    public ResponseEntity<PendingJobsResponse> getPendingJobs() {
        return ResponseEntity.ok(cronJobDispatcher.getPendingJobs());
    }

    @PostMapping
    @Operation(summary = "Run jobs", description = "Run a single job when job_id is given, otherwise every due job")
    public ResponseEntity<Object> run(@RequestBody(required = false) CronRunRequest request) {
        var runRequest = request != null ? request : new CronRunRequest();

        if (runRequest.hasJobId()) {
            log.info("API: Run cron job {} (force: {}, dry run: {})", runRequest.getJobId(), runRequest.isForced(), runRequest.isDry());
            return ResponseEntity.ok(cronJobDispatcher.runJob(runRequest.getJobId(), runRequest.isForced(), runRequest.isDry()));
        }

        log.info("API: Run all due cron jobs (force: {}, dry run: {})", runRequest.isForced(), runRequest.isDry());
        return ResponseEntity.ok(cronJobDispatcher.runDueJobs(runRequest.isForced(), runRequest.isDry()));
    }

    @GetMapping("/jobs/{jobId}/executions")
    @Operation(summary = "Get execution history", description = "Executions of a job, newest first")
    public ResponseEntity<List<CronExecutionResponse>> getExecutions(@Parameter(description = "Cron job UUID") @PathVariable UUID jobId) {
        return ResponseEntity.ok(cronJobDispatcher.getExecutions(jobId));
    }
}
