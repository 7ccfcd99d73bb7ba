package com.example.jobrunner.controller;

import com.example.jobrunner.dto.CreateTaskRequest;
import com.example.jobrunner.dto.PendingTasksResponse;
import com.example.jobrunner.dto.TaskResponse;
import com.example.jobrunner.dto.TaskRunSummary;
import com.example.jobrunner.service.task.TaskRunnerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API of the task queue runner
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/task-runner")
@Tag(name = "Task Runner", description = "APIs for running and enqueueing automated tasks")
public class TaskRunnerController {

    private final TaskRunnerService taskRunnerService;

    @PostMapping("/run")
    @Operation(summary = "Run due tasks", description = "Claim and execute one batch of due tasks")
    public ResponseEntity<TaskRunSummary> run() {
        log.info("API: Run due tasks");
        return ResponseEntity.ok(taskRunnerService.runDueTasks());
    }

    @GetMapping("/pending")
    @Operation(summary = "List due tasks", description = "Due scheduled tasks in dispatch order. Nothing is claimed.")
    public ResponseEntity<PendingTasksResponse> getPendingTasks() {
        return ResponseEntity.ok(taskRunnerService.getPendingTasks());
    }

    @PostMapping("/tasks")
    @Operation(summary = "Enqueue a task", description = "Create a scheduled automated task")
    public ResponseEntity<TaskResponse> enqueueTask(@Valid @RequestBody CreateTaskRequest request) {
        log.info("API: Enqueue task of type {}", request.getTaskType());
        return ResponseEntity.status(HttpStatus.CREATED).body(taskRunnerService.enqueueTask(request));
    }
}
