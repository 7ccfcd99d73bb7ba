package com.example.jobrunner.service.task;

/**
 * What happened to a single task in a runner pass
 */
public enum TaskOutcome {
    EXECUTED,
    FAILED,
    /**
     * Another runner claimed the task first
     */
    SKIPPED
}
