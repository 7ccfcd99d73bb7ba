package com.example.jobrunner.service.handler;

import com.example.jobrunner.domain.entity.AutomatedTask;
import com.example.jobrunner.domain.enums.TaskType;

/**
 * Interface for automated task handlers.
 * <p>
 * Each task type has exactly one handler. Handlers should:
 * - Be stateless
 * - Return clear success/failure results or throw
 * - Not manage transactions (handled by the executor)
 */
public interface TaskHandler {

    /**
     * Get the task type this handler supports
     */
    TaskType getTaskType();

    /**
     * Execute the task
     *
     * @param task The claimed task
     * @return Result of the execution
     */
    ExecutionResult execute(AutomatedTask task);

    /**
     * Validate task before execution (optional override)
     *
     * @throws IllegalArgumentException if validation fails
     */
    default void validate(AutomatedTask task) {
    }
}
