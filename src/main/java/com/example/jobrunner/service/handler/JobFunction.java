package com.example.jobrunner.service.handler;

import java.util.Map;

/**
 * A named unit of work a cron job can reference through its {@code function_name}.
 * <p>
 * Implementations receive the job parameters merged with invocation metadata
 * and either return a result or throw. The runner does not assume they are idempotent.
 */
public interface JobFunction {

    /**
     * Key under which this function is registered
     */
    String getName();

    /**
     * Run the function
     *
     * @param input JSON-serializable input
     * @return Result of the execution
     */
    ExecutionResult invoke(Map<String, Object> input);
}
