package com.example.jobrunner.service.handler;

import com.example.jobrunner.client.EdgeFunctionClient;
import com.example.jobrunner.domain.entity.AutomatedTask;
import com.example.jobrunner.exception.ExternalServiceException;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Base class for task handlers that delegate to one edge function.
 * <p>
 * The request carries the task metadata plus {@code task_id} and {@code task_type};
 * subclasses add what their function expects.
 */
@Slf4j
public abstract class EdgeFunctionTaskHandler implements TaskHandler {

    private final EdgeFunctionClient client;

    protected EdgeFunctionTaskHandler(EdgeFunctionClient client) {
        this.client = client;
    }

    /**
     * Name of the edge function this handler calls
     */
    protected abstract String getFunctionName();

    /**
     * Hook for adding function-specific fields to the request body
     */
    protected void customizeRequest(AutomatedTask task, Map<String, Object> request) {
    }

    @Override
    public ExecutionResult execute(AutomatedTask task) {
        log.info("Executing {} for task {} via {}", getTaskType(), task.getId(), getFunctionName());

        var request = new HashMap<String, Object>();
        if (task.getMetadata() != null) {
            request.putAll(task.getMetadata());
        }
        request.put("task_id", task.getId() != null ? task.getId().toString() : null);
        request.put("task_type", task.getTaskType());
        customizeRequest(task, request);

        try {
            return ExecutionResult.success(client.invoke(getFunctionName(), request));
        } catch (ExternalServiceException e) {
            log.error("{} failed for task {}: {}", getFunctionName(), task.getId(), e.getMessage());
            if (e.getHttpStatusCode() != null) {
                return ExecutionResult.httpFailure(e.getHttpStatusCode(), e.getMessage());
            }
            return ExecutionResult.failure(e);
        }
    }

    protected static String getMetadataString(AutomatedTask task, String key, String defaultValue) {
        if (task.getMetadata() == null) {
            return defaultValue;
        }
        var value = task.getMetadata().get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
