package com.example.jobrunner.service.handler;

import com.example.jobrunner.client.EdgeFunctionClient;
import com.example.jobrunner.domain.entity.AutomatedTask;
import com.example.jobrunner.domain.enums.TaskType;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Handler for MEMORY_CONSOLIDATION tasks.
 * <p>
 * Expected metadata (optional):
 * - user_id: consolidate a single user instead of every recently active one
 * - timeframe: look-back window, default 24h
 */
@Component
public class MemoryConsolidationHandler extends EdgeFunctionTaskHandler {

    public MemoryConsolidationHandler(EdgeFunctionClient client) {
        super(client);
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.MEMORY_CONSOLIDATION;
    }

    @Override
    protected String getFunctionName() {
        return "memory-consolidator";
    }

    @Override
    protected void customizeRequest(AutomatedTask task, Map<String, Object> request) {
        var userId = getMetadataString(task, "user_id", null);
        request.put("action", userId != null ? "consolidate_user" : "consolidate_all");
        request.put("timeframe", getMetadataString(task, "timeframe", "24h"));
    }
}
