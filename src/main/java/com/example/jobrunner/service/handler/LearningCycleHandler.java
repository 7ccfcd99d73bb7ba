package com.example.jobrunner.service.handler;

import com.example.jobrunner.client.EdgeFunctionClient;
import com.example.jobrunner.domain.entity.AutomatedTask;
import com.example.jobrunner.domain.enums.TaskType;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Handler for LEARNING_CYCLE tasks.
 * <p>
 * Expected metadata (optional):
 * - period: analysis window, default 24h
 */
@Component
public class LearningCycleHandler extends EdgeFunctionTaskHandler {

    public LearningCycleHandler(EdgeFunctionClient client) {
        super(client);
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.LEARNING_CYCLE;
    }

    @Override
    protected String getFunctionName() {
        return "continuous-learning-pipeline";
    }

    @Override
    protected void customizeRequest(AutomatedTask task, Map<String, Object> request) {
        request.put("action", "run_learning_cycle");
        request.put("period", getMetadataString(task, "period", "24h"));
    }
}
