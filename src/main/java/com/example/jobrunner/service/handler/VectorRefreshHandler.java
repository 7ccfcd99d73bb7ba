package com.example.jobrunner.service.handler;

import com.example.jobrunner.client.EdgeFunctionClient;
import com.example.jobrunner.domain.enums.TaskType;
import org.springframework.stereotype.Component;

/**
 * Handler for VECTOR_REFRESH tasks. Metadata is passed through unchanged.
 */
@Component
public class VectorRefreshHandler extends EdgeFunctionTaskHandler {

    public VectorRefreshHandler(EdgeFunctionClient client) {
        super(client);
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.VECTOR_REFRESH;
    }

    @Override
    protected String getFunctionName() {
        return "vectorize-agent-resources";
    }
}
