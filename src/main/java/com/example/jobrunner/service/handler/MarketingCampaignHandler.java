package com.example.jobrunner.service.handler;

import com.example.jobrunner.client.EdgeFunctionClient;
import com.example.jobrunner.domain.entity.AutomatedTask;
import com.example.jobrunner.domain.enums.TaskType;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Handler for MARKETING_CAMPAIGN tasks.
 * <p>
 * Expected metadata:
 * - templateName: template to send (required)
 * - targetSegment: user segment, default all
 */
@Component
public class MarketingCampaignHandler extends EdgeFunctionTaskHandler {

    public MarketingCampaignHandler(EdgeFunctionClient client) {
        super(client);
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.MARKETING_CAMPAIGN;
    }

    @Override
    protected String getFunctionName() {
        return "marketing-campaign-manager";
    }

    @Override
    public void validate(AutomatedTask task) {
        if (getMetadataString(task, "templateName", null) == null) {
            throw new IllegalArgumentException("Marketing campaign task requires metadata.templateName");
        }
    }

    @Override
    protected void customizeRequest(AutomatedTask task, Map<String, Object> request) {
        request.put("action", "execute_campaign");
        request.put("targetSegment", getMetadataString(task, "targetSegment", "all"));
    }
}
