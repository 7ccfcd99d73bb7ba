package com.example.jobrunner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Slack alerting configuration properties
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String webhookUrl;
    private String channel = "#job-runner-alerts";
    private boolean enabled = true;

    /**
     * Base URL of the operations dashboard, used for links in alerts
     */
    private String dashboardUrl;
}
