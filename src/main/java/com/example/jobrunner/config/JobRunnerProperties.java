package com.example.jobrunner.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

/**
 * Configuration properties for the cron and task runners.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "job-runner")
public class JobRunnerProperties {

    /**
     * Whether the periodic scans run. HTTP triggers work either way.
     */
    private boolean schedulingEnabled = true;

    /**
     * Delay between cron job scans in milliseconds
     */
    @Min(1000)
    private long cronScanIntervalMs = 60000;

    /**
     * Delay between task queue scans in milliseconds
     */
    @Min(1000)
    private long taskScanIntervalMs = 60000;

    /**
     * Maximum number of tasks processed per task runner pass
     */
    @Min(1)
    private int taskBatchSize = 10;

    /**
     * Minutes after which an unreleased cron job claim may be taken over
     */
    @Min(1)
    private int claimTimeoutMinutes = 30;

    /**
     * Zone in which wall-clock schedules such as "daily at 09:00" are evaluated
     */
    @NotBlank
    private String timeZone = "UTC";

    /**
     * Job failure count from which each further cron job failure is alerted
     */
    @Min(1)
    private int failureAlertThreshold = 3;

    /**
     * Minimum task priority for which a task failure is alerted
     */
    private int alertMinTaskPriority = 8;

    public ZoneId getZoneId() {
        return ZoneId.of(timeZone);
    }
}
