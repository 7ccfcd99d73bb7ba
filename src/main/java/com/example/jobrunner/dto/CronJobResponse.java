package com.example.jobrunner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for cron job data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CronJobResponse {

    private UUID id;
    private String name;
    private String functionName;
    private String scheduleExpression;
    private Map<String, Object> parameters;

    @JsonProperty("is_active")
    private boolean active;

    private Instant nextExecution;
    private Instant lastExecution;
    private long executionCount;
    private long failureCount;
}
