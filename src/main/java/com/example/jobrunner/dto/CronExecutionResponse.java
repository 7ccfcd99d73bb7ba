package com.example.jobrunner.dto;

import com.example.jobrunner.domain.enums.CronExecutionStatus;
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
 * Response DTO for cron execution history
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CronExecutionResponse {

    private UUID id;
    private UUID jobId;
    private CronExecutionStatus status;
    private Instant startedAt;
    private Instant completedAt;
    private Long executionTimeMs;
    private Map<String, Object> resultData;
    private String errorDetails;
    private String executorInstance;
}
