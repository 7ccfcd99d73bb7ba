package com.example.jobrunner.dto;

import com.example.jobrunner.domain.enums.Recurrence;
import com.example.jobrunner.domain.enums.TaskStatus;
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
 * Response DTO for automated task data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TaskResponse {

    private UUID id;
    private String taskType;
    private String taskName;
    private TaskStatus status;
    private Instant scheduledAt;
    private Instant startedAt;
    private Instant completedAt;
    private int priority;
    private Recurrence recurring;
    private Map<String, Object> metadata;
    private Map<String, Object> result;
    private String errorMessage;
    private UUID parentTaskId;
    private Instant createdAt;
}
