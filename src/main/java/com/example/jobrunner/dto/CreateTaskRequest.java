package com.example.jobrunner.dto;

import com.example.jobrunner.domain.enums.Recurrence;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Request DTO for enqueueing an automated task
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CreateTaskRequest {

    @NotBlank(message = "Task type is required")
    private String taskType;

    @Size(max = 200, message = "Task name must be at most 200 characters")
    private String taskName;

    /**
     * Higher runs first (default: 0)
     */
    private Integer priority;

    /**
     * When the task becomes due (default: immediately)
     */
    private Instant scheduledAt;

    private Recurrence recurring;

    /**
     * Data handed to the task handler
     */
    private Map<String, Object> metadata;
}
