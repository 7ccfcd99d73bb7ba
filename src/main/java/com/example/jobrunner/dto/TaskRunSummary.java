package com.example.jobrunner.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Summary of one task runner pass.
 * {@code executed + failed + skipped} always equals {@code total}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TaskRunSummary {

    private boolean success;
    private int executed;
    private int failed;

    /**
     * Tasks claimed by another runner between selection and claim
     */
    private int skipped;

    private int total;
    private Instant timestamp;
}
