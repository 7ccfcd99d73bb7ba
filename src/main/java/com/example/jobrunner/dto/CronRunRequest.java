package com.example.jobrunner.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.StringUtils;

/**
 * Request body of the cron runner. Without a job id every due job is run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CronRunRequest {

    /**
     * Raw job id as sent. A value that is not a UUID is answered like an unknown job.
     */
    private String jobId;

    /**
     * Run even if the job is not due yet
     */
    private Boolean forceRun;

    /**
     * Report what would happen without writing anything
     */
    private Boolean dryRun;

    public boolean hasJobId() {
        return StringUtils.hasText(jobId);
    }

    public boolean isForced() {
        return Boolean.TRUE.equals(forceRun);
    }

    public boolean isDry() {
        return Boolean.TRUE.equals(dryRun);
    }
}
