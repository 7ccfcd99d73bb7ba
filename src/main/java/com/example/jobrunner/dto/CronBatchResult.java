package com.example.jobrunner.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one pass over all due cron jobs
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CronBatchResult {

    private boolean success;

    @Builder.Default
    private List<CronJobRunResult> executedJobs = new ArrayList<>();

    private int totalExecuted;
    private int totalSucceeded;
    private int totalFailed;
    private boolean dryRun;

    public static CronBatchResult of(List<CronJobRunResult> results, boolean dryRun) {
        var succeeded = (int) results.stream().filter(CronJobRunResult::isSuccess).count();
        return CronBatchResult.builder()
                .success(true)
                .executedJobs(results)
                .totalExecuted(results.size())
                .totalSucceeded(succeeded)
                .totalFailed(results.size() - succeeded)
                .dryRun(dryRun)
                .build();
    }
}
