package com.example.jobrunner.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for lookups of a cron job that does not exist.
 * The run endpoints report a missing job as a typed result instead.
 */
@Getter
public class CronJobNotFoundException extends RuntimeException {

    private final UUID jobId;

    public CronJobNotFoundException(UUID jobId) {
        super("Cron job not found: " + jobId);
        this.jobId = jobId;
    }
}
