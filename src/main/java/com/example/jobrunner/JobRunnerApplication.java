package com.example.jobrunner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Cron job runner and priority task queue runner.
 * <p>
 * Features:
 * - Wall-clock cron jobs with execution history
 * - Priority/FIFO task queue with append-only recurrence
 * - Atomic claims, so overlapping runs never execute an item twice
 * - Remote edge functions behind a circuit breaker
 * - Slack alerting for repeated failures
 */
@EnableScheduling
@SpringBootApplication
public class JobRunnerApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobRunnerApplication.class, args);
    }
}
