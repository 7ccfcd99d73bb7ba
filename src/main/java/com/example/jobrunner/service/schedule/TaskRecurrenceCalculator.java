package com.example.jobrunner.service.schedule;

import com.example.jobrunner.config.JobRunnerProperties;
import com.example.jobrunner.domain.enums.Recurrence;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Computes when the next occurrence of a recurring task is scheduled.
 * <p>
 * Intervals are counted from the completion time, with no wall-clock alignment.
 * Monthly keeps the day of month, clamped to the length of the next month.
 */
@Component
@RequiredArgsConstructor
public class TaskRecurrenceCalculator {

    private final JobRunnerProperties properties;

    public Optional<Instant> nextScheduledAt(Recurrence recurrence, Instant completedAt) {
        if (recurrence == null) {
            return Optional.empty();
        }
        return switch (recurrence) {
            case NONE -> Optional.empty();
            case HOURLY -> Optional.of(completedAt.plus(Duration.ofHours(1)));
            case DAILY -> Optional.of(completedAt.plus(Duration.ofHours(24)));
            case WEEKLY -> Optional.of(completedAt.plus(Duration.ofDays(7)));
            case MONTHLY -> Optional.of(completedAt.atZone(properties.getZoneId()).plusMonths(1).toInstant());
        };
    }
}
