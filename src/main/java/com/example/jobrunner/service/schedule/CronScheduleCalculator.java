package com.example.jobrunner.service.schedule;

import com.example.jobrunner.config.JobRunnerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Set;

/**
 * Computes the next execution time of a cron job.
 * <p>
 * Only a closed set of wall-clock patterns is understood:
 * <ul>
 *     <li>{@code *}{@code /15 * * * *} - next quarter-hour boundary</li>
 *     <li>{@code 0 * * * *} - top of the next hour</li>
 *     <li>{@code 0 9 * * *} - 09:00 today if before 09:00, otherwise tomorrow</li>
 *     <li>{@code 0 0 * * 0} - next Sunday 00:00, always at least one day ahead</li>
 * </ul>
 * Anything else is treated as hourly. Times are evaluated in {@code job-runner.time-zone}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CronScheduleCalculator {

    public static final String EVERY_15_MINUTES = "*/15 * * * *";
    public static final String HOURLY = "0 * * * *";
    public static final String DAILY_9AM = "0 9 * * *";
    public static final String WEEKLY_SUNDAY = "0 0 * * 0";

    private static final Set<String> SUPPORTED = Set.of(EVERY_15_MINUTES, HOURLY, DAILY_9AM, WEEKLY_SUNDAY);
    private static final LocalTime DAILY_RUN_TIME = LocalTime.of(9, 0);

    private final JobRunnerProperties properties;

    /**
     * Next execution strictly after {@code reference} for the given expression
     */
    public Instant nextExecution(String expression, Instant reference) {
        var now = reference.atZone(properties.getZoneId());
        var normalized = normalize(expression);

        var next = switch (normalized) {
            case EVERY_15_MINUTES -> nextQuarterHour(now);
            case HOURLY -> nextHour(now);
            case DAILY_9AM -> nextDailyRun(now);
            case WEEKLY_SUNDAY -> now.truncatedTo(ChronoUnit.DAYS).with(TemporalAdjusters.next(DayOfWeek.SUNDAY));
            default -> {
                log.warn("Unsupported schedule expression '{}', falling back to hourly", expression);
                yield nextHour(now);
            }
        };
        return next.toInstant();
    }

    public boolean isSupported(String expression) {
        return SUPPORTED.contains(normalize(expression));
    }

    private static ZonedDateTime nextQuarterHour(ZonedDateTime now) {
        var minute = (now.getMinute() / 15 + 1) * 15;
        var hour = now.truncatedTo(ChronoUnit.HOURS);
        return minute >= 60 ? hour.plusHours(1) : hour.plusMinutes(minute);
    }

    private static ZonedDateTime nextHour(ZonedDateTime now) {
        return now.truncatedTo(ChronoUnit.HOURS).plusHours(1);
    }

    private static ZonedDateTime nextDailyRun(ZonedDateTime now) {
        var today = now.truncatedTo(ChronoUnit.DAYS).with(DAILY_RUN_TIME);
        return now.getHour() < DAILY_RUN_TIME.getHour() ? today : today.plusDays(1);
    }

    private static String normalize(String expression) {
        return expression == null ? "" : expression.trim().replaceAll("\\s+", " ");
    }
}
