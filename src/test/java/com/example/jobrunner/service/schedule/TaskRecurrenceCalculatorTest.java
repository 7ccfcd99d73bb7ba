package com.example.jobrunner.service.schedule;

import com.example.jobrunner.config.JobRunnerProperties;
import com.example.jobrunner.domain.enums.Recurrence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TaskRecurrenceCalculator Tests")
class TaskRecurrenceCalculatorTest {

    private static final Instant COMPLETED_AT = Instant.parse("2024-03-14T10:17:23Z");

    private TaskRecurrenceCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new TaskRecurrenceCalculator(new JobRunnerProperties());
    }

    @Test
    @DisplayName("Should not recur for none or missing recurrence")
    void shouldNotRecurForNone() {
        assertThat(calculator.nextScheduledAt(Recurrence.NONE, COMPLETED_AT)).isEmpty();
        assertThat(calculator.nextScheduledAt(null, COMPLETED_AT)).isEmpty();
    }

    @Test
    @DisplayName("Should add fixed intervals to the completion time without alignment")
    void shouldAddFixedIntervals() {
        assertThat(calculator.nextScheduledAt(Recurrence.HOURLY, COMPLETED_AT)).contains(Instant.parse("2024-03-14T11:17:23Z"));
        assertThat(calculator.nextScheduledAt(Recurrence.DAILY, COMPLETED_AT)).contains(Instant.parse("2024-03-15T10:17:23Z"));
        assertThat(calculator.nextScheduledAt(Recurrence.WEEKLY, COMPLETED_AT)).contains(Instant.parse("2024-03-21T10:17:23Z"));
    }

    @Test
    @DisplayName("Should keep the day of month for monthly recurrence")
    void shouldKeepDayOfMonth() {
        assertThat(calculator.nextScheduledAt(Recurrence.MONTHLY, COMPLETED_AT)).contains(Instant.parse("2024-04-14T10:17:23Z"));
    }

    @Test
    @DisplayName("Should clamp monthly recurrence to the end of a shorter month")
    void shouldClampToEndOfMonth() {
        assertThat(calculator.nextScheduledAt(Recurrence.MONTHLY, Instant.parse("2024-01-31T06:00:00Z")))
                .contains(Instant.parse("2024-02-29T06:00:00Z"));
    }
}
