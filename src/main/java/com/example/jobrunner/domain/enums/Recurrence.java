package com.example.jobrunner.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Recurrence policy of an automated task.
 * The next occurrence is computed from the completion time plus a fixed interval.
 */
@Getter
@RequiredArgsConstructor
public enum Recurrence {

    NONE("none"),

    HOURLY("hourly"),

    DAILY("daily"),

    WEEKLY("weekly"),

    MONTHLY("monthly");

    @JsonValue
    private final String code;

    /**
     * Find Recurrence by its code value. A missing value means no recurrence.
     */
    @JsonCreator
    public static Recurrence fromCode(String code) {
        if (code == null || code.isBlank()) {
            return NONE;
        }
        for (var recurrence : values()) {
            if (recurrence.getCode().equalsIgnoreCase(code)) {
                return recurrence;
            }
        }
        throw new IllegalArgumentException("Unknown recurrence code: " + code);
    }

    public boolean isRecurring() {
        return this != NONE;
    }
}
