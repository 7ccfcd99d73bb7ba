package com.example.jobrunner.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle of an automated task row.
 * <p>
 * Transitions only move forward: SCHEDULED -> RUNNING -> COMPLETED | FAILED.
 * A row never reopens; recurrence inserts a new SCHEDULED row instead.
 */
@Getter
@RequiredArgsConstructor
public enum TaskStatus {

    /**
     * Waiting for its scheduled time to arrive
     */
    SCHEDULED("scheduled"),

    /**
     * Claimed by a runner and currently executing
     */
    RUNNING("running"),

    /**
     * Handler finished successfully. Terminal.
     */
    COMPLETED("completed"),

    /**
     * Handler failed or the task type was unknown. Terminal.
     */
    FAILED("failed");

    @JsonValue
    private final String code;

    /**
     * Find TaskStatus by its code value
     */
    public static TaskStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status code: " + code);
    }

    /**
     * Check whether the forward-only state machine allows moving to {@code target}
     */
    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case SCHEDULED -> target == RUNNING;
            case RUNNING -> target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
