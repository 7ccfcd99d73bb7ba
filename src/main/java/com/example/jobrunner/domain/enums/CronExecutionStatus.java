package com.example.jobrunner.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Status of a single cron job execution attempt.
 * An execution starts as RUNNING and moves exactly once to a terminal status.
 */
@Getter
@RequiredArgsConstructor
public enum CronExecutionStatus {

    RUNNING("running"),

    SUCCESS("success"),

    FAILED("failed");

    @JsonValue
    private final String code;

    public static CronExecutionStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown cron execution status code: " + code);
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
