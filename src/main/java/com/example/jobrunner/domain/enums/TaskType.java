package com.example.jobrunner.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of automated task types.
 * Each task type maps to a specific handler implementation.
 * <p>
 * Rows store the code as a plain string so that an unknown code
 * surfaces at dispatch time rather than when the row is loaded.
 */
@Getter
@RequiredArgsConstructor
public enum TaskType {

    /**
     * Consolidate recent agent conversations into long-term memory
     */
    MEMORY_CONSOLIDATION("memory_consolidation", "Memory Consolidation"),

    /**
     * Re-embed agent resources into the vector store
     */
    VECTOR_REFRESH("vector_refresh", "Vector Refresh"),

    /**
     * Run one continuous learning cycle over recent conversations
     */
    LEARNING_CYCLE("learning_cycle", "Learning Cycle"),

    /**
     * Send a scheduled marketing campaign
     */
    MARKETING_CAMPAIGN("marketing_campaign", "Marketing Campaign");

    @JsonValue
    private final String code;
    private final String displayName;

    /**
     * Find TaskType by its code value
     *
     * @throws IllegalArgumentException if the code is not a known task type
     */
    public static TaskType fromCode(String code) {
        for (var type : values()) {
            if (type.getCode().equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown task type code: " + code);
    }
}
