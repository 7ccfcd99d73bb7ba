package com.example.jobrunner.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Error body returned for failed requests
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String error;

    /**
     * Truncated stack trace, present for unexpected errors
     */
    private String stack;

    /**
     * Field errors for validation failures
     */
    private List<String> details;
}
