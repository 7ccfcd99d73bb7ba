package com.example.jobrunner.service.handler;

import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Represents the result of a job function or task handler invocation.
 * <p>
 * Contains all information needed to record the outcome on the
 * execution history and the job or task row.
 */
@Data
@Builder
public class ExecutionResult {

    private static final int MAX_STACK_LINES = 20;
    private static final int MAX_STACK_LENGTH = 4000;

    private boolean success;

    private String errorMessage;

    /**
     * Error type/classification for analysis
     */
    private String errorType;

    /**
     * Stack trace if available
     */
    private String stackTrace;

    /**
     * HTTP status code if the handler called a remote function
     */
    private Integer httpStatusCode;

    /**
     * JSON-serializable data returned by the handler
     */
    @Builder.Default
    private Map<String, Object> responseData = new HashMap<>();

    public static ExecutionResult success() {
        return ExecutionResult.builder().success(true).build();
    }

    public static ExecutionResult success(Map<String, Object> responseData) {
        return ExecutionResult.builder()
                .success(true)
                .responseData(responseData != null ? responseData : new HashMap<>())
                .build();
    }

    public static ExecutionResult failure(String errorMessage, String errorType) {
        return ExecutionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorType(errorType)
                .build();
    }

    /**
     * Create a failure result from exception
     */
    public static ExecutionResult failure(Exception e) {
        return ExecutionResult.builder()
                .success(false)
                .errorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                .errorType(e.getClass().getSimpleName())
                .stackTrace(truncateStackTrace(e))
                .build();
    }

    public static ExecutionResult httpFailure(int statusCode, String errorMessage) {
        return ExecutionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorType("HTTP_" + statusCode)
                .httpStatusCode(statusCode)
                .build();
    }

    /**
     * Error text stored on the execution history: message plus the truncated trace when present
     */
    public String describeError() {
        var message = errorMessage != null ? errorMessage : "Unknown error";
        if (errorType != null && !message.startsWith(errorType)) {
            message = errorType + ": " + message;
        }
        return stackTrace != null ? message + "\n" + stackTrace : message;
    }

    /**
     * Truncate stack trace to prevent database overflow
     */
    public static String truncateStackTrace(Throwable e) {
        if (e == null) return null;

        var sb = new StringBuilder();
        sb.append(e.getClass().getName()).append(": ").append(e.getMessage()).append("\n");

        var trace = e.getStackTrace();
        var maxLines = Math.min(trace.length, MAX_STACK_LINES);
        for (var i = 0; i < maxLines; i++) {
            sb.append("\tat ").append(trace[i]).append("\n");
        }
        if (trace.length > maxLines) {
            sb.append("\t... ").append(trace.length - maxLines).append(" more\n");
        }

        var result = sb.toString();
        if (result.length() > MAX_STACK_LENGTH) {
            result = result.substring(0, MAX_STACK_LENGTH) + "...";
        }
        return result;
    }
}
