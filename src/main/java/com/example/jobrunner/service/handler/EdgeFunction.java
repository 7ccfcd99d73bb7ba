package com.example.jobrunner.service.handler;

import com.example.jobrunner.client.EdgeFunctionClient;
import com.example.jobrunner.exception.ExternalServiceException;
import lombok.RequiredArgsConstructor;

import java.util.Map;

/**
 * Job function backed by a remote edge function of the same name
 */
@RequiredArgsConstructor
public class EdgeFunction implements JobFunction {

    private final String name;
    private final EdgeFunctionClient client;

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ExecutionResult invoke(Map<String, Object> input) {
        try {
            return ExecutionResult.success(client.invoke(name, input));
        } catch (ExternalServiceException e) {
            if (e.getHttpStatusCode() != null) {
                return ExecutionResult.httpFailure(e.getHttpStatusCode(), e.getMessage());
            }
            return ExecutionResult.failure(e);
        }
    }
}
