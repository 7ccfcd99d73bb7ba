package com.example.jobrunner.service.handler;

import com.example.jobrunner.client.EdgeFunctionClient;
import com.example.jobrunner.config.EdgeFunctionProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Registry of job functions, resolved once at startup.
 * <p>
 * Local {@link JobFunction} beans are registered first; every name listed under
 * {@code edge-functions.registered-functions} that no bean claims is backed by
 * an {@link EdgeFunction}.
 */
@Slf4j
@Component
public class JobFunctionRegistry {

    private final Map<String, JobFunction> functions = new LinkedHashMap<>();
    private final ObjectProvider<JobFunction> functionBeans;
    private final EdgeFunctionProperties edgeFunctionProperties;
    private final EdgeFunctionClient edgeFunctionClient;

    public JobFunctionRegistry(ObjectProvider<JobFunction> functionBeans, EdgeFunctionProperties edgeFunctionProperties,
                               EdgeFunctionClient edgeFunctionClient) {
        this.functionBeans = functionBeans;
        this.edgeFunctionProperties = edgeFunctionProperties;
        this.edgeFunctionClient = edgeFunctionClient;
    }

    @PostConstruct
    public void initialize() {
        functionBeans.orderedStream().forEach(function -> {
            if (functions.containsKey(function.getName())) {
                log.warn("Duplicate job function {}: {} will override {}", function.getName(),
                        function.getClass().getSimpleName(), functions.get(function.getName()).getClass().getSimpleName());
            }
            functions.put(function.getName(), function);
            log.info("Registered job function {}: {}", function.getName(), function.getClass().getSimpleName());
        });

        for (var name : edgeFunctionProperties.getRegisteredFunctions()) {
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("Blank name in edge-functions.registered-functions");
            }
            if (!functions.containsKey(name)) {
                functions.put(name, new EdgeFunction(name, edgeFunctionClient));
                log.info("Registered edge function {}", name);
            }
        }
    }

    public Optional<JobFunction> getFunction(String name) {
        return Optional.ofNullable(name).map(functions::get);
    }

    public boolean hasFunction(String name) {
        return name != null && functions.containsKey(name);
    }
}
