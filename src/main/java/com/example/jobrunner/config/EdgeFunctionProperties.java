package com.example.jobrunner.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Edge function gateway configuration properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "edge-functions")
public class EdgeFunctionProperties {

    @NotBlank
    private String baseUrl;

    /**
     * Service key sent as bearer token on every call
     */
    private String serviceKey;

    /**
     * Upper bound for a single function call, also bounding one job or task execution
     */
    @Min(1)
    private int timeoutSeconds = 300;

    /**
     * Function names that cron jobs may reference through {@code function_name}
     */
    private List<String> registeredFunctions = new ArrayList<>();
}
