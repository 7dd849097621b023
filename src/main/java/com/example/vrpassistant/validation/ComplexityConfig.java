package com.example.vrpassistant.validation;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ComplexityConfig {

    @Bean
    public ComplexityLimits complexityLimits(
            @Value("${app.complexity.max-jobs:250}") int maxJobs,
            @Value("${app.complexity.max-resources:30}") int maxResources,
            @Value("${app.complexity.max-time-windows-per-job:5}") int maxTimeWindowsPerJob,
            @Value("${app.complexity.max-breaks-per-resource:3}") int maxBreaksPerResource) {
        return new ComplexityLimits(maxJobs, maxResources, maxTimeWindowsPerJob, maxBreaksPerResource);
    }
}
