package com.example.vrpassistant.validation;

import lombok.*;

/**
 * Admission limits for a single solve request.
 */
@Value
@Builder
public class ComplexityLimits {

    public static final ComplexityLimits DEFAULT = ComplexityLimits.builder()
            .maxJobs(250)
            .maxResources(30)
            .maxTimeWindowsPerJob(5)
            .maxBreaksPerResource(3)
            .build();

    int maxJobs;
    int maxResources;
    int maxTimeWindowsPerJob;
    int maxBreaksPerResource;

    public ComplexityLimits(int maxJobs, int maxResources, int maxTimeWindowsPerJob, int maxBreaksPerResource) {
        requirePositive("maxJobs", maxJobs);
        requirePositive("maxResources", maxResources);
        requirePositive("maxTimeWindowsPerJob", maxTimeWindowsPerJob);
        requirePositive("maxBreaksPerResource", maxBreaksPerResource);
        this.maxJobs = maxJobs;
        this.maxResources = maxResources;
        this.maxTimeWindowsPerJob = maxTimeWindowsPerJob;
        this.maxBreaksPerResource = maxBreaksPerResource;
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be >= 1, got " + value);
        }
    }
}
