package com.example.vrpassistant.validation;

import com.example.vrpassistant.model.Job;
import com.example.vrpassistant.model.Resource;
import com.example.vrpassistant.model.Shift;
import com.example.vrpassistant.model.VrpProblem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Admission control for solve requests.
 * <p>
 * Validation never throws for oversized or empty problems; every violation is reported in
 * {@link ComplexityCheckResult#getErrors()} next to the measured complexity, so the caller
 * can tell the user exactly what to trim. Results are deterministic for a given input.
 * </p>
 */
@Component
public class ComplexityValidator {

    private static final double WARNING_RATIO = 0.8;

    public ComplexityCheckResult validate(VrpProblem problem, ComplexityLimits limits) {
        List<Job> jobs = problem == null ? List.of() : problem.getJobs();
        List<Resource> resources = problem == null ? List.of() : problem.getResources();
        int jobCount = jobs.size();
        int resourceCount = resources.size();

        List<String> errors = new ArrayList<>();

        if (jobCount > limits.getMaxJobs()) {
            errors.add(String.format("Too many jobs: %d (maximum %d)", jobCount, limits.getMaxJobs()));
        }
        if (jobCount == 0) {
            errors.add("At least 1 job is required");
        }
        if (resourceCount > limits.getMaxResources()) {
            errors.add(String.format("Too many vehicles: %d (maximum %d)", resourceCount, limits.getMaxResources()));
        }
        if (resourceCount == 0) {
            errors.add("At least 1 vehicle/resource is required");
        }

        int maxTimeWindows = 0;
        int totalTimeWindows = 0;
        for (int idx = 0; idx < jobCount; idx++) {
            Job job = jobs.get(idx);
            int windowCount = job.getWindows().size();
            totalTimeWindows += windowCount;
            maxTimeWindows = Math.max(maxTimeWindows, windowCount);

            if (windowCount > limits.getMaxTimeWindowsPerJob()) {
                errors.add(String.format("Job \"%s\" has %d time windows (maximum %d)",
                        label(job.getName(), idx), windowCount, limits.getMaxTimeWindowsPerJob()));
            }
        }

        for (int idx = 0; idx < resourceCount; idx++) {
            Resource resource = resources.get(idx);
            List<Shift> shifts = resource.getShifts();
            for (int shiftIdx = 0; shiftIdx < shifts.size(); shiftIdx++) {
                int breakCount = shifts.get(shiftIdx).getBreaks().size();
                if (breakCount > limits.getMaxBreaksPerResource()) {
                    errors.add(String.format("Resource \"%s\" shift %d has %d breaks (maximum %d)",
                            label(resource.getName(), idx), shiftIdx, breakCount, limits.getMaxBreaksPerResource()));
                }
            }
        }

        List<String> warnings = new ArrayList<>();
        if (jobCount >= warningThreshold(limits.getMaxJobs())) {
            warnings.add(String.format("Approaching job limit (%d/%d)", jobCount, limits.getMaxJobs()));
        }
        if (resourceCount >= warningThreshold(limits.getMaxResources())) {
            warnings.add(String.format("Approaching resource limit (%d/%d)", resourceCount, limits.getMaxResources()));
        }

        return ComplexityCheckResult.builder()
                .valid(errors.isEmpty())
                .errors(errors)
                .warnings(warnings)
                .actualComplexity(ActualComplexity.builder()
                        .jobCount(jobCount)
                        .resourceCount(resourceCount)
                        .maxTimeWindows(maxTimeWindows)
                        .totalTimeWindows(totalTimeWindows)
                        .build())
                .build();
    }

    /**
     * Renders the errors of a rejected check as a numbered list. Returns an empty string for
     * valid results.
     */
    public String formatErrorMessage(ComplexityCheckResult result) {
        if (result.isValid()) {
            return "";
        }
        List<String> errors = result.getErrors();
        String numbered = IntStream.range(0, errors.size())
                .mapToObj(i -> (i + 1) + ". " + errors.get(i))
                .collect(Collectors.joining("\n"));
        return "VRP problem too complex:\n\n" + numbered;
    }

    /**
     * Rough solve-time estimate in seconds: a fixed base plus per-job and per-resource costs.
     */
    public double estimateSolveTimeSeconds(VrpProblem problem) {
        if (problem == null) return 2.0;
        return 2.0 + problem.getJobs().size() * 0.1 + problem.getResources().size() * 0.5;
    }

    private static int warningThreshold(int limit) {
        return (int) Math.floor(limit * WARNING_RATIO);
    }

    private static String label(String name, int idx) {
        return name != null ? name : String.valueOf(idx);
    }
}
