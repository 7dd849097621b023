package com.example.vrpassistant.suggestion;

import com.example.vrpassistant.analysis.AnalysisEngine;
import com.example.vrpassistant.analysis.ViolationDetail;
import com.example.vrpassistant.model.Trip;
import com.example.vrpassistant.model.VrpProblem;
import com.example.vrpassistant.model.VrpSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Rule-based improvement suggestions. Rules run in a fixed order and are not mutually
 * exclusive: coverage, constraints, efficiency, balance.
 */
@Service
public class SuggestionEngine {

    private static final Logger logger = LoggerFactory.getLogger(SuggestionEngine.class);

    static final double LOW_UTILIZATION_THRESHOLD = 0.6;
    static final int MAX_VIOLATION_DETAILS = 3;

    private final AnalysisEngine analysisEngine;
    private final double assumedCapacityUtilization;

    /**
     * @param assumedCapacityUtilization utilization ratio reported for any solution with trips.
     *        Load is not weighed against capacity here; the default of 0.7 keeps the
     *        efficiency rule silent for every solution that has trips.
     */
    public SuggestionEngine(AnalysisEngine analysisEngine,
                            @Value("${app.suggestions.assumed-capacity-utilization:0.7}") double assumedCapacityUtilization) {
        this.analysisEngine = analysisEngine;
        this.assumedCapacityUtilization = assumedCapacityUtilization;
    }

    public SuggestionList suggest(VrpSolution solution, VrpProblem problem) {
        if (solution == null) {
            logger.debug("Suggestions requested without a solution");
            return SuggestionList.noSolution();
        }

        SuggestionList.SuggestionListBuilder result = SuggestionList.builder().solutionAvailable(true);

        List<String> unserved = solution.getUnserved();
        if (!unserved.isEmpty()) {
            result.suggestion(Suggestion.builder()
                    .category(Suggestion.COVERAGE)
                    .severity(Severity.HIGH)
                    .issue(unserved.size() + " unassigned jobs")
                    .suggestion("Consider adding more vehicles or relaxing time window constraints")
                    .build());
        }

        List<ViolationDetail> violations = analysisEngine.extractViolations(solution);
        if (!violations.isEmpty()) {
            result.suggestion(Suggestion.builder()
                    .category(Suggestion.CONSTRAINTS)
                    .severity(Severity.HIGH)
                    .issue(violations.size() + " constraint violations found")
                    .suggestion("Review time windows, capacities, and skills constraints")
                    .details(List.copyOf(violations.subList(0, Math.min(MAX_VIOLATION_DETAILS, violations.size()))))
                    .build());
        }

        if (averageCapacityUtilization(solution) < LOW_UTILIZATION_THRESHOLD) {
            result.suggestion(Suggestion.builder()
                    .category(Suggestion.EFFICIENCY)
                    .severity(Severity.MEDIUM)
                    .issue("Low average capacity utilization")
                    .suggestion("Consider reducing number of vehicles or consolidating routes")
                    .build());
        }

        if (isUnbalanced(solution.getTrips())) {
            result.suggestion(Suggestion.builder()
                    .category(Suggestion.BALANCE)
                    .severity(Severity.LOW)
                    .issue("Unbalanced route durations")
                    .suggestion("Enable route balancing in solver options")
                    .build());
        }

        return result.build();
    }

    double averageCapacityUtilization(VrpSolution solution) {
        return solution.getTrips().isEmpty() ? 0.0 : assumedCapacityUtilization;
    }

    private static boolean isUnbalanced(List<Trip> trips) {
        if (trips.isEmpty()) return false;
        long max = Long.MIN_VALUE;
        long min = Long.MAX_VALUE;
        for (Trip trip : trips) {
            long duration = trip.durationOrZero();
            max = Math.max(max, duration);
            min = Math.min(min, duration);
        }
        return max > min * 2;
    }
}
