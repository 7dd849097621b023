package com.example.vrpassistant.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

/**
 * Outcome of one analysis call. Only the sections belonging to {@link #aspect} are set;
 * {@link AnalysisAspect#OVERVIEW} fills all four.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisResult {
    AnalysisAspect aspect;
    boolean solutionAvailable;
    String message;
    RouteBreakdown routes;
    UtilizationReport utilization;
    ConstraintReport constraints;
    EfficiencyReport efficiency;

    public static AnalysisResult noSolution(AnalysisAspect aspect) {
        return AnalysisResult.builder()
                .aspect(aspect)
                .solutionAvailable(false)
                .message(AnalysisEngine.NO_SOLUTION_MESSAGE)
                .build();
    }
}
