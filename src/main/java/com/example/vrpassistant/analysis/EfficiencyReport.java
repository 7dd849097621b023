package com.example.vrpassistant.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EfficiencyReport {
    boolean tripsFound;
    String message;
    long totalDistance;
    long totalDuration;
    int totalStops;
    double avgDistancePerStop;
    int vehiclesUsed;

    static EfficiencyReport noTrips() {
        return EfficiencyReport.builder()
                .tripsFound(false)
                .message(AnalysisEngine.NO_TRIPS_MESSAGE)
                .build();
    }
}
