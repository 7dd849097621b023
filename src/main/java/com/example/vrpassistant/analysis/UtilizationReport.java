package com.example.vrpassistant.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UtilizationReport {
    boolean tripsFound;
    String message;
    int vehiclesUsed;
    int totalVehiclesAvailable;
    @Singular("vehicle")
    List<VehicleUtilization> utilizationByVehicle;

    static UtilizationReport noTrips(int totalVehiclesAvailable) {
        return UtilizationReport.builder()
                .tripsFound(false)
                .message(AnalysisEngine.NO_TRIPS_MESSAGE)
                .totalVehiclesAvailable(totalVehiclesAvailable)
                .build();
    }

    @Value
    @Builder
    public static class VehicleUtilization {
        String resource;
        List<Integer> capacityUsed;
        // empty when the resource declares no capacity or is not part of the problem
        List<Integer> capacityTotal;
        int stops;
    }
}
