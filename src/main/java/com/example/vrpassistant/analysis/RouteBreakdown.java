package com.example.vrpassistant.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RouteBreakdown {
    boolean tripsFound;
    String message;
    int totalRoutes;
    @Singular
    List<RouteStats> routes;

    static RouteBreakdown noTrips() {
        return RouteBreakdown.builder()
                .tripsFound(false)
                .message(AnalysisEngine.NO_TRIPS_MESSAGE)
                .build();
    }

    @Value
    @Builder
    public static class RouteStats {
        int routeId;
        String resource;
        int stops;
        Long distance;
        Long duration;
        List<String> jobs;
    }
}
