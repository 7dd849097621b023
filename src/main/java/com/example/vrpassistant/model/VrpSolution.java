package com.example.vrpassistant.model;

import lombok.*;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Solution document returned by the solver.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class VrpSolution {
    String id;
    String status;
    @Singular(ignoreNullCollections = true)
    List<Trip> trips;
    @Singular(value = "unservedJob", ignoreNullCollections = true)
    List<String> unserved;
    @Singular(ignoreNullCollections = true)
    Map<String, List<String>> unservedReasons;
    @Singular(ignoreNullCollections = true)
    List<SolutionViolation> violations;
    Score score;
    Double occupancy;
    Long totalTravelDistanceInMeters;
    Long totalTravelTimeInSeconds;
}
