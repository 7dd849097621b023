package com.example.vrpassistant.model;

import lombok.*;

import java.time.Instant;
import java.util.Optional;

/**
 * Most recent problem/solution pair of one session. Instances are immutable, so the
 * store can hand them out as snapshots.
 */
@Value
@Builder(toBuilder = true)
public class SessionContext {
    @NonNull
    String sessionId;
    @NonNull
    VrpProblem problem;
    VrpSolution solution;
    @NonNull
    Instant updatedAt;

    public Optional<VrpSolution> solution() {
        return Optional.ofNullable(solution);
    }

    public boolean hasSolution() {
        return solution != null;
    }
}
