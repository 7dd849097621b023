package com.example.vrpassistant.model;

import lombok.*;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Visit {
    String job;
    String arrival;
    Integer serviceTime;
    // solvers report flagged constraints under either key
    @Singular(ignoreNullCollections = true)
    List<String> violatedConstraints;
    @Singular(ignoreNullCollections = true)
    List<String> violations;

    /**
     * Constraint names flagged on this visit: {@code violatedConstraints} when present,
     * otherwise {@code violations}.
     */
    public List<String> flaggedConstraints() {
        return violatedConstraints.isEmpty() ? violations : violatedConstraints;
    }
}
