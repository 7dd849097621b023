package com.example.vrpassistant.model;

import lombok.*;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

/**
 * Problem document as forwarded to the solver. Absent collections deserialize to empty lists.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class VrpProblem {
    @Singular(ignoreNullCollections = true)
    List<Job> jobs;
    @Singular(ignoreNullCollections = true)
    List<Resource> resources;

    public Optional<Resource> findResource(String name) {
        if (name == null) return Optional.empty();
        return resources.stream()
                .filter(r -> name.equals(r.getName()))
                .findFirst();
    }
}
