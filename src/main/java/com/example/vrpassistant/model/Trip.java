package com.example.vrpassistant.model;

import lombok.*;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Trip {
    String resource;
    @Singular(ignoreNullCollections = true)
    List<Visit> visits;
    Long distance;   // meters
    Long duration;   // seconds
    Long travelTime; // seconds
    @Singular(value = "loadValue", ignoreNullCollections = true)
    List<Integer> load;

    public long distanceOrZero() {
        return distance == null ? 0L : distance;
    }

    public long durationOrZero() {
        return duration == null ? 0L : duration;
    }

    public int stopCount() {
        return visits.size();
    }
}
