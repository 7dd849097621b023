package com.example.vrpassistant.model;

import lombok.*;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Job {
    String name;
    Location location;
    Integer duration; // seconds
    @Singular(ignoreNullCollections = true)
    List<TimeWindow> windows;
    @Singular(value = "loadValue", ignoreNullCollections = true)
    List<Integer> load;
}
