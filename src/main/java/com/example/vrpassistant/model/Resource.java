package com.example.vrpassistant.model;

import lombok.*;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A vehicle: capacity per load dimension plus its work shifts.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Resource {
    String name;
    @Singular(value = "capacityValue", ignoreNullCollections = true)
    List<Integer> capacity;
    @Singular(ignoreNullCollections = true)
    List<Shift> shifts;
}
