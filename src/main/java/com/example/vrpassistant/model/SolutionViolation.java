package com.example.vrpassistant.model;

import lombok.*;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class SolutionViolation {
    String name;
    Long value;
    String level; // HARD, MEDIUM, SOFT
}
