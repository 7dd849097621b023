package com.example.vrpassistant.analysis;

import lombok.*;

import java.util.List;

/**
 * A visit that the solver flagged with one or more violated constraints.
 */
@Value
@Builder
public class ViolationDetail {
    String job;
    String resource;
    List<String> violations;
}
