package com.example.vrpassistant.validation;

import lombok.*;

import java.util.List;

@Value
@Builder
public class ComplexityCheckResult {
    boolean valid;
    @Singular
    List<String> errors;
    @Singular
    List<String> warnings;
    ActualComplexity actualComplexity;
}
