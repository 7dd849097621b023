package com.example.vrpassistant.validation;

import lombok.*;

@Value
@Builder
public class ActualComplexity {
    int jobCount;
    int resourceCount;
    int maxTimeWindows;
    int totalTimeWindows;
}
