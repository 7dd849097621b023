package com.example.vrpassistant.suggestion;

import com.example.vrpassistant.analysis.ViolationDetail;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Suggestion {

    public static final String COVERAGE = "coverage";
    public static final String CONSTRAINTS = "constraints";
    public static final String EFFICIENCY = "efficiency";
    public static final String BALANCE = "balance";

    String category;
    Severity severity;
    String issue;
    String suggestion;
    List<ViolationDetail> details;
}
