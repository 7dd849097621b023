package com.example.vrpassistant.analysis;

import lombok.*;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ConstraintReport {

    public static final String FEASIBLE = "feasible";
    public static final String HAS_VIOLATIONS = "has_violations";

    int totalViolations;
    List<ViolationDetail> violations;
    int unassignedJobs;
    List<String> unassignedDetails;
    Map<String, List<String>> unassignedReasons;
    String status;
}
