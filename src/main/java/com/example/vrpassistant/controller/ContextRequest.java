package com.example.vrpassistant.controller;

import com.example.vrpassistant.model.VrpProblem;
import com.example.vrpassistant.model.VrpSolution;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContextRequest {
    private String sessionId;
    private VrpProblem request;
    private VrpSolution solution;
}
