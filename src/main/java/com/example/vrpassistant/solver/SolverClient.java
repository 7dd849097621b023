package com.example.vrpassistant.solver;

import com.example.vrpassistant.model.VrpProblem;
import com.example.vrpassistant.model.VrpSolution;
import reactor.core.publisher.Mono;

/**
 * Remote VRP solver. Implementations signal failures as {@link SolverException}.
 */
public interface SolverClient {
    Mono<VrpSolution> solve(VrpProblem problem);
}
