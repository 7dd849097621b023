package com.example.vrpassistant.controller;

import com.example.vrpassistant.context.ContextStore;
import com.example.vrpassistant.model.VrpProblem;
import com.example.vrpassistant.model.VrpSolution;
import com.example.vrpassistant.solver.SolverClient;
import com.example.vrpassistant.solver.SolverException;
import com.example.vrpassistant.validation.ComplexityCheckResult;
import com.example.vrpassistant.validation.ComplexityLimits;
import com.example.vrpassistant.validation.ComplexityValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/vrp")
public class VrpController {

    private static final Logger logger = LoggerFactory.getLogger(VrpController.class);

    static final String SESSION_HEADER = "X-Session-Id";

    private final ComplexityValidator complexityValidator;
    private final ComplexityLimits limits;
    private final SolverClient solverClient;
    private final ContextStore contextStore;

    public VrpController(ComplexityValidator complexityValidator, ComplexityLimits limits,
                         SolverClient solverClient, ContextStore contextStore) {
        this.complexityValidator = complexityValidator;
        this.limits = limits;
        this.solverClient = solverClient;
        this.contextStore = contextStore;
    }

    /**
     * Admission check, solve, then remember the pair for the assistant.
     */
    @PostMapping("/solve")
    public Mono<ResponseEntity<Object>> solve(@RequestHeader(value = SESSION_HEADER, required = false) String sessionId,
                                              @RequestBody VrpProblem problem) {
        if (sessionId == null || sessionId.isBlank()) {
            return Mono.just(ResponseEntity.badRequest().body((Object) error(SESSION_HEADER + " header is required", "validation")));
        }

        ComplexityCheckResult check = complexityValidator.validate(problem, limits);
        if (!check.isValid()) {
            logger.info("Rejected solve for session {}: {}", sessionId, check.getErrors());
            return Mono.just(ResponseEntity.badRequest().body((Object) rejection(check)));
        }
        if (!check.getWarnings().isEmpty()) {
            logger.warn("VRP complexity warnings for session {}: {}", sessionId, check.getWarnings());
        }
        logger.info("Admitted solve for session {} (estimated {}s)",
                sessionId, complexityValidator.estimateSolveTimeSeconds(problem));

        return solverClient.solve(problem)
                .map(solution -> {
                    contextStore.save(sessionId, problem, solution);
                    return ResponseEntity.ok((Object) solution);
                });
    }

    @PostMapping("/validate")
    public ComplexityCheckResult validate(@RequestBody VrpProblem problem) {
        return complexityValidator.validate(problem, limits);
    }

    @PostMapping("/context")
    public ResponseEntity<Map<String, Object>> storeContext(@RequestBody ContextRequest request) {
        if (request.getSessionId() == null || request.getSessionId().isBlank()) {
            return ResponseEntity.badRequest().body(error("sessionId is required", "validation"));
        }
        if (request.getRequest() == null) {
            return ResponseEntity.badRequest().body(error("request is required", "validation"));
        }
        contextStore.save(request.getSessionId(), request.getRequest(), request.getSolution());
        return ResponseEntity.ok(Map.of("status", "ok", "sessionId", request.getSessionId()));
    }

    @GetMapping("/context")
    public Map<String, Object> listContexts() {
        List<String> sessions = contextStore.listSessions();
        return Map.of("sessions", sessions, "count", sessions.size());
    }

    @GetMapping("/context/{sessionId}")
    public ResponseEntity<Object> getContext(@PathVariable String sessionId) {
        return contextStore.get(sessionId)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(error("No VRP context for session " + sessionId, "not_found")));
    }

    @PutMapping("/context/{sessionId}/solution")
    public ResponseEntity<Map<String, Object>> updateSolution(@PathVariable String sessionId,
                                                              @RequestBody VrpSolution solution) {
        if (!contextStore.updateSolution(sessionId, solution)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(error("No VRP context for session " + sessionId, "not_found"));
        }
        return ResponseEntity.ok(Map.of("status", "ok", "sessionId", sessionId));
    }

    @DeleteMapping("/context/{sessionId}")
    public Map<String, Object> deleteContext(@PathVariable String sessionId) {
        boolean deleted = contextStore.delete(sessionId);
        return Map.of("status", "ok", "deleted", deleted);
    }

    @ExceptionHandler(SolverException.class)
    public ResponseEntity<Map<String, Object>> handleSolverError(SolverException e) {
        logger.warn("Solver call failed: {} ({})", e.getMessage(), e.getErrorType());
        return ResponseEntity.status(e.getStatusCode()).body(error(e.getMessage(), e.getErrorType()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadInput(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(error(e.getMessage(), "validation"));
    }

    private Map<String, Object> rejection(ComplexityCheckResult check) {
        return Map.of(
                "error", complexityValidator.formatErrorMessage(check),
                "type", "complexity_limit",
                "details", Map.of(
                        "errors", check.getErrors(),
                        "warnings", check.getWarnings(),
                        "actualComplexity", check.getActualComplexity()
                )
        );
    }

    static Map<String, Object> error(String message, String type) {
        return Map.of("error", message, "type", type);
    }
}
