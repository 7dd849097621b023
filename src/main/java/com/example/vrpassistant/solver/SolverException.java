package com.example.vrpassistant.solver;

import lombok.Getter;

/**
 * Failure talking to the external solver, classified for the HTTP layer.
 */
@Getter
public class SolverException extends RuntimeException {

    private final String errorType;
    private final int statusCode;

    public SolverException(String message, String errorType, int statusCode) {
        super(message);
        this.errorType = errorType;
        this.statusCode = statusCode;
    }

    public SolverException(String message, String errorType, int statusCode, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.statusCode = statusCode;
    }
}
