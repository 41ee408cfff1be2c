package com.architecture.memory.inevitability.exception;

/**
 * The satisfiability backend failed outright (native error, broken session state).
 */
public class SolverBackendException extends CausalAnalysisException {

    public SolverBackendException(String message, Throwable cause) {
        super(message, cause);
    }

    public SolverBackendException(String message) {
        super(message);
    }
}
