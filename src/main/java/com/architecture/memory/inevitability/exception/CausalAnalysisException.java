package com.architecture.memory.inevitability.exception;

/**
 * Base class of all errors raised by the causal analysis core.
 */
public class CausalAnalysisException extends RuntimeException {

    public CausalAnalysisException(String message) {
        super(message);
    }

    public CausalAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
