package com.architecture.memory.inevitability.exception;

import com.architecture.memory.inevitability.dto.SolverResult;

/**
 * A query needed a definite answer but the backend returned TIMEOUT or UNKNOWN.
 * Carries the result verbatim so callers can inspect status and elapsed time.
 */
public class SolverIndeterminateException extends CausalAnalysisException {

    private final SolverResult result;

    public SolverIndeterminateException(String context, SolverResult result) {
        super(context + ": solver returned " + result.getStatus() + " after " + result.getElapsedMs() + " ms"
                + (result.getReasonUnknown() != null ? " (" + result.getReasonUnknown() + ")" : ""));
        this.result = result;
    }

    public SolverResult getResult() {
        return result;
    }
}
