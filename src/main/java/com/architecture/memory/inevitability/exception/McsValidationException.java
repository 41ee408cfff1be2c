package com.architecture.memory.inevitability.exception;

import com.architecture.memory.inevitability.dto.McsValidationFailure;

/**
 * An MCS candidate failed the independent sufficiency/irredundancy re-check. This points at
 * a solver or encoding defect; it is not the "no MCS exists" outcome.
 */
public class McsValidationException extends CausalAnalysisException {

    private final McsValidationFailure failure;

    public McsValidationException(McsValidationFailure failure) {
        super("MCS validation failed for goal " + failure.getGoalId() + " candidate " + failure.getElements()
                + ": " + failure.getReason());
        this.failure = failure;
    }

    public McsValidationFailure getFailure() {
        return failure;
    }
}
