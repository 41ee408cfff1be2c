package com.architecture.memory.inevitability.exception;

public class InvalidGoalException extends CausalAnalysisException {

    public InvalidGoalException(String message) {
        super(message);
    }
}
