package com.architecture.memory.inevitability.exception;

public class InvalidInterventionException extends CausalAnalysisException {

    private final String variable;

    public InvalidInterventionException(String variable, String message) {
        super(message);
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
