package com.architecture.memory.inevitability.dto;

public enum SolverStatus {
    SAT,
    UNSAT,
    TIMEOUT,
    UNKNOWN;

    public boolean isDefinite() {
        return this == SAT || this == UNSAT;
    }
}
