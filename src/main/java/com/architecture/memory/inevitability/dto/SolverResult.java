package com.architecture.memory.inevitability.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.SortedMap;

/**
 * Outcome of a single satisfiability query. TIMEOUT and UNKNOWN are reported as such and
 * never folded into SAT or UNSAT.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SolverResult {

    private SolverStatus status;

    // Variable assignment, only for SAT
    private SortedMap<String, Boolean> witness;

    // Labels of the tracked assertions in the core, only for UNSAT
    private List<String> unsatCore;

    private long elapsedMs;

    private String reasonUnknown;

    private String backend;

    public boolean isSat() {
        return status == SolverStatus.SAT;
    }

    public boolean isUnsat() {
        return status == SolverStatus.UNSAT;
    }

    public boolean isDefinite() {
        return status != null && status.isDefinite();
    }
}
