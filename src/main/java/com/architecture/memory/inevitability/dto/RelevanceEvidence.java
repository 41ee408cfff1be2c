package com.architecture.memory.inevitability.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Solver results that justify a classification. For IRRELEVANT controls this is the formal
 * causal-independence evidence.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelevanceEvidence {

    private SolverResult enabledResult;

    private SolverResult disabledResult;

    // UNSAT means no configuration exists in which toggling the control changes the goal
    private SolverResult independenceResult;

    private double satisfiabilityDelta;

    private double witnessTraversal;
}
