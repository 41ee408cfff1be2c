package com.architecture.memory.inevitability.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InevitabilityResult {

    private String goalId;

    private String goalName;

    // Fraction of exogenous configurations in which the goal is reachable
    private double score;

    // False when the configuration space exceeded the enumeration limit and score is a 0/1 indicator
    private boolean exhaustive;

    private InevitabilityVerdict verdict;

    private SolverResult solverResult;

    @Builder.Default
    private List<EntryPointResult> entryPoints = new ArrayList<>();

    @Builder.Default
    private List<AttackPathStep> attackPath = new ArrayList<>();
}
