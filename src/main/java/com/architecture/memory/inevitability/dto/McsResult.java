package com.architecture.memory.inevitability.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Minimal causal sets found for one goal. Callers must check {@link #truncated} before
 * treating {@link #mcsSets} as exhaustive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class McsResult {

    private String goalId;

    private McsAlgorithm algorithm;

    private McsOutcome outcome;

    @Builder.Default
    private List<MinimalCausalSet> mcsSets = new ArrayList<>();

    private boolean truncated;

    @Builder.Default
    private List<McsValidationFailure> validationFailures = new ArrayList<>();

    private long elapsedMs;

    public List<MinimalCausalSet> validatedSets() {
        return mcsSets.stream().filter(MinimalCausalSet::isValidated).toList();
    }

    public int membershipCount(String controlId) {
        return (int) validatedSets().stream().filter(m -> m.contains(controlId)).count();
    }

    public Set<String> memberControls() {
        Set<String> members = new TreeSet<>();
        validatedSets().forEach(m -> members.addAll(m.getElements()));
        return members;
    }

    public boolean isGoalInevitable() {
        return outcome == McsOutcome.NONE_EXISTS || outcome == McsOutcome.NO_CONTROLS;
    }
}
