package com.architecture.memory.inevitability.service.mcs;

import com.architecture.memory.inevitability.dto.McsValidationFailure;
import com.architecture.memory.inevitability.dto.SolverResult;
import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.service.solver.SolveSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Independent re-check of an MCS candidate:
 * - sufficiency: enforcing all elements makes the goal UNSAT
 * - irredundancy: no proper subset does
 *
 * Candidates up to the policy's exhaustive limit are checked against every proper subset;
 * larger candidates only against their leave-one-out subsets.
 */
@Component
@Slf4j
public class McsValidator {

    public Optional<McsValidationFailure> validate(SolveSession session, GoalPredicate goal,
                                                   List<String> candidate, List<String> allControls,
                                                   McsPolicy policy) {
        SolverResult full = session.solve(goal, ControlAssignments.enforcing(candidate, allControls));
        if (!full.isDefinite()) {
            return Optional.of(failure(goal, candidate, McsValidationFailure.Kind.INDETERMINATE, candidate,
                    "sufficiency check returned " + full.getStatus()));
        }
        if (full.isSat()) {
            return Optional.of(failure(goal, candidate, McsValidationFailure.Kind.INSUFFICIENT, candidate,
                    "goal remains satisfiable with every element enforced"));
        }

        for (List<String> subset : properSubsets(candidate, policy.getExhaustiveValidationLimit())) {
            SolverResult partial = session.solve(goal, ControlAssignments.enforcing(subset, allControls));
            if (!partial.isDefinite()) {
                return Optional.of(failure(goal, candidate, McsValidationFailure.Kind.INDETERMINATE, subset,
                        "irredundancy check returned " + partial.getStatus()));
            }
            if (partial.isUnsat()) {
                return Optional.of(failure(goal, candidate, McsValidationFailure.Kind.REDUNDANT, subset,
                        "proper subset " + subset + " already blocks the goal"));
            }
        }
        return Optional.empty();
    }

    /**
     * Proper subsets to test, in ascending size. All of them (empty set included) when the
     * candidate is small enough, otherwise the leave-one-out subsets only.
     */
    List<List<String>> properSubsets(List<String> candidate, int exhaustiveLimit) {
        List<List<String>> subsets = new ArrayList<>();
        int n = candidate.size();
        if (n <= exhaustiveLimit) {
            int full = (1 << n) - 1;
            for (int mask = 0; mask < full; mask++) {
                List<String> subset = new ArrayList<>(Integer.bitCount(mask));
                for (int i = 0; i < n; i++) {
                    if ((mask & (1 << i)) != 0) {
                        subset.add(candidate.get(i));
                    }
                }
                subsets.add(subset);
            }
            subsets.sort((a, b) -> Integer.compare(a.size(), b.size()));
        } else {
            for (int skip = 0; skip < n; skip++) {
                List<String> subset = new ArrayList<>(candidate);
                subset.remove(skip);
                subsets.add(subset);
            }
        }
        return subsets;
    }

    private McsValidationFailure failure(GoalPredicate goal, List<String> candidate,
                                         McsValidationFailure.Kind kind, List<String> offending, String reason) {
        McsValidationFailure failure = McsValidationFailure.builder()
                .goalId(goal.getId())
                .elements(List.copyOf(candidate))
                .kind(kind)
                .offendingSubset(List.copyOf(offending))
                .reason(reason)
                .build();
        if (kind == McsValidationFailure.Kind.INDETERMINATE) {
            log.warn("MCS {} for goal {} could not be validated: {}", candidate, goal.getId(), reason);
        } else {
            log.error("MCS validation defect for goal {}: candidate {} is {} ({})",
                    goal.getId(), candidate, kind, reason);
        }
        return failure;
    }
}
