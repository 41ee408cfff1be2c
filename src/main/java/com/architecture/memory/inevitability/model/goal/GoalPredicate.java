package com.architecture.memory.inevitability.model.goal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Attacker goal: a boolean expression over SCM variables identified by {@link #id}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GoalPredicate {

    private String id;

    private String name;

    private String description;

    private GoalExpression expression;

    // Inevitability score at or above which the goal counts as structurally inevitable
    @Builder.Default
    private double threshold = 0.7;

    public Set<String> variables() {
        return expression.variables();
    }

    public String getDisplayName() {
        return name != null && !name.isBlank() ? name : id;
    }

    /**
     * Goal reached when the given node is compromised.
     */
    public static GoalPredicate compromise(String nodeId) {
        return GoalPredicate.builder()
                .id("compromise(" + nodeId + ")")
                .name("compromise " + nodeId)
                .expression(GoalExpression.var(nodeId))
                .build();
    }

    /**
     * Goal reached when every target asset is compromised and every required condition holds.
     */
    public static GoalPredicate allOf(String id, List<String> targetAssets, List<String> requiredConditions) {
        List<GoalExpression> operands = new ArrayList<>();
        Stream.concat(targetAssets.stream(), requiredConditions.stream())
                .map(GoalExpression::var)
                .forEach(operands::add);
        return GoalPredicate.builder()
                .id(id)
                .name(id)
                .expression(GoalExpression.allOf(operands))
                .build();
    }
}
