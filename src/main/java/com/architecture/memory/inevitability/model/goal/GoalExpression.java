package com.architecture.memory.inevitability.model.goal;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Boolean expression over node identifiers: variable references combined by conjunction
 * and disjunction.
 */
public interface GoalExpression {

    Set<String> variables();

    boolean evaluate(Map<String, Boolean> assignment);

    String describe();

    static GoalExpression var(String id) {
        return new Var(id);
    }

    static GoalExpression allOf(GoalExpression... operands) {
        return new AllOf(List.of(operands));
    }

    static GoalExpression allOf(List<GoalExpression> operands) {
        return new AllOf(List.copyOf(operands));
    }

    static GoalExpression anyOf(GoalExpression... operands) {
        return new AnyOf(List.of(operands));
    }

    static GoalExpression anyOf(List<GoalExpression> operands) {
        return new AnyOf(List.copyOf(operands));
    }

    record Var(String id) implements GoalExpression {
        @Override
        public Set<String> variables() {
            return Set.of(id);
        }

        @Override
        public boolean evaluate(Map<String, Boolean> assignment) {
            return Boolean.TRUE.equals(assignment.get(id));
        }

        @Override
        public String describe() {
            return id;
        }
    }

    record AllOf(List<GoalExpression> operands) implements GoalExpression {
        @Override
        public Set<String> variables() {
            Set<String> vars = new LinkedHashSet<>();
            operands.forEach(o -> vars.addAll(o.variables()));
            return vars;
        }

        @Override
        public boolean evaluate(Map<String, Boolean> assignment) {
            return operands.stream().allMatch(o -> o.evaluate(assignment));
        }

        @Override
        public String describe() {
            return operands.stream().map(GoalExpression::describe)
                    .collect(Collectors.joining(" & ", "(", ")"));
        }
    }

    record AnyOf(List<GoalExpression> operands) implements GoalExpression {
        @Override
        public Set<String> variables() {
            Set<String> vars = new LinkedHashSet<>();
            operands.forEach(o -> vars.addAll(o.variables()));
            return vars;
        }

        @Override
        public boolean evaluate(Map<String, Boolean> assignment) {
            return operands.stream().anyMatch(o -> o.evaluate(assignment));
        }

        @Override
        public String describe() {
            return operands.stream().map(GoalExpression::describe)
                    .collect(Collectors.joining(" | ", "(", ")"));
        }
    }
}
