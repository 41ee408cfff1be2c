package com.architecture.memory.inevitability.service.solver;

import com.architecture.memory.inevitability.model.goal.GoalExpression;
import com.architecture.memory.inevitability.model.scm.StructuralEquation;
import com.architecture.memory.inevitability.service.solver.formula.Formula;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Translates SCM equations and goal expressions into backend-neutral formulas.
 *
 * Every variable {@code v} with a structural equation gets a guard literal
 * {@code active!v}; the equation is asserted as {@code active!v => (v <=> f(parents))}.
 * Clearing the guard inside a query scope detaches the variable from its parents, which is
 * how {@code do(v := x)} is expressed without re-encoding the model.
 */
@Component
public class ScmEncoder {

    public static final String GUARD_PREFIX = "active!";

    public static final String EQUATION_LABEL = "equation:";
    public static final String DEFAULT_LABEL = "default:";
    public static final String INTERVENTION_LABEL = "do:";
    public static final String GOAL_LABEL = "goal:";

    public String guard(String variable) {
        return GUARD_PREFIX + variable;
    }

    /**
     * Right-hand side of the structural equation: {@code (OR enabling) AND NOT (OR blocking)}.
     * A node with blocking parents only is true unless a blocker holds; a node whose
     * enabling edges were all severed is false.
     */
    public Formula equationBody(StructuralEquation equation, UnaryOperator<String> naming) {
        if (equation.isConstant()) {
            return Formula.constant(equation.getConstantValue());
        }
        List<Formula> enabling = vars(equation.getEnablingParents(), naming);
        List<Formula> blocking = vars(equation.getBlockingParents(), naming);

        if (enabling.isEmpty()) {
            // Every enabling edge severed: unreachable
            if (!equation.getSeveredParents().isEmpty()) {
                return Formula.FALSE;
            }
            return Formula.not(Formula.or(blocking));
        }
        if (blocking.isEmpty()) {
            return Formula.or(enabling);
        }
        return Formula.and(Formula.or(enabling), Formula.not(Formula.or(blocking)));
    }

    public Formula equation(StructuralEquation equation, UnaryOperator<String> naming) {
        return Formula.iff(Formula.var(naming.apply(equation.getTarget())), equationBody(equation, naming));
    }

    public Formula guardedEquation(StructuralEquation equation) {
        return Formula.implies(Formula.var(guard(equation.getTarget())), equation(equation, UnaryOperator.identity()));
    }

    public Formula goal(GoalExpression expression, UnaryOperator<String> naming) {
        if (expression instanceof GoalExpression.Var v) {
            return Formula.var(naming.apply(v.id()));
        } else if (expression instanceof GoalExpression.AllOf all) {
            return Formula.and(all.operands().stream().map(o -> goal(o, naming)).collect(Collectors.toList()));
        } else if (expression instanceof GoalExpression.AnyOf any) {
            return Formula.or(any.operands().stream().map(o -> goal(o, naming)).collect(Collectors.toList()));
        }
        throw new IllegalArgumentException("Unsupported goal expression: " + expression.getClass().getSimpleName());
    }

    public Formula goal(GoalExpression expression) {
        return goal(expression, UnaryOperator.identity());
    }

    /**
     * Naming for one copy of a two-copy encoding.
     */
    public UnaryOperator<String> copyNaming(String prefix) {
        return id -> prefix + id;
    }

    private static List<Formula> vars(List<String> ids, UnaryOperator<String> naming) {
        return ids.stream().map(naming).map(Formula::var).collect(Collectors.toList());
    }
}
