package com.architecture.memory.inevitability.service.solver.formula;

import java.util.List;

/**
 * Backend-neutral propositional formula. Backends translate it into their own term
 * representation; nothing above the backend layer depends on a concrete solver API.
 */
public interface Formula {

    Formula TRUE = new Const(true);
    Formula FALSE = new Const(false);

    static Formula var(String name) {
        return new Var(name);
    }

    static Formula constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    static Formula literal(String name, boolean value) {
        return value ? var(name) : not(var(name));
    }

    static Formula not(Formula operand) {
        return new Not(operand);
    }

    static Formula and(List<Formula> operands) {
        if (operands.isEmpty()) return TRUE;
        if (operands.size() == 1) return operands.get(0);
        return new And(List.copyOf(operands));
    }

    static Formula and(Formula... operands) {
        return and(List.of(operands));
    }

    static Formula or(List<Formula> operands) {
        if (operands.isEmpty()) return FALSE;
        if (operands.size() == 1) return operands.get(0);
        return new Or(List.copyOf(operands));
    }

    static Formula or(Formula... operands) {
        return or(List.of(operands));
    }

    static Formula iff(Formula left, Formula right) {
        return new Iff(left, right);
    }

    static Formula implies(Formula antecedent, Formula consequent) {
        return new Implies(antecedent, consequent);
    }

    record Var(String name) implements Formula {
        @Override
        public String toString() {
            return name;
        }
    }

    record Const(boolean value) implements Formula {
        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record Not(Formula operand) implements Formula {
        @Override
        public String toString() {
            return "!" + operand;
        }
    }

    record And(List<Formula> operands) implements Formula {
        @Override
        public String toString() {
            return "(" + String.join(" & ", operands.stream().map(Object::toString).toList()) + ")";
        }
    }

    record Or(List<Formula> operands) implements Formula {
        @Override
        public String toString() {
            return "(" + String.join(" | ", operands.stream().map(Object::toString).toList()) + ")";
        }
    }

    record Iff(Formula left, Formula right) implements Formula {
        @Override
        public String toString() {
            return "(" + left + " <=> " + right + ")";
        }
    }

    record Implies(Formula antecedent, Formula consequent) implements Formula {
        @Override
        public String toString() {
            return "(" + antecedent + " => " + consequent + ")";
        }
    }
}
