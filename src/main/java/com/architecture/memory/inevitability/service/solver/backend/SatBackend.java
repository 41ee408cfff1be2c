package com.architecture.memory.inevitability.service.solver.backend;

import com.architecture.memory.inevitability.dto.SolverStatus;
import com.architecture.memory.inevitability.service.solver.formula.Formula;

import java.util.Collection;
import java.util.List;
import java.util.SortedMap;

/**
 * Narrow incremental satisfiability interface. One instance holds one solver context and
 * must only be used from a single thread.
 */
public interface SatBackend extends AutoCloseable {

    String name();

    /**
     * Declare a boolean variable. Formulas may only reference declared variables.
     */
    void declare(String variable);

    void assertFormula(Formula formula);

    /**
     * Assert a formula under a label that is reported in the unsat core when the
     * formula participates in the conflict.
     */
    void assertTracked(String label, Formula formula);

    void push();

    void pop();

    SolverStatus check(long timeoutMs);

    /**
     * Model values of the given variables after a SAT check. Unconstrained variables are
     * completed to a concrete value.
     */
    SortedMap<String, Boolean> witness(Collection<String> variables);

    /**
     * Labels of the tracked assertions in the core after an UNSAT check.
     */
    List<String> unsatCore();

    String reasonUnknown();

    @Override
    void close();
}
