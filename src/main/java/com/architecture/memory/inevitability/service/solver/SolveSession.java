package com.architecture.memory.inevitability.service.solver;

import com.architecture.memory.inevitability.dto.ModelCount;
import com.architecture.memory.inevitability.dto.SolverResult;
import com.architecture.memory.inevitability.dto.SolverStatus;
import com.architecture.memory.inevitability.exception.InvalidGoalException;
import com.architecture.memory.inevitability.exception.InvalidInterventionException;
import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.model.intervention.Intervention;
import com.architecture.memory.inevitability.model.intervention.InterventionSet;
import com.architecture.memory.inevitability.model.scm.ExogenousVariable;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;
import com.architecture.memory.inevitability.model.scm.StructuralEquation;
import com.architecture.memory.inevitability.service.solver.backend.SatBackend;
import com.architecture.memory.inevitability.service.solver.formula.Formula;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;

/**
 * Incremental solving context over one SCM. The base encoding is asserted once; every
 * query runs inside its own push/pop scope so queries never observe each other.
 *
 * <p>Not thread-safe. Concurrent callers open one session each.
 */
@Slf4j
public class SolveSession implements AutoCloseable {

    private final StructuralCausalModel scm;
    private final SatBackend backend;
    private final ScmEncoder encoder;
    private final SolverOptions options;
    private final List<String> variables;
    private int queries;

    SolveSession(StructuralCausalModel scm, SatBackend backend, ScmEncoder encoder, SolverOptions options) {
        this.scm = scm;
        this.backend = backend;
        this.encoder = encoder;
        this.options = options;
        this.variables = scm.getVariables();
        encodeBase();
    }

    private void encodeBase() {
        for (String variable : variables) {
            backend.declare(variable);
        }
        for (StructuralEquation equation : scm.getEquations().values()) {
            backend.declare(encoder.guard(equation.getTarget()));
            Formula guarded = encoder.guardedEquation(equation);
            if (options.isTrackUnsatCore()) {
                backend.assertTracked(ScmEncoder.EQUATION_LABEL + equation.getTarget(), guarded);
            } else {
                backend.assertFormula(guarded);
            }
        }
        log.debug("Encoded SCM {} with {} equations on backend {}",
                scm.getVersion(), scm.getEquations().size(), backend.name());
    }

    public StructuralCausalModel getScm() {
        return scm;
    }

    public SolverOptions getOptions() {
        return options;
    }

    public int getQueryCount() {
        return queries;
    }

    /**
     * Is the goal satisfiable in the model under the given interventions?
     */
    public SolverResult solve(GoalPredicate goal, InterventionSet interventions) {
        validate(goal, interventions);
        backend.push();
        try {
            assertQuery(goal, interventions);
            return check();
        } finally {
            backend.pop();
        }
    }

    /**
     * Enumerate satisfying assignments that differ on the projection variables, using
     * blocking clauses inside a private scope. Stops after {@code limit} models.
     */
    public ModelCount enumerate(GoalPredicate goal, InterventionSet interventions,
                                Collection<String> projection, int limit) {
        validate(goal, interventions);
        long start = System.currentTimeMillis();
        List<SortedMap<String, Boolean>> witnesses = new ArrayList<>();

        backend.push();
        try {
            assertQuery(goal, interventions);
            while (true) {
                SolverResult result = check();
                if (!result.isSat()) {
                    return ModelCount.builder()
                            .count(witnesses.size())
                            .witnesses(witnesses)
                            .complete(result.isUnsat())
                            .truncated(false)
                            .lastResult(result)
                            .elapsedMs(System.currentTimeMillis() - start)
                            .build();
                }
                witnesses.add(result.getWitness());

                boolean exhausted = projection.isEmpty();
                if (exhausted || witnesses.size() >= limit) {
                    return ModelCount.builder()
                            .count(witnesses.size())
                            .witnesses(witnesses)
                            .complete(exhausted)
                            .truncated(!exhausted)
                            .lastResult(result)
                            .elapsedMs(System.currentTimeMillis() - start)
                            .build();
                }

                // Exclude this projected assignment
                List<Formula> differs = new ArrayList<>();
                for (String variable : projection) {
                    differs.add(Formula.literal(variable, !result.getWitness().get(variable)));
                }
                backend.assertFormula(Formula.or(differs));
            }
        } finally {
            backend.pop();
        }
    }

    // ===== QUERY ENCODING =====

    private void assertQuery(GoalPredicate goal, InterventionSet interventions) {
        for (String target : scm.getEquations().keySet()) {
            backend.assertFormula(Formula.literal(encoder.guard(target), !interventions.targets(target)));
        }
        for (Intervention intervention : interventions.interventions()) {
            track(ScmEncoder.INTERVENTION_LABEL + intervention.getVariable(),
                    Formula.literal(intervention.getVariable(), intervention.isValue()));
        }
        for (ExogenousVariable root : scm.getExogenous().values()) {
            if (root.isFree() || interventions.targets(root.getId())) continue;
            track(ScmEncoder.DEFAULT_LABEL + root.getId(), Formula.literal(root.getId(), root.getDefaultValue()));
        }
        track(ScmEncoder.GOAL_LABEL + goal.getId(), encoder.goal(goal.getExpression()));
    }

    private void track(String label, Formula formula) {
        if (options.isTrackUnsatCore()) {
            backend.assertTracked(label, formula);
        } else {
            backend.assertFormula(formula);
        }
    }

    private SolverResult check() {
        long start = System.currentTimeMillis();
        SolverStatus status = backend.check(options.getTimeoutMs());
        queries++;

        SolverResult.SolverResultBuilder result = SolverResult.builder()
                .status(status)
                .backend(backend.name());
        switch (status) {
            case SAT -> result.witness(Collections.unmodifiableSortedMap(backend.witness(variables)));
            case UNSAT -> result.unsatCore(options.isTrackUnsatCore() ? List.copyOf(backend.unsatCore()) : List.of());
            default -> {
                String reason = backend.reasonUnknown();
                result.reasonUnknown(reason);
                log.warn("Solver returned {} on SCM {} after {} ms: {}",
                        status, scm.getVersion(), System.currentTimeMillis() - start, reason);
            }
        }
        return result.elapsedMs(System.currentTimeMillis() - start).build();
    }

    private void validate(GoalPredicate goal, InterventionSet interventions) {
        if (goal == null || goal.getExpression() == null || goal.variables().isEmpty()) {
            throw new InvalidGoalException("Goal must reference at least one variable");
        }
        for (String variable : goal.variables()) {
            if (!scm.hasVariable(variable)) {
                throw new InvalidGoalException("Goal " + goal.getId() + " references unknown variable " + variable);
            }
        }
        for (Intervention intervention : interventions.interventions()) {
            if (!scm.hasVariable(intervention.getVariable())) {
                throw new InvalidInterventionException(intervention.getVariable(),
                        "Intervention on unknown variable " + intervention.getVariable());
            }
        }
    }

    @Override
    public void close() {
        backend.close();
    }
}
