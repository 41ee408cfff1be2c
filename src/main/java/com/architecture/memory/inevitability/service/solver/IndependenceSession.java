package com.architecture.memory.inevitability.service.solver;

import com.architecture.memory.inevitability.dto.SolverResult;
import com.architecture.memory.inevitability.dto.SolverStatus;
import com.architecture.memory.inevitability.exception.InvalidInterventionException;
import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;
import com.architecture.memory.inevitability.model.scm.StructuralEquation;
import com.architecture.memory.inevitability.service.solver.backend.SatBackend;
import com.architecture.memory.inevitability.service.solver.formula.Formula;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Incremental two-copy encoding of one SCM for independence checks.
 *
 * <p>Both copies of every equation are asserted once, behind a guard shared by the two
 * copies. A check fixes the guards, ties every root except the checked variable across the
 * copies, forces the variable true in one copy and false in the other, and requires the
 * goal to differ. Each check runs in its own push/pop scope.
 *
 * <p>Not thread-safe.
 */
@Slf4j
public class IndependenceSession implements AutoCloseable {

    static final String COPY_ENFORCED = "on!";
    static final String COPY_DISABLED = "off!";

    private final StructuralCausalModel scm;
    private final SatBackend backend;
    private final ScmEncoder encoder;
    private final SolverOptions options;
    private final UnaryOperator<String> enforced;
    private final UnaryOperator<String> disabled;
    private int checks;

    IndependenceSession(StructuralCausalModel scm, SatBackend backend, ScmEncoder encoder, SolverOptions options) {
        this.scm = scm;
        this.backend = backend;
        this.encoder = encoder;
        this.options = options;
        this.enforced = encoder.copyNaming(COPY_ENFORCED);
        this.disabled = encoder.copyNaming(COPY_DISABLED);
        encodeBase();
    }

    private void encodeBase() {
        for (String id : scm.getVariables()) {
            backend.declare(enforced.apply(id));
            backend.declare(disabled.apply(id));
        }
        for (StructuralEquation equation : scm.getEquations().values()) {
            String guard = encoder.guard(equation.getTarget());
            backend.declare(guard);
            backend.assertFormula(Formula.implies(Formula.var(guard), encoder.equation(equation, enforced)));
            backend.assertFormula(Formula.implies(Formula.var(guard), encoder.equation(equation, disabled)));
        }
        log.debug("Encoded two-copy SCM {} with {} equations on backend {}",
                scm.getVersion(), scm.getEquations().size(), backend.name());
    }

    public int getCheckCount() {
        return checks;
    }

    /**
     * UNSAT proves the goal is independent of the variable under every configuration of the
     * other roots; a SAT witness is a distinguishing configuration of those roots.
     */
    public SolverResult check(GoalPredicate goal, String variable) {
        if (!scm.hasVariable(variable)) {
            throw new InvalidInterventionException(variable, "Independence check on unknown variable " + variable);
        }
        List<String> shared = scm.getExogenous().keySet().stream()
                .filter(id -> !id.equals(variable))
                .collect(Collectors.toList());

        long start = System.currentTimeMillis();
        backend.push();
        try {
            for (String target : scm.getEquations().keySet()) {
                backend.assertFormula(Formula.literal(encoder.guard(target), !target.equals(variable)));
            }
            for (String root : shared) {
                backend.assertFormula(Formula.iff(Formula.var(enforced.apply(root)), Formula.var(disabled.apply(root))));
            }
            backend.assertFormula(Formula.var(enforced.apply(variable)));
            backend.assertFormula(Formula.not(Formula.var(disabled.apply(variable))));
            backend.assertFormula(Formula.not(Formula.iff(
                    encoder.goal(goal.getExpression(), enforced),
                    encoder.goal(goal.getExpression(), disabled))));

            SolverStatus status = backend.check(options.getTimeoutMs());
            checks++;
            SolverResult.SolverResultBuilder result = SolverResult.builder()
                    .status(status)
                    .backend(backend.name());
            if (status == SolverStatus.SAT) {
                result.witness(sharedWitness(shared));
            } else if (status == SolverStatus.UNSAT) {
                result.unsatCore(List.of());
            } else {
                result.reasonUnknown(backend.reasonUnknown());
                log.warn("Independence check of {} for goal {} returned {}", variable, goal.getId(), status);
            }
            return result.elapsedMs(System.currentTimeMillis() - start).build();
        } finally {
            backend.pop();
        }
    }

    private SortedMap<String, Boolean> sharedWitness(List<String> shared) {
        SortedMap<String, Boolean> copy = backend.witness(shared.stream().map(enforced).collect(Collectors.toList()));
        SortedMap<String, Boolean> witness = new TreeMap<>();
        for (String root : shared) {
            witness.put(root, copy.get(enforced.apply(root)));
        }
        return witness;
    }

    @Override
    public void close() {
        backend.close();
    }
}
