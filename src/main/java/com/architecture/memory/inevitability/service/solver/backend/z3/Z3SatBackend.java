package com.architecture.memory.inevitability.service.solver.backend.z3;

import com.architecture.memory.inevitability.dto.SolverStatus;
import com.architecture.memory.inevitability.exception.SolverBackendException;
import com.architecture.memory.inevitability.service.solver.backend.SatBackend;
import com.architecture.memory.inevitability.service.solver.formula.Formula;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * {@link SatBackend} on top of the Z3 Java bindings. Each instance owns a private
 * {@link Context}; Z3 contexts are not safe for concurrent use.
 */
@Slf4j
public class Z3SatBackend implements SatBackend {

    public static final String NAME = "z3";

    private static final String TRACKER_PREFIX = "trk_";

    private final Context ctx;
    private final Solver solver;
    private final Map<String, BoolExpr> variables = new HashMap<>();

    // Tracker constant name -> caller label
    private final Map<String, String> labelsByTracker = new HashMap<>();
    private final Map<String, BoolExpr> trackersByLabel = new HashMap<>();

    private Model lastModel;
    private boolean closed;

    public Z3SatBackend() {
        try {
            this.ctx = new Context();
            this.solver = ctx.mkSolver();
        } catch (Z3Exception | UnsatisfiedLinkError e) {
            throw new SolverBackendException("Failed to initialise Z3 context", e);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void declare(String variable) {
        ensureOpen();
        variables.computeIfAbsent(variable, ctx::mkBoolConst);
    }

    @Override
    public void assertFormula(Formula formula) {
        ensureOpen();
        try {
            solver.add(translate(formula));
        } catch (Z3Exception e) {
            throw new SolverBackendException("Z3 rejected assertion " + formula, e);
        }
    }

    @Override
    public void assertTracked(String label, Formula formula) {
        ensureOpen();
        BoolExpr tracker = trackersByLabel.computeIfAbsent(label, l -> {
            String trackerName = TRACKER_PREFIX + trackersByLabel.size();
            labelsByTracker.put(trackerName, l);
            return ctx.mkBoolConst(trackerName);
        });
        try {
            solver.assertAndTrack(translate(formula), tracker);
        } catch (Z3Exception e) {
            throw new SolverBackendException("Z3 rejected tracked assertion " + label, e);
        }
    }

    @Override
    public void push() {
        ensureOpen();
        solver.push();
    }

    @Override
    public void pop() {
        ensureOpen();
        solver.pop();
        lastModel = null;
    }

    @Override
    public SolverStatus check(long timeoutMs) {
        ensureOpen();
        lastModel = null;
        try {
            Params params = ctx.mkParams();
            params.add("timeout", (int) Math.min(Math.max(timeoutMs, 1), Integer.MAX_VALUE));
            solver.setParameters(params);

            Status status = solver.check();
            switch (status) {
                case SATISFIABLE:
                    lastModel = solver.getModel();
                    return SolverStatus.SAT;
                case UNSATISFIABLE:
                    return SolverStatus.UNSAT;
                default:
                    String reason = solver.getReasonUnknown();
                    log.debug("Z3 returned UNKNOWN: {}", reason);
                    return isTimeout(reason) ? SolverStatus.TIMEOUT : SolverStatus.UNKNOWN;
            }
        } catch (Z3Exception e) {
            throw new SolverBackendException("Z3 check failed", e);
        }
    }

    @Override
    public SortedMap<String, Boolean> witness(Collection<String> names) {
        if (lastModel == null) {
            throw new SolverBackendException("No model available: last check was not SAT");
        }
        SortedMap<String, Boolean> assignment = new TreeMap<>();
        for (String name : names) {
            BoolExpr variable = variables.get(name);
            if (variable == null) {
                throw new SolverBackendException("Undeclared variable in witness request: " + name);
            }
            assignment.put(name, lastModel.eval(variable, true).isTrue());
        }
        return assignment;
    }

    @Override
    public List<String> unsatCore() {
        ensureOpen();
        List<String> labels = new ArrayList<>();
        for (BoolExpr tracker : solver.getUnsatCore()) {
            String label = labelsByTracker.get(tracker.getFuncDecl().getName().toString());
            if (label != null) {
                labels.add(label);
            }
        }
        labels.sort(String::compareTo);
        return labels;
    }

    @Override
    public String reasonUnknown() {
        ensureOpen();
        return solver.getReasonUnknown();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            ctx.close();
        }
    }

    // ===== TRANSLATION =====

    private BoolExpr translate(Formula formula) {
        if (formula instanceof Formula.Var v) {
            BoolExpr variable = variables.get(v.name());
            if (variable == null) {
                throw new SolverBackendException("Formula references undeclared variable: " + v.name());
            }
            return variable;
        } else if (formula instanceof Formula.Const c) {
            return ctx.mkBool(c.value());
        } else if (formula instanceof Formula.Not n) {
            return ctx.mkNot(translate(n.operand()));
        } else if (formula instanceof Formula.And a) {
            return ctx.mkAnd(translateAll(a.operands()));
        } else if (formula instanceof Formula.Or o) {
            return ctx.mkOr(translateAll(o.operands()));
        } else if (formula instanceof Formula.Iff i) {
            return ctx.mkIff(translate(i.left()), translate(i.right()));
        } else if (formula instanceof Formula.Implies i) {
            return ctx.mkImplies(translate(i.antecedent()), translate(i.consequent()));
        }
        throw new SolverBackendException("Unsupported formula node: " + formula.getClass().getSimpleName());
    }

    private BoolExpr[] translateAll(List<Formula> operands) {
        BoolExpr[] result = new BoolExpr[operands.size()];
        for (int i = 0; i < operands.size(); i++) {
            result[i] = translate(operands.get(i));
        }
        return result;
    }

    private static boolean isTimeout(String reason) {
        return reason != null && (reason.contains("timeout") || reason.contains("canceled"));
    }

    private void ensureOpen() {
        if (closed) {
            throw new SolverBackendException("Z3 backend already closed");
        }
    }
}
