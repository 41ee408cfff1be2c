package com.architecture.memory.inevitability.service.solver;

import com.architecture.memory.inevitability.dto.ModelCount;
import com.architecture.memory.inevitability.dto.SolverResult;
import com.architecture.memory.inevitability.exception.InvalidGoalException;
import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.model.intervention.InterventionSet;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;
import com.architecture.memory.inevitability.service.cache.AnalysisCache;
import com.architecture.memory.inevitability.service.cache.CacheKey;
import com.architecture.memory.inevitability.service.cache.CacheKeyGenerator;
import com.architecture.memory.inevitability.service.solver.backend.SatBackend;
import com.architecture.memory.inevitability.service.solver.backend.SatBackendFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Answers satisfiability queries over a compiled SCM: is the goal reachable under these
 * interventions? Results are SAT with a witness, UNSAT with an unsat core, or an explicit
 * TIMEOUT/UNKNOWN.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CausalSolver {

    private static final String CACHE_KIND = "solve";

    private final SatBackendFactory backendFactory;
    private final ScmEncoder encoder;
    private final AnalysisCache cache;

    /**
     * Definite results are cached per model version; TIMEOUT and UNKNOWN are not, so a
     * retry with a longer timeout reaches the backend again.
     */
    public SolverResult solve(StructuralCausalModel scm, GoalPredicate goal,
                              InterventionSet interventions, SolverOptions options) {
        if (goal == null || goal.getExpression() == null) {
            throw new InvalidGoalException("Goal must reference at least one variable");
        }
        CacheKey key = CacheKey.of(scm.getVersion(), CACHE_KIND, goal.getId(),
                CacheKeyGenerator.forSolve(goal, interventions, options.isTrackUnsatCore()));
        Optional<SolverResult> cached = cache.get(key, SolverResult.class);
        if (cached.isPresent()) {
            return cached.get();
        }
        try (SolveSession session = openSession(scm, options)) {
            SolverResult result = session.solve(goal, interventions);
            log.debug("solve {} under {} -> {} in {} ms", goal.getId(), interventions.canonical(),
                    result.getStatus(), result.getElapsedMs());
            if (result.isDefinite()) {
                cache.put(key, result);
            }
            return result;
        }
    }

    /**
     * Solve one goal under many intervention sets. The model is encoded once and each set is
     * evaluated in its own scope, so the results equal those of independent solves.
     */
    public List<SolverResult> solveBatch(StructuralCausalModel scm, GoalPredicate goal,
                                         List<InterventionSet> interventionSets, SolverOptions options) {
        List<SolverResult> results = new ArrayList<>(interventionSets.size());
        long start = System.currentTimeMillis();
        try (SolveSession session = openSession(scm, options)) {
            for (InterventionSet interventions : interventionSets) {
                results.add(session.solve(goal, interventions));
            }
        }
        log.info("Batch of {} queries for goal {} finished in {} ms",
                interventionSets.size(), goal.getId(), System.currentTimeMillis() - start);
        return results;
    }

    /**
     * Open an incremental session. The caller owns the session and must close it.
     */
    public SolveSession openSession(StructuralCausalModel scm, SolverOptions options) {
        SatBackend backend = backendFactory.create();
        try {
            return new SolveSession(scm, backend, encoder, options);
        } catch (RuntimeException e) {
            backend.close();
            throw e;
        }
    }

    /**
     * Count satisfying assignments projected onto the given variables, up to {@code limit}.
     */
    public ModelCount countModels(StructuralCausalModel scm, GoalPredicate goal, InterventionSet interventions,
                                  Collection<String> projection, int limit, SolverOptions options) {
        try (SolveSession session = openSession(scm, options)) {
            ModelCount count = session.enumerate(goal, interventions, projection, limit);
            log.debug("Enumerated {} models of {} over {} projected variables (complete={}, truncated={})",
                    count.getCount(), goal.getId(), projection.size(), count.isComplete(), count.isTruncated());
            return count;
        }
    }

    /**
     * Decide whether a variable can ever change the goal. Two copies of the model share
     * every other root variable; the variable is true in one copy and false in the other,
     * and the goal is required to differ. UNSAT proves the goal is independent of the
     * variable under every configuration; a SAT witness is a distinguishing configuration.
     */
    public SolverResult checkIndependence(StructuralCausalModel scm, GoalPredicate goal,
                                          String variable, SolverOptions options) {
        try (IndependenceSession session = openIndependenceSession(scm, options)) {
            return session.check(goal, variable);
        }
    }

    /**
     * Open a two-copy session for many independence checks over one model. The caller owns
     * the session and must close it.
     */
    public IndependenceSession openIndependenceSession(StructuralCausalModel scm, SolverOptions options) {
        SatBackend backend = backendFactory.create();
        try {
            return new IndependenceSession(scm, backend, encoder, options);
        } catch (RuntimeException e) {
            backend.close();
            throw e;
        }
    }
}
