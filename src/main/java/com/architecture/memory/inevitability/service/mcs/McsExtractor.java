package com.architecture.memory.inevitability.service.mcs;

import com.architecture.memory.inevitability.dto.McsAlgorithm;
import com.architecture.memory.inevitability.dto.McsOutcome;
import com.architecture.memory.inevitability.dto.McsResult;
import com.architecture.memory.inevitability.dto.McsValidationFailure;
import com.architecture.memory.inevitability.dto.MinimalCausalSet;
import com.architecture.memory.inevitability.dto.SolverResult;
import com.architecture.memory.inevitability.exception.McsValidationException;
import com.architecture.memory.inevitability.exception.SolverIndeterminateException;
import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.model.graph.InfraEdge;
import com.architecture.memory.inevitability.model.graph.InfraNode;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;
import com.architecture.memory.inevitability.service.cache.AnalysisCache;
import com.architecture.memory.inevitability.service.cache.CacheKey;
import com.architecture.memory.inevitability.service.cache.CacheKeyGenerator;
import com.architecture.memory.inevitability.service.scm.ScmBuilder;
import com.architecture.memory.inevitability.service.solver.CausalSolver;
import com.architecture.memory.inevitability.service.solver.SolveSession;
import com.architecture.memory.inevitability.service.solver.SolverOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Extracts Minimal Causal Sets: sets of controls whose joint enforcement makes a goal
 * unsatisfiable while no proper subset does.
 *
 * Query convention: the candidate's controls are enforced, every other control is off.
 *
 * - EXACT: level-wise search by ascending cardinality with superset pruning, bounded by
 *   the policy's cardinality ceiling and result budget
 * - GREEDY: start from all controls enforced and drop controls in ascending structural
 *   impact while the goal stays blocked, yielding one locally minimal set
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class McsExtractor {

    private static final String CACHE_KIND = "mcs";

    private final CausalSolver solver;
    private final McsValidator validator;
    private final ScmBuilder scmBuilder;
    private final AnalysisCache cache;
    private final Executor analysisExecutor;

    public McsResult extract(StructuralCausalModel scm, GoalPredicate goal, McsPolicy policy, SolverOptions options) {
        CacheKey key = CacheKey.of(scm.getVersion(), CACHE_KIND, goal.getId(),
                CacheKeyGenerator.forQuery(CACHE_KIND, goal.getExpression().describe() + "|" + policy.canonical()));
        return cache.getOrCompute(key, McsResult.class, () -> compute(scm, goal, policy, options));
    }

    private McsResult compute(StructuralCausalModel scm, GoalPredicate goal, McsPolicy policy, SolverOptions options) {
        long start = System.currentTimeMillis();
        List<String> controls = scm.getControlIds();
        log.info("Extracting MCS for goal {} over {} controls ({})", goal.getId(), controls.size(), policy.getAlgorithm());

        McsResult.McsResultBuilder result = McsResult.builder()
                .goalId(goal.getId())
                .algorithm(policy.getAlgorithm());

        try (SolveSession session = solver.openSession(scm, options)) {
            SolverResult baseline = definite(session.solve(goal, ControlAssignments.noneEnforced(controls)),
                    "baseline for goal " + goal.getId());
            if (baseline.isUnsat()) {
                log.info("Goal {} is unreachable even with every control off", goal.getId());
                return finish(result.outcome(McsOutcome.GOAL_UNREACHABLE), start);
            }
            if (controls.isEmpty()) {
                return finish(result.outcome(McsOutcome.NO_CONTROLS), start);
            }

            List<List<String>> found;
            boolean truncated = false;
            if (policy.getAlgorithm() == McsAlgorithm.GREEDY) {
                found = greedy(session, scm, goal, controls);
            } else {
                ExactSearch search = exact(scm, goal, controls, policy, options);
                found = search.sets();
                truncated = search.truncated();
            }

            List<MinimalCausalSet> sets = new ArrayList<>();
            List<McsValidationFailure> failures = new ArrayList<>();
            for (List<String> elements : found) {
                Optional<McsValidationFailure> failure = validator.validate(session, goal, elements, controls, policy);
                failure.ifPresent(failures::add);
                if (failure.isPresent() && policy.isStrictValidation()
                        && failure.get().getKind() != McsValidationFailure.Kind.INDETERMINATE) {
                    throw new McsValidationException(failure.get());
                }
                sets.add(toSet(scm, elements, failure.isEmpty()));
            }

            result.mcsSets(sets)
                    .validationFailures(failures)
                    .truncated(truncated)
                    .outcome(sets.isEmpty() ? McsOutcome.NONE_EXISTS : McsOutcome.FOUND);
            McsResult done = finish(result, start);
            log.info("Goal {}: {} MCS found (truncated={}, {} validation failures) in {} ms",
                    goal.getId(), sets.size(), truncated, failures.size(), done.getElapsedMs());
            return done;
        }
    }

    // ========================= GREEDY =========================

    private List<List<String>> greedy(SolveSession session, StructuralCausalModel scm, GoalPredicate goal,
                                      List<String> controls) {
        SolverResult allOn = definite(session.solve(goal, ControlAssignments.allEnforced(controls)),
                "all-controls check for goal " + goal.getId());
        if (allOn.isSat()) {
            log.info("Goal {} stays satisfiable with every control enforced", goal.getId());
            return List.of();
        }

        List<String> order = greedyOrder(scm, goal, controls);
        Set<String> current = new TreeSet<>(controls);
        for (String control : order) {
            Set<String> trial = new TreeSet<>(current);
            trial.remove(control);
            SolverResult result = definite(session.solve(goal, ControlAssignments.enforcing(trial, controls)),
                    "greedy drop of " + control);
            if (result.isUnsat()) {
                current = trial;
            }
        }
        return List.of(List.copyOf(current));
    }

    /**
     * Drop order for the greedy search: controls blocking fewer nodes inside the goal's
     * backward slice go first, ties by id.
     */
    List<String> greedyOrder(StructuralCausalModel scm, GoalPredicate goal, List<String> controls) {
        Set<String> slice = scmBuilder.backwardSlice(scm, goal.variables());
        Map<String, Long> impact = new HashMap<>();
        for (String control : controls) {
            long blockedInSlice = scm.outgoingEdges(control).stream()
                    .filter(InfraEdge::isBlocking)
                    .map(InfraEdge::getTarget)
                    .filter(slice::contains)
                    .distinct()
                    .count();
            impact.put(control, blockedInSlice);
        }
        return controls.stream()
                .sorted(Comparator.<String, Long>comparing(impact::get).thenComparing(Comparator.naturalOrder()))
                .collect(Collectors.toList());
    }

    // ========================= EXACT =========================

    private record ExactSearch(List<List<String>> sets, boolean truncated) {
    }

    private ExactSearch exact(StructuralCausalModel scm, GoalPredicate goal, List<String> controls,
                              McsPolicy policy, SolverOptions options) {
        List<List<String>> found = new ArrayList<>();
        int ceiling = Math.min(policy.getMaxCardinality(), controls.size());
        boolean truncated = ceiling < controls.size();

        for (int k = 1; k <= ceiling; k++) {
            List<List<String>> candidates = new ArrayList<>();
            for (List<String> combo : combinations(controls, k)) {
                if (found.stream().noneMatch(combo::containsAll)) {
                    candidates.add(combo);
                }
            }
            if (candidates.isEmpty()) {
                continue;
            }

            List<List<String>> minimal = evaluateLevel(scm, goal, controls, candidates, policy, options);
            log.debug("Cardinality {}: {} candidates, {} minimal", k, candidates.size(), minimal.size());

            // Register the whole level before the next one starts pruning against it
            for (List<String> set : minimal) {
                if (found.size() >= policy.getMaxResults()) {
                    truncated = true;
                    break;
                }
                found.add(set);
            }
            if (found.size() >= policy.getMaxResults() && k < ceiling) {
                truncated = true;
                break;
            }
        }
        return new ExactSearch(found, truncated);
    }

    /**
     * Evaluate one cardinality level. Candidates are split into contiguous chunks, each
     * solved on the analysis executor in its own session; the result keeps candidate order.
     */
    private List<List<String>> evaluateLevel(StructuralCausalModel scm, GoalPredicate goal, List<String> controls,
                                             List<List<String>> candidates, McsPolicy policy, SolverOptions options) {
        int chunks = Math.max(1, Math.min(policy.getParallelism(), candidates.size()));
        int chunkSize = (candidates.size() + chunks - 1) / chunks;

        List<CompletableFuture<List<List<String>>>> futures = new ArrayList<>();
        for (int from = 0; from < candidates.size(); from += chunkSize) {
            List<List<String>> chunk = candidates.subList(from, Math.min(from + chunkSize, candidates.size()));
            futures.add(CompletableFuture.supplyAsync(
                    () -> evaluateChunk(scm, goal, controls, chunk, options), analysisExecutor));
        }

        List<List<String>> minimal = new ArrayList<>();
        try {
            for (CompletableFuture<List<List<String>>> future : futures) {
                minimal.addAll(future.join());
            }
        } catch (CompletionException e) {
            // Chunks still queued are dropped; running ones stop at their solver timeout
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        return minimal;
    }

    private List<List<String>> evaluateChunk(StructuralCausalModel scm, GoalPredicate goal, List<String> controls,
                                             List<List<String>> chunk, SolverOptions options) {
        List<List<String>> minimal = new ArrayList<>();
        try (SolveSession session = solver.openSession(scm, options)) {
            for (List<String> candidate : chunk) {
                SolverResult result = definite(session.solve(goal, ControlAssignments.enforcing(candidate, controls)),
                        "MCS candidate " + candidate);
                if (result.isUnsat() && leaveOneOutSatisfiable(session, goal, candidate, controls)) {
                    minimal.add(candidate);
                }
            }
        }
        return minimal;
    }

    private boolean leaveOneOutSatisfiable(SolveSession session, GoalPredicate goal, List<String> candidate,
                                           List<String> controls) {
        for (String dropped : candidate) {
            List<String> subset = new ArrayList<>(candidate);
            subset.remove(dropped);
            SolverResult result = definite(session.solve(goal, ControlAssignments.enforcing(subset, controls)),
                    "minimality check of " + candidate);
            if (result.isUnsat()) {
                return false;
            }
        }
        return true;
    }

    /**
     * All k-element subsets of the sorted input, in lexicographic order.
     */
    static List<List<String>> combinations(List<String> items, int k) {
        List<List<String>> result = new ArrayList<>();
        if (k <= 0 || k > items.size()) {
            return result;
        }
        int[] indices = new int[k];
        for (int i = 0; i < k; i++) {
            indices[i] = i;
        }
        while (true) {
            List<String> combo = new ArrayList<>(k);
            for (int index : indices) {
                combo.add(items.get(index));
            }
            result.add(combo);

            int i = k - 1;
            while (i >= 0 && indices[i] == items.size() - k + i) {
                i--;
            }
            if (i < 0) {
                return result;
            }
            indices[i]++;
            for (int j = i + 1; j < k; j++) {
                indices[j] = indices[j - 1] + 1;
            }
        }
    }

    // ========================= HELPERS =========================

    private static SolverResult definite(SolverResult result, String context) {
        if (!result.isDefinite()) {
            throw new SolverIndeterminateException(context, result);
        }
        return result;
    }

    private static MinimalCausalSet toSet(StructuralCausalModel scm, List<String> elements, boolean validated) {
        double cost = elements.stream()
                .map(scm::findNode)
                .flatMap(Optional::stream)
                .map(InfraNode::getAnnualCost)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .sum();
        return MinimalCausalSet.builder()
                .elements(List.copyOf(elements))
                .cardinality(elements.size())
                .totalCost(cost)
                .validated(validated)
                .build();
    }

    /**
     * Results are shared through the cache, so their lists are frozen.
     */
    private static McsResult finish(McsResult.McsResultBuilder result, long start) {
        McsResult done = result.elapsedMs(System.currentTimeMillis() - start).build();
        done.setMcsSets(List.copyOf(done.getMcsSets()));
        done.setValidationFailures(List.copyOf(done.getValidationFailures()));
        return done;
    }
}
