package com.architecture.memory.inevitability.service.analysis;

import com.architecture.memory.inevitability.dto.EntryPointResult;
import com.architecture.memory.inevitability.dto.InevitabilityResult;
import com.architecture.memory.inevitability.dto.InevitabilityVerdict;
import com.architecture.memory.inevitability.dto.ModelCount;
import com.architecture.memory.inevitability.dto.SolverResult;
import com.architecture.memory.inevitability.exception.SolverIndeterminateException;
import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.model.graph.InfraNode;
import com.architecture.memory.inevitability.model.graph.NodeType;
import com.architecture.memory.inevitability.model.intervention.InterventionSet;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;
import com.architecture.memory.inevitability.service.solver.CausalSolver;
import com.architecture.memory.inevitability.service.solver.SolverOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Computes how inevitable a goal is: the fraction of root-variable configurations in
 * which the goal is reachable, a per-identity entry point breakdown and the witness
 * attack path.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InevitabilityAnalyzer {

    // Scores above this (and below the goal threshold) are reported AT_RISK
    static final double AT_RISK_THRESHOLD = 0.4;

    // 2^k must fit in a long
    private static final int MAX_COUNTABLE_VARIABLES = 62;

    private final CausalSolver solver;
    private final AttackPathTracer attackPathTracer;

    /**
     * Inevitability score with its provenance. {@code exhaustive} is false when the
     * configuration space exceeded the enumeration limit and the score is a 0/1 indicator.
     */
    public record Score(double value, boolean exhaustive) {
    }

    public InevitabilityResult analyze(StructuralCausalModel scm, GoalPredicate goal,
                                       InterventionSet interventions, SolverOptions options) {
        SolverResult baseline = solver.solve(scm, goal, interventions, options);
        if (!baseline.isDefinite()) {
            throw new SolverIndeterminateException("inevitability of " + goal.getId(), baseline);
        }

        Score score = baseline.isSat() ? score(scm, goal, interventions, options) : new Score(0.0, true);
        InevitabilityVerdict verdict = verdict(score.value(), goal.getThreshold());
        log.info("Goal {} inevitability {} ({}, exhaustive={})",
                goal.getId(), String.format("%.3f", score.value()), verdict, score.exhaustive());

        return InevitabilityResult.builder()
                .goalId(goal.getId())
                .goalName(goal.getDisplayName())
                .score(score.value())
                .exhaustive(score.exhaustive())
                .verdict(verdict)
                .solverResult(baseline)
                .entryPoints(entryPoints(scm, goal, interventions, options))
                .attackPath(baseline.isSat()
                        ? attackPathTracer.trace(scm, goal, baseline.getWitness())
                        : new ArrayList<>())
                .build();
    }

    public InevitabilityResult analyze(StructuralCausalModel scm, GoalPredicate goal, SolverOptions options) {
        return analyze(scm, goal, InterventionSet.empty(), options);
    }

    /**
     * Fraction of configurations of the free root variables (those neither defaulted nor
     * intervened on) under which the goal holds. Falls back to a 0/1 satisfiability
     * indicator when there are more configurations than the enumeration limit.
     */
    public Score score(StructuralCausalModel scm, GoalPredicate goal,
                       InterventionSet interventions, SolverOptions options) {
        List<String> free = scm.getFreeExogenousIds().stream()
                .filter(id -> !interventions.targets(id))
                .collect(Collectors.toList());

        if (free.size() <= MAX_COUNTABLE_VARIABLES && (1L << free.size()) <= options.getEnumerationLimit()) {
            long configurations = 1L << free.size();
            ModelCount count = solver.countModels(scm, goal, interventions, free, (int) configurations, options);
            if (count.isIndeterminate()) {
                throw new SolverIndeterminateException("model count of " + goal.getId(), count.getLastResult());
            }
            return new Score((double) count.getCount() / configurations, true);
        }

        log.debug("{} free root variables exceed the enumeration limit {}, using satisfiability indicator",
                free.size(), options.getEnumerationLimit());
        SolverResult result = solver.solve(scm, goal, interventions, options);
        if (!result.isDefinite()) {
            throw new SolverIndeterminateException("inevitability of " + goal.getId(), result);
        }
        return new Score(result.isSat() ? 1.0 : 0.0, false);
    }

    /**
     * Goal satisfiability with exactly one identity present, for each identity.
     */
    List<EntryPointResult> entryPoints(StructuralCausalModel scm, GoalPredicate goal,
                                       InterventionSet interventions, SolverOptions options) {
        List<String> identities = scm.getNodes().values().stream()
                .filter(n -> n.getType() == NodeType.IDENTITY)
                .map(InfraNode::getId)
                .filter(id -> !interventions.targets(id))
                .collect(Collectors.toList());
        if (identities.isEmpty()) {
            return new ArrayList<>();
        }

        List<InterventionSet> queries = new ArrayList<>();
        for (String identity : identities) {
            InterventionSet query = interventions;
            for (String other : identities) {
                query = query.with(other, other.equals(identity));
            }
            queries.add(query);
        }

        List<SolverResult> results = solver.solveBatch(scm, goal, queries, options);
        List<EntryPointResult> entryPoints = new ArrayList<>();
        for (int i = 0; i < identities.size(); i++) {
            entryPoints.add(EntryPointResult.builder()
                    .identityId(identities.get(i))
                    .status(results.get(i).getStatus())
                    .build());
        }
        return entryPoints;
    }

    static InevitabilityVerdict verdict(double score, double threshold) {
        if (score >= threshold) return InevitabilityVerdict.INEVITABLE;
        if (score > AT_RISK_THRESHOLD) return InevitabilityVerdict.AT_RISK;
        return InevitabilityVerdict.DEFENDED;
    }
}
