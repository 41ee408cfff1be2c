package com.architecture.memory.inevitability.service.relevance;

import com.architecture.memory.inevitability.dto.ControlClassification;
import com.architecture.memory.inevitability.dto.DefenseClassification;
import com.architecture.memory.inevitability.dto.McsResult;
import com.architecture.memory.inevitability.dto.ModelCount;
import com.architecture.memory.inevitability.dto.RelevanceEvidence;
import com.architecture.memory.inevitability.dto.RelevanceReport;
import com.architecture.memory.inevitability.dto.SolverResult;
import com.architecture.memory.inevitability.exception.SolverIndeterminateException;
import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.model.graph.InfraEdge;
import com.architecture.memory.inevitability.model.graph.InfraNode;
import com.architecture.memory.inevitability.model.intervention.InterventionSet;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;
import com.architecture.memory.inevitability.service.analysis.AttackPathTracer;
import com.architecture.memory.inevitability.service.cache.AnalysisCache;
import com.architecture.memory.inevitability.service.cache.CacheKey;
import com.architecture.memory.inevitability.service.cache.CacheKeyGenerator;
import com.architecture.memory.inevitability.service.solver.CausalSolver;
import com.architecture.memory.inevitability.service.solver.IndependenceSession;
import com.architecture.memory.inevitability.service.solver.SolveSession;
import com.architecture.memory.inevitability.service.solver.SolverOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Classifies every control by its causal relevance to a goal.
 *
 * - CRITICAL: member of every MCS
 * - NECESSARY: member of some MCS
 * - PARTIAL: in no MCS, but toggling it changes goal satisfiability in some configuration
 * - IRRELEVANT: toggling it never changes goal satisfiability (security theater)
 *
 * IRRELEVANT requires a proof: the two-copy independence query must be UNSAT.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RelevanceClassifier {

    private static final String CACHE_KIND = "relevance";

    private final CausalSolver solver;
    private final AttackPathTracer attackPathTracer;
    private final RelevanceWeights weights;
    private final AnalysisCache cache;

    public RelevanceReport classify(StructuralCausalModel scm, GoalPredicate goal, McsResult mcs,
                                    SolverOptions options) {
        return classify(scm, goal, mcs, weights, options);
    }

    public RelevanceReport classify(StructuralCausalModel scm, GoalPredicate goal, McsResult mcs,
                                    RelevanceWeights weights, SolverOptions options) {
        CacheKey key = CacheKey.of(scm.getVersion(), CACHE_KIND, goal.getId(),
                CacheKeyGenerator.forQuery(CACHE_KIND, canonicalQuery(goal, mcs, weights, options)));
        return cache.getOrCompute(key, RelevanceReport.class, () -> compute(scm, goal, mcs, weights, options));
    }

    private RelevanceReport compute(StructuralCausalModel scm, GoalPredicate goal, McsResult mcs,
                                    RelevanceWeights weights, SolverOptions options) {
        List<ControlClassification> classifications = new ArrayList<>();
        // One encoding per query shape, reused by every control through push/pop scopes
        try (SolveSession session = solver.openSession(scm, options);
             IndependenceSession independence = solver.openIndependenceSession(scm, options)) {
            for (String controlId : scm.getControlIds()) {
                classifications.add(classifyControl(session, independence, goal, mcs, controlId, weights));
            }
        }

        Map<DefenseClassification, Long> counts = classifications.stream()
                .collect(Collectors.groupingBy(ControlClassification::getClassification, Collectors.counting()));
        double wasted = classifications.stream()
                .filter(c -> c.getClassification() == DefenseClassification.IRRELEVANT)
                .mapToDouble(ControlClassification::getAnnualCost)
                .sum();
        double totalSpend = classifications.stream().mapToDouble(ControlClassification::getAnnualCost).sum();

        RelevanceReport report = RelevanceReport.builder()
                .goalId(goal.getId())
                .classifications(List.copyOf(classifications))
                .criticalCount(counts.getOrDefault(DefenseClassification.CRITICAL, 0L).intValue())
                .necessaryCount(counts.getOrDefault(DefenseClassification.NECESSARY, 0L).intValue())
                .partialCount(counts.getOrDefault(DefenseClassification.PARTIAL, 0L).intValue())
                .irrelevantCount(counts.getOrDefault(DefenseClassification.IRRELEVANT, 0L).intValue())
                .wastedSpend(wasted)
                .wasteRatio(totalSpend > 0 ? wasted / totalSpend : 0.0)
                .build();
        log.info("Goal {}: {} critical, {} necessary, {} partial, {} irrelevant controls (wasted spend {})",
                goal.getId(), report.getCriticalCount(), report.getNecessaryCount(),
                report.getPartialCount(), report.getIrrelevantCount(), wasted);
        return report;
    }

    private static String canonicalQuery(GoalPredicate goal, McsResult mcs, RelevanceWeights weights,
                                         SolverOptions options) {
        String sets = mcs.validatedSets().stream()
                .map(m -> String.join(",", m.getElements()))
                .collect(Collectors.joining(";"));
        return "goal=" + goal.getExpression().describe()
                + "|mcs=" + mcs.getOutcome() + ":" + sets
                + "|w=" + weights.getMcsFrequency() + "," + weights.getSatisfiabilityDelta()
                + "," + weights.getWitnessTraversal()
                + "|n=" + options.getEnumerationLimit();
    }

    public List<RelevanceReport> classifyAll(StructuralCausalModel scm, List<GoalPredicate> goals,
                                             Map<String, McsResult> mcsByGoal, SolverOptions options) {
        List<RelevanceReport> reports = new ArrayList<>();
        for (GoalPredicate goal : goals) {
            McsResult mcs = mcsByGoal.get(goal.getId());
            if (mcs == null) {
                throw new IllegalArgumentException("No MCS result for goal " + goal.getId());
            }
            reports.add(classify(scm, goal, mcs, options));
        }
        return reports;
    }

    /**
     * Controls classified IRRELEVANT in every report.
     */
    public List<String> universalTheater(List<RelevanceReport> reports) {
        if (reports.isEmpty()) {
            return List.of();
        }
        Set<String> theater = null;
        for (RelevanceReport report : reports) {
            Set<String> irrelevant = report.getClassifications().stream()
                    .filter(c -> c.getClassification() == DefenseClassification.IRRELEVANT)
                    .map(ControlClassification::getControlId)
                    .collect(Collectors.toCollection(TreeSet::new));
            if (theater == null) {
                theater = irrelevant;
            } else {
                theater.retainAll(irrelevant);
            }
        }
        return List.copyOf(theater);
    }

    // ========================= PER CONTROL =========================

    private ControlClassification classifyControl(SolveSession session, IndependenceSession independenceSession,
                                                  GoalPredicate goal, McsResult mcs, String controlId,
                                                  RelevanceWeights weights) {
        StructuralCausalModel scm = session.getScm();
        InfraNode control = scm.findNode(controlId).orElseThrow();
        int validatedSets = mcs.validatedSets().size();
        int membership = mcs.membershipCount(controlId);

        SolverResult enabled = definite(session.solve(goal, InterventionSet.empty().with(controlId, true)),
                controlId + " enabled");
        SolverResult disabled = definite(session.solve(goal, InterventionSet.empty().with(controlId, false)),
                controlId + " disabled");
        double satDelta = Math.abs((disabled.isSat() ? 1.0 : 0.0) - (enabled.isSat() ? 1.0 : 0.0));

        DefenseClassification classification;
        SolverResult independence = null;
        if (validatedSets > 0 && membership == validatedSets) {
            classification = DefenseClassification.CRITICAL;
        } else if (membership > 0) {
            classification = DefenseClassification.NECESSARY;
        } else {
            independence = definite(independenceSession.check(goal, controlId), "independence of " + controlId);
            classification = independence.isUnsat() ? DefenseClassification.IRRELEVANT : DefenseClassification.PARTIAL;
        }

        double traversal = 0.0;
        double score = 0.0;
        if (classification != DefenseClassification.IRRELEVANT) {
            traversal = witnessTraversal(session, goal, controlId);
            double mcsFrequency = validatedSets > 0 ? (double) membership / validatedSets : 0.0;
            score = weights.getMcsFrequency() * mcsFrequency
                    + weights.getSatisfiabilityDelta() * satDelta
                    + weights.getWitnessTraversal() * traversal;
            score = Math.min(1.0, Math.max(0.0, score));
        }

        double cost = control.getAnnualCost() != null ? control.getAnnualCost() : 0.0;
        log.debug("Control {} for goal {}: {} (score {}, membership {}/{})",
                controlId, goal.getId(), classification, score, membership, validatedSets);

        return ControlClassification.builder()
                .controlId(controlId)
                .controlName(control.getDisplayName())
                .controlType(control.getControlType())
                .classification(classification)
                .contributionScore(score)
                .mcsMembershipCount(membership)
                .annualCost(cost)
                .reason(reason(control, goal, classification, membership, validatedSets, independence))
                .recommendation(recommendation(control, classification, cost))
                .evidence(RelevanceEvidence.builder()
                        .enabledResult(enabled)
                        .disabledResult(disabled)
                        .independenceResult(independence)
                        .satisfiabilityDelta(satDelta)
                        .witnessTraversal(traversal)
                        .build())
                .build();
    }

    /**
     * Fraction of goal witnesses (control disabled) whose attack path passes through a node
     * the control blocks.
     */
    private double witnessTraversal(SolveSession session, GoalPredicate goal, String controlId) {
        StructuralCausalModel scm = session.getScm();
        Set<String> guarded = scm.outgoingEdges(controlId).stream()
                .filter(InfraEdge::isBlocking)
                .map(InfraEdge::getTarget)
                .collect(Collectors.toSet());
        if (guarded.isEmpty()) {
            return 0.0;
        }

        InterventionSet disabled = InterventionSet.empty().with(controlId, false);
        List<String> projection = scm.getFreeExogenousIds().stream()
                .filter(id -> !id.equals(controlId))
                .collect(Collectors.toList());
        ModelCount models = session.enumerate(goal, disabled, projection, session.getOptions().getEnumerationLimit());
        if (models.isIndeterminate()) {
            throw new SolverIndeterminateException("witness enumeration for " + controlId, models.getLastResult());
        }
        if (models.getWitnesses().isEmpty()) {
            return 0.0;
        }

        long traversing = models.getWitnesses().stream()
                .filter(w -> attackPathTracer.pathNodes(scm, goal, w).stream().anyMatch(guarded::contains))
                .count();
        return (double) traversing / models.getWitnesses().size();
    }

    private static SolverResult definite(SolverResult result, String context) {
        if (!result.isDefinite()) {
            throw new SolverIndeterminateException(context, result);
        }
        return result;
    }

    private static String reason(InfraNode control, GoalPredicate goal, DefenseClassification classification,
                                 int membership, int validatedSets, SolverResult independence) {
        String name = control.getDisplayName();
        String goalName = goal.getDisplayName();
        switch (classification) {
            case CRITICAL:
                return name + " appears in every minimal causal set for '" + goalName
                        + "'. Disabling it removes every known minimal defense.";
            case NECESSARY:
                return name + " appears in " + membership + " of " + validatedSets
                        + " minimal causal sets for '" + goalName + "'.";
            case PARTIAL:
                return name + " is in no minimal causal set for '" + goalName
                        + "' but changes its reachability in at least one configuration.";
            default:
                return name + " has no causal effect on '" + goalName + "': no configuration exists in which "
                        + "toggling it changes whether the goal is reachable"
                        + (independence != null ? " (independence proof " + independence.getStatus() + ")." : ".");
        }
    }

    private static String recommendation(InfraNode control, DefenseClassification classification, double cost) {
        String name = control.getDisplayName();
        switch (classification) {
            case CRITICAL:
                return "CRITICAL: ensure " + name + " is always enforced and monitored.";
            case NECESSARY:
                return "Keep " + name + " enforced as part of a minimal defense.";
            case PARTIAL:
                return "Review cost-effectiveness of " + name + ".";
            default:
                return String.format("Consider reallocating $%,.0f/year from %s to causally relevant controls.",
                        cost, name);
        }
    }
}
