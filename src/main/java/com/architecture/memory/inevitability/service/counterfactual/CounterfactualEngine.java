package com.architecture.memory.inevitability.service.counterfactual;

import com.architecture.memory.inevitability.dto.ChangeDirection;
import com.architecture.memory.inevitability.dto.CounterfactualResult;
import com.architecture.memory.inevitability.dto.SensitivityResult;
import com.architecture.memory.inevitability.exception.InvalidInterventionException;
import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.model.graph.InfraEdge;
import com.architecture.memory.inevitability.model.graph.InfraNode;
import com.architecture.memory.inevitability.model.intervention.Intervention;
import com.architecture.memory.inevitability.model.intervention.InterventionSet;
import com.architecture.memory.inevitability.model.scm.Assumption;
import com.architecture.memory.inevitability.model.scm.ExogenousVariable;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;
import com.architecture.memory.inevitability.model.scm.StructuralEquation;
import com.architecture.memory.inevitability.service.analysis.InevitabilityAnalyzer;
import com.architecture.memory.inevitability.service.cache.AnalysisCache;
import com.architecture.memory.inevitability.service.cache.CacheKey;
import com.architecture.memory.inevitability.service.cache.CacheKeyGenerator;
import com.architecture.memory.inevitability.service.scm.ScmBuilder;
import com.architecture.memory.inevitability.service.scm.ScmCanonicalizer;
import com.architecture.memory.inevitability.service.solver.SolverOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Pearl's do-operator over compiled models.
 *
 * {@code do(X := x)} replaces X's structural equation with the constant x and removes the
 * incoming edges of X; outgoing edges stay. The input model is never modified: every
 * intervention yields a new model with its own version.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CounterfactualEngine {

    private static final String CACHE_KIND = "do";

    // Sensitivity entries with a smaller absolute delta are not reported
    private static final double MIN_REPORTED_DELTA = 0.01;

    private final ScmBuilder scmBuilder;
    private final ScmCanonicalizer canonicalizer;
    private final InevitabilityAnalyzer inevitabilityAnalyzer;
    private final AnalysisCache cache;

    // ========================= DO-OPERATOR =========================

    public StructuralCausalModel apply(StructuralCausalModel scm, Intervention intervention) {
        return applyCompound(scm, InterventionSet.of(intervention));
    }

    /**
     * Apply all interventions at once. The result does not depend on their order.
     */
    public StructuralCausalModel applyCompound(StructuralCausalModel scm, InterventionSet interventions) {
        for (Intervention intervention : interventions.interventions()) {
            validateTarget(scm, intervention.getVariable());
        }
        if (interventions.isEmpty()) {
            return scm;
        }

        int evicted = cache.evictValues(DerivedModel.class, derived -> derived.isStaleAgainst(scm));
        if (evicted > 0) {
            log.info("Evicted {} derived models built on outdated assumption states", evicted);
        }

        CacheKey key = CacheKey.of(scm.getVersion(), CACHE_KIND, null, CacheKeyGenerator.forInterventions(interventions));
        return cache.getOrCompute(key, DerivedModel.class,
                () -> new DerivedModel(derive(scm, interventions), interventions)).model();
    }

    private StructuralCausalModel derive(StructuralCausalModel scm, InterventionSet interventions) {
        SortedMap<String, StructuralEquation> equations = new TreeMap<>(scm.getEquations());
        SortedMap<String, ExogenousVariable> exogenous = new TreeMap<>(scm.getExogenous());
        SortedMap<String, Boolean> applied = new TreeMap<>(scm.getAppliedInterventions());

        for (Intervention intervention : interventions.interventions()) {
            String variable = intervention.getVariable();
            equations.put(variable, StructuralEquation.constant(variable, intervention.isValue()));
            exogenous.remove(variable);
            applied.put(variable, intervention.isValue());
        }

        List<InfraEdge> edges = scm.getEdges().stream()
                .filter(e -> !interventions.targets(e.getTarget()))
                .collect(Collectors.toList());

        StructuralCausalModel derived = canonicalizer.stamp(scm.toBuilder()
                .equations(Collections.unmodifiableSortedMap(equations))
                .exogenous(Collections.unmodifiableSortedMap(exogenous))
                .edges(List.copyOf(edges))
                .appliedInterventions(Collections.unmodifiableSortedMap(applied))
                .build());
        log.debug("Derived SCM {} from {} under {}", derived.getVersion(), scm.getVersion(), interventions.canonical());
        return derived;
    }

    private void validateTarget(StructuralCausalModel scm, String variable) {
        InfraNode node = scm.findNode(variable).orElseThrow(() ->
                new InvalidInterventionException(variable, "Intervention on unknown variable " + variable));
        if (node.isBusinessImmutable()) {
            throw new InvalidInterventionException(variable,
                    "Variable " + variable + " is business-immutable and cannot be intervened on");
        }
    }

    // ========================= ASSUMPTIONS =========================

    /**
     * Rebuild the model from its source graph with one assumption flipped. Interventions
     * already applied to the input are re-applied to the rebuilt model.
     */
    public StructuralCausalModel toggleAssumption(StructuralCausalModel scm, String assumptionId) {
        Assumption assumption = scm.findAssumption(assumptionId).orElseThrow(() ->
                new InvalidInterventionException(assumptionId, "Unknown assumption " + assumptionId));

        Map<String, Boolean> states = new HashMap<>();
        for (Assumption a : scm.getAssumptions()) {
            states.put(a.getId(), a.isActive());
        }
        states.put(assumption.getId(), !assumption.isActive());

        StructuralCausalModel rebuilt = scmBuilder.build(scm.getSourceGraph(), states);
        if (!scm.getAppliedInterventions().isEmpty()) {
            rebuilt = applyCompound(rebuilt, InterventionSet.fromValues(scm.getAppliedInterventions()));
        }

        StructuralCausalModel current = rebuilt;
        int evicted = cache.evictValues(DerivedModel.class, derived -> derived.isStaleAgainst(current));
        log.info("Assumption {} toggled to {} (SCM {} -> {}, {} cached derivations evicted)",
                assumption.getId(), !assumption.isActive(), scm.getVersion(), rebuilt.getVersion(), evicted);
        return rebuilt;
    }

    /**
     * Intervention equivalent to a control-state assumption: forcing the control on or off.
     * The intervention remembers the assumption's current fingerprint.
     */
    public Intervention interventionFromAssumption(StructuralCausalModel scm, String assumptionId, boolean value) {
        Assumption assumption = scm.findAssumption(assumptionId).orElseThrow(() ->
                new InvalidInterventionException(assumptionId, "Unknown assumption " + assumptionId));
        if (!assumption.isControlState()) {
            throw new InvalidInterventionException(assumptionId,
                    "Assumption " + assumption.getId() + " does not map to a control variable");
        }
        return Intervention.builder()
                .variable(assumption.getSubjectId())
                .value(value)
                .sourceAssumptionId(assumption.getId())
                .sourceAssumptionFingerprint(assumption.fingerprint())
                .build();
    }

    // ========================= WHAT-IF & SENSITIVITY =========================

    /**
     * Inevitability change caused by disabling the variable: inev(do(variable := false)) - inev.
     */
    public SensitivityResult sensitivity(StructuralCausalModel scm, String variable, GoalPredicate goal,
                                         SolverOptions options) {
        validateTarget(scm, variable);
        double baseline = inevitabilityAnalyzer.score(scm, goal, InterventionSet.empty(), options).value();
        return sensitivity(scm, variable, false, goal, baseline, options);
    }

    private SensitivityResult sensitivity(StructuralCausalModel scm, String variable, boolean value,
                                          GoalPredicate goal, double baseline, SolverOptions options) {
        StructuralCausalModel intervened = apply(scm, Intervention.of(variable, value));
        double after = inevitabilityAnalyzer.score(intervened, goal, InterventionSet.empty(), options).value();
        return SensitivityResult.builder()
                .variable(variable)
                .forcedValue(value)
                .baselineScore(baseline)
                .interventionScore(after)
                .delta(after - baseline)
                .build();
    }

    /**
     * Sensitivity of the goal to forcing each variable true and false, largest effect first.
     */
    public List<SensitivityResult> sensitivityAnalysis(StructuralCausalModel scm, GoalPredicate goal,
                                                       SolverOptions options) {
        double baseline = inevitabilityAnalyzer.score(scm, goal, InterventionSet.empty(), options).value();
        List<SensitivityResult> results = new ArrayList<>();
        for (InfraNode node : scm.getNodes().values()) {
            if (node.isBusinessImmutable()) continue;
            for (boolean value : new boolean[]{true, false}) {
                SensitivityResult result = sensitivity(scm, node.getId(), value, goal, baseline, options);
                if (Math.abs(result.getDelta()) > MIN_REPORTED_DELTA) {
                    results.add(result);
                }
            }
        }
        results.sort(Comparator.comparingDouble((SensitivityResult r) -> -Math.abs(r.getDelta()))
                .thenComparing(SensitivityResult::getVariable)
                .thenComparing(SensitivityResult::isForcedValue));
        return results;
    }

    public CounterfactualResult whatIf(StructuralCausalModel scm, GoalPredicate goal,
                                       InterventionSet interventions, SolverOptions options) {
        double before = inevitabilityAnalyzer.score(scm, goal, InterventionSet.empty(), options).value();
        StructuralCausalModel intervened = applyCompound(scm, interventions);
        double after = inevitabilityAnalyzer.score(intervened, goal, InterventionSet.empty(), options).value();
        double delta = after - before;
        boolean crossed = (before >= goal.getThreshold()) != (after >= goal.getThreshold());

        return CounterfactualResult.builder()
                .goalId(goal.getId())
                .interventions(interventions.asValues())
                .before(before)
                .after(after)
                .delta(delta)
                .direction(ChangeDirection.of(delta))
                .crossedThreshold(crossed)
                .explanation(explain(scm, goal, interventions, before, after))
                .build();
    }

    private String explain(StructuralCausalModel scm, GoalPredicate goal, InterventionSet interventions,
                           double before, double after) {
        String applied = interventions.interventions().stream()
                .map(i -> scm.nameOf(i.getVariable()) + (i.isValue() ? " enabled" : " disabled"))
                .collect(Collectors.joining(", "));
        double delta = after - before;
        if (Math.abs(delta) < MIN_REPORTED_DELTA) {
            return String.format("Setting %s has no measurable effect on '%s'.", applied, goal.getDisplayName());
        }
        return String.format("Setting %s %s the inevitability of '%s' by %.2f (from %.2f to %.2f).",
                applied, delta > 0 ? "INCREASED" : "DECREASED", goal.getDisplayName(), Math.abs(delta), before, after);
    }
}
