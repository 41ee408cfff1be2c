package com.architecture.memory.inevitability.service.analysis;

import com.architecture.memory.inevitability.dto.CollapseMetrics;
import com.architecture.memory.inevitability.dto.CollapseReport;
import com.architecture.memory.inevitability.dto.FragilityGrade;
import com.architecture.memory.inevitability.dto.McsResult;
import com.architecture.memory.inevitability.dto.MinimalCausalSet;
import com.architecture.memory.inevitability.dto.SolverResult;
import com.architecture.memory.inevitability.exception.SolverIndeterminateException;
import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.model.intervention.InterventionSet;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;
import com.architecture.memory.inevitability.service.solver.CausalSolver;
import com.architecture.memory.inevitability.service.solver.SolverOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Structural collapse metrics.
 *
 * Collapse radius of a control: number of goals that are blocked while the control is
 * enforced and become reachable once it is disabled. The fragility index is the mean
 * radius normalized by the goal count.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CollapseAnalyzer {

    private final CausalSolver solver;

    public CollapseReport analyze(StructuralCausalModel scm, List<GoalPredicate> goals,
                                  Map<String, McsResult> mcsByGoal, SolverOptions options) {
        List<String> controls = scm.getControlIds();
        if (controls.isEmpty() || goals.isEmpty()) {
            return CollapseReport.builder()
                    .fragilityIndex(0.0)
                    .grade(FragilityGrade.A)
                    .meanMcsCardinality(meanMcsCardinality(mcsByGoal))
                    .build();
        }

        // Enforced / disabled query per control, solved goal by goal in one session each
        List<InterventionSet> queries = new ArrayList<>();
        for (String control : controls) {
            queries.add(InterventionSet.empty().with(control, true));
            queries.add(InterventionSet.empty().with(control, false));
        }

        Map<String, List<String>> collapsedGoals = new TreeMap<>();
        controls.forEach(c -> collapsedGoals.put(c, new ArrayList<>()));
        for (GoalPredicate goal : goals) {
            List<SolverResult> results = solver.solveBatch(scm, goal, queries, options);
            for (int i = 0; i < controls.size(); i++) {
                SolverResult enforced = definite(results.get(2 * i), controls.get(i), goal);
                SolverResult disabled = definite(results.get(2 * i + 1), controls.get(i), goal);
                if (enforced.isUnsat() && disabled.isSat()) {
                    collapsedGoals.get(controls.get(i)).add(goal.getId());
                }
            }
        }

        int goalCount = goals.size();
        List<CollapseMetrics> ranking = new ArrayList<>();
        for (String control : controls) {
            int radius = collapsedGoals.get(control).size();
            ranking.add(CollapseMetrics.builder()
                    .controlId(control)
                    .controlName(scm.nameOf(control))
                    .collapseRadius(radius)
                    .collapsedGoals(collapsedGoals.get(control))
                    .singlePointOfFailure(radius == goalCount)
                    .build());
        }
        ranking.sort(Comparator.comparingInt(CollapseMetrics::getCollapseRadius).reversed()
                .thenComparing(CollapseMetrics::getControlId));

        double fragility = ranking.stream().mapToInt(CollapseMetrics::getCollapseRadius).average().orElse(0.0)
                / goalCount;
        int spof = (int) ranking.stream().filter(CollapseMetrics::isSinglePointOfFailure).count();
        int high = (int) ranking.stream().filter(m -> m.getCollapseRadius() > goalCount / 2.0).count();
        FragilityGrade grade = FragilityGrade.of(fragility);

        log.info("Fragility index {} (grade {}), {} single points of failure across {} goals",
                String.format("%.3f", fragility), grade, spof, goalCount);

        return CollapseReport.builder()
                .ranking(ranking)
                .fragilityIndex(fragility)
                .grade(grade)
                .singlePointsOfFailure(spof)
                .highCollapseControls(high)
                .meanMcsCardinality(meanMcsCardinality(mcsByGoal))
                .build();
    }

    private static double meanMcsCardinality(Map<String, McsResult> mcsByGoal) {
        if (mcsByGoal == null) {
            return 0.0;
        }
        return mcsByGoal.values().stream()
                .flatMap(r -> r.validatedSets().stream())
                .mapToInt(MinimalCausalSet::getCardinality)
                .average()
                .orElse(0.0);
    }

    private static SolverResult definite(SolverResult result, String control, GoalPredicate goal) {
        if (!result.isDefinite()) {
            throw new SolverIndeterminateException("collapse of " + control + " on " + goal.getId(), result);
        }
        return result;
    }
}
