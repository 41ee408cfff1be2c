package com.architecture.memory.inevitability.service.analysis;

import com.architecture.memory.inevitability.dto.AnalysisReport;
import com.architecture.memory.inevitability.dto.CollapseReport;
import com.architecture.memory.inevitability.dto.GoalAnalysis;
import com.architecture.memory.inevitability.dto.InevitabilityResult;
import com.architecture.memory.inevitability.dto.McsResult;
import com.architecture.memory.inevitability.dto.RelevanceReport;
import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.model.graph.InfraGraph;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;
import com.architecture.memory.inevitability.service.cache.AnalysisCache;
import com.architecture.memory.inevitability.service.mcs.McsExtractor;
import com.architecture.memory.inevitability.service.mcs.McsPolicy;
import com.architecture.memory.inevitability.service.relevance.RelevanceClassifier;
import com.architecture.memory.inevitability.service.scm.ScmBuilder;
import com.architecture.memory.inevitability.service.solver.SolverOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Full analysis pipeline over a set of goals:
 * 1. Compile the graph
 * 2. Per goal, in parallel: inevitability, MCS, relevance classification
 * 3. Across goals: collapse ranking and universal security theater
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CausalAnalysisService {

    private final ScmBuilder scmBuilder;
    private final InevitabilityAnalyzer inevitabilityAnalyzer;
    private final McsExtractor mcsExtractor;
    private final RelevanceClassifier relevanceClassifier;
    private final CollapseAnalyzer collapseAnalyzer;
    private final Executor analysisExecutor;
    private final SolverOptions solverOptions;
    private final McsPolicy mcsPolicy;
    private final AnalysisCache cache;

    // Latest compiled version per graph id
    private final Map<String, String> versionsByGraph = new ConcurrentHashMap<>();

    /**
     * Compile and analyse the graph. When a graph with the same id was analysed before under
     * different content, every cached result of the earlier version is dropped.
     */
    public AnalysisReport analyze(InfraGraph graph, List<GoalPredicate> goals) {
        StructuralCausalModel scm = scmBuilder.build(graph);
        if (graph.getId() != null) {
            String previous = versionsByGraph.put(graph.getId(), scm.getVersion());
            if (previous != null && !previous.equals(scm.getVersion())) {
                int evicted = cache.invalidate(previous);
                log.info("Graph {} changed (SCM {} -> {}), {} cached results evicted",
                        graph.getId(), previous, scm.getVersion(), evicted);
            }
        }
        return analyze(scm, goals, mcsPolicy, solverOptions);
    }

    public AnalysisReport analyze(StructuralCausalModel scm, List<GoalPredicate> goals,
                                  McsPolicy policy, SolverOptions options) {
        long start = System.currentTimeMillis();
        log.info("Analysing {} goals on SCM {}", goals.size(), scm.getVersion());

        List<CompletableFuture<GoalAnalysis>> futures = goals.stream()
                .map(goal -> CompletableFuture.supplyAsync(() -> analyzeGoal(scm, goal, policy, options),
                        analysisExecutor))
                .collect(Collectors.toList());

        List<GoalAnalysis> analyses = new ArrayList<>();
        try {
            for (CompletableFuture<GoalAnalysis> future : futures) {
                analyses.add(future.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }

        Map<String, McsResult> mcsByGoal = new LinkedHashMap<>();
        analyses.forEach(a -> mcsByGoal.put(a.getGoalId(), a.getMcs()));
        CollapseReport collapse = collapseAnalyzer.analyze(scm, goals, mcsByGoal, options);
        List<String> theater = relevanceClassifier.universalTheater(
                analyses.stream().map(GoalAnalysis::getRelevance).collect(Collectors.toList()));

        long elapsed = System.currentTimeMillis() - start;
        log.info("Analysis of {} goals finished in {} ms ({} universal theater controls, cache {} hits / {} misses)",
                goals.size(), elapsed, theater.size(), cache.getHits(), cache.getMisses());

        return AnalysisReport.builder()
                .scmVersion(scm.getVersion())
                .goals(analyses)
                .collapse(collapse)
                .universalTheater(theater)
                .elapsedMs(elapsed)
                .build();
    }

    public GoalAnalysis analyzeGoal(StructuralCausalModel scm, GoalPredicate goal,
                                    McsPolicy policy, SolverOptions options) {
        InevitabilityResult inevitability = inevitabilityAnalyzer.analyze(scm, goal, options);
        McsResult mcs = mcsExtractor.extract(scm, goal, policy, options);
        RelevanceReport relevance = relevanceClassifier.classify(scm, goal, mcs, options);
        return GoalAnalysis.builder()
                .goalId(goal.getId())
                .inevitability(inevitability)
                .mcs(mcs)
                .relevance(relevance)
                .build();
    }
}
