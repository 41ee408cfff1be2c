package com.architecture.memory.inevitability;

import com.architecture.memory.inevitability.dto.AnalysisReport;
import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.service.analysis.CausalAnalysisService;
import com.architecture.memory.inevitability.service.mcs.McsPolicy;
import com.architecture.memory.inevitability.service.solver.SolverOptions;
import com.architecture.memory.inevitability.support.TestGraphs;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class InevitabilityApplicationTest {

    @Autowired
    private CausalAnalysisService causalAnalysisService;

    @Autowired
    private SolverOptions solverOptions;

    @Autowired
    private McsPolicy mcsPolicy;

    @Test
    void bindsConfiguredDefaults() {
        assertThat(solverOptions.getTimeoutMs()).isEqualTo(30_000);
        assertThat(solverOptions.getEnumerationLimit()).isEqualTo(4096);
        assertThat(mcsPolicy.getMaxCardinality()).isEqualTo(5);
        assertThat(mcsPolicy.getParallelism()).isEqualTo(4);
    }

    @Test
    void runsFullAnalysisThroughWiredServices() {
        AnalysisReport report = causalAnalysisService.analyze(TestGraphs.withUnrelatedControl(),
                List.of(GoalPredicate.compromise("server")));

        assertThat(report.getGoals()).hasSize(1);
        assertThat(report.getUniversalTheater()).containsExactly("badge_reader");
    }
}
