package com.architecture.memory.inevitability.service.analysis;

import com.architecture.memory.inevitability.dto.AttackPathStep;
import com.architecture.memory.inevitability.dto.EntryPointResult;
import com.architecture.memory.inevitability.dto.InevitabilityResult;
import com.architecture.memory.inevitability.dto.InevitabilityVerdict;
import com.architecture.memory.inevitability.dto.SolverStatus;
import com.architecture.memory.inevitability.model.goal.GoalExpression;
import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.model.graph.ControlState;
import com.architecture.memory.inevitability.model.intervention.InterventionSet;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;
import com.architecture.memory.inevitability.service.solver.SolverOptions;
import com.architecture.memory.inevitability.support.AnalysisFixture;
import com.architecture.memory.inevitability.support.TestGraphs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class InevitabilityAnalyzerTest {

    private static final GoalPredicate SERVER = GoalPredicate.compromise("server");

    private AnalysisFixture fixture;
    private InevitabilityAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        fixture = new AnalysisFixture();
        analyzer = fixture.inevitabilityAnalyzer;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void scoresInevitable_whenNoControlIsEnforced() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.firewalledServer(ControlState.INACTIVE));

        InevitabilityResult result = analyzer.analyze(scm, SERVER, fixture.options);

        assertThat(result.getScore()).isEqualTo(1.0);
        assertThat(result.isExhaustive()).isTrue();
        assertThat(result.getVerdict()).isEqualTo(InevitabilityVerdict.INEVITABLE);
        assertThat(result.getAttackPath()).extracting(AttackPathStep::getSourceNode, AttackPathStep::getTargetNode)
                .containsExactly(tuple("attacker", "server"));
        assertThat(result.getEntryPoints()).extracting(EntryPointResult::getStatus).containsExactly(SolverStatus.SAT);
    }

    @Test
    void scoresDefended_whenEnforcedControlBlocksGoal() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.firewalledServer(ControlState.ACTIVE));

        InevitabilityResult result = analyzer.analyze(scm, SERVER, fixture.options);

        assertThat(result.getScore()).isZero();
        assertThat(result.getVerdict()).isEqualTo(InevitabilityVerdict.DEFENDED);
        assertThat(result.getSolverResult().isUnsat()).isTrue();
        assertThat(result.getAttackPath()).isEmpty();
    }

    @Test
    void scoresFractionOfFreeRootConfigurations() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.twoEntryChannels(ControlState.INACTIVE));

        InevitabilityResult result = analyzer.analyze(scm, SERVER, fixture.options);

        assertThat(result.getScore()).isCloseTo(0.75, within(1e-9));
        assertThat(result.isExhaustive()).isTrue();
        assertThat(result.getVerdict()).isEqualTo(InevitabilityVerdict.INEVITABLE);
        assertThat(result.getAttackPath()).isNotEmpty();
        assertThat(result.getAttackPath().get(result.getAttackPath().size() - 1).getTargetNode()).isEqualTo("server");
    }

    @Test
    void reportsAtRisk_whenScoreBelowGoalThreshold() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.twoEntryChannels(ControlState.INACTIVE));
        GoalPredicate strict = GoalPredicate.builder()
                .id("server-strict")
                .expression(GoalExpression.var("server"))
                .threshold(0.8)
                .build();

        assertThat(analyzer.analyze(scm, strict, fixture.options).getVerdict()).isEqualTo(InevitabilityVerdict.AT_RISK);
    }

    @Test
    void excludesIntervenedRootsFromConfigurationSpace() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.twoEntryChannels(ControlState.INACTIVE));

        InevitabilityAnalyzer.Score score = analyzer.score(scm, SERVER,
                InterventionSet.empty().with("phishing", false), fixture.options);

        assertThat(score.value()).isCloseTo(0.5, within(1e-9));
        assertThat(score.exhaustive()).isTrue();
    }

    @Test
    void fallsBackToIndicator_whenConfigurationSpaceExceedsLimit() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.twoEntryChannels(ControlState.INACTIVE));
        SolverOptions tight = fixture.options.toBuilder().enumerationLimit(2).build();

        InevitabilityResult result = analyzer.analyze(scm, SERVER, tight);

        assertThat(result.getScore()).isEqualTo(1.0);
        assertThat(result.isExhaustive()).isFalse();
    }

    @Test
    void reportsReachabilityPerIdentity() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.twoIdentities());

        InevitabilityResult result = analyzer.analyze(scm, SERVER, fixture.options);

        assertThat(result.getEntryPoints()).extracting(EntryPointResult::getIdentityId, EntryPointResult::getStatus)
                .containsExactly(
                        tuple("alice", SolverStatus.SAT),
                        tuple("bob", SolverStatus.UNSAT));
    }

    @Test
    void mapsScoreToVerdict() {
        assertThat(InevitabilityAnalyzer.verdict(0.7, 0.7)).isEqualTo(InevitabilityVerdict.INEVITABLE);
        assertThat(InevitabilityAnalyzer.verdict(0.41, 0.7)).isEqualTo(InevitabilityVerdict.AT_RISK);
        assertThat(InevitabilityAnalyzer.verdict(0.4, 0.7)).isEqualTo(InevitabilityVerdict.DEFENDED);
    }
}
