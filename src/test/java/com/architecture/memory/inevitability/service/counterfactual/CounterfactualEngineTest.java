package com.architecture.memory.inevitability.service.counterfactual;

import com.architecture.memory.inevitability.dto.ChangeDirection;
import com.architecture.memory.inevitability.dto.CounterfactualResult;
import com.architecture.memory.inevitability.dto.SensitivityResult;
import com.architecture.memory.inevitability.exception.InvalidInterventionException;
import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.model.graph.ControlState;
import com.architecture.memory.inevitability.model.intervention.Intervention;
import com.architecture.memory.inevitability.model.intervention.InterventionSet;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;
import com.architecture.memory.inevitability.support.AnalysisFixture;
import com.architecture.memory.inevitability.support.TestGraphs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class CounterfactualEngineTest {

    private static final GoalPredicate SERVER = GoalPredicate.compromise("server");
    private static final GoalPredicate DATABASE = GoalPredicate.compromise("database");

    private AnalysisFixture fixture;
    private CounterfactualEngine engine;

    @BeforeEach
    void setUp() {
        fixture = new AnalysisFixture();
        engine = fixture.counterfactualEngine;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    // ===== DO-OPERATOR =====

    @Test
    void replacesEquationWithConstant_andLeavesInputUntouched() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.firewalledServer(ControlState.ACTIVE));

        StructuralCausalModel derived = engine.apply(scm, Intervention.of("firewall", false));

        assertThat(derived.getVersion()).isNotEqualTo(scm.getVersion());
        assertThat(derived.equationFor("firewall").orElseThrow().isConstant()).isTrue();
        assertThat(derived.isExogenous("firewall")).isFalse();
        assertThat(derived.getAppliedInterventions()).containsEntry("firewall", false);
        assertThat(scm.equationFor("firewall")).isEmpty();
        assertThat(scm.isExogenous("firewall")).isTrue();
        assertThat(scm.getAppliedInterventions()).isEmpty();
    }

    @Test
    void removesIncomingEdgesOfIntervenedVariable() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.corporate());

        StructuralCausalModel derived = engine.apply(scm, Intervention.of("admin", true));

        assertThat(derived.incomingEdges("admin")).isEmpty();
        assertThat(derived.outgoingEdges("admin")).hasSize(1);
        assertThat(scm.incomingEdges("admin")).hasSize(2);
        assertThat(fixture.solver.solve(derived, DATABASE, InterventionSet.empty(), fixture.options).isSat()).isTrue();
    }

    @Test
    void yieldsSameModel_regardlessOfInterventionOrder() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.corporate());

        StructuralCausalModel compound = engine.applyCompound(scm, InterventionSet.of(
                Intervention.of("mfa", false), Intervention.of("edr", true)));
        StructuralCausalModel sequential = engine.apply(engine.apply(scm, Intervention.of("edr", true)),
                Intervention.of("mfa", false));

        assertThat(compound.getVersion()).isEqualTo(sequential.getVersion());
    }

    @Test
    void reusesCachedDerivation() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.corporate());

        StructuralCausalModel first = engine.apply(scm, Intervention.of("mfa", false));
        StructuralCausalModel second = engine.apply(scm, Intervention.of("mfa", false));

        assertThat(second).isSameAs(first);
    }

    @Test
    void rejectsInterventionOnBusinessImmutableNode() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.corporate());

        assertThatThrownBy(() -> engine.apply(scm, Intervention.of("database", false)))
                .isInstanceOf(InvalidInterventionException.class)
                .hasMessageContaining("business-immutable");
    }

    @Test
    void rejectsInterventionOnUnknownNode() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.corporate());

        assertThatThrownBy(() -> engine.apply(scm, Intervention.of("ghost", true)))
                .isInstanceOf(InvalidInterventionException.class);
    }

    // ===== ASSUMPTIONS =====

    @Test
    void rebuildsModelAndReappliesInterventions_whenAssumptionToggled() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.corporate());
        StructuralCausalModel withoutMfa = engine.apply(scm, Intervention.of("mfa", false));

        StructuralCausalModel notPhishable = engine.toggleAssumption(withoutMfa, TestGraphs.PHISHABLE);

        assertThat(notPhishable.getAppliedInterventions()).containsEntry("mfa", false);
        assertThat(notPhishable.findAssumption(TestGraphs.PHISHABLE).orElseThrow().isActive()).isFalse();
        assertThat(fixture.inevitabilityAnalyzer.score(withoutMfa, DATABASE, InterventionSet.empty(),
                fixture.options).value()).isEqualTo(1.0);
        assertThat(fixture.inevitabilityAnalyzer.score(notPhishable, DATABASE, InterventionSet.empty(),
                fixture.options).value()).isZero();
    }

    @Test
    void restoresOriginalVersion_whenAssumptionToggledTwice() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.corporate());

        StructuralCausalModel twice = engine.toggleAssumption(
                engine.toggleAssumption(scm, "control-state:edr"), "control-state:edr");

        assertThat(twice.getVersion()).isEqualTo(scm.getVersion());
    }

    @Test
    void rejectsUnknownAssumption() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.corporate());

        assertThatThrownBy(() -> engine.toggleAssumption(scm, "no_such_assumption"))
                .isInstanceOf(InvalidInterventionException.class);
    }

    @Test
    void derivesInterventionFromControlStateAssumption() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.corporate());

        Intervention intervention = engine.interventionFromAssumption(scm, "control-state:mfa", false);

        assertThat(intervention.getVariable()).isEqualTo("mfa");
        assertThat(intervention.isValue()).isFalse();
        assertThat(intervention.getSourceAssumptionId()).isEqualTo("control-state:mfa");
        assertThat(intervention.getSourceAssumptionFingerprint()).isEqualTo("control-state:mfa@on");
        assertThatThrownBy(() -> engine.interventionFromAssumption(scm, TestGraphs.PHISHABLE, false))
                .isInstanceOf(InvalidInterventionException.class);
    }

    @Test
    void evictsDerivedModels_whenSourceAssumptionChanges() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.corporate());
        engine.apply(scm, engine.interventionFromAssumption(scm, "control-state:mfa", false));
        engine.apply(scm, Intervention.of("edr", true));
        assertThat(fixture.cache.size()).isEqualTo(2);

        engine.toggleAssumption(scm, "control-state:mfa");

        assertThat(fixture.cache.size()).isEqualTo(1);
    }

    // ===== WHAT-IF & SENSITIVITY =====

    @Test
    void explainsWhatIfThatCrossesThreshold() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.firewalledServer(ControlState.ACTIVE));

        CounterfactualResult result = engine.whatIf(scm, SERVER, InterventionSet.empty().with("firewall", false),
                fixture.options);

        assertThat(result.getBefore()).isZero();
        assertThat(result.getAfter()).isEqualTo(1.0);
        assertThat(result.getDirection()).isEqualTo(ChangeDirection.INCREASED);
        assertThat(result.isCrossedThreshold()).isTrue();
        assertThat(result.getInterventions()).containsEntry("firewall", false);
        assertThat(result.getExplanation()).contains("firewall disabled", "INCREASED", "compromise server");
    }

    @Test
    void reportsNoEffect_whenInterventionIsCausallyIrrelevant() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.withUnrelatedControl());

        CounterfactualResult result = engine.whatIf(scm, SERVER, InterventionSet.empty().with("badge_reader", false),
                fixture.options);

        assertThat(result.getDirection()).isEqualTo(ChangeDirection.UNCHANGED);
        assertThat(result.isCrossedThreshold()).isFalse();
        assertThat(result.getExplanation()).contains("no measurable effect");
    }

    @Test
    void measuresSensitivityToDisablingVariable() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.firewalledServer(ControlState.ACTIVE));

        SensitivityResult result = engine.sensitivity(scm, "firewall", SERVER, fixture.options);

        assertThat(result.isForcedValue()).isFalse();
        assertThat(result.getBaselineScore()).isZero();
        assertThat(result.getInterventionScore()).isEqualTo(1.0);
        assertThat(result.getDelta()).isEqualTo(1.0);
    }

    @Test
    void ranksVariablesBySensitivity() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.firewalledServer(ControlState.ACTIVE));

        List<SensitivityResult> results = engine.sensitivityAnalysis(scm, SERVER, fixture.options);

        assertThat(results).extracting(SensitivityResult::getVariable, SensitivityResult::isForcedValue)
                .containsExactly(tuple("firewall", false), tuple("server", true));
    }
}
