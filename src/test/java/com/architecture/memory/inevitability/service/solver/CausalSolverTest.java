package com.architecture.memory.inevitability.service.solver;

import com.architecture.memory.inevitability.dto.ModelCount;
import com.architecture.memory.inevitability.dto.SolverResult;
import com.architecture.memory.inevitability.dto.SolverStatus;
import com.architecture.memory.inevitability.exception.InvalidGoalException;
import com.architecture.memory.inevitability.exception.InvalidInterventionException;
import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.model.graph.ControlState;
import com.architecture.memory.inevitability.model.intervention.InterventionSet;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;
import com.architecture.memory.inevitability.service.cache.AnalysisCache;
import com.architecture.memory.inevitability.service.solver.backend.SatBackend;
import com.architecture.memory.inevitability.service.solver.backend.SatBackendFactory;
import com.architecture.memory.inevitability.support.AnalysisFixture;
import com.architecture.memory.inevitability.support.TestGraphs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CausalSolverTest {

    private static final GoalPredicate SERVER = GoalPredicate.compromise("server");
    private static final GoalPredicate DATABASE = GoalPredicate.compromise("database");

    @Mock
    private SatBackendFactory backendFactory;

    @Mock
    private SatBackend backend;

    private AnalysisFixture fixture;
    private CausalSolver solver;

    @BeforeEach
    void setUp() {
        fixture = new AnalysisFixture();
        solver = fixture.solver;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void returnsUnsatWithCore_whenActiveControlBlocksOnlyPath() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.firewalledServer(ControlState.ACTIVE));

        SolverResult result = solver.solve(scm, SERVER, InterventionSet.empty(), fixture.options);

        assertThat(result.getStatus()).isEqualTo(SolverStatus.UNSAT);
        assertThat(result.getWitness()).isNull();
        assertThat(result.getUnsatCore())
                .contains("goal:compromise(server)", "equation:server", "default:firewall");
        assertThat(result.getBackend()).isEqualTo("z3");
    }

    @Test
    void returnsWitness_whenControlInactive() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.firewalledServer(ControlState.INACTIVE));

        SolverResult result = solver.solve(scm, SERVER, InterventionSet.empty(), fixture.options);

        assertThat(result.isSat()).isTrue();
        assertThat(result.getWitness())
                .containsEntry("attacker", true)
                .containsEntry("firewall", false)
                .containsEntry("server", true);
    }

    @Test
    void honoursInterventionOnRootVariable() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.firewalledServer(ControlState.ACTIVE));

        SolverResult result = solver.solve(scm, SERVER, InterventionSet.empty().with("firewall", false), fixture.options);

        assertThat(result.isSat()).isTrue();
        assertThat(result.getWitness()).containsEntry("firewall", false);
    }

    @Test
    void detachesEndogenousVariableFromParents_whenIntervenedOn() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.corporate());

        SolverResult blocked = solver.solve(scm, DATABASE, InterventionSet.empty(), fixture.options);
        SolverResult forced = solver.solve(scm, DATABASE, InterventionSet.empty().with("vpn", true), fixture.options);

        assertThat(blocked.isUnsat()).isTrue();
        assertThat(forced.isSat()).isTrue();
        assertThat(forced.getWitness()).containsEntry("mfa", true).containsEntry("vpn", true);
    }

    @Test
    void batchResultsMatchIndependentSolves() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.corporate());
        List<InterventionSet> queries = List.of(
                InterventionSet.empty(),
                InterventionSet.empty().with("mfa", false),
                InterventionSet.empty().with("mfa", false).with("edr", true),
                InterventionSet.empty().with("database", true));

        List<SolverStatus> batch = solver.solveBatch(scm, DATABASE, queries, fixture.options).stream()
                .map(SolverResult::getStatus)
                .collect(Collectors.toList());
        List<SolverStatus> single = queries.stream()
                .map(q -> solver.solve(scm, DATABASE, q, fixture.options).getStatus())
                .collect(Collectors.toList());

        assertThat(batch).containsExactly(SolverStatus.UNSAT, SolverStatus.SAT, SolverStatus.UNSAT, SolverStatus.SAT);
        assertThat(batch).isEqualTo(single);
    }

    @Test
    void isolatesQueriesWithinOneSession() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.firewalledServer(ControlState.ACTIVE));

        try (SolveSession session = solver.openSession(scm, fixture.options)) {
            assertThat(session.solve(SERVER, InterventionSet.empty().with("firewall", false)).isSat()).isTrue();
            assertThat(session.solve(SERVER, InterventionSet.empty()).isUnsat()).isTrue();
            assertThat(session.solve(SERVER, InterventionSet.empty().with("firewall", false)).isSat()).isTrue();
            assertThat(session.getQueryCount()).isEqualTo(3);
        }
    }

    @Test
    void rejectsGoalOnUnknownVariable() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.unguarded());

        assertThatThrownBy(() -> solver.solve(scm, GoalPredicate.compromise("ghost"), InterventionSet.empty(),
                fixture.options))
                .isInstanceOf(InvalidGoalException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void rejectsInterventionOnUnknownVariable() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.unguarded());

        assertThatThrownBy(() -> solver.solve(scm, SERVER, InterventionSet.empty().with("ghost", true),
                fixture.options))
                .isInstanceOf(InvalidInterventionException.class)
                .satisfies(e -> assertThat(((InvalidInterventionException) e).getVariable()).isEqualTo("ghost"));
    }

    @Test
    void countsProjectedModels() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.twoEntryChannels(ControlState.INACTIVE));

        ModelCount all = solver.countModels(scm, SERVER, InterventionSet.empty(),
                List.of("phishing", "zero_day"), 16, fixture.options);
        ModelCount capped = solver.countModels(scm, SERVER, InterventionSet.empty(),
                List.of("phishing", "zero_day"), 2, fixture.options);

        assertThat(all.getCount()).isEqualTo(3);
        assertThat(all.isComplete()).isTrue();
        assertThat(all.getWitnesses()).allMatch(w -> w.get("phishing") || w.get("zero_day"));
        assertThat(capped.getCount()).isEqualTo(2);
        assertThat(capped.isTruncated()).isTrue();
        assertThat(capped.isIndeterminate()).isFalse();
    }

    @Test
    void provesIndependence_whenControlGuardsUnrelatedAsset() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.withUnrelatedControl());

        SolverResult badge = solver.checkIndependence(scm, SERVER, "badge_reader", fixture.options);
        SolverResult firewall = solver.checkIndependence(scm, SERVER, "firewall", fixture.options);

        assertThat(badge.isUnsat()).isTrue();
        assertThat(firewall.isSat()).isTrue();
        assertThat(firewall.getWitness()).containsEntry("attacker", true).doesNotContainKey("firewall");
    }

    @Test
    void reusesCachedResult_forRepeatedDefiniteQuery() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.firewalledServer(ControlState.INACTIVE));
        InterventionSet forced = InterventionSet.empty().with("firewall", false);

        SolverResult first = solver.solve(scm, SERVER, forced, fixture.options);
        SolverResult second = solver.solve(scm, SERVER, InterventionSet.empty().with("firewall", false), fixture.options);

        assertThat(second).isSameAs(first);
        assertThat(fixture.cache.getHits()).isEqualTo(1);
        assertThatThrownBy(() -> first.getWitness().put("server", false))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void reusesOneEncoding_acrossIndependenceChecks() {
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.withUnrelatedControl());

        try (IndependenceSession session = solver.openIndependenceSession(scm, fixture.options)) {
            assertThat(session.check(SERVER, "badge_reader").isUnsat()).isTrue();
            assertThat(session.check(SERVER, "firewall").isSat()).isTrue();
            assertThat(session.check(SERVER, "badge_reader").isUnsat()).isTrue();
            assertThat(session.getCheckCount()).isEqualTo(3);
        }
    }

    @Test
    void doesNotCacheTimeout() {
        when(backendFactory.create()).thenReturn(backend);
        when(backend.check(anyLong())).thenReturn(SolverStatus.TIMEOUT);
        when(backend.reasonUnknown()).thenReturn("timeout");
        when(backend.name()).thenReturn("stub");
        AnalysisCache cache = new AnalysisCache();
        CausalSolver stubbed = new CausalSolver(backendFactory, new ScmEncoder(), cache);
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.firewalledServer(ControlState.ACTIVE));

        stubbed.solve(scm, SERVER, InterventionSet.empty(), fixture.options);
        stubbed.solve(scm, SERVER, InterventionSet.empty(), fixture.options);

        assertThat(cache.size()).isZero();
        verify(backendFactory, times(2)).create();
    }

    @Test
    void reportsTimeout_withoutFoldingItIntoSatOrUnsat() {
        when(backendFactory.create()).thenReturn(backend);
        when(backend.check(anyLong())).thenReturn(SolverStatus.TIMEOUT);
        when(backend.reasonUnknown()).thenReturn("timeout");
        when(backend.name()).thenReturn("stub");
        CausalSolver stubbed = new CausalSolver(backendFactory, new ScmEncoder(), new AnalysisCache());
        StructuralCausalModel scm = fixture.scmBuilder.build(TestGraphs.firewalledServer(ControlState.ACTIVE));

        SolverResult result = stubbed.solve(scm, SERVER, InterventionSet.empty(), fixture.options.withTimeout(1_234));

        assertThat(result.getStatus()).isEqualTo(SolverStatus.TIMEOUT);
        assertThat(result.isDefinite()).isFalse();
        assertThat(result.getReasonUnknown()).isEqualTo("timeout");
        assertThat(result.getWitness()).isNull();
        assertThat(result.getUnsatCore()).isNull();
        verify(backend).check(1_234L);
        verify(backend).close();
    }
}
