package com.architecture.memory.inevitability.service.mcs;

import com.architecture.memory.inevitability.dto.McsValidationFailure;
import com.architecture.memory.inevitability.dto.SolverResult;
import com.architecture.memory.inevitability.dto.SolverStatus;
import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.model.graph.ControlState;
import com.architecture.memory.inevitability.model.graph.InfraGraph;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;
import com.architecture.memory.inevitability.service.solver.SolveSession;
import com.architecture.memory.inevitability.support.AnalysisFixture;
import com.architecture.memory.inevitability.support.TestGraphs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class McsValidatorTest {

    private static final GoalPredicate SERVER = GoalPredicate.compromise("server");

    @Mock
    private SolveSession stalledSession;

    private AnalysisFixture fixture;
    private final McsValidator validator = new McsValidator();

    @BeforeEach
    void setUp() {
        fixture = new AnalysisFixture();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void acceptsSufficientAndIrredundantSet() {
        Optional<McsValidationFailure> failure = validate(TestGraphs.firewalledServer(ControlState.ACTIVE),
                List.of("firewall"));

        assertThat(failure).isEmpty();
    }

    @Test
    void reportsInsufficient_whenGoalStaysSatisfiable() {
        Optional<McsValidationFailure> failure = validate(TestGraphs.withUnrelatedControl(), List.of("badge_reader"));

        assertThat(failure).hasValueSatisfying(f -> {
            assertThat(f.getKind()).isEqualTo(McsValidationFailure.Kind.INSUFFICIENT);
            assertThat(f.getElements()).containsExactly("badge_reader");
            assertThat(f.getGoalId()).isEqualTo("compromise(server)");
        });
    }

    @Test
    void reportsRedundant_withSmallestBlockingSubset() {
        Optional<McsValidationFailure> failure = validate(TestGraphs.parallelControls(), List.of("ids", "waf"));

        assertThat(failure).hasValueSatisfying(f -> {
            assertThat(f.getKind()).isEqualTo(McsValidationFailure.Kind.REDUNDANT);
            assertThat(f.getOffendingSubset()).containsExactly("ids");
        });
    }

    @Test
    void reportsIndeterminate_whenSolverTimesOut() {
        when(stalledSession.solve(any(), any())).thenReturn(SolverResult.builder()
                .status(SolverStatus.TIMEOUT)
                .reasonUnknown("timeout")
                .build());

        Optional<McsValidationFailure> failure = validator.validate(stalledSession, SERVER, List.of("firewall"),
                List.of("firewall"), McsPolicy.defaults());

        assertThat(failure).hasValueSatisfying(f ->
                assertThat(f.getKind()).isEqualTo(McsValidationFailure.Kind.INDETERMINATE));
    }

    @Test
    void checksEveryProperSubset_upToExhaustiveLimit() {
        List<List<String>> subsets = validator.properSubsets(List.of("a", "b", "c"), 10);

        assertThat(subsets).hasSize(7);
        assertThat(subsets.get(0)).isEmpty();
        assertThat(subsets).doesNotContain(List.of("a", "b", "c"));
        assertThat(subsets.subList(1, 4)).allMatch(s -> s.size() == 1);
    }

    @Test
    void checksLeaveOneOutSubsets_aboveExhaustiveLimit() {
        List<List<String>> subsets = validator.properSubsets(List.of("a", "b", "c"), 2);

        assertThat(subsets).containsExactly(List.of("b", "c"), List.of("a", "c"), List.of("a", "b"));
    }

    private Optional<McsValidationFailure> validate(InfraGraph graph, List<String> candidate) {
        StructuralCausalModel scm = fixture.scmBuilder.build(graph);
        try (SolveSession session = fixture.solver.openSession(scm, fixture.options)) {
            return validator.validate(session, SERVER, candidate, scm.getControlIds(), McsPolicy.defaults());
        }
    }
}
