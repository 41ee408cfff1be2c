package com.architecture.memory.inevitability.service.scm;

import com.architecture.memory.inevitability.exception.GraphInconsistencyException;
import com.architecture.memory.inevitability.model.graph.EdgeType;
import com.architecture.memory.inevitability.model.graph.InfraEdge;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class AcyclicityCheckerTest {

    private final AcyclicityChecker checker = new AcyclicityChecker();

    @Test
    void returnsDeterministicTopologicalOrder() {
        List<InfraEdge> edges = List.of(
                InfraEdge.of("c", "d", EdgeType.ACCESS),
                InfraEdge.of("a", "c", EdgeType.ACCESS),
                InfraEdge.of("b", "c", EdgeType.ACCESS));

        assertThat(checker.topologicalOrder(List.of("d", "c", "b", "a"), edges))
                .containsExactly("a", "b", "c", "d");
    }

    @Test
    void ignoresControlEdges_whenLookingForCycles() {
        List<InfraEdge> edges = List.of(
                InfraEdge.of("a", "b", EdgeType.ACCESS),
                InfraEdge.of("b", "a", EdgeType.CONTROL));

        assertThat(checker.isAcyclic(List.of("a", "b"), edges)).isTrue();
    }

    @Test
    void reportsOffendingCycle_whenEnablingEdgesLoop() {
        List<InfraEdge> edges = List.of(
                InfraEdge.of("root", "x", EdgeType.ACCESS),
                InfraEdge.of("x", "y", EdgeType.LATERAL),
                InfraEdge.of("y", "z", EdgeType.LATERAL),
                InfraEdge.of("z", "x", EdgeType.TRUST));

        GraphInconsistencyException e = catchThrowableOfType(
                () -> checker.topologicalOrder(List.of("root", "x", "y", "z"), edges),
                GraphInconsistencyException.class);

        assertThat(e).isNotNull();
        assertThat(e.getCycle()).containsExactly("x", "y", "z", "x");
        assertThat(e.getMessage()).contains("x -> y -> z -> x");
        assertThat(checker.isAcyclic(List.of("root", "x", "y", "z"), edges)).isFalse();
    }

    @Test
    void handlesLongChainsWithoutRecursion() {
        List<String> nodes = new ArrayList<>();
        List<InfraEdge> edges = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            nodes.add(String.format("n%05d", i));
            if (i > 0) {
                edges.add(InfraEdge.of(String.format("n%05d", i - 1), String.format("n%05d", i), EdgeType.ACCESS));
            }
        }

        assertThat(checker.topologicalOrder(nodes, edges)).hasSize(20_000).startsWith("n00000").endsWith("n19999");
    }
}
