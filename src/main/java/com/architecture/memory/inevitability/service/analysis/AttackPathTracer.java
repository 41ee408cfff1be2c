package com.architecture.memory.inevitability.service.analysis;

import com.architecture.memory.inevitability.dto.AttackPathStep;
import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.model.graph.InfraEdge;
import com.architecture.memory.inevitability.model.graph.InfraNode;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;
import com.architecture.memory.inevitability.service.scm.ScmBuilder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Reconstructs the attack path behind a satisfying witness: starting at the goal
 * variables, walk backwards through enabling edges whose source is true in the witness.
 * Steps are returned root first. Statements are fixed templates over node names, so the
 * same witness always yields the same explanation.
 */
@Component
@RequiredArgsConstructor
public class AttackPathTracer {

    private final ScmBuilder scmBuilder;

    public List<AttackPathStep> trace(StructuralCausalModel scm, GoalPredicate goal, Map<String, Boolean> witness) {
        if (witness == null || witness.isEmpty()) {
            return List.of();
        }

        List<InfraEdge> contributing = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> worklist = new ArrayDeque<>();
        goal.variables().stream().sorted().filter(id -> isTrue(witness, id)).forEach(worklist::add);

        while (!worklist.isEmpty()) {
            String current = worklist.poll();
            if (!visited.add(current)) continue;

            for (InfraEdge edge : scm.incomingEdges(current)) {
                if (edge.isBlocking() || !isTrue(witness, edge.getSource())) continue;
                contributing.add(edge);
                worklist.add(edge.getSource());
            }
        }

        // Root-to-goal order: by the topological position of the step's target
        List<String> order = scmBuilder.topologicalOrder(scm);
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            position.put(order.get(i), i);
        }
        contributing.sort(Comparator
                .comparing((InfraEdge e) -> position.getOrDefault(e.getTarget(), Integer.MAX_VALUE))
                .thenComparing(InfraEdge::getSource));

        List<AttackPathStep> steps = new ArrayList<>();
        for (InfraEdge edge : contributing) {
            steps.add(AttackPathStep.builder()
                    .stepNumber(steps.size() + 1)
                    .sourceNode(edge.getSource())
                    .targetNode(edge.getTarget())
                    .edgeType(edge.getEdgeType().name())
                    .statement(statement(scm, edge))
                    .build());
        }
        return steps;
    }

    /**
     * Every node touched by the witness's attack path, goal variables included.
     */
    public Set<String> pathNodes(StructuralCausalModel scm, GoalPredicate goal, Map<String, Boolean> witness) {
        Set<String> nodes = new TreeSet<>();
        for (AttackPathStep step : trace(scm, goal, witness)) {
            nodes.add(step.getSourceNode());
            nodes.add(step.getTargetNode());
        }
        goal.variables().stream().filter(id -> isTrue(witness, id)).forEach(nodes::add);
        return nodes;
    }

    private String statement(StructuralCausalModel scm, InfraEdge edge) {
        String source = scm.nameOf(edge.getSource());
        String target = scm.nameOf(edge.getTarget());
        String via = edge.getEdgeType().name().toLowerCase();
        InfraNode targetNode = scm.findNode(edge.getTarget()).orElse(null);
        if (targetNode == null) {
            return "BECAUSE '" + source + "' enables '" + target + "'";
        }
        switch (targetNode.getType()) {
            case ASSET:
                return "BECAUSE '" + source + "' provides " + via
                        + (edge.getLabel() != null ? " via '" + edge.getLabel() + "'" : "")
                        + ", '" + target + "' is compromised";
            case PRIVILEGE:
                return "BECAUSE '" + source + "' has " + via + " to '" + target + "'";
            case CHANNEL:
                return "BECAUSE '" + source + "' enables network path to '" + target + "'";
            default:
                return "BECAUSE '" + source + "' enables '" + target + "' via " + via;
        }
    }

    private static boolean isTrue(Map<String, Boolean> witness, String id) {
        return Boolean.TRUE.equals(witness.get(id));
    }
}
