package com.architecture.memory.inevitability.service.scm;

import com.architecture.memory.inevitability.exception.GraphInconsistencyException;
import com.architecture.memory.inevitability.model.graph.ControlState;
import com.architecture.memory.inevitability.model.graph.EdgeConstraint;
import com.architecture.memory.inevitability.model.graph.InfraEdge;
import com.architecture.memory.inevitability.model.graph.InfraGraph;
import com.architecture.memory.inevitability.model.graph.InfraNode;
import com.architecture.memory.inevitability.model.graph.NodeType;
import com.architecture.memory.inevitability.model.scm.Assumption;
import com.architecture.memory.inevitability.model.scm.AssumptionCategory;
import com.architecture.memory.inevitability.model.scm.EdgeAnnotation;
import com.architecture.memory.inevitability.model.scm.EquationKind;
import com.architecture.memory.inevitability.model.scm.ExogenousVariable;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;
import com.architecture.memory.inevitability.model.scm.StructuralEquation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Compiles an infrastructure graph into a Structural Causal Model.
 *
 * Pipeline:
 * 1. Validate node ids and edge endpoints
 * 2. Extract assumptions (edge assumptions, control states, identity MFA flags)
 * 3. Verify the enabling subgraph is acyclic
 * 4. Synthesize one structural equation per node with incoming edges
 * 5. Record exogenous defaults for root nodes
 * 6. Stamp the canonical version
 *
 * The builder performs no solving and is deterministic: equal graphs (and equal assumption
 * states) always produce byte-identical canonical serializations.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScmBuilder {

    private static final Comparator<InfraEdge> EDGE_ORDER = Comparator
            .comparing(InfraEdge::getTarget)
            .thenComparing(InfraEdge::getSource)
            .thenComparing(InfraEdge::getEdgeType);

    private final AcyclicityChecker acyclicityChecker;
    private final ScmCanonicalizer canonicalizer;

    public StructuralCausalModel build(InfraGraph graph) {
        return build(graph, Map.of());
    }

    /**
     * Compile the graph with explicit assumption states. Assumptions absent from the map
     * are active.
     *
     * @param assumptionStates assumption id to active flag
     */
    public StructuralCausalModel build(InfraGraph graph, Map<String, Boolean> assumptionStates) {
        SortedMap<String, InfraNode> nodes = validateNodes(graph);
        List<InfraEdge> allEdges = validateEdges(graph, nodes);

        // Cycles are a property of the source graph, independent of assumption toggles
        List<String> order = acyclicityChecker.topologicalOrder(nodes.keySet(), allEdges);
        log.debug("Topological order of {} nodes computed", order.size());

        List<Assumption> assumptions = extractAssumptions(allEdges, nodes, assumptionStates);
        Set<String> inactiveEdgeAssumptions = assumptions.stream()
                .filter(a -> a.isEdgeAssumption() && !a.isActive())
                .map(Assumption::getName)
                .collect(Collectors.toSet());

        List<InfraEdge> activeEdges = allEdges.stream()
                .filter(e -> isActive(e, inactiveEdgeAssumptions))
                .sorted(EDGE_ORDER)
                .collect(Collectors.toList());

        SortedMap<String, InfraNode> compiledNodes = applyConfigAssumptions(nodes, assumptions);
        SortedMap<String, StructuralEquation> equations = generateEquations(allEdges, inactiveEdgeAssumptions);
        SortedMap<String, ExogenousVariable> exogenous = computeExogenous(compiledNodes, equations);

        StructuralCausalModel scm = StructuralCausalModel.builder()
                .nodes(Collections.unmodifiableSortedMap(compiledNodes))
                .edges(List.copyOf(activeEdges))
                .equations(Collections.unmodifiableSortedMap(equations))
                .exogenous(Collections.unmodifiableSortedMap(exogenous))
                .assumptions(List.copyOf(assumptions))
                .appliedInterventions(Collections.unmodifiableSortedMap(new TreeMap<>()))
                .sourceGraph(graph)
                .build();

        StructuralCausalModel stamped = canonicalizer.stamp(scm);
        log.info("Compiled SCM {} with {} variables, {} equations, {} exogenous, {} assumptions",
                stamped.getVersion(), compiledNodes.size(), equations.size(), exogenous.size(), assumptions.size());
        return stamped;
    }

    // ========================= VALIDATION =========================

    private SortedMap<String, InfraNode> validateNodes(InfraGraph graph) {
        SortedMap<String, InfraNode> nodes = new TreeMap<>();
        for (InfraNode node : graph.getNodes()) {
            if (node.getId() == null || node.getId().isBlank()) {
                throw new GraphInconsistencyException("Node without id: " + node.getName());
            }
            if (node.getType() == null) {
                throw new GraphInconsistencyException("Node " + node.getId() + " has no type");
            }
            // A second node with the same id would give the variable two structural equations
            if (nodes.put(node.getId(), node.toBuilder().build()) != null) {
                throw new GraphInconsistencyException("Duplicate node id (duplicate equation target): " + node.getId());
            }
        }
        return nodes;
    }

    private List<InfraEdge> validateEdges(InfraGraph graph, Map<String, InfraNode> nodes) {
        List<InfraEdge> edges = new ArrayList<>();
        for (int i = 0; i < graph.getEdges().size(); i++) {
            InfraEdge edge = graph.getEdges().get(i);
            if (!nodes.containsKey(edge.getSource())) {
                throw new GraphInconsistencyException(
                        "Edge " + i + ": source '" + edge.getSource() + "' does not match any node id");
            }
            if (!nodes.containsKey(edge.getTarget())) {
                throw new GraphInconsistencyException(
                        "Edge " + i + ": target '" + edge.getTarget() + "' does not match any node id");
            }
            if (edge.getEdgeType() == null) {
                throw new GraphInconsistencyException("Edge " + i + " (" + edge.getSource() + " -> "
                        + edge.getTarget() + ") has no edge type");
            }
            if (edge.getConstraint() != null) {
                double confidence = edge.getConstraint().getConfidence();
                if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
                    throw new GraphInconsistencyException("Edge " + i + " (" + edge.getSource() + " -> "
                            + edge.getTarget() + ") has confidence " + confidence + " outside [0, 1]");
                }
            }
            InfraEdge copy = edge.toBuilder()
                    .constraint(edge.getConstraint() != null
                            ? edge.getConstraint().toBuilder()
                                .preconditions(sortedCopy(edge.getConstraint().getPreconditions()))
                                .assumptions(sortedCopy(edge.getConstraint().getAssumptions()))
                                .build()
                            : EdgeConstraint.deterministic())
                    .build();
            edges.add(copy);
        }
        return edges;
    }

    private static List<String> sortedCopy(List<String> values) {
        if (values == null) return List.of();
        return values.stream().sorted().distinct().collect(Collectors.toList());
    }

    // ========================= ASSUMPTIONS =========================

    private List<Assumption> extractAssumptions(List<InfraEdge> edges, Map<String, InfraNode> nodes,
                                                Map<String, Boolean> states) {
        List<Assumption> assumptions = new ArrayList<>();

        // Edge assumptions, one per distinct text
        SortedMap<String, List<String>> edgesByAssumption = new TreeMap<>();
        for (InfraEdge edge : edges) {
            for (String text : edge.getConstraint().getAssumptions()) {
                edgesByAssumption.computeIfAbsent(text, k -> new ArrayList<>()).add(edge.describe());
            }
        }
        edgesByAssumption.forEach((text, edgeDescriptions) -> {
            String id = Assumption.EDGE_PREFIX + text;
            assumptions.add(Assumption.builder()
                    .id(id)
                    .name(text)
                    .description("Assumed by " + String.join(", ", new TreeSet<>(edgeDescriptions)))
                    .category(AssumptionCategory.THREAT)
                    .active(states.getOrDefault(id, true))
                    .build());
        });

        for (InfraNode node : nodes.values()) {
            if (node.getType() == NodeType.CONTROL && node.getControlState() != null) {
                String id = Assumption.CONTROL_STATE_PREFIX + node.getId();
                assumptions.add(Assumption.builder()
                        .id(id)
                        .name(node.getDisplayName() + "_is_" + node.getControlState().name().toLowerCase())
                        .description("Control " + node.getDisplayName() + " state assumption")
                        .category(AssumptionCategory.CONFIG)
                        .active(states.getOrDefault(id, true))
                        .subjectId(node.getId())
                        .build());
            }
            if (node.getType() == NodeType.IDENTITY && node.getMfaEnabled() != null) {
                String id = Assumption.MFA_PREFIX + node.getId();
                assumptions.add(Assumption.builder()
                        .id(id)
                        .name(node.getDisplayName() + (node.getMfaEnabled() ? "_mfa_enabled" : "_mfa_disabled"))
                        .description("MFA status for " + node.getDisplayName())
                        .category(AssumptionCategory.CONFIG)
                        .active(states.getOrDefault(id, true))
                        .subjectId(node.getId())
                        .build());
            }
        }

        assumptions.sort(Comparator.comparing(Assumption::getId));
        return assumptions;
    }

    /**
     * Inactive config assumptions mean the declared attribute does not hold: the control's
     * enforcement flips, the identity's MFA flag flips.
     */
    private SortedMap<String, InfraNode> applyConfigAssumptions(SortedMap<String, InfraNode> nodes,
                                                                List<Assumption> assumptions) {
        SortedMap<String, InfraNode> result = new TreeMap<>(nodes);
        for (Assumption assumption : assumptions) {
            if (assumption.isActive() || assumption.getSubjectId() == null) continue;
            InfraNode node = result.get(assumption.getSubjectId());
            if (assumption.isControlState()) {
                ControlState flipped = node.getControlState().isEnforced() ? ControlState.INACTIVE : ControlState.ACTIVE;
                result.put(node.getId(), node.toBuilder().controlState(flipped).build());
            } else if (node.getMfaEnabled() != null) {
                result.put(node.getId(), node.toBuilder().mfaEnabled(!node.getMfaEnabled()).build());
            }
        }
        return result;
    }

    // ========================= STRUCTURAL EQUATIONS =========================

    /**
     * For each node with incoming edges:
     * - CONTROL edges contribute blocking parents (negated)
     * - every other edge type contributes enabling parents (disjunction)
     * - enabling edges switched off by an inactive assumption are recorded as severed
     */
    private SortedMap<String, StructuralEquation> generateEquations(List<InfraEdge> edges,
                                                                    Set<String> inactiveEdgeAssumptions) {
        Map<String, List<InfraEdge>> incoming = new TreeMap<>();
        for (InfraEdge edge : edges) {
            incoming.computeIfAbsent(edge.getTarget(), k -> new ArrayList<>()).add(edge);
        }

        SortedMap<String, StructuralEquation> equations = new TreeMap<>();
        for (Map.Entry<String, List<InfraEdge>> entry : incoming.entrySet()) {
            String target = entry.getKey();
            SortedSet<String> enabling = new TreeSet<>();
            SortedSet<String> blocking = new TreeSet<>();
            SortedSet<String> severed = new TreeSet<>();
            List<EdgeAnnotation> annotations = new ArrayList<>();

            List<InfraEdge> sorted = new ArrayList<>(entry.getValue());
            sorted.sort(EDGE_ORDER);
            for (InfraEdge edge : sorted) {
                if (!isActive(edge, inactiveEdgeAssumptions)) {
                    if (!edge.isBlocking()) {
                        severed.add(edge.getSource());
                    }
                    continue;
                }
                if (edge.isBlocking()) {
                    blocking.add(edge.getSource());
                } else {
                    enabling.add(edge.getSource());
                }
                annotations.add(EdgeAnnotation.builder()
                        .source(edge.getSource())
                        .edgeType(edge.getEdgeType())
                        .constraintType(edge.getConstraint().getType())
                        .confidence(edge.getConstraint().getConfidence())
                        .preconditions(List.copyOf(edge.getConstraint().getPreconditions()))
                        .assumptions(List.copyOf(edge.getConstraint().getAssumptions()))
                        .inferred(edge.getConstraint().isInferred())
                        .build());
            }
            severed.removeAll(enabling);

            equations.put(target, StructuralEquation.builder()
                    .target(target)
                    .kind(EquationKind.STRUCTURAL)
                    .enablingParents(List.copyOf(enabling))
                    .blockingParents(List.copyOf(blocking))
                    .severedParents(List.copyOf(severed))
                    .annotations(List.copyOf(annotations))
                    .build());
        }
        return equations;
    }

    private static boolean isActive(InfraEdge edge, Set<String> inactiveEdgeAssumptions) {
        return edge.getConstraint().getAssumptions().stream().noneMatch(inactiveEdgeAssumptions::contains);
    }

    // ========================= EXOGENOUS DEFAULTS =========================

    /**
     * Root defaults:
     * - controls take their declared state (only ACTIVE is enforced)
     * - identities are present (the attacker exists in the threat model)
     * - all other roots are left free
     */
    private SortedMap<String, ExogenousVariable> computeExogenous(Map<String, InfraNode> nodes,
                                                                  Map<String, StructuralEquation> equations) {
        SortedMap<String, ExogenousVariable> exogenous = new TreeMap<>();
        for (InfraNode node : nodes.values()) {
            if (equations.containsKey(node.getId())) continue;
            Boolean defaultValue = switch (node.getType()) {
                case CONTROL -> node.getControlState() != null && node.getControlState().isEnforced();
                case IDENTITY -> Boolean.TRUE;
                default -> null;
            };
            exogenous.put(node.getId(), ExogenousVariable.builder()
                    .id(node.getId())
                    .nodeType(node.getType())
                    .defaultValue(defaultValue)
                    .build());
        }
        return exogenous;
    }

    // ========================= UTILITY =========================

    /**
     * Node ids in topological order over the model's enabling edges.
     */
    public List<String> topologicalOrder(StructuralCausalModel scm) {
        return acyclicityChecker.topologicalOrder(scm.getNodes().keySet(), scm.getEdges());
    }

    /**
     * All ancestors of the given node over every induced edge, the node included.
     * Explicit worklist, so deep graphs cannot overflow the stack.
     */
    public Set<String> backwardSlice(StructuralCausalModel scm, String nodeId) {
        Map<String, List<String>> parents = new HashMap<>();
        for (InfraEdge edge : scm.getEdges()) {
            parents.computeIfAbsent(edge.getTarget(), k -> new ArrayList<>()).add(edge.getSource());
        }

        Set<String> slice = new TreeSet<>();
        Deque<String> worklist = new ArrayDeque<>();
        worklist.add(nodeId);
        while (!worklist.isEmpty()) {
            String current = worklist.poll();
            if (!slice.add(current)) continue;
            worklist.addAll(parents.getOrDefault(current, List.of()));
        }
        return slice;
    }

    public Set<String> backwardSlice(StructuralCausalModel scm, Collection<String> nodeIds) {
        Set<String> slice = new TreeSet<>();
        nodeIds.forEach(id -> slice.addAll(backwardSlice(scm, id)));
        return slice;
    }
}
