package com.architecture.memory.inevitability.model.scm;

import com.architecture.memory.inevitability.model.graph.InfraEdge;
import com.architecture.memory.inevitability.model.graph.InfraGraph;
import com.architecture.memory.inevitability.model.graph.InfraNode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.stream.Collectors;

/**
 * Compiled structural causal model. Read-only once built; interventions and assumption
 * toggles produce new instances that share the immutable node records.
 */
@Value
@Builder(toBuilder = true)
public class StructuralCausalModel {

    SortedMap<String, InfraNode> nodes;

    // Induced edges: incoming edges of intervened variables are removed
    List<InfraEdge> edges;

    SortedMap<String, StructuralEquation> equations;

    SortedMap<String, ExogenousVariable> exogenous;

    List<Assumption> assumptions;

    SortedMap<String, Boolean> appliedInterventions;

    // Graph the model was compiled from, kept for assumption toggling
    @JsonIgnore
    InfraGraph sourceGraph;

    @JsonIgnore
    String version;

    public boolean hasVariable(String id) {
        return nodes.containsKey(id);
    }

    public Optional<InfraNode> findNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean isExogenous(String id) {
        return exogenous.containsKey(id);
    }

    public Optional<StructuralEquation> equationFor(String id) {
        return Optional.ofNullable(equations.get(id));
    }

    public Optional<Assumption> findAssumption(String id) {
        return assumptions.stream()
                .filter(a -> a.getId().equals(id) || a.getName().equals(id))
                .findFirst();
    }

    @JsonIgnore
    public List<String> getVariables() {
        return List.copyOf(nodes.keySet());
    }

    @JsonIgnore
    public List<String> getControlIds() {
        return nodes.values().stream()
                .filter(InfraNode::isControl)
                .map(InfraNode::getId)
                .collect(Collectors.toList());
    }

    @JsonIgnore
    public List<String> getFreeExogenousIds() {
        return exogenous.values().stream()
                .filter(ExogenousVariable::isFree)
                .map(ExogenousVariable::getId)
                .collect(Collectors.toList());
    }

    public List<InfraEdge> incomingEdges(String id) {
        return edges.stream().filter(e -> e.getTarget().equals(id)).collect(Collectors.toList());
    }

    public List<InfraEdge> outgoingEdges(String id) {
        return edges.stream().filter(e -> e.getSource().equals(id)).collect(Collectors.toList());
    }

    public String nameOf(String id) {
        InfraNode node = nodes.get(id);
        return node != null ? node.getDisplayName() : id;
    }
}
