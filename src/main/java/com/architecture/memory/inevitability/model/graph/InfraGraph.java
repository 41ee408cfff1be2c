package com.architecture.memory.inevitability.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Typed node/edge collection produced by the ingestion layer and consumed by the SCM builder.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InfraGraph {

    // Identity of the modelled environment across revisions, optional
    private String id;

    @Builder.Default
    private List<InfraNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<InfraEdge> edges = new ArrayList<>();

    public Optional<InfraNode> findNode(String nodeId) {
        return nodes.stream().filter(n -> n.getId().equals(nodeId)).findFirst();
    }

    public List<InfraNode> getControls() {
        return nodes.stream().filter(InfraNode::isControl).collect(Collectors.toList());
    }

    public InfraGraph addNode(InfraNode node) {
        nodes.add(node);
        return this;
    }

    public InfraGraph addEdge(InfraEdge edge) {
        edges.add(edge);
        return this;
    }
}
