package com.architecture.memory.inevitability.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Directed causal edge between two nodes of the infrastructure graph.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class InfraEdge {

    private String source;

    private String target;

    private EdgeType edgeType;

    private String label;

    @Builder.Default
    private EdgeConstraint constraint = EdgeConstraint.deterministic();

    public boolean isBlocking() {
        return edgeType != null && edgeType.isBlocking();
    }

    public static InfraEdge of(String source, String target, EdgeType edgeType) {
        return InfraEdge.builder().source(source).target(target).edgeType(edgeType).build();
    }

    public String describe() {
        return edgeType.name().toLowerCase() + ":" + source + "->" + target;
    }
}
