package com.architecture.memory.inevitability.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

/**
 * A typed node of the infrastructure graph as delivered by the ingestion layer.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class InfraNode {

    private String id;

    private NodeType type;

    private String name;

    private String description;

    @Builder.Default
    private Map<String, String> properties = new TreeMap<>();

    // Control-specific fields
    private ControlState controlState;
    private Double annualCost;
    private String controlType;

    // Identity-specific fields
    private Boolean mfaEnabled;

    // Asset-specific fields
    private Criticality criticality;

    // Business-immutable nodes cannot be the target of an intervention
    private boolean businessImmutable;

    public boolean isControl() {
        return type == NodeType.CONTROL;
    }

    public String getDisplayName() {
        return name != null && !name.isBlank() ? name : id;
    }

    public static InfraNode of(String id, NodeType type) {
        return InfraNode.builder().id(id).type(type).name(id).build();
    }

    public static InfraNode control(String id, ControlState state) {
        return InfraNode.builder().id(id).type(NodeType.CONTROL).name(id).controlState(state).build();
    }

    public static InfraNode control(String id, ControlState state, double annualCost) {
        return InfraNode.builder().id(id).type(NodeType.CONTROL).name(id)
                .controlState(state).annualCost(annualCost).build();
    }
}
