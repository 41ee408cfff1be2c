package com.architecture.memory.inevitability.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Constraint record attached to an edge. Copied onto the structural equation of the
 * edge's target for assumption-sensitivity queries.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EdgeConstraint {

    @Builder.Default
    private ConstraintType type = ConstraintType.DETERMINISTIC;

    @Builder.Default
    private double confidence = 1.0;

    @Builder.Default
    private List<String> preconditions = new ArrayList<>();

    // Free-text assumptions this edge relies on, e.g. "vpn_credentials_phishable"
    @Builder.Default
    private List<String> assumptions = new ArrayList<>();

    private boolean inferred;

    public static EdgeConstraint deterministic() {
        return EdgeConstraint.builder().build();
    }
}
