package com.architecture.memory.inevitability.model.scm;

import com.architecture.memory.inevitability.model.graph.ConstraintType;
import com.architecture.memory.inevitability.model.graph.EdgeType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Confidence and assumption metadata copied from an incoming edge onto a structural equation.
 */
@Value
@Builder
public class EdgeAnnotation {
    String source;
    EdgeType edgeType;
    ConstraintType constraintType;
    double confidence;
    List<String> preconditions;
    List<String> assumptions;
    boolean inferred;
}
