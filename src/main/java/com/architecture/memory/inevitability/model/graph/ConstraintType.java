package com.architecture.memory.inevitability.model.graph;

public enum ConstraintType {
    DETERMINISTIC,
    CONDITIONAL,
    INFERRED
}
