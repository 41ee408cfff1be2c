package com.architecture.memory.inevitability.model.graph;

public enum Criticality {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
