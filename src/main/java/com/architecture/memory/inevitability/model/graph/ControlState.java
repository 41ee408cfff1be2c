package com.architecture.memory.inevitability.model.graph;

/**
 * Declared deployment state of a control. Only {@link #ACTIVE} counts as enforced.
 */
public enum ControlState {
    ACTIVE,
    INACTIVE,
    PARTIAL,
    UNKNOWN;

    public boolean isEnforced() {
        return this == ACTIVE;
    }
}
