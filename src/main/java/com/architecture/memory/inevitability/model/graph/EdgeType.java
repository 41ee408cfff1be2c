package com.architecture.memory.inevitability.model.graph;

/**
 * Kinds of causal influence between nodes. {@link #CONTROL} edges block their target,
 * every other type enables it.
 */
public enum EdgeType {
    ACCESS,
    PRIVILEGE,
    ESCALATION,
    LATERAL,
    CONTROL,
    TRUST,
    DEPENDENCY;

    public boolean isBlocking() {
        return this == CONTROL;
    }

    public static EdgeType fromString(String value) {
        if (value == null) return null;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
