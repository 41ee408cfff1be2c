package com.architecture.memory.inevitability.model.graph;

/**
 * Kinds of nodes in an infrastructure causal graph.
 */
public enum NodeType {
    ASSET("asset"),
    IDENTITY("identity"),
    PRIVILEGE("privilege"),
    CONTROL("control"),
    CHANNEL("channel"),
    TRUST_BOUNDARY("trust_boundary");

    private final String value;

    NodeType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Get the enum value from a string, case-insensitive.
     */
    public static NodeType fromString(String value) {
        if (value == null) return null;
        try {
            return valueOf(value.trim().toUpperCase().replace(" ", "_"));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
