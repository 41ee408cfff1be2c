package com.architecture.memory.inevitability.dto;

public enum McsAlgorithm {
    EXACT,
    GREEDY;

    public static McsAlgorithm fromString(String value) {
        if (value == null) return GREEDY;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return GREEDY;
        }
    }
}
