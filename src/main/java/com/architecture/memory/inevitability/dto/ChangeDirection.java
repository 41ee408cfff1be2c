package com.architecture.memory.inevitability.dto;

public enum ChangeDirection {
    INCREASED,
    DECREASED,
    UNCHANGED;

    public static ChangeDirection of(double delta) {
        if (Math.abs(delta) < 1e-9) return UNCHANGED;
        return delta > 0 ? INCREASED : DECREASED;
    }
}
