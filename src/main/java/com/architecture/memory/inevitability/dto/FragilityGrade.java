package com.architecture.memory.inevitability.dto;

public enum FragilityGrade {
    A, B, C, D, F;

    public static FragilityGrade of(double fragilityIndex) {
        if (fragilityIndex <= 0.10) return A;
        if (fragilityIndex <= 0.25) return B;
        if (fragilityIndex <= 0.45) return C;
        if (fragilityIndex <= 0.70) return D;
        return F;
    }
}
