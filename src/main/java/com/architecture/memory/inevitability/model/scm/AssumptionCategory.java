package com.architecture.memory.inevitability.model.scm;

public enum AssumptionCategory {
    THREAT,   // taken from edge constraint assumption texts
    CONFIG,   // control states and identity MFA flags
    TRUST,
    BUSINESS
}
