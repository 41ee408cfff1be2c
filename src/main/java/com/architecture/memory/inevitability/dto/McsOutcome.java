package com.architecture.memory.inevitability.dto;

public enum McsOutcome {
    FOUND,
    NONE_EXISTS,      // goal stays satisfiable with every control enforced
    GOAL_UNREACHABLE, // goal unsatisfiable even with every control off
    NO_CONTROLS
}
