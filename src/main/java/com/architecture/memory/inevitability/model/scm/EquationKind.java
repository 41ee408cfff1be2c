package com.architecture.memory.inevitability.model.scm;

public enum EquationKind {
    STRUCTURAL,
    CONSTANT
}
