package com.architecture.memory.inevitability.dto;

public enum DefenseClassification {
    CRITICAL,   // member of every MCS
    NECESSARY,  // member of some MCS
    PARTIAL,    // in no MCS but changes satisfiability in some configuration
    IRRELEVANT  // never changes satisfiability: security theater
}
