package com.architecture.memory.inevitability.dto;

public enum InevitabilityVerdict {
    INEVITABLE,
    AT_RISK,
    DEFENDED
}
