package com.architecture.memory.inevitability.service.solver;

import lombok.Builder;
import lombok.Value;

/**
 * Per-call solver configuration. Passed explicitly into every solve; the configured
 * default instance is only a starting point for callers.
 */
@Value
@Builder(toBuilder = true)
public class SolverOptions {

    public static final long DEFAULT_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_ENUMERATION_LIMIT = 4096;

    @Builder.Default
    long timeoutMs = DEFAULT_TIMEOUT_MS;

    @Builder.Default
    boolean trackUnsatCore = true;

    // Upper bound on enumerated models (and on exogenous configurations counted exactly)
    @Builder.Default
    int enumerationLimit = DEFAULT_ENUMERATION_LIMIT;

    public static SolverOptions defaults() {
        return SolverOptions.builder().build();
    }

    public SolverOptions withTimeout(long timeoutMs) {
        return toBuilder().timeoutMs(timeoutMs).build();
    }
}
