package com.architecture.memory.inevitability.service.mcs;

import com.architecture.memory.inevitability.dto.McsAlgorithm;
import lombok.Builder;
import lombok.Value;

/**
 * Search and validation bounds for MCS extraction.
 */
@Value
@Builder(toBuilder = true)
public class McsPolicy {

    @Builder.Default
    McsAlgorithm algorithm = McsAlgorithm.EXACT;

    // Largest candidate size the exact search will try
    @Builder.Default
    int maxCardinality = 5;

    // Exact search stops once this many sets are recorded
    @Builder.Default
    int maxResults = 100;

    // Sets up to this size are checked against every proper subset, larger ones leave-one-out
    @Builder.Default
    int exhaustiveValidationLimit = 10;

    @Builder.Default
    boolean strictValidation = false;

    // Number of candidate chunks evaluated concurrently per cardinality
    @Builder.Default
    int parallelism = 4;

    public static McsPolicy defaults() {
        return McsPolicy.builder().build();
    }

    public static McsPolicy greedy() {
        return McsPolicy.builder().algorithm(McsAlgorithm.GREEDY).build();
    }

    public String canonical() {
        return algorithm + "|k=" + maxCardinality + "|n=" + maxResults + "|v=" + exhaustiveValidationLimit
                + "|strict=" + strictValidation;
    }
}
