package com.architecture.memory.inevitability.service.relevance;

import lombok.Builder;
import lombok.Value;

/**
 * Weights of the contribution score:
 * {@code mcsFrequency * w1 + satisfiabilityDelta * w2 + witnessTraversal * w3}.
 */
@Value
@Builder(toBuilder = true)
public class RelevanceWeights {

    @Builder.Default
    double mcsFrequency = 0.4;

    @Builder.Default
    double satisfiabilityDelta = 0.35;

    @Builder.Default
    double witnessTraversal = 0.25;

    public static RelevanceWeights defaults() {
        return RelevanceWeights.builder().build();
    }
}
