package com.architecture.memory.inevitability.config;

import com.architecture.memory.inevitability.dto.McsAlgorithm;
import com.architecture.memory.inevitability.service.mcs.McsPolicy;
import com.architecture.memory.inevitability.service.relevance.RelevanceWeights;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalysisPolicyConfig {

    @Value("${inevitability.mcs.algorithm:exact}")
    private String algorithm;

    @Value("${inevitability.mcs.max-cardinality:5}")
    private int maxCardinality;

    @Value("${inevitability.mcs.max-results:100}")
    private int maxResults;

    @Value("${inevitability.mcs.exhaustive-validation-limit:10}")
    private int exhaustiveValidationLimit;

    @Value("${inevitability.mcs.strict-validation:false}")
    private boolean strictValidation;

    @Value("${inevitability.workers.pool-size:4}")
    private int parallelism;

    @Value("${inevitability.relevance.weights.mcs-frequency:0.4}")
    private double mcsFrequencyWeight;

    @Value("${inevitability.relevance.weights.satisfiability-delta:0.35}")
    private double satisfiabilityDeltaWeight;

    @Value("${inevitability.relevance.weights.witness-traversal:0.25}")
    private double witnessTraversalWeight;

    @Bean
    public McsPolicy mcsPolicy() {
        return McsPolicy.builder()
                .algorithm(McsAlgorithm.fromString(algorithm))
                .maxCardinality(maxCardinality)
                .maxResults(maxResults)
                .exhaustiveValidationLimit(exhaustiveValidationLimit)
                .strictValidation(strictValidation)
                .parallelism(parallelism)
                .build();
    }

    @Bean
    public RelevanceWeights relevanceWeights() {
        return RelevanceWeights.builder()
                .mcsFrequency(mcsFrequencyWeight)
                .satisfiabilityDelta(satisfiabilityDeltaWeight)
                .witnessTraversal(witnessTraversalWeight)
                .build();
    }
}
