package com.architecture.memory.inevitability.config;

import com.architecture.memory.inevitability.service.solver.SolverOptions;
import com.architecture.memory.inevitability.service.solver.backend.SatBackendFactory;
import com.architecture.memory.inevitability.service.solver.backend.z3.Z3SatBackendFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Solver backend and default per-call options.
 * Reads timeout and enumeration bounds from application.yml properties.
 */
@Configuration
@Slf4j
public class SolverConfig {

    @Value("${inevitability.solver.timeout-ms:30000}")
    private long timeoutMs;

    @Value("${inevitability.solver.track-unsat-core:true}")
    private boolean trackUnsatCore;

    @Value("${inevitability.solver.enumeration-limit:4096}")
    private int enumerationLimit;

    @Bean
    public SatBackendFactory satBackendFactory() {
        log.info("[Solver Config] Using Z3 satisfiability backend");
        return new Z3SatBackendFactory();
    }

    /**
     * Default options handed to callers that do not bring their own. Never mutated.
     */
    @Bean
    public SolverOptions solverOptions() {
        log.info("[Solver Config] Default timeout {} ms, enumeration limit {}", timeoutMs, enumerationLimit);
        return SolverOptions.builder()
                .timeoutMs(timeoutMs)
                .trackUnsatCore(trackUnsatCore)
                .enumerationLimit(enumerationLimit)
                .build();
    }
}
