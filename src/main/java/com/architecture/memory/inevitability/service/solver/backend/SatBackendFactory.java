package com.architecture.memory.inevitability.service.solver.backend;

/**
 * Creates fresh backend instances. Every solver session owns the backend it was given.
 */
public interface SatBackendFactory {

    String name();

    SatBackend create();
}
