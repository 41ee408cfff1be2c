package com.architecture.memory.inevitability.service.solver.backend.z3;

import com.architecture.memory.inevitability.service.solver.backend.SatBackend;
import com.architecture.memory.inevitability.service.solver.backend.SatBackendFactory;

public class Z3SatBackendFactory implements SatBackendFactory {

    @Override
    public String name() {
        return Z3SatBackend.NAME;
    }

    @Override
    public SatBackend create() {
        return new Z3SatBackend();
    }
}
