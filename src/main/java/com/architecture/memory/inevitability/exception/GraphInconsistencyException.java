package com.architecture.memory.inevitability.exception;

import java.util.List;

/**
 * The input graph cannot be compiled into an SCM: a non-control cycle, a duplicate
 * equation target or an edge pointing at an unknown node. Never repaired silently.
 */
public class GraphInconsistencyException extends CausalAnalysisException {

    private final List<String> cycle;

    public GraphInconsistencyException(String message) {
        super(message);
        this.cycle = List.of();
    }

    public GraphInconsistencyException(String message, List<String> cycle) {
        super(message);
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Offending cycle with the first node repeated at the end, empty for other inconsistencies.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
