package com.architecture.memory.inevitability.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;

/**
 * Result of enumerating satisfying assignments projected onto a set of variables.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelCount {

    private long count;

    // One full witness per distinct projected assignment
    @Builder.Default
    private List<SortedMap<String, Boolean>> witnesses = new ArrayList<>();

    // Enumeration ended because no further model exists
    private boolean complete;

    // Enumeration stopped at the model limit
    private boolean truncated;

    // Last check performed; TIMEOUT or UNKNOWN when enumeration was cut short by the solver
    private SolverResult lastResult;

    private long elapsedMs;

    public boolean isIndeterminate() {
        return !complete && !truncated;
    }
}
