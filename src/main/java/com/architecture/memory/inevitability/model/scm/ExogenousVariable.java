package com.architecture.memory.inevitability.model.scm;

import com.architecture.memory.inevitability.model.graph.NodeType;
import lombok.Builder;
import lombok.Value;

/**
 * Root variable without incoming causal edges. A null default leaves the variable free.
 */
@Value
@Builder(toBuilder = true)
public class ExogenousVariable {
    String id;
    NodeType nodeType;
    Boolean defaultValue;

    public boolean isFree() {
        return defaultValue == null;
    }
}
