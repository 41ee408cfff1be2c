package com.architecture.memory.inevitability.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class McsValidationFailure {

    public enum Kind {
        INSUFFICIENT,  // enforcing all elements leaves the goal satisfiable
        REDUNDANT,     // some proper subset already blocks the goal
        INDETERMINATE  // a validation query timed out or returned unknown
    }

    private String goalId;
    private List<String> elements;
    private Kind kind;
    private List<String> offendingSubset;
    private String reason;
}
