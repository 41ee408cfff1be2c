package com.architecture.memory.inevitability.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.SortedMap;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CounterfactualResult {
    private String goalId;
    private SortedMap<String, Boolean> interventions;
    private double before;
    private double after;
    private double delta;
    private ChangeDirection direction;
    private boolean crossedThreshold;
    private String explanation;
}
