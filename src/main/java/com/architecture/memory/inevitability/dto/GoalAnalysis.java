package com.architecture.memory.inevitability.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GoalAnalysis {
    private String goalId;
    private InevitabilityResult inevitability;
    private McsResult mcs;
    private RelevanceReport relevance;
}
