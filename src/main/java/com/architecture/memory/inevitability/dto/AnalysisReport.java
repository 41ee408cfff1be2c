package com.architecture.memory.inevitability.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything computed for one analysis request over a compiled SCM.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisReport {

    private String scmVersion;

    @Builder.Default
    private List<GoalAnalysis> goals = new ArrayList<>();

    private CollapseReport collapse;

    // Controls irrelevant to every analysed goal
    @Builder.Default
    private List<String> universalTheater = new ArrayList<>();

    private long elapsedMs;
}
