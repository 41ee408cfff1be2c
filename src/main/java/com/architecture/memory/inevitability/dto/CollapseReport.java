package com.architecture.memory.inevitability.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollapseReport {

    @Builder.Default
    private List<CollapseMetrics> ranking = new ArrayList<>();

    private double fragilityIndex;

    private FragilityGrade grade;

    private int singlePointsOfFailure;

    private int highCollapseControls;

    private double meanMcsCardinality;
}
