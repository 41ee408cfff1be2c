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
public class CollapseMetrics {
    private String controlId;
    private String controlName;

    // Goals blocked with the control enforced that become reachable once it is disabled
    private int collapseRadius;

    @Builder.Default
    private List<String> collapsedGoals = new ArrayList<>();

    private boolean singlePointOfFailure;
}
