package com.architecture.memory.inevitability.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SensitivityResult {
    private String variable;
    private boolean forcedValue;
    private double baselineScore;
    private double interventionScore;
    private double delta;
}
