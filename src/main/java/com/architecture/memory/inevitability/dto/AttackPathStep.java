package com.architecture.memory.inevitability.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttackPathStep {
    private int stepNumber;
    private String sourceNode;
    private String targetNode;
    private String edgeType;
    private String statement;
}
