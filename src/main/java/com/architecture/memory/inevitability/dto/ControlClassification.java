package com.architecture.memory.inevitability.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ControlClassification {
    private String controlId;
    private String controlName;
    private String controlType;
    private DefenseClassification classification;
    private double contributionScore;
    private int mcsMembershipCount;
    private double annualCost;
    private String reason;
    private String recommendation;
    private RelevanceEvidence evidence;
}
