package com.architecture.memory.inevitability.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelevanceReport {

    private String goalId;

    @Builder.Default
    private List<ControlClassification> classifications = new ArrayList<>();

    private int criticalCount;
    private int necessaryCount;
    private int partialCount;
    private int irrelevantCount;

    // Annual cost of the controls classified IRRELEVANT
    private double wastedSpend;

    // Share of total control spend that is wasted
    private double wasteRatio;

    public Optional<ControlClassification> find(String controlId) {
        return classifications.stream().filter(c -> c.getControlId().equals(controlId)).findFirst();
    }
}
