package com.architecture.memory.inevitability.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Set of controls whose joint enforcement makes a goal unsatisfiable while no proper subset does.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MinimalCausalSet {

    private List<String> elements; // sorted control ids

    private int cardinality;

    private double totalCost;

    private boolean validated;

    public boolean contains(String controlId) {
        return elements.contains(controlId);
    }
}
