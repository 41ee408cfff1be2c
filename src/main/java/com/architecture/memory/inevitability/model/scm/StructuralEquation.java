package com.architecture.memory.inevitability.model.scm;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Structural equation of an endogenous variable:
 * {@code target = (OR enabling) AND NOT (OR blocking)}. A target with blocking parents only
 * reduces to {@code NOT (OR blocking)} unless its enabling edges were severed.
 * Interventions replace the equation with a constant.
 */
@Value
@Builder(toBuilder = true)
public class StructuralEquation {

    String target;

    EquationKind kind;

    // Sorted parent ids
    List<String> enablingParents;
    List<String> blockingParents;

    // Enabling parents whose edge was removed by an inactive assumption. Keeps the target
    // endogenous: with no enabling parent left it can no longer be reached.
    @Builder.Default
    List<String> severedParents = List.of();

    // Only set for CONSTANT equations
    Boolean constantValue;

    List<EdgeAnnotation> annotations;

    public boolean isConstant() {
        return kind == EquationKind.CONSTANT;
    }

    public static StructuralEquation constant(String target, boolean value) {
        return StructuralEquation.builder()
                .target(target)
                .kind(EquationKind.CONSTANT)
                .enablingParents(List.of())
                .blockingParents(List.of())
                .severedParents(List.of())
                .constantValue(value)
                .annotations(List.of())
                .build();
    }

    public String describe() {
        if (isConstant()) {
            return target + " := " + constantValue;
        }
        String enabling = enablingParents.isEmpty() ? "" : "(" + String.join(" | ", enablingParents) + ")";
        String blocking = blockingParents.isEmpty() ? "" : "!(" + String.join(" | ", blockingParents) + ")";
        String joiner = !enabling.isEmpty() && !blocking.isEmpty() ? " & " : "";
        return target + " = " + enabling + joiner + blocking;
    }
}
