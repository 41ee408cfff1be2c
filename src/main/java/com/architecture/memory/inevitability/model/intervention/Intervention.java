package com.architecture.memory.inevitability.model.intervention;

import lombok.Builder;
import lombok.Value;

/**
 * do(variable := value). Interventions derived from an assumption carry the assumption's
 * fingerprint at derivation time.
 */
@Value
@Builder
public class Intervention {

    String variable;

    boolean value;

    String sourceAssumptionId;

    String sourceAssumptionFingerprint;

    public static Intervention of(String variable, boolean value) {
        return Intervention.builder().variable(variable).value(value).build();
    }

    public boolean isDerivedFromAssumption() {
        return sourceAssumptionId != null;
    }

    public String canonical() {
        String base = variable + "=" + value;
        return isDerivedFromAssumption() ? base + "<" + sourceAssumptionFingerprint : base;
    }
}
