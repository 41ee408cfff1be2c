package com.architecture.memory.inevitability.model.scm;

import lombok.Builder;
import lombok.Value;

/**
 * A modelling assumption the compiled SCM depends on. Deactivating an assumption and
 * recompiling yields the counterfactual model in which it does not hold.
 */
@Value
@Builder(toBuilder = true)
public class Assumption {

    public static final String CONTROL_STATE_PREFIX = "control-state:";
    public static final String MFA_PREFIX = "mfa:";
    public static final String EDGE_PREFIX = "edge:";

    String id;
    String name;
    String description;
    AssumptionCategory category;
    boolean active;

    // Node the assumption is about, null for edge assumptions
    String subjectId;

    /**
     * Identity of this assumption's current state. Interventions derived from an assumption
     * remember the fingerprint so cached results can be dropped once the assumption changes.
     */
    public String fingerprint() {
        return id + "@" + (active ? "on" : "off");
    }

    public boolean isControlState() {
        return id.startsWith(CONTROL_STATE_PREFIX);
    }

    public boolean isEdgeAssumption() {
        return id.startsWith(EDGE_PREFIX);
    }
}
