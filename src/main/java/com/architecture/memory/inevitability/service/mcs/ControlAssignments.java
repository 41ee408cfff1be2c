package com.architecture.memory.inevitability.service.mcs;

import com.architecture.memory.inevitability.model.intervention.Intervention;
import com.architecture.memory.inevitability.model.intervention.InterventionSet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Intervention sets for MCS queries: the listed controls are enforced, every other
 * control is forced off.
 */
public final class ControlAssignments {

    private ControlAssignments() {
        // Utility class
    }

    public static InterventionSet enforcing(Collection<String> enforced, Collection<String> allControls) {
        List<Intervention> interventions = new ArrayList<>(allControls.size());
        for (String control : allControls) {
            interventions.add(Intervention.of(control, enforced.contains(control)));
        }
        return InterventionSet.of(interventions);
    }

    public static InterventionSet allEnforced(Collection<String> allControls) {
        return enforcing(allControls, allControls);
    }

    public static InterventionSet noneEnforced(Collection<String> allControls) {
        return enforcing(List.of(), allControls);
    }
}
