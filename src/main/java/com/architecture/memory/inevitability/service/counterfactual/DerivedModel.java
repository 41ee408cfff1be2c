package com.architecture.memory.inevitability.service.counterfactual;

import com.architecture.memory.inevitability.model.intervention.Intervention;
import com.architecture.memory.inevitability.model.intervention.InterventionSet;
import com.architecture.memory.inevitability.model.scm.Assumption;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;

import java.util.Optional;

/**
 * Cached result of applying an intervention set to a model.
 */
record DerivedModel(StructuralCausalModel model, InterventionSet interventions) {

    /**
     * True when one of the interventions was derived from an assumption whose state in the
     * given model differs from the state recorded at derivation time.
     */
    boolean isStaleAgainst(StructuralCausalModel current) {
        for (Intervention intervention : interventions.interventions()) {
            if (!intervention.isDerivedFromAssumption()) continue;
            Optional<String> fingerprint = current.findAssumption(intervention.getSourceAssumptionId())
                    .map(Assumption::fingerprint);
            if (fingerprint.isPresent() && !fingerprint.get().equals(intervention.getSourceAssumptionFingerprint())) {
                return true;
            }
        }
        return false;
    }
}
