package com.edsim.department;

import com.edsim.config.SimulationParameters;
import com.edsim.patient.Patient;
import com.edsim.triage.TriageCategory;
import com.edsim.triage.TriageService;
import com.edsim.triage.TriageVerdict;

import java.util.function.Function;

/**
 * Triage stub: the category comes from a function of the patient, the target wait from the parameters.
 */
class FixedTriageService implements TriageService {

    private final SimulationParameters parameters;
    private final Function<Patient, TriageCategory> categoryOf;

    FixedTriageService(SimulationParameters parameters, Function<Patient, TriageCategory> categoryOf) {
        this.parameters = parameters;
        this.categoryOf = categoryOf;
    }

    static FixedTriageService always(SimulationParameters parameters, TriageCategory category) {
        return new FixedTriageService(parameters, patient -> category);
    }

    @Override
    public TriageVerdict assess(Patient patient) {
        TriageCategory category = categoryOf.apply(patient);
        return new TriageVerdict(category, parameters.category(category).targetWait, category.priority(),
            "test", 1.0, 0.0, null, name());
    }

    @Override
    public String name() {
        return "fixed";
    }
}
