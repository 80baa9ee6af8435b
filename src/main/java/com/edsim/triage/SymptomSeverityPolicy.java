package com.edsim.triage;

import com.edsim.fuzzy.SeverityTerm;
import com.edsim.patient.Patient;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides how severe each flowchart symptom is for a patient.
 */
public interface SymptomSeverityPolicy {

    SeverityTerm severityOf(String symptom, Patient patient);

    default List<SeverityTerm> assess(Flowchart flowchart, Patient patient) {
        List<SeverityTerm> severities = new ArrayList<>();
        for (String symptom : flowchart.symptoms) {
            SeverityTerm term = severityOf(symptom, patient);
            severities.add(term == null ? SeverityTerm.NONE : term);
        }
        return severities;
    }
}
