package com.edsim.triage;

import com.edsim.patient.Patient;

/**
 * Assigns a triage verdict to a patient. Called once per patient, with no simulated delay.
 */
public interface TriageService {

    TriageVerdict assess(Patient patient);

    String name();
}
