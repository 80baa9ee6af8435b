package com.edsim.triage.llm;

import com.edsim.patient.Patient;

/**
 * An outside triage system that returns category, priority and a wait-time string.
 */
public interface ExternalTriageClient {

    ExternalTriageAssessment assess(Patient patient) throws ExternalTriageException;
}
