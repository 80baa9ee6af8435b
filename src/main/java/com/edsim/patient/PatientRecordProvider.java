package com.edsim.patient;

import com.edsim.kernel.SimulationRandom;

/**
 * Source of clinical records for new arrivals.
 */
@FunctionalInterface
public interface PatientRecordProvider {

    PatientRecord nextRecord(SimulationRandom random);
}
