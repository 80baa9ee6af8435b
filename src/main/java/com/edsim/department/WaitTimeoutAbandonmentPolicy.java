package com.edsim.department;

import com.edsim.patient.Patient;
import com.edsim.patient.PatientStatus;
import com.edsim.triage.TriageCategory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Patients leave once they have waited longer than {@code maxWait} minutes for triage
 * or for a doctor. Exempt categories and patients waiting for a bed always stay.
 */
public final class WaitTimeoutAbandonmentPolicy implements AbandonmentPolicy {

    private final double maxWait;
    private final Set<TriageCategory> exempt;

    public WaitTimeoutAbandonmentPolicy(double maxWait, Set<TriageCategory> exempt) {
        this.maxWait = maxWait;
        this.exempt = exempt.isEmpty() ? EnumSet.noneOf(TriageCategory.class) : EnumSet.copyOf(exempt);
    }

    @Override
    public boolean shouldLeave(Patient patient, double now) {
        PatientStatus status = patient.status();
        if (status != PatientStatus.WAITING_TRIAGE && status != PatientStatus.WAITING_CONSULTATION) {
            return false;
        }
        TriageCategory category = patient.category();
        if (category != null && exempt.contains(category)) {
            return false;
        }
        return patient.waitingFor(now) > maxWait;
    }

    @Override
    public String toString() {
        return "WaitTimeoutAbandonmentPolicy{maxWait=" + maxWait + ", exempt=" + exempt + "}";
    }
}
