package com.edsim.department;

import com.edsim.config.SimulationParameters.AbandonmentSettings;
import com.edsim.patient.Patient;

/**
 * Decides whether a waiting patient gives up and leaves without being seen.
 */
@FunctionalInterface
public interface AbandonmentPolicy {

    AbandonmentPolicy NEVER = (patient, now) -> false;

    boolean shouldLeave(Patient patient, double now);

    static AbandonmentPolicy from(AbandonmentSettings settings) {
        if (!settings.isEnabled()) {
            return NEVER;
        }
        return new WaitTimeoutAbandonmentPolicy(settings.maxWait, settings.exemptCategories);
    }
}
