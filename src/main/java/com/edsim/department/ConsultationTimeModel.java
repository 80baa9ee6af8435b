package com.edsim.department;

import com.edsim.config.SimulationParameters;
import com.edsim.config.SimulationParameters.CategorySettings;
import com.edsim.kernel.SimulationRandom;
import com.edsim.patient.Patient;
import com.edsim.triage.TriageCategory;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Samples how long a doctor spends with a triaged patient.
 *
 * normal(estimate, category std) scaled by a complexity multiplier for very
 * young or old patients, any medical history and high-acuity complaints, then
 * floored at the configured minimum.
 */
public class ConsultationTimeModel {

    static final List<String> HIGH_ACUITY_COMPLAINTS = List.of(
        "chest pain", "difficulty breathing", "abdominal pain", "head injury");

    private final Map<TriageCategory, CategorySettings> categories;
    private final double minimumDuration;

    public ConsultationTimeModel(Map<TriageCategory, CategorySettings> categories, double minimumDuration) {
        this.categories = new EnumMap<>(categories);
        this.minimumDuration = minimumDuration;
    }

    public static ConsultationTimeModel from(SimulationParameters parameters) {
        return new ConsultationTimeModel(parameters.categories, parameters.minimumConsultation);
    }

    public double complexityMultiplier(Patient patient) {
        double multiplier = 1.0;
        if (patient.age() < 2) {
            multiplier += 0.3;
        } else if (patient.age() > 75) {
            multiplier += 0.2;
        }
        if (!patient.history().isEmpty()) {
            multiplier += 0.1;
        }
        String complaint = patient.complaint().toLowerCase(Locale.ROOT);
        for (String keyword : HIGH_ACUITY_COMPLAINTS) {
            if (complaint.contains(keyword)) {
                multiplier += 0.2;
                break;
            }
        }
        return multiplier;
    }

    public double sample(Patient patient, SimulationRandom random) {
        TriageCategory category = patient.category();
        if (category == null) {
            throw new IllegalStateException("Patient " + patient.id() + " has not been triaged");
        }
        CategorySettings settings = categories.get(category);
        double estimate = patient.verdict().estimatedConsultationMinutes;
        double mean = estimate > 0 ? estimate : settings.consultationMean;
        double raw = random.normal(mean, settings.consultationStd) * complexityMultiplier(patient);
        return Math.max(minimumDuration, raw);
    }
}
