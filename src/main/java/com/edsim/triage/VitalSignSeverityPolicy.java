package com.edsim.triage;

import com.edsim.fuzzy.SeverityTerm;
import com.edsim.patient.Patient;

import java.util.Map;
import java.util.Set;

/**
 * VitalSignSeverityPolicy - default mapping from a patient's record to symptom severities.
 *
 * A severity the patient reported for the exact symptom always wins. Otherwise
 * the symptom is matched to a family (pain, breathing, fever, circulation,
 * consciousness) and graded from the vital sign that family depends on.
 * Symptoms outside every family, and families whose vitals are missing, are
 * graded {@code none}.
 */
public class VitalSignSeverityPolicy implements SymptomSeverityPolicy {

    public static final String PAIN_SCORE = "pain_score";
    public static final String OXYGEN_SATURATION = "oxygen_saturation";
    public static final String RESPIRATORY_RATE = "respiratory_rate";
    public static final String TEMPERATURE = "temperature";
    public static final String HEART_RATE = "heart_rate";
    public static final String SYSTOLIC_BP = "systolic_bp";
    public static final String CONSCIOUSNESS_LEVEL = "consciousness_level";

    enum Family { PAIN, BREATHING, FEVER, CIRCULATION, CONSCIOUSNESS, OTHER }

    private static final Set<String> PAIN_SYMPTOMS = Set.of(
        "tenderness", "crushing_sensation", "cramping", "rigidity", "radiation", "chest_discomfort");
    private static final Set<String> BREATHING_SYMPTOMS = Set.of(
        "wheeze", "cyanosis", "unable_to_speak", "speech_difficulty", "stridor", "low_sao2",
        "accessory_muscles", "respiratory_depression", "very_low_pefr", "peak_flow", "airway_compromise",
        "airway_involvement", "exhaustion");
    private static final Set<String> CIRCULATION_SYMPTOMS = Set.of(
        "irregular_pulse", "no_pulse", "shock", "pallor", "cardiac_effects", "syncope", "sweating");
    private static final Set<String> CONSCIOUSNESS_SYMPTOMS = Set.of(
        "confusion", "disorientation", "gcs_score", "response_to_pain", "unconscious", "collapse",
        "lethargy", "post_ictal", "altered_consciousness", "loss_of_consciousness", "consciousness");

    @Override
    public SeverityTerm severityOf(String symptom, Patient patient) {
        SeverityTerm reported = patient.reportedSymptoms().get(symptom);
        if (reported != null) {
            return reported;
        }
        Map<String, Double> vitals = patient.vitals();
        return switch (familyOf(symptom)) {
            case PAIN -> painSeverity(vitals.get(PAIN_SCORE));
            case BREATHING -> worst(
                saturationSeverity(vitals.get(OXYGEN_SATURATION)),
                respiratoryRateSeverity(vitals.get(RESPIRATORY_RATE)));
            case FEVER -> temperatureSeverity(vitals.get(TEMPERATURE));
            case CIRCULATION -> worst(
                heartRateSeverity(vitals.get(HEART_RATE)),
                bloodPressureSeverity(vitals.get(SYSTOLIC_BP)));
            case CONSCIOUSNESS -> consciousnessSeverity(vitals.get(CONSCIOUSNESS_LEVEL));
            case OTHER -> SeverityTerm.NONE;
        };
    }

    static Family familyOf(String symptom) {
        if (CONSCIOUSNESS_SYMPTOMS.contains(symptom)) {
            return Family.CONSCIOUSNESS;
        }
        if (CIRCULATION_SYMPTOMS.contains(symptom) || symptom.contains("pulse") || symptom.contains("palpitation")) {
            return Family.CIRCULATION;
        }
        if (BREATHING_SYMPTOMS.contains(symptom) || symptom.contains("breath")) {
            return Family.BREATHING;
        }
        if (PAIN_SYMPTOMS.contains(symptom) || symptom.contains("pain")) {
            return Family.PAIN;
        }
        if (symptom.equals("fever") || symptom.equals("temperature")) {
            return Family.FEVER;
        }
        return Family.OTHER;
    }

    static SeverityTerm painSeverity(Double score) {
        if (score == null || score <= 1) {
            return SeverityTerm.NONE;
        }
        if (score <= 3) {
            return SeverityTerm.MILD;
        }
        if (score <= 6) {
            return SeverityTerm.MODERATE;
        }
        return score <= 8 ? SeverityTerm.SEVERE : SeverityTerm.VERY_SEVERE;
    }

    static SeverityTerm saturationSeverity(Double saturation) {
        if (saturation == null || saturation >= 94) {
            return SeverityTerm.NONE;
        }
        if (saturation < 85) {
            return SeverityTerm.VERY_SEVERE;
        }
        return saturation < 90 ? SeverityTerm.SEVERE : SeverityTerm.MODERATE;
    }

    static SeverityTerm respiratoryRateSeverity(Double rate) {
        if (rate == null) {
            return SeverityTerm.NONE;
        }
        if (rate <= 8 || rate >= 35) {
            return SeverityTerm.VERY_SEVERE;
        }
        if (rate >= 30) {
            return SeverityTerm.SEVERE;
        }
        if (rate >= 25) {
            return SeverityTerm.MODERATE;
        }
        return rate >= 21 ? SeverityTerm.MILD : SeverityTerm.NONE;
    }

    static SeverityTerm temperatureSeverity(Double temperature) {
        if (temperature == null) {
            return SeverityTerm.NONE;
        }
        if (temperature >= 40 || temperature < 35) {
            return SeverityTerm.VERY_SEVERE;
        }
        if (temperature >= 39) {
            return SeverityTerm.SEVERE;
        }
        if (temperature >= 38) {
            return SeverityTerm.MODERATE;
        }
        return temperature >= 37.5 ? SeverityTerm.MILD : SeverityTerm.NONE;
    }

    static SeverityTerm heartRateSeverity(Double rate) {
        if (rate == null) {
            return SeverityTerm.NONE;
        }
        if (rate > 150 || rate < 40) {
            return SeverityTerm.VERY_SEVERE;
        }
        if (rate > 120) {
            return SeverityTerm.SEVERE;
        }
        return rate > 100 ? SeverityTerm.MODERATE : SeverityTerm.NONE;
    }

    static SeverityTerm bloodPressureSeverity(Double systolic) {
        if (systolic == null) {
            return SeverityTerm.NONE;
        }
        if (systolic < 80) {
            return SeverityTerm.VERY_SEVERE;
        }
        if (systolic < 90) {
            return SeverityTerm.SEVERE;
        }
        return systolic > 180 ? SeverityTerm.MODERATE : SeverityTerm.NONE;
    }

    static SeverityTerm consciousnessSeverity(Double gcs) {
        if (gcs == null || gcs >= 15) {
            return SeverityTerm.NONE;
        }
        if (gcs <= 8) {
            return SeverityTerm.VERY_SEVERE;
        }
        return gcs <= 12 ? SeverityTerm.SEVERE : SeverityTerm.MODERATE;
    }

    private static SeverityTerm worst(SeverityTerm a, SeverityTerm b) {
        return a.isAtLeast(b) ? a : b;
    }
}
