package com.edsim.triage;

import java.util.Arrays;

/**
 * Immutable outcome of triaging one patient.
 */
public final class TriageVerdict {

    public final TriageCategory category;
    public final int priority;
    public final int targetWaitMinutes;
    public final double score;
    public final String flowchart;
    public final double confidence;
    public final double estimatedConsultationMinutes;
    public final String system;
    private final double[] symptomValues;

    public TriageVerdict(TriageCategory category, int targetWaitMinutes, double score, String flowchart,
                         double confidence, double estimatedConsultationMinutes, double[] symptomValues,
                         String system) {
        this.category = category;
        this.priority = category.priority();
        this.targetWaitMinutes = targetWaitMinutes;
        this.score = score;
        this.flowchart = flowchart;
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
        this.estimatedConsultationMinutes = estimatedConsultationMinutes;
        this.symptomValues = symptomValues == null ? new double[0] : symptomValues.clone();
        this.system = system;
    }

    public double[] symptomValues() {
        return symptomValues.clone();
    }

    @Override
    public String toString() {
        return String.format("TriageVerdict{%s (P%d), target=%d min, score=%.2f, flowchart=%s, confidence=%.2f, inputs=%s, by=%s}",
            category, priority, targetWaitMinutes, score, flowchart, confidence, Arrays.toString(symptomValues), system);
    }
}
