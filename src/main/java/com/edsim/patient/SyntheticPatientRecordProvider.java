package com.edsim.patient;

import com.edsim.kernel.SimulationRandom;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SyntheticPatientRecordProvider - draws plausible ED presentations.
 *
 * Ages come from a paediatric / adult / elderly mixture, complaints from a
 * weighted table of common presentations, and each vital sign is abnormal with
 * a fixed probability.
 */
public class SyntheticPatientRecordProvider implements PatientRecordProvider {

    private static final Map<String, Double> COMPLAINTS = new LinkedHashMap<>();
    private static final Map<String, Double> CONDITIONS = new LinkedHashMap<>();

    static {
        COMPLAINTS.put("chest pain", 0.15);
        COMPLAINTS.put("difficulty breathing", 0.12);
        COMPLAINTS.put("abdominal pain", 0.10);
        COMPLAINTS.put("head injury", 0.08);
        COMPLAINTS.put("fever", 0.08);
        COMPLAINTS.put("nausea and vomiting", 0.07);
        COMPLAINTS.put("back pain", 0.06);
        COMPLAINTS.put("wound laceration", 0.06);
        COMPLAINTS.put("dizziness", 0.05);
        COMPLAINTS.put("allergic reaction", 0.04);
        COMPLAINTS.put("anxiety", 0.04);
        COMPLAINTS.put("cold symptoms", 0.03);
        COMPLAINTS.put("skin rash", 0.03);
        COMPLAINTS.put("joint pain", 0.03);
        COMPLAINTS.put("feeling unwell", 0.06);

        CONDITIONS.put("diabetes", 0.174);
        CONDITIONS.put("hypertension", 0.261);
        CONDITIONS.put("heart disease", 0.116);
        CONDITIONS.put("asthma", 0.145);
        CONDITIONS.put("copd", 0.087);
        CONDITIONS.put("cancer", 0.058);
        CONDITIONS.put("kidney disease", 0.043);
        CONDITIONS.put("mental health", 0.116);
    }

    private static final double HISTORY_PROBABILITY = 0.40;
    private static final double MALE_PROBABILITY = 0.48;

    @Override
    public PatientRecord nextRecord(SimulationRandom random) {
        int age = sampleAge(random);
        String gender = random.bernoulli(MALE_PROBABILITY) ? "male" : "female";
        String complaint = weightedChoice(COMPLAINTS, random);
        return new PatientRecord(age, gender, complaint, sampleVitals(random), sampleHistory(random), null);
    }

    private int sampleAge(SimulationRandom random) {
        double band = random.uniform();
        double age;
        if (band < 0.15) {
            age = clamp(random.normal(5, 2), 0, 18);
        } else if (band < 0.65) {
            age = clamp(random.normal(35, 15), 18, 65);
        } else {
            age = clamp(random.normal(75, 8), 65, 100);
        }
        return (int) Math.round(age);
    }

    private Map<String, Double> sampleVitals(SimulationRandom random) {
        Map<String, Double> vitals = new LinkedHashMap<>();
        vitals.put("systolic_bp", (double) Math.round(vital(random, 120, 15, 0.25, 75, 200)));
        vitals.put("heart_rate", (double) Math.round(vital(random, 75, 12, 0.20, 35, 170)));
        vitals.put("respiratory_rate", (double) Math.round(vital(random, 16, 3, 0.15, 6, 40)));
        vitals.put("temperature", round1(vital(random, 36.8, 0.5, 0.30, 35.0, 41.0)));
        vitals.put("oxygen_saturation", (double) Math.round(vital(random, 98, 2, 0.10, 80, 100)));
        vitals.put("pain_score", (double) Math.round(clamp(random.normal(4, 2.5), 0, 10)));
        return vitals;
    }

    /**
     * Normal reading most of the time; an abnormal draw lands uniformly towards
     * either end of the physiological range.
     */
    private double vital(SimulationRandom random, double mean, double std, double abnormalProbability,
                         double low, double high) {
        if (!random.bernoulli(abnormalProbability)) {
            return clamp(random.normal(mean, std), low, high);
        }
        double reading = random.bernoulli(0.5)
            ? low + random.uniform() * (mean - 2 * std - low)
            : mean + 2 * std + random.uniform() * (high - mean - 2 * std);
        return clamp(reading, low, high);
    }

    private List<String> sampleHistory(SimulationRandom random) {
        List<String> history = new ArrayList<>();
        if (!random.bernoulli(HISTORY_PROBABILITY)) {
            return history;
        }
        history.add(weightedChoice(CONDITIONS, random));
        if (random.bernoulli(0.3)) {
            String second = weightedChoice(CONDITIONS, random);
            if (!history.contains(second)) {
                history.add(second);
            }
        }
        return history;
    }

    private static String weightedChoice(Map<String, Double> weights, SimulationRandom random) {
        double total = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        double draw = random.uniform() * total;
        String last = null;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            draw -= entry.getValue();
            last = entry.getKey();
            if (draw < 0) {
                return last;
            }
        }
        return last;
    }

    private static double clamp(double value, double low, double high) {
        return Math.max(low, Math.min(high, value));
    }

    private static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
