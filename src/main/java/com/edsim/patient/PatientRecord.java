package com.edsim.patient;

import com.edsim.fuzzy.SeverityTerm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Clinical data for one arrival, as handed over by a {@link PatientRecordProvider}.
 * Vitals, history and reported severities are optional and default to empty.
 */
public final class PatientRecord {

    public final int age;
    public final String gender;
    public final String complaint;
    public final Map<String, Double> vitals;
    public final List<String> history;
    public final Map<String, SeverityTerm> reportedSymptoms;

    public PatientRecord(int age, String gender, String complaint, Map<String, Double> vitals,
                         List<String> history, Map<String, SeverityTerm> reportedSymptoms) {
        this.age = age;
        this.gender = gender;
        this.complaint = complaint == null ? "" : complaint;
        this.vitals = vitals == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(vitals));
        this.history = history == null ? List.of() : List.copyOf(history);
        this.reportedSymptoms = reportedSymptoms == null
            ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(reportedSymptoms));
    }

    public static PatientRecord of(int age, String complaint) {
        return new PatientRecord(age, "unknown", complaint, null, null, null);
    }

    public PatientRecord withReportedSymptoms(Map<String, SeverityTerm> symptoms) {
        return new PatientRecord(age, gender, complaint, vitals, history, symptoms);
    }

    public PatientRecord withVitals(Map<String, Double> newVitals) {
        return new PatientRecord(age, gender, complaint, newVitals, history, reportedSymptoms);
    }

    public PatientRecord withHistory(List<String> newHistory) {
        return new PatientRecord(age, gender, complaint, vitals, newHistory, reportedSymptoms);
    }

    @Override
    public String toString() {
        return String.format("PatientRecord{age=%d, gender='%s', complaint='%s', vitals=%s, history=%s}",
            age, gender, complaint, vitals, history);
    }
}
