package com.edsim.patient;

import com.edsim.fuzzy.SeverityTerm;
import com.edsim.triage.TriageCategory;
import com.edsim.triage.TriageVerdict;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Patient - one person moving through the department.
 *
 * Status only moves forward along the journey, apart from leaving without being
 * seen from a waiting state. The triage verdict can be assigned once.
 */
public final class Patient {

    private final String id;
    private final double arrivalTime;
    private final PatientRecord record;
    private final Map<PatientStatus, Double> statusTimes = new EnumMap<>(PatientStatus.class);
    private PatientStatus status = PatientStatus.ARRIVED;
    private TriageVerdict verdict;
    private Double consultationDuration;

    public Patient(String id, double arrivalTime, PatientRecord record) {
        this.id = id;
        this.arrivalTime = arrivalTime;
        this.record = record;
        statusTimes.put(PatientStatus.ARRIVED, arrivalTime);
    }

    public String id() {
        return id;
    }

    public double arrivalTime() {
        return arrivalTime;
    }

    public int age() {
        return record.age;
    }

    public String gender() {
        return record.gender;
    }

    public String complaint() {
        return record.complaint;
    }

    public Map<String, Double> vitals() {
        return record.vitals;
    }

    public List<String> history() {
        return record.history;
    }

    public Map<String, SeverityTerm> reportedSymptoms() {
        return record.reportedSymptoms;
    }

    public PatientStatus status() {
        return status;
    }

    public void transitionTo(PatientStatus next, double time) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                String.format("Patient %s cannot move from %s to %s", id, status, next));
        }
        status = next;
        statusTimes.put(next, time);
    }

    /** Time the patient entered {@code state}, or null if it never did. */
    public Double timeOf(PatientStatus state) {
        return statusTimes.get(state);
    }

    public Map<PatientStatus, Double> statusTimes() {
        return Collections.unmodifiableMap(statusTimes);
    }

    public TriageVerdict verdict() {
        return verdict;
    }

    public boolean isTriaged() {
        return verdict != null;
    }

    public TriageCategory category() {
        return verdict == null ? null : verdict.category;
    }

    public void assignVerdict(TriageVerdict newVerdict) {
        if (verdict != null) {
            throw new IllegalStateException("Patient " + id + " already has a triage verdict: " + verdict.category);
        }
        verdict = newVerdict;
    }

    public Double consultationDuration() {
        return consultationDuration;
    }

    public void recordConsultationDuration(double minutes) {
        consultationDuration = minutes;
    }

    public boolean isComplete() {
        return status.isTerminal();
    }

    /** Minutes between arrival and the start of triage, or null. */
    public Double triageWait() {
        return between(PatientStatus.ARRIVED, PatientStatus.IN_TRIAGE);
    }

    /** Minutes spent queued for a doctor and cubicle after triage, or null. */
    public Double consultationWait() {
        return between(PatientStatus.WAITING_CONSULTATION, PatientStatus.IN_CONSULTATION);
    }

    public Double departureTime() {
        if (!status.isTerminal()) {
            return null;
        }
        return statusTimes.get(status);
    }

    public Double timeInSystem() {
        Double departure = departureTime();
        return departure == null ? null : departure - arrivalTime;
    }

    /** Minutes spent in the current waiting state up to {@code now}. */
    public double waitingFor(double now) {
        Double since = statusTimes.get(status);
        return since == null ? 0.0 : now - since;
    }

    private Double between(PatientStatus from, PatientStatus to) {
        Double start = statusTimes.get(from);
        Double end = statusTimes.get(to);
        return start == null || end == null ? null : end - start;
    }

    @Override
    public String toString() {
        return String.format("Patient{%s, status=%s, category=%s, complaint='%s'}",
            id, status, category(), record.complaint);
    }
}
