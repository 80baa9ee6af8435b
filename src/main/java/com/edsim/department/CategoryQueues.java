package com.edsim.department;

import com.edsim.patient.Patient;
import com.edsim.triage.TriageCategory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

/**
 * One FIFO queue per triage category for patients waiting to see a doctor.
 * Dispatch order is most urgent non-empty queue first, then arrival order.
 *
 * The arbiter grants doctor and cubicle in (priority, request order), which is
 * the same order; {@link PatientJourney} checks that every grant goes to {@link #peekNext()}.
 */
public final class CategoryQueues {

    private final Map<TriageCategory, Deque<Patient>> queues = new EnumMap<>(TriageCategory.class);

    public CategoryQueues() {
        for (TriageCategory category : TriageCategory.values()) {
            queues.put(category, new ArrayDeque<>());
        }
    }

    public void enqueue(Patient patient) {
        TriageCategory category = patient.category();
        if (category == null) {
            throw new IllegalStateException("Patient " + patient.id() + " cannot queue before triage");
        }
        if (contains(patient)) {
            throw new IllegalStateException("Patient " + patient.id() + " is already queued");
        }
        queues.get(category).addLast(patient);
    }

    public boolean remove(Patient patient) {
        TriageCategory category = patient.category();
        return category != null && queues.get(category).remove(patient);
    }

    public boolean contains(Patient patient) {
        TriageCategory category = patient.category();
        return category != null && queues.get(category).contains(patient);
    }

    /** Head of the most urgent non-empty queue, or null. */
    public Patient peekNext() {
        for (TriageCategory category : TriageCategory.values()) {
            Patient head = queues.get(category).peekFirst();
            if (head != null) {
                return head;
            }
        }
        return null;
    }

    public int size(TriageCategory category) {
        return queues.get(category).size();
    }

    public int total() {
        int total = 0;
        for (Deque<Patient> queue : queues.values()) {
            total += queue.size();
        }
        return total;
    }

    public Map<TriageCategory, Integer> lengths() {
        Map<TriageCategory, Integer> lengths = new EnumMap<>(TriageCategory.class);
        queues.forEach((category, queue) -> lengths.put(category, queue.size()));
        return lengths;
    }
}
