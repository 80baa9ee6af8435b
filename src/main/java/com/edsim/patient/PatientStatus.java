package com.edsim.patient;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a patient in the department. Declaration order is journey order.
 */
public enum PatientStatus {
    ARRIVED,
    WAITING_TRIAGE,
    IN_TRIAGE,
    WAITING_CONSULTATION,
    IN_CONSULTATION,
    WAITING_ADMISSION,
    ADMITTED,
    DISCHARGED,
    LEFT_WITHOUT_BEING_SEEN;

    public boolean isWaiting() {
        return this == WAITING_TRIAGE || this == WAITING_CONSULTATION || this == WAITING_ADMISSION;
    }

    public boolean isTerminal() {
        return this == ADMITTED || this == DISCHARGED || this == LEFT_WITHOUT_BEING_SEEN;
    }

    public boolean canTransitionTo(PatientStatus next) {
        return successors().contains(next);
    }

    private Set<PatientStatus> successors() {
        return switch (this) {
            case ARRIVED -> EnumSet.of(WAITING_TRIAGE);
            case WAITING_TRIAGE -> EnumSet.of(IN_TRIAGE, LEFT_WITHOUT_BEING_SEEN);
            case IN_TRIAGE -> EnumSet.of(WAITING_CONSULTATION);
            case WAITING_CONSULTATION -> EnumSet.of(IN_CONSULTATION, LEFT_WITHOUT_BEING_SEEN);
            case IN_CONSULTATION -> EnumSet.of(WAITING_ADMISSION, DISCHARGED);
            case WAITING_ADMISSION -> EnumSet.of(ADMITTED, LEFT_WITHOUT_BEING_SEEN);
            case ADMITTED, DISCHARGED, LEFT_WITHOUT_BEING_SEEN -> EnumSet.noneOf(PatientStatus.class);
        };
    }
}
