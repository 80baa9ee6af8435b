package com.edsim.patient;

import com.edsim.triage.TriageCategory;
import com.edsim.triage.TriageVerdict;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatientTest {

    @Test
    void followsTheJourneyAndRecordsTimes() {
        Patient patient = new Patient("P000001", 10.0, PatientRecord.of(40, "headache"));

        patient.transitionTo(PatientStatus.WAITING_TRIAGE, 10.0);
        patient.transitionTo(PatientStatus.IN_TRIAGE, 12.0);
        patient.transitionTo(PatientStatus.WAITING_CONSULTATION, 17.0);
        patient.transitionTo(PatientStatus.IN_CONSULTATION, 47.0);
        patient.transitionTo(PatientStatus.DISCHARGED, 70.0);

        assertThat(patient.triageWait()).isEqualTo(2.0);
        assertThat(patient.consultationWait()).isEqualTo(30.0);
        assertThat(patient.departureTime()).isEqualTo(70.0);
        assertThat(patient.timeInSystem()).isEqualTo(60.0);
        assertThat(patient.isComplete()).isTrue();
    }

    @Test
    void rejectsSkippedOrBackwardTransitions() {
        Patient patient = new Patient("P000002", 0.0, PatientRecord.of(40, "headache"));

        assertThatThrownBy(() -> patient.transitionTo(PatientStatus.IN_CONSULTATION, 1.0))
            .isInstanceOf(IllegalStateException.class);

        patient.transitionTo(PatientStatus.WAITING_TRIAGE, 0.0);
        patient.transitionTo(PatientStatus.IN_TRIAGE, 1.0);
        assertThatThrownBy(() -> patient.transitionTo(PatientStatus.WAITING_TRIAGE, 2.0))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> patient.transitionTo(PatientStatus.LEFT_WITHOUT_BEING_SEEN, 2.0))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void canLeaveFromAnyWaitingState() {
        for (PatientStatus status : PatientStatus.values()) {
            assertThat(status.canTransitionTo(PatientStatus.LEFT_WITHOUT_BEING_SEEN))
                .as(status.name())
                .isEqualTo(status.isWaiting());
        }
    }

    @Test
    void terminalStatesHaveNoSuccessors() {
        for (PatientStatus terminal : new PatientStatus[]{
                PatientStatus.ADMITTED, PatientStatus.DISCHARGED, PatientStatus.LEFT_WITHOUT_BEING_SEEN}) {
            assertThat(terminal.isTerminal()).isTrue();
            for (PatientStatus next : PatientStatus.values()) {
                assertThat(terminal.canTransitionTo(next)).isFalse();
            }
        }
    }

    @Test
    void verdictCanOnlyBeAssignedOnce() {
        Patient patient = new Patient("P000003", 0.0, PatientRecord.of(40, "headache"));
        TriageVerdict verdict = new TriageVerdict(TriageCategory.GREEN, 120, 4.0, "headache", 1.0, 20.0,
            new double[]{5}, "test");

        patient.assignVerdict(verdict);

        assertThat(patient.category()).isEqualTo(TriageCategory.GREEN);
        assertThatThrownBy(() -> patient.assignVerdict(verdict))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("P000003");
    }

    @Test
    void openJourneyHasNoDeparture() {
        Patient patient = new Patient("P000004", 5.0, PatientRecord.of(40, "headache"));
        patient.transitionTo(PatientStatus.WAITING_TRIAGE, 5.0);

        assertThat(patient.departureTime()).isNull();
        assertThat(patient.timeInSystem()).isNull();
        assertThat(patient.consultationWait()).isNull();
        assertThat(patient.waitingFor(25.0)).isEqualTo(20.0);
    }

    @Test
    void recordDefaultsMissingData() {
        PatientRecord record = new PatientRecord(30, "female", null, null, null, null);

        assertThat(record.complaint).isEmpty();
        assertThat(record.vitals).isEmpty();
        assertThat(record.history).isEmpty();
        assertThat(record.reportedSymptoms).isEmpty();
    }
}
