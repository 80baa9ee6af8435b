package com.edsim.department;

import com.edsim.config.SimulationParameters;
import com.edsim.kernel.SimulationRandom;
import com.edsim.patient.Patient;
import com.edsim.patient.PatientRecord;
import com.edsim.triage.TriageCategory;
import com.edsim.triage.TriageVerdict;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConsultationTimeModelTest {

    private final ConsultationTimeModel model = ConsultationTimeModel.from(
        SimulationParameters.withOverrides("categories.YELLOW.consultation-std = 0"));

    @ParameterizedTest
    @CsvSource({
        "40, sore throat,             false, 1.0",
        "1,  fever,                   false, 1.3",
        "80, fall,                    false, 1.2",
        "80, fall,                    true,  1.3",
        "50, central chest pain,      false, 1.2",
        "1,  head injury after fall,  true,  1.6"
    })
    void complexityMultiplier(int age, String complaint, boolean history, double expected) {
        PatientRecord record = PatientRecord.of(age, complaint);
        if (history) {
            record = record.withHistory(List.of("asthma"));
        }

        assertThat(model.complexityMultiplier(new Patient("P1", 0.0, record))).isCloseTo(expected, within(1e-9));
    }

    @Test
    void triageEstimateReplacesCategoryMean() {
        Patient estimated = yellow(PatientRecord.of(40, "sore throat"), 32.0);
        Patient unestimated = yellow(PatientRecord.of(40, "sore throat"), 0.0);

        assertThat(model.sample(estimated, new SimulationRandom(1L))).isEqualTo(32.0);
        assertThat(model.sample(unestimated, new SimulationRandom(1L))).isEqualTo(25.0);
    }

    @Test
    void durationIsFlooredAtMinimum() {
        Patient patient = yellow(PatientRecord.of(40, "sore throat"), 1.0);

        assertThat(model.sample(patient, new SimulationRandom(1L))).isEqualTo(5.0);
    }

    private static Patient yellow(PatientRecord record, double estimate) {
        Patient patient = new Patient("P1", 0.0, record);
        patient.assignVerdict(new TriageVerdict(TriageCategory.YELLOW, 60, 3.0, "test", 1.0, estimate, null, "test"));
        return patient;
    }
}
