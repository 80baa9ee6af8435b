package com.edsim.triage;

import com.edsim.fuzzy.SeverityTerm;
import com.edsim.patient.Patient;
import com.edsim.patient.PatientRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.edsim.triage.VitalSignSeverityPolicy.Family;
import static org.assertj.core.api.Assertions.assertThat;

class VitalSignSeverityPolicyTest {

    private final VitalSignSeverityPolicy policy = new VitalSignSeverityPolicy();

    @Test
    void reportedSeverityWinsOverVitals() {
        Patient patient = patient(PatientRecord.of(40, "chest pain")
            .withVitals(Map.of(VitalSignSeverityPolicy.PAIN_SCORE, 10.0))
            .withReportedSymptoms(Map.of("severe_pain", SeverityTerm.MILD)));

        assertThat(policy.severityOf("severe_pain", patient)).isEqualTo(SeverityTerm.MILD);
        assertThat(policy.severityOf("crushing_sensation", patient)).isEqualTo(SeverityTerm.VERY_SEVERE);
    }

    @Test
    void classifiesSymptomsIntoFamilies() {
        assertThat(VitalSignSeverityPolicy.familyOf("pain_intensity")).isEqualTo(Family.PAIN);
        assertThat(VitalSignSeverityPolicy.familyOf("tenderness")).isEqualTo(Family.PAIN);
        assertThat(VitalSignSeverityPolicy.familyOf("difficulty_breathing")).isEqualTo(Family.BREATHING);
        assertThat(VitalSignSeverityPolicy.familyOf("wheeze")).isEqualTo(Family.BREATHING);
        assertThat(VitalSignSeverityPolicy.familyOf("fever")).isEqualTo(Family.FEVER);
        assertThat(VitalSignSeverityPolicy.familyOf("irregular_pulse")).isEqualTo(Family.CIRCULATION);
        assertThat(VitalSignSeverityPolicy.familyOf("response_to_pain")).isEqualTo(Family.CONSCIOUSNESS);
        assertThat(VitalSignSeverityPolicy.familyOf("swelling")).isEqualTo(Family.OTHER);
    }

    @Test
    void gradesVitalSigns() {
        assertThat(VitalSignSeverityPolicy.painSeverity(2.0)).isEqualTo(SeverityTerm.MILD);
        assertThat(VitalSignSeverityPolicy.painSeverity(7.0)).isEqualTo(SeverityTerm.SEVERE);
        assertThat(VitalSignSeverityPolicy.saturationSeverity(88.0)).isEqualTo(SeverityTerm.SEVERE);
        assertThat(VitalSignSeverityPolicy.saturationSeverity(98.0)).isEqualTo(SeverityTerm.NONE);
        assertThat(VitalSignSeverityPolicy.respiratoryRateSeverity(36.0)).isEqualTo(SeverityTerm.VERY_SEVERE);
        assertThat(VitalSignSeverityPolicy.temperatureSeverity(38.4)).isEqualTo(SeverityTerm.MODERATE);
        assertThat(VitalSignSeverityPolicy.temperatureSeverity(34.0)).isEqualTo(SeverityTerm.VERY_SEVERE);
        assertThat(VitalSignSeverityPolicy.heartRateSeverity(130.0)).isEqualTo(SeverityTerm.SEVERE);
        assertThat(VitalSignSeverityPolicy.bloodPressureSeverity(75.0)).isEqualTo(SeverityTerm.VERY_SEVERE);
        assertThat(VitalSignSeverityPolicy.consciousnessSeverity(7.0)).isEqualTo(SeverityTerm.VERY_SEVERE);
    }

    @Test
    void missingVitalsGradeAsNone() {
        Patient patient = patient(PatientRecord.of(30, "shortness of breath"));

        assertThat(policy.severityOf("difficulty_breathing", patient)).isEqualTo(SeverityTerm.NONE);
        assertThat(policy.severityOf("fever", patient)).isEqualTo(SeverityTerm.NONE);
        assertThat(policy.severityOf("swelling", patient)).isEqualTo(SeverityTerm.NONE);
    }

    @Test
    void worstOfTwoVitalsGradesTheFamily() {
        Patient patient = patient(PatientRecord.of(70, "palpitations")
            .withVitals(Map.of(VitalSignSeverityPolicy.HEART_RATE, 105.0, VitalSignSeverityPolicy.SYSTOLIC_BP, 85.0)));

        assertThat(policy.severityOf("irregular_pulse", patient)).isEqualTo(SeverityTerm.SEVERE);
    }

    @Test
    void assessesEveryFlowchartSymptomInOrder() {
        Flowchart chart = new Flowchart("test", "general", List.of("pain", "fever", "swelling"), List.of("test"));
        Patient patient = patient(PatientRecord.of(30, "test")
            .withVitals(Map.of(VitalSignSeverityPolicy.PAIN_SCORE, 5.0, VitalSignSeverityPolicy.TEMPERATURE, 39.5)));

        assertThat(policy.assess(chart, patient))
            .containsExactly(SeverityTerm.MODERATE, SeverityTerm.SEVERE, SeverityTerm.NONE);
    }

    private static Patient patient(PatientRecord record) {
        return new Patient("P000001", 0.0, record);
    }
}
