package com.edsim.triage.llm;

import com.edsim.config.SimulationParameters;
import com.edsim.patient.Patient;
import com.edsim.patient.PatientRecord;
import com.edsim.triage.TriageCategory;
import com.edsim.triage.TriageService;
import com.edsim.triage.TriageVerdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExternalTriageServiceTest {

    @Mock
    private ExternalTriageClient client;

    @Mock
    private TriageService fallback;

    private ExternalTriageService service;
    private Patient patient;

    @BeforeEach
    void setUp() {
        service = new ExternalTriageService(client, fallback, SimulationParameters.load().categories);
        patient = new Patient("P000001", 0.0, PatientRecord.of(50, "chest pain"));
    }

    @Test
    void usesTheExternalVerdict() throws Exception {
        when(client.assess(patient)).thenReturn(
            new ExternalTriageAssessment(TriageCategory.ORANGE, 2, "10 min", 0.9, "possible ACS"));

        TriageVerdict verdict = service.assess(patient);

        assertThat(verdict.category).isEqualTo(TriageCategory.ORANGE);
        assertThat(verdict.priority).isEqualTo(2);
        assertThat(verdict.targetWaitMinutes).isEqualTo(10);
        assertThat(verdict.confidence).isEqualTo(0.9);
        assertThat(verdict.estimatedConsultationMinutes).isEqualTo(35.0);
        assertThat(verdict.flowchart).isEqualTo(ExternalTriageService.FLOWCHART);
        assertThat(verdict.system).isEqualTo("external-llm");
        assertThat(service.fallbackCount()).isZero();
        verify(fallback, never()).assess(any());
    }

    @Test
    void unreadableWaitFallsBackToTheConfiguredTarget() throws Exception {
        when(client.assess(patient)).thenReturn(
            new ExternalTriageAssessment(TriageCategory.GREEN, 4, "when convenient", 0.6, null));

        assertThat(service.assess(patient).targetWaitMinutes).isEqualTo(120);
    }

    @Test
    void fallsBackWhenTheClientFails() throws Exception {
        TriageVerdict fallbackVerdict = new TriageVerdict(
            TriageCategory.YELLOW, 60, 3.0, "chest_pain", 1.0, 25.0, new double[]{5, 5, 5}, "fuzzy-manchester");
        when(client.assess(patient)).thenThrow(new ExternalTriageException("connection refused"));
        when(fallback.name()).thenReturn("fuzzy-manchester");
        when(fallback.assess(patient)).thenReturn(fallbackVerdict);

        TriageVerdict verdict = service.assess(patient);

        assertThat(verdict).isSameAs(fallbackVerdict);
        assertThat(service.fallbackCount()).isEqualTo(1);
        assertThat(service.statistics().processed()).isZero();
    }

    @ParameterizedTest
    @CsvSource({
        "Immediate, 0",
        "now, 0",
        "10 min, 10",
        "within 30 minutes, 30",
        "1-2 hours, 60",
        "2 hrs, 120",
        "1.5 hours, 90",
        "60, 60"
    })
    void parsesWaitTimes(String text, int minutes) {
        assertThat(ExternalTriageService.parseWaitMinutes(text)).isEqualTo(minutes);
    }

    @Test
    void unparseableWaitTimesAreNull() {
        assertThat(ExternalTriageService.parseWaitMinutes(null)).isNull();
        assertThat(ExternalTriageService.parseWaitMinutes("  ")).isNull();
        assertThat(ExternalTriageService.parseWaitMinutes("soon")).isNull();
    }
}
