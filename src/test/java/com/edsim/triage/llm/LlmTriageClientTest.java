package com.edsim.triage.llm;

import com.edsim.config.ConfigurationException;
import com.edsim.config.SimulationParameters;
import com.edsim.patient.Patient;
import com.edsim.patient.PatientRecord;
import com.edsim.triage.FuzzyTriageService;
import com.edsim.triage.TriageCategory;
import com.edsim.triage.TriageVerdict;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmTriageClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private LlmTriageClient client;
    private Patient patient;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        LlmTriageSettings settings = new LlmTriageSettings(
            server.url("/").toString(), "test-model", 5, 0.1, 200);
        client = new LlmTriageClient(settings, new OkHttpClient());
        patient = new Patient("P000001", 0.0, PatientRecord.of(71, "shortness of breath")
            .withVitals(Map.of("oxygen_saturation", 86.0)));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void postsAGenerateRequestAndParsesTheVerdict() throws Exception {
        server.enqueue(envelope("{\"triage_category\": \"orange\", \"priority_score\": 2, "
            + "\"wait_time\": \"10 min\", \"confidence\": 0.85, \"reasoning\": \"hypoxic\"}"));

        ExternalTriageAssessment assessment = client.assess(patient);

        assertThat(assessment.category).isEqualTo(TriageCategory.ORANGE);
        assertThat(assessment.priority).isEqualTo(2);
        assertThat(assessment.waitTime).isEqualTo("10 min");
        assertThat(assessment.confidence).isEqualTo(0.85);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/generate");
        JsonNode payload = mapper.readTree(request.getBody().readUtf8());
        assertThat(payload.path("model").asText()).isEqualTo("test-model");
        assertThat(payload.path("stream").asBoolean()).isFalse();
        assertThat(payload.path("format").asText()).isEqualTo("json");
        assertThat(payload.path("options").path("num_predict").asInt()).isEqualTo(200);
        assertThat(payload.path("prompt").asText()).contains("shortness of breath", "Age: 71");
    }

    @Test
    void toleratesTextAroundTheJsonAndMissingConfidence() throws Exception {
        server.enqueue(envelope("Here is my answer: {\"triage_category\": \"GREEN\", \"wait_time\": \"2 hours\"} done"));

        ExternalTriageAssessment assessment = client.assess(patient);

        assertThat(assessment.category).isEqualTo(TriageCategory.GREEN);
        assertThat(assessment.priority).isEqualTo(4);
        assertThat(assessment.confidence).isEqualTo(0.5);
    }

    @Test
    void httpErrorsBecomeTriageExceptions() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("model not loaded"));

        assertThatThrownBy(() -> client.assess(patient))
            .isInstanceOf(ExternalTriageException.class)
            .hasMessageContaining("HTTP 500");
    }

    @Test
    void emptyOrMalformedAnswersBecomeTriageExceptions() {
        server.enqueue(envelope(""));
        server.enqueue(envelope("I am not sure"));
        server.enqueue(envelope("{\"triage_category\": \"PURPLE\"}"));

        assertThatThrownBy(() -> client.assess(patient)).isInstanceOf(ExternalTriageException.class)
            .hasMessageContaining("empty");
        assertThatThrownBy(() -> client.assess(patient)).isInstanceOf(ExternalTriageException.class)
            .hasMessageContaining("No JSON");
        assertThatThrownBy(() -> client.assess(patient)).isInstanceOf(ExternalTriageException.class)
            .hasMessageContaining("Malformed");
    }

    @Test
    void trailingSlashIsStrippedFromTheBaseUrl() {
        LlmTriageSettings settings = new LlmTriageSettings("http://localhost:11434/", "m", 1, 0.0, 1);

        assertThat(settings.generateUrl().toString()).isEqualTo("http://localhost:11434/api/generate");
    }

    @Test
    void baseUrlWithoutSchemeIsAConfigurationError() {
        assertThatThrownBy(() -> new LlmTriageSettings("localhost:11434", "m", 1, 0.1, 10))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("OLLAMA_BASE_URL")
            .hasMessageContaining("localhost:11434");
    }

    @Test
    void basePathIsKept() {
        LlmTriageSettings settings = new LlmTriageSettings("https://gateway.example/ollama", "m", 1, 0.0, 1);

        assertThat(settings.generateUrl().toString()).isEqualTo("https://gateway.example/ollama/api/generate");
    }

    @Test
    void rejectedRequestsBecomeTriageExceptionsAndFallBack() {
        OkHttpClient rejecting = new OkHttpClient.Builder()
            .addInterceptor(chain -> {
                throw new IllegalArgumentException("Unexpected char 0x0a in header value");
            })
            .build();
        LlmTriageClient failing = new LlmTriageClient(
            new LlmTriageSettings(server.url("/").toString(), "test-model", 5, 0.1, 200), rejecting);

        assertThatThrownBy(() -> failing.assess(patient))
            .isInstanceOf(ExternalTriageException.class)
            .hasMessageContaining("rejected")
            .hasCauseInstanceOf(IllegalArgumentException.class);

        SimulationParameters parameters = SimulationParameters.load();
        ExternalTriageService service = new ExternalTriageService(
            failing, FuzzyTriageService.create(parameters), parameters.categories);

        TriageVerdict verdict = service.assess(patient);

        assertThat(verdict.system).isEqualTo(FuzzyTriageService.NAME);
        assertThat(service.fallbackCount()).isEqualTo(1);
    }

    private MockResponse envelope(String generated) {
        String body = mapper.createObjectNode().put("model", "test-model").put("response", generated)
            .put("done", true).toString();
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
