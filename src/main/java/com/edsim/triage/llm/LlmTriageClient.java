package com.edsim.triage.llm;

import com.edsim.patient.Patient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * LlmTriageClient - asks an Ollama-compatible model for a Manchester triage verdict.
 *
 * Calls are blocking: the simulation waits for the answer inside one scheduler
 * step, so no simulated time passes.
 */
public class LlmTriageClient implements ExternalTriageClient {

    private static final Logger log = LoggerFactory.getLogger(LlmTriageClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final LlmTriageSettings settings;
    private final OkHttpClient httpClient;
    private final ObjectMapper jsonMapper;

    public LlmTriageClient(LlmTriageSettings settings) {
        this(settings, new OkHttpClient.Builder()
            .callTimeout(settings.timeoutSeconds, TimeUnit.SECONDS)
            .build());
    }

    LlmTriageClient(LlmTriageSettings settings, OkHttpClient httpClient) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.jsonMapper = new ObjectMapper();
        log.info("🤖 LLM triage client for {} using model {}", settings.baseUrl, settings.model);
    }

    @Override
    public ExternalTriageAssessment assess(Patient patient) throws ExternalTriageException {
        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("model", settings.model);
        payload.put("prompt", buildPrompt(patient));
        payload.put("system", SYSTEM_PROMPT);
        payload.put("stream", false);
        payload.put("format", "json");
        ObjectNode options = payload.putObject("options");
        options.put("temperature", settings.temperature);
        options.put("num_predict", settings.maxTokens);
        options.put("top_p", 0.9);

        try (Response response = httpClient.newCall(new Request.Builder()
                .url(settings.generateUrl())
                .post(RequestBody.create(payload.toString(), JSON))
                .build()).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new ExternalTriageException("HTTP " + response.code() + " from triage model: " + text);
            }
            JsonNode envelope = jsonMapper.readTree(text);
            String generated = envelope.path("response").asText("");
            if (generated.isBlank()) {
                throw new ExternalTriageException("Triage model returned an empty response");
            }
            ExternalTriageAssessment assessment = parseAssessment(generated);
            log.debug("🤖 {} → {}", patient.id(), assessment);
            return assessment;
        } catch (IOException e) {
            throw new ExternalTriageException("Triage model call failed: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            // OkHttp rejects bad requests, headers and redirect targets this way
            throw new ExternalTriageException("Triage model request rejected: " + e.getMessage(), e);
        }
    }

    /**
     * Pulls the first JSON object out of the generated text.
     */
    ExternalTriageAssessment parseAssessment(String generated) throws ExternalTriageException {
        int start = generated.indexOf('{');
        int end = generated.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new ExternalTriageException("No JSON verdict in model output: " + preview(generated));
        }
        try {
            return jsonMapper.readValue(generated.substring(start, end + 1), ExternalTriageAssessment.class);
        } catch (JsonProcessingException e) {
            throw new ExternalTriageException("Malformed verdict in model output: " + preview(generated), e);
        }
    }

    private String buildPrompt(Patient patient) {
        return String.format("""
            Triage this emergency department patient using the Manchester Triage System.

            Age: %d
            Gender: %s
            Chief complaint: %s
            Vital signs: %s
            Medical history: %s
            Reported symptoms: %s

            Respond with JSON only:
            {"triage_category": "RED|ORANGE|YELLOW|GREEN|BLUE",
             "priority_score": 1-5,
             "wait_time": "e.g. Immediate, 10 min, 60 min",
             "confidence": 0.0-1.0,
             "reasoning": "one sentence"}
            """,
            patient.age(), patient.gender(), patient.complaint(), patient.vitals(),
            patient.history().isEmpty() ? "none" : String.join(", ", patient.history()),
            patient.reportedSymptoms().isEmpty() ? "none" : patient.reportedSymptoms());
    }

    private static String preview(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }

    private static final String SYSTEM_PROMPT =
        "You are an experienced emergency triage nurse. Categories: RED immediate, ORANGE very urgent (10 min), "
            + "YELLOW urgent (60 min), GREEN standard (120 min), BLUE non-urgent (240 min).";
}
