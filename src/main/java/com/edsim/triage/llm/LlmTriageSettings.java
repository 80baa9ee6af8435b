package com.edsim.triage.llm;

import com.edsim.config.ConfigurationException;
import io.github.cdimascio.dotenv.Dotenv;
import okhttp3.HttpUrl;

import java.util.List;

/**
 * LlmTriageSettings - endpoint and model for the LLM triage client, read from {@code .env}.
 *
 * The base URL is parsed once, so a malformed endpoint fails while the simulation is built.
 */
public class LlmTriageSettings {
    public final String baseUrl;
    public final String model;
    public final int timeoutSeconds;
    public final double temperature;
    public final int maxTokens;
    private final HttpUrl generateUrl;

    public LlmTriageSettings(String baseUrl, String model, int timeoutSeconds, double temperature, int maxTokens) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
        this.temperature = temperature;
        this.maxTokens = maxTokens;

        HttpUrl base = HttpUrl.parse(this.baseUrl);
        if (base == null) {
            throw new ConfigurationException(List.of(
                "OLLAMA_BASE_URL must be an http or https URL, got '" + baseUrl + "'"));
        }
        this.generateUrl = base.newBuilder().addPathSegments("api/generate").build();
    }

    public static LlmTriageSettings fromEnvironment() {
        Dotenv d = Dotenv.configure().ignoreIfMissing().load();
        return new LlmTriageSettings(
            d.get("OLLAMA_BASE_URL", "http://localhost:11434"),
            d.get("OLLAMA_MODEL", "llama3.2:1b"),
            Integer.parseInt(d.get("OLLAMA_TIMEOUT_SECONDS", "60")),
            Double.parseDouble(d.get("OLLAMA_TEMPERATURE", "0.1")),
            Integer.parseInt(d.get("OLLAMA_MAX_TOKENS", "500")));
    }

    public HttpUrl generateUrl() {
        return generateUrl;
    }

    @Override
    public String toString() {
        return String.format("LlmTriageSettings{baseUrl='%s', model='%s', timeout=%ds, temperature=%.2f}",
            baseUrl, model, timeoutSeconds, temperature);
    }
}
