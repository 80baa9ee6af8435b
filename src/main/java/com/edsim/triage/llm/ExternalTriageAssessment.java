package com.edsim.triage.llm;

import com.edsim.triage.TriageCategory;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured verdict returned by an external triage system.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ExternalTriageAssessment {

    public final TriageCategory category;
    public final int priority;
    public final String waitTime;
    public final double confidence;
    public final String reasoning;

    public ExternalTriageAssessment(TriageCategory category, int priority, String waitTime,
                                    double confidence, String reasoning) {
        this.category = category;
        this.priority = priority;
        this.waitTime = waitTime;
        this.confidence = confidence;
        this.reasoning = reasoning;
    }

    @JsonCreator
    static ExternalTriageAssessment fromJson(
            @JsonProperty("triage_category") String category,
            @JsonProperty("priority_score") Integer priority,
            @JsonProperty("wait_time") String waitTime,
            @JsonProperty("confidence") Double confidence,
            @JsonProperty("reasoning") String reasoning) {
        TriageCategory parsed = TriageCategory.parse(category);
        return new ExternalTriageAssessment(
            parsed,
            priority != null ? priority : parsed.priority(),
            waitTime,
            confidence != null ? confidence : 0.5,
            reasoning);
    }

    @Override
    public String toString() {
        return String.format("ExternalTriageAssessment{%s, priority=%d, wait='%s', confidence=%.2f}",
            category, priority, waitTime, confidence);
    }
}
