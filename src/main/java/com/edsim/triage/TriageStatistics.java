package com.edsim.triage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Running counts over the verdicts a triage service has produced.
 */
public final class TriageStatistics {

    private final Map<TriageCategory, Integer> categoryCounts = new EnumMap<>(TriageCategory.class);
    private final Map<String, Integer> flowchartUsage = new TreeMap<>();
    private int processed;
    private double confidenceSum;

    public synchronized void record(TriageVerdict verdict) {
        processed++;
        confidenceSum += verdict.confidence;
        categoryCounts.merge(verdict.category, 1, Integer::sum);
        flowchartUsage.merge(verdict.flowchart, 1, Integer::sum);
    }

    public synchronized int processed() {
        return processed;
    }

    public synchronized double averageConfidence() {
        return processed == 0 ? 0.0 : confidenceSum / processed;
    }

    public synchronized Map<TriageCategory, Integer> categoryCounts() {
        return Collections.unmodifiableMap(new EnumMap<>(categoryCounts));
    }

    public synchronized Map<String, Integer> flowchartUsage() {
        return Collections.unmodifiableMap(new TreeMap<>(flowchartUsage));
    }

    @Override
    public synchronized String toString() {
        return String.format("TriageStatistics{processed=%d, avgConfidence=%.2f, categories=%s}",
            processed, averageConfidence(), categoryCounts);
    }
}
