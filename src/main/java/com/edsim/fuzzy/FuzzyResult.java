package com.edsim.fuzzy;

import com.edsim.triage.TriageCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of one inference: crisp score, aggregated strength per category and the mapped category.
 */
public final class FuzzyResult {

    private final double score;
    private final Map<TriageCategory, Double> strengths;
    private final TriageCategory category;

    public FuzzyResult(double score, Map<TriageCategory, Double> strengths) {
        this.score = score;
        this.strengths = Collections.unmodifiableMap(new EnumMap<>(strengths));
        this.category = TriageCategory.fromScore(score);
    }

    public double score() {
        return score;
    }

    public TriageCategory category() {
        return category;
    }

    public Map<TriageCategory, Double> strengths() {
        return strengths;
    }

    public double strength(TriageCategory category) {
        return strengths.getOrDefault(category, 0.0);
    }

    @Override
    public String toString() {
        return String.format("FuzzyResult{score=%.3f, category=%s, strengths=%s}", score, category, strengths);
    }
}
