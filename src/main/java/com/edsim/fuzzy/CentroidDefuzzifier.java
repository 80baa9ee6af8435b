package com.edsim.fuzzy;

import com.edsim.triage.TriageCategory;

import java.util.Map;

/**
 * Centroid of the clipped-and-combined output surface, sampled on a discrete grid.
 */
public final class CentroidDefuzzifier {

    private final double step;

    public CentroidDefuzzifier(double step) {
        if (step <= 0) {
            throw new IllegalArgumentException("Step must be positive, got " + step);
        }
        this.step = step;
    }

    /** Unit grid, i.e. the points 1, 2, 3, 4, 5. */
    public static CentroidDefuzzifier unitGrid() {
        return new CentroidDefuzzifier(1.0);
    }

    public double defuzzify(SymptomVariableSet variables, Map<TriageCategory, Double> strengths) {
        double weighted = 0.0;
        double area = 0.0;
        int points = (int) Math.round((variables.outputMax() - variables.outputMin()) / step);
        for (int i = 0; i <= points; i++) {
            double x = variables.outputMin() + i * step;
            double mu = 0.0;
            for (Map.Entry<TriageCategory, TriangularMembership> term : variables.outputTerms().entrySet()) {
                double clipped = Math.min(strengths.getOrDefault(term.getKey(), 0.0), term.getValue().degree(x));
                mu = Math.max(mu, clipped);
            }
            weighted += x * mu;
            area += mu;
        }
        if (area <= 0.0) {
            throw new IllegalStateException("Empty output surface, no rule fired for strengths " + strengths);
        }
        return weighted / area;
    }
}
