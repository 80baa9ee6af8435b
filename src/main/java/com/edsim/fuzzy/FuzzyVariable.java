package com.edsim.fuzzy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named variable over a bounded universe with a set of linguistic terms.
 */
public final class FuzzyVariable {

    private final String name;
    private final double min;
    private final double max;
    private final Map<String, MembershipFunction> terms;

    public FuzzyVariable(String name, double min, double max, Map<String, MembershipFunction> terms) {
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("Variable '" + name + "' needs at least one term");
        }
        this.name = name;
        this.min = min;
        this.max = max;
        this.terms = Collections.unmodifiableMap(new LinkedHashMap<>(terms));
    }

    /**
     * Evenly spaced partition of [min, max]: shoulders at both ends, triangles in between,
     * each peak one step from its neighbours.
     */
    public static FuzzyVariable evenPartition(String name, double min, double max, List<String> termNames) {
        int count = termNames.size();
        if (count < 2) {
            throw new IllegalArgumentException("An even partition needs at least two terms");
        }
        double step = (max - min) / (count - 1);
        Map<String, MembershipFunction> terms = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            double peak = min + i * step;
            MembershipFunction function;
            if (i == 0) {
                function = TrapezoidalMembership.leftShoulder(peak, peak + step);
            } else if (i == count - 1) {
                function = TrapezoidalMembership.rightShoulder(peak - step, peak);
            } else {
                function = new TriangularMembership(peak - step, peak, peak + step);
            }
            terms.put(termNames.get(i), function);
        }
        return new FuzzyVariable(name, min, max, terms);
    }

    public String name() {
        return name;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    public List<String> termNames() {
        return new ArrayList<>(terms.keySet());
    }

    public MembershipFunction term(String termName) {
        MembershipFunction function = terms.get(termName);
        if (function == null) {
            throw new IllegalArgumentException("Variable '" + name + "' has no term '" + termName + "'");
        }
        return function;
    }

    public double clamp(double x) {
        return Math.max(min, Math.min(max, x));
    }

    /**
     * Degrees of the clamped value in every term, in declaration order.
     */
    public Map<String, Double> fuzzify(double x) {
        double clamped = clamp(x);
        Map<String, Double> degrees = new LinkedHashMap<>();
        terms.forEach((termName, function) -> degrees.put(termName, function.degree(clamped)));
        return degrees;
    }

    @Override
    public String toString() {
        return "FuzzyVariable{" + name + " [" + min + ", " + max + "] " + terms + "}";
    }
}
