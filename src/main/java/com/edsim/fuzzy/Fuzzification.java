package com.edsim.fuzzy;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Membership degrees of every input variable for one crisp input vector.
 */
public final class Fuzzification {

    private final Map<String, Map<String, Double>> degrees;

    Fuzzification(Map<String, Map<String, Double>> degrees) {
        this.degrees = degrees;
    }

    public static Fuzzification of(SymptomVariableSet variables, double[] values) {
        Map<String, Map<String, Double>> degrees = new HashMap<>();
        for (int i = 0; i < variables.inputs().size(); i++) {
            FuzzyVariable variable = variables.inputs().get(i);
            degrees.put(variable.name(), variable.fuzzify(values[i]));
        }
        return new Fuzzification(degrees);
    }

    public double degree(String variable, String term) {
        Map<String, Double> terms = degrees.get(variable);
        if (terms == null) {
            throw new IllegalArgumentException("Unknown input variable '" + variable + "'");
        }
        Double degree = terms.get(term);
        if (degree == null) {
            throw new IllegalArgumentException("Variable '" + variable + "' has no term '" + term + "'");
        }
        return degree;
    }

    public Map<String, Double> degrees(String variable) {
        return Collections.unmodifiableMap(degrees.get(variable));
    }
}
