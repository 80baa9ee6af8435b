package com.edsim.fuzzy;

import com.edsim.triage.TriageCategory;

/**
 * IF antecedent THEN category.
 */
public final class FuzzyRule {

    private final String label;
    private final FuzzyExpression antecedent;
    private final TriageCategory consequent;

    public FuzzyRule(String label, FuzzyExpression antecedent, TriageCategory consequent) {
        this.label = label;
        this.antecedent = antecedent;
        this.consequent = consequent;
    }

    public String label() {
        return label;
    }

    public TriageCategory consequent() {
        return consequent;
    }

    public double firingStrength(Fuzzification input) {
        return antecedent.evaluate(input);
    }

    @Override
    public String toString() {
        return label + ": IF " + antecedent + " THEN " + consequent;
    }
}
