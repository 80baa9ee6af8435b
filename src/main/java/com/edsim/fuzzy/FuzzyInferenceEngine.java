package com.edsim.fuzzy;

import com.edsim.triage.TriageCategory;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * FuzzyInferenceEngine - fuzzify, fire rules, aggregate with max, defuzzify.
 *
 * Stateless after construction and safe to share. Input vectors shorter than
 * five are padded with zeros ("none"), longer ones are cut to five, and
 * NaN entries count as "none".
 */
public final class FuzzyInferenceEngine {

    private final SymptomVariableSet variables;
    private final RuleBase rules;
    private final CentroidDefuzzifier defuzzifier;

    public FuzzyInferenceEngine(SymptomVariableSet variables, RuleBase rules, CentroidDefuzzifier defuzzifier) {
        this.variables = variables;
        this.rules = rules;
        this.defuzzifier = defuzzifier;
    }

    public static FuzzyInferenceEngine standard() {
        SymptomVariableSet variables = SymptomVariableSet.standard();
        return new FuzzyInferenceEngine(variables, RuleBase.standard(variables), CentroidDefuzzifier.unitGrid());
    }

    public FuzzyResult infer(double[] symptomValues) {
        double[] values = Arrays.copyOf(symptomValues, SymptomVariableSet.INPUT_COUNT);
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                values[i] = SeverityTerm.NONE.value();
            }
        }
        Fuzzification input = Fuzzification.of(variables, values);

        Map<TriageCategory, Double> strengths = new EnumMap<>(TriageCategory.class);
        for (TriageCategory category : TriageCategory.values()) {
            strengths.put(category, 0.0);
        }
        for (FuzzyRule rule : rules.rules()) {
            double strength = rule.firingStrength(input);
            strengths.merge(rule.consequent(), strength, Math::max);
        }

        double score = defuzzifier.defuzzify(variables, strengths);
        return new FuzzyResult(score, strengths);
    }

    public SymptomVariableSet variables() {
        return variables;
    }

    public RuleBase rules() {
        return rules;
    }
}
