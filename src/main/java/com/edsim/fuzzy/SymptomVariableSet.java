package com.edsim.fuzzy;

import com.edsim.triage.TriageCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The five symptom inputs on [0, 10] and the triage score output on [1, 5].
 */
public final class SymptomVariableSet {

    public static final int INPUT_COUNT = 5;
    public static final double INPUT_MIN = 0.0;
    public static final double INPUT_MAX = 10.0;

    private final List<FuzzyVariable> inputs;
    private final Map<TriageCategory, TriangularMembership> outputTerms;

    private SymptomVariableSet(List<FuzzyVariable> inputs, Map<TriageCategory, TriangularMembership> outputTerms) {
        this.inputs = Collections.unmodifiableList(inputs);
        this.outputTerms = Collections.unmodifiableMap(outputTerms);
    }

    public static SymptomVariableSet standard() {
        List<String> termNames = new ArrayList<>();
        for (SeverityTerm term : SeverityTerm.values()) {
            termNames.add(term.label());
        }
        List<FuzzyVariable> inputs = new ArrayList<>();
        for (int i = 1; i <= INPUT_COUNT; i++) {
            inputs.add(FuzzyVariable.evenPartition(inputName(i), INPUT_MIN, INPUT_MAX, termNames));
        }

        // triangles on the output scale, one per category, peaking at its priority
        Map<TriageCategory, TriangularMembership> outputTerms = new EnumMap<>(TriageCategory.class);
        int lowest = TriageCategory.RED.priority();
        int highest = TriageCategory.BLUE.priority();
        for (TriageCategory category : TriageCategory.values()) {
            int peak = category.priority();
            outputTerms.put(category, new TriangularMembership(
                Math.max(lowest, peak - 1), peak, Math.min(highest, peak + 1)));
        }
        return new SymptomVariableSet(inputs, outputTerms);
    }

    public static String inputName(int position) {
        return "symptom_" + position;
    }

    public List<FuzzyVariable> inputs() {
        return inputs;
    }

    public FuzzyVariable input(int position) {
        return inputs.get(position - 1);
    }

    public Map<TriageCategory, TriangularMembership> outputTerms() {
        return outputTerms;
    }

    public double outputMin() {
        return TriageCategory.RED.priority();
    }

    public double outputMax() {
        return TriageCategory.BLUE.priority();
    }
}
