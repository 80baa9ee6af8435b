package com.edsim.fuzzy;

import com.edsim.triage.TriageCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.edsim.fuzzy.FuzzyExpression.and;
import static com.edsim.fuzzy.FuzzyExpression.is;
import static com.edsim.fuzzy.FuzzyExpression.not;
import static com.edsim.fuzzy.FuzzyExpression.or;

/**
 * RuleBase - the fixed Manchester triage rules over the five symptom inputs.
 *
 * Each less urgent rule is guarded by the negation of every more urgent trigger,
 * so raising any symptom's severity can only keep or raise the urgency of the
 * result. Without the guards a mild extra symptom would pull the centroid
 * towards BLUE.
 */
public final class RuleBase {

    private final List<FuzzyRule> rules;

    public RuleBase(List<FuzzyRule> rules) {
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("A rule base needs at least one rule");
        }
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public List<FuzzyRule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public static RuleBase standard(SymptomVariableSet variables) {
        int n = variables.inputs().size();
        List<FuzzyRule> rules = new ArrayList<>();

        FuzzyExpression anyVerySevere = anyOf(variables, SeverityTerm.VERY_SEVERE);
        FuzzyExpression anySevere = anyOf(variables, SeverityTerm.SEVERE);
        FuzzyExpression anyModerate = anyOf(variables, SeverityTerm.MODERATE);
        FuzzyExpression anyMild = anyOf(variables, SeverityTerm.MILD);
        FuzzyExpression allNone = allOf(variables, SeverityTerm.NONE);
        FuzzyExpression twoSevere = atLeast(variables, SeverityTerm.SEVERE, 2);
        FuzzyExpression threeModerate = atLeast(variables, SeverityTerm.MODERATE, 3);

        // RED
        rules.add(new FuzzyRule("any-very-severe", anyVerySevere, TriageCategory.RED));
        for (int[] triple : combinations(n, 3)) {
            rules.add(new FuzzyRule("three-severe" + describe(triple),
                and(severeAt(triple)), TriageCategory.RED));
        }

        // ORANGE: exactly two severe, nothing very severe
        for (int[] pair : combinations(n, 2)) {
            List<FuzzyExpression> terms = new ArrayList<>(severeAt(pair));
            for (int i = 1; i <= n; i++) {
                if (i != pair[0] && i != pair[1]) {
                    terms.add(not(is(SymptomVariableSet.inputName(i), SeverityTerm.SEVERE.label())));
                }
            }
            terms.add(not(anyVerySevere));
            rules.add(new FuzzyRule("exactly-two-severe" + describe(pair), and(terms), TriageCategory.ORANGE));
        }

        // YELLOW
        rules.add(new FuzzyRule("single-severe",
            and(anySevere, not(anyVerySevere), not(twoSevere)), TriageCategory.YELLOW));
        rules.add(new FuzzyRule("three-moderate",
            and(threeModerate, not(anyVerySevere), not(twoSevere)), TriageCategory.YELLOW));

        // GREEN
        rules.add(new FuzzyRule("any-moderate",
            and(anyModerate, not(anySevere), not(anyVerySevere), not(threeModerate)), TriageCategory.GREEN));

        // BLUE
        FuzzyExpression nothingWorse = and(not(anyModerate), not(anySevere), not(anyVerySevere));
        rules.add(new FuzzyRule("any-mild", and(anyMild, nothingWorse), TriageCategory.BLUE));
        rules.add(new FuzzyRule("all-none", and(allNone, nothingWorse), TriageCategory.BLUE));

        return new RuleBase(rules);
    }

    private static FuzzyExpression anyOf(SymptomVariableSet variables, SeverityTerm term) {
        List<FuzzyExpression> operands = new ArrayList<>();
        for (FuzzyVariable input : variables.inputs()) {
            operands.add(is(input.name(), term.label()));
        }
        return or(operands);
    }

    private static FuzzyExpression allOf(SymptomVariableSet variables, SeverityTerm term) {
        List<FuzzyExpression> operands = new ArrayList<>();
        for (FuzzyVariable input : variables.inputs()) {
            operands.add(is(input.name(), term.label()));
        }
        return and(operands);
    }

    private static FuzzyExpression atLeast(SymptomVariableSet variables, SeverityTerm term, int count) {
        List<FuzzyExpression> alternatives = new ArrayList<>();
        for (int[] combination : combinations(variables.inputs().size(), count)) {
            List<FuzzyExpression> operands = new ArrayList<>();
            for (int position : combination) {
                operands.add(is(SymptomVariableSet.inputName(position), term.label()));
            }
            alternatives.add(and(operands));
        }
        return or(alternatives);
    }

    private static List<FuzzyExpression> severeAt(int[] positions) {
        List<FuzzyExpression> operands = new ArrayList<>();
        for (int position : positions) {
            operands.add(is(SymptomVariableSet.inputName(position), SeverityTerm.SEVERE.label()));
        }
        return operands;
    }

    /** All k-subsets of 1..n in lexicographic order. */
    static List<int[]> combinations(int n, int k) {
        List<int[]> result = new ArrayList<>();
        collect(new int[k], 0, 1, n, result);
        return result;
    }

    private static void collect(int[] current, int depth, int start, int n, List<int[]> result) {
        if (depth == current.length) {
            result.add(current.clone());
            return;
        }
        for (int i = start; i <= n; i++) {
            current[depth] = i;
            collect(current, depth + 1, i + 1, n, result);
        }
    }

    private static String describe(int[] positions) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < positions.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(positions[i]);
        }
        return sb.append(']').toString();
    }
}
