package com.edsim.fuzzy;

import java.util.List;
import java.util.Locale;

/**
 * Converts between severity words and the numeric input scale.
 * Unknown or missing words count as {@code none}.
 */
public final class LinguisticConverter {

    private LinguisticConverter() {
    }

    public static double toNumeric(String word) {
        return toTerm(word).value();
    }

    public static SeverityTerm toTerm(String word) {
        if (word == null) {
            return SeverityTerm.NONE;
        }
        String normalised = word.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (SeverityTerm term : SeverityTerm.values()) {
            if (term.label().equals(normalised)) {
                return term;
            }
        }
        return SeverityTerm.NONE;
    }

    /**
     * Nearest linguistic term for a numeric value; ties resolve to the more severe word.
     */
    public static SeverityTerm fromNumeric(double value) {
        SeverityTerm nearest = SeverityTerm.NONE;
        double bestDistance = Double.MAX_VALUE;
        for (SeverityTerm term : SeverityTerm.values()) {
            double distance = Math.abs(term.value() - value);
            if (distance <= bestDistance) {
                bestDistance = distance;
                nearest = term;
            }
        }
        return nearest;
    }

    public static double[] toNumeric(List<SeverityTerm> terms) {
        double[] values = new double[terms.size()];
        for (int i = 0; i < values.length; i++) {
            SeverityTerm term = terms.get(i);
            values[i] = term == null ? 0.0 : term.value();
        }
        return values;
    }
}
