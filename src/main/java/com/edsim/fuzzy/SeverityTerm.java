package com.edsim.fuzzy;

/**
 * Linguistic severity words and their fixed position on the 0-10 input scale.
 */
public enum SeverityTerm {
    NONE("none", 0.0),
    MILD("mild", 2.0),
    MODERATE("moderate", 5.0),
    SEVERE("severe", 8.0),
    VERY_SEVERE("very_severe", 10.0);

    private final String label;
    private final double value;

    SeverityTerm(String label, double value) {
        this.label = label;
        this.value = value;
    }

    public String label() {
        return label;
    }

    public double value() {
        return value;
    }

    public boolean isAtLeast(SeverityTerm other) {
        return ordinal() >= other.ordinal();
    }
}
