package com.edsim.triage;

import java.util.Locale;

/**
 * Manchester Triage System categories, most urgent first.
 */
public enum TriageCategory {
    RED(1, 0, "Immediate"),
    ORANGE(2, 10, "Very urgent"),
    YELLOW(3, 60, "Urgent"),
    GREEN(4, 120, "Standard"),
    BLUE(5, 240, "Non-urgent");

    private final int priority;
    private final int defaultTargetWait;
    private final String description;

    TriageCategory(int priority, int defaultTargetWait, String description) {
        this.priority = priority;
        this.defaultTargetWait = defaultTargetWait;
        this.description = description;
    }

    /** Priority rank, 1 = most urgent. */
    public int priority() {
        return priority;
    }

    /** Target wait to consultation in minutes when nothing else is configured. */
    public int defaultTargetWait() {
        return defaultTargetWait;
    }

    public String description() {
        return description;
    }

    public boolean isMoreUrgentThan(TriageCategory other) {
        return priority < other.priority;
    }

    public static TriageCategory fromPriority(int priority) {
        for (TriageCategory category : values()) {
            if (category.priority == priority) {
                return category;
            }
        }
        throw new IllegalArgumentException("No triage category with priority " + priority);
    }

    /**
     * Maps a defuzzified score in [1, 5] onto a category.
     * The score is quantised first so float noise cannot tip a half-way value,
     * then rounded half-to-even.
     */
    public static TriageCategory fromScore(double score) {
        double quantised = Math.round(score * 1e9) / 1e9;
        int index = (int) Math.rint(quantised) - 1;
        index = Math.max(0, Math.min(values().length - 1, index));
        return values()[index];
    }

    /**
     * Lenient lookup used for external verdicts ("red", "Red", "RED").
     */
    public static TriageCategory parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Triage category is missing");
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
