package com.edsim.triage;

import java.util.List;

/**
 * A presentation flowchart: the up-to-five discriminating symptoms assessed for a complaint.
 */
public final class Flowchart {

    public static final int MAX_SYMPTOMS = 5;

    public final String name;
    public final String group;
    public final List<String> symptoms;
    public final List<String> keywords;

    public Flowchart(String name, String group, List<String> symptoms, List<String> keywords) {
        if (symptoms.isEmpty() || symptoms.size() > MAX_SYMPTOMS) {
            throw new IllegalArgumentException(
                "Flowchart '" + name + "' needs 1-" + MAX_SYMPTOMS + " symptoms, got " + symptoms.size());
        }
        this.name = name;
        this.group = group;
        this.symptoms = List.copyOf(symptoms);
        this.keywords = List.copyOf(keywords);
    }

    @Override
    public String toString() {
        return name + symptoms;
    }
}
