package com.edsim.triage;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TriageCategoryTest {

    @Test
    void parseIgnoresCaseAndPadding() {
        assertThat(TriageCategory.parse(" red ")).isEqualTo(TriageCategory.RED);
        assertThat(TriageCategory.parse("Orange")).isEqualTo(TriageCategory.ORANGE);
        assertThat(TriageCategory.parse("BLUE")).isEqualTo(TriageCategory.BLUE);
    }

    @Test
    void parseDoesNotDependOnTheDefaultLocale() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            for (TriageCategory category : TriageCategory.values()) {
                assertThat(TriageCategory.parse(category.name().toLowerCase(Locale.ROOT))).isEqualTo(category);
            }
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void parseRejectsMissingAndUnknownNames() {
        assertThatThrownBy(() -> TriageCategory.parse(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("missing");
        assertThatThrownBy(() -> TriageCategory.parse("purple"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void scoresRoundToTheNearestCategory() {
        assertThat(TriageCategory.fromScore(1.2)).isEqualTo(TriageCategory.RED);
        assertThat(TriageCategory.fromScore(3.5)).isEqualTo(TriageCategory.GREEN);
        assertThat(TriageCategory.fromScore(9.0)).isEqualTo(TriageCategory.BLUE);
        assertThat(TriageCategory.fromScore(-1.0)).isEqualTo(TriageCategory.RED);
    }
}
