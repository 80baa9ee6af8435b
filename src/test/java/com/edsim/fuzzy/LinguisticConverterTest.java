package com.edsim.fuzzy;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class LinguisticConverterTest {

    @Test
    void convertsWordsToFixedValues() {
        assertThat(LinguisticConverter.toNumeric("none")).isEqualTo(0.0);
        assertThat(LinguisticConverter.toNumeric("mild")).isEqualTo(2.0);
        assertThat(LinguisticConverter.toNumeric("moderate")).isEqualTo(5.0);
        assertThat(LinguisticConverter.toNumeric("severe")).isEqualTo(8.0);
        assertThat(LinguisticConverter.toNumeric("very_severe")).isEqualTo(10.0);
    }

    @Test
    void acceptsLooseSpelling() {
        assertThat(LinguisticConverter.toTerm("Very Severe")).isEqualTo(SeverityTerm.VERY_SEVERE);
        assertThat(LinguisticConverter.toTerm(" very-severe ")).isEqualTo(SeverityTerm.VERY_SEVERE);
        assertThat(LinguisticConverter.toTerm("MILD")).isEqualTo(SeverityTerm.MILD);
    }

    @Test
    void unknownOrMissingWordsCountAsNone() {
        assertThat(LinguisticConverter.toTerm(null)).isEqualTo(SeverityTerm.NONE);
        assertThat(LinguisticConverter.toTerm("excruciating")).isEqualTo(SeverityTerm.NONE);
        assertThat(LinguisticConverter.toNumeric(Arrays.asList(SeverityTerm.SEVERE, null)))
            .containsExactly(8.0, 0.0);
    }

    @Test
    void nearestTermWinsAndTiesGoToTheMoreSevere() {
        assertThat(LinguisticConverter.fromNumeric(7.1)).isEqualTo(SeverityTerm.SEVERE);
        assertThat(LinguisticConverter.fromNumeric(1.0)).isEqualTo(SeverityTerm.MILD);
        assertThat(LinguisticConverter.fromNumeric(9.0)).isEqualTo(SeverityTerm.VERY_SEVERE);
        assertThat(SeverityTerm.SEVERE.isAtLeast(SeverityTerm.MODERATE)).isTrue();
        assertThat(SeverityTerm.MILD.isAtLeast(SeverityTerm.MODERATE)).isFalse();
    }
}
