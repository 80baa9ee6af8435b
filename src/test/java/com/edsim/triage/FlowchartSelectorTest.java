package com.edsim.triage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowchartSelectorTest {

    private final FlowchartSelector selector = FlowchartSelector.standard();

    @ParameterizedTest
    @CsvSource({
        "Severe chest pain radiating to left arm, chest_pain",
        "Shortness of breath, shortness_of_breath",
        "child shortness of breath, shortness_of_breath_child",
        "broken wrist, limb_injuries",
        "Stomach pain and vomiting, abdominal_pain",
        "Head injury after fall, head_injury",
        "suicidal thoughts, mental_illness",
        "chest_pain, chest_pain",
        "Fall from ladder, falls",
        "Cut to hand, wounds"
    })
    void selectsFlowchartByKeyword(String complaint, String expected) {
        assertThat(selector.select(complaint).name).isEqualTo(expected);
    }

    @Test
    void longestKeywordWins() {
        // "headache" beats "fever"
        assertThat(selector.select("fever and headache").name).isEqualTo("headache");
    }

    @Test
    void keywordsOnlyMatchAtWordStarts() {
        assertThat(selector.select("heart palpitations").name).isEqualTo("palpitations");
        assertThat(selector.select("acute routine check").name).isEqualTo(FlowchartSelector.DEFAULT_FLOWCHART);
    }

    @Test
    void unmatchedOrMissingComplaintsUseTheDefault() {
        assertThat(selector.select("something odd").name).isEqualTo("unwell_adult");
        assertThat(selector.select("").name).isEqualTo("unwell_adult");
        assertThat(selector.select(null)).isSameAs(selector.defaultFlowchart());
        assertThat(selector.byName("no_such_chart")).isSameAs(selector.defaultFlowchart());
    }

    @Test
    void standardTableIsCompleteAndWellFormed() {
        assertThat(selector.size()).isGreaterThanOrEqualTo(50);
        assertThat(selector.names()).contains(
            "chest_pain", "shortness_of_breath", "headache", "abdominal_pain", "limb_injuries", "mental_illness");
        for (String name : selector.names()) {
            Flowchart flowchart = selector.byName(name);
            assertThat(flowchart.symptoms).as(name).isNotEmpty().hasSizeLessThanOrEqualTo(Flowchart.MAX_SYMPTOMS);
            assertThat(flowchart.keywords).as(name).contains(name.replace('_', ' '));
        }
    }

    @Test
    void rejectsDuplicateNamesAndMissingDefault() {
        Flowchart chart = new Flowchart("a", "general", List.of("pain"), List.of("a"));

        assertThatThrownBy(() -> new FlowchartSelector(List.of(chart, chart), "a"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FlowchartSelector(List.of(chart), "b"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
