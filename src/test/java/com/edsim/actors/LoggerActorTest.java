package com.edsim.actors;

import com.edsim.messages.Messages.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LoggerActorTest {

    @Test
    void formatsSimulatedClock() {
        String line = LoggerActor.format(new LogEvent("crisis", "ScenarioRunner", "Summary ready", "info", 605.0));

        assertThat(line).matches("\\[\\d{2}:\\d{2}:\\d{2}\\.\\d{3}] .+")
            .endsWith("INFO | [crisis] ScenarioRunner @ 10:05: Summary ready");
    }

    @Test
    void eventsOutsideARunHaveNoClock() {
        String line = LoggerActor.format(new LogEvent("holiday", "SimulationSupervisor", "Unknown scenario", "WARNING"));

        assertThat(line).contains("⚠️ WARNING | [holiday] SimulationSupervisor: Unknown scenario");
    }
}
