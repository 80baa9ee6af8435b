package com.edsim.actors;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import akka.actor.testkit.typed.javadsl.TestProbe;
import akka.actor.typed.ActorRef;
import com.edsim.config.SimulationParameters;
import com.edsim.messages.Messages.*;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ScenarioRunnerActorTest {

    private static final ActorTestKit testKit = ActorTestKit.create();
    private static final Duration RUN_TIMEOUT = Duration.ofSeconds(30);

    @AfterAll
    static void tearDown() {
        testKit.shutdownTestKit();
    }

    @Test
    void repliesWithSummaryAndStops() {
        TestProbe<LogCommand> logger = testKit.createTestProbe();
        TestProbe<ScenarioResult> results = testKit.createTestProbe();
        ActorRef<ScenarioCommand> runner = testKit.spawn(ScenarioRunnerActor.create(logger.getRef()));
        SimulationParameters parameters = SimulationParameters.withOverrides(
            "simulation.duration = 240\nsimulation.warm-up = 0");

        runner.tell(new RunScenario("short-shift", parameters, results.getRef()));

        ScenarioResult result = results.receiveMessage(RUN_TIMEOUT);
        assertThat(result.success).isTrue();
        assertThat(result.scenario).isEqualTo("short-shift");
        assertThat(result.summary.endTime).isEqualTo(240.0);
        assertThat(result.summary.totalArrivals).isPositive();
        assertThat(result.summary.snapshots).isEqualTo(4);

        LogEvent first = (LogEvent) logger.receiveMessage();
        assertThat(first.scenario).isEqualTo("short-shift");
        assertThat(first.event).isEqualTo("Starting scenario");
        results.expectTerminated(runner, RUN_TIMEOUT);
    }

    @Test
    void invalidParametersFailWithoutRunning() {
        TestProbe<LogCommand> logger = testKit.createTestProbe();
        TestProbe<ScenarioResult> results = testKit.createTestProbe();
        ActorRef<ScenarioCommand> runner = testKit.spawn(ScenarioRunnerActor.create(logger.getRef()));
        SimulationParameters parameters = SimulationParameters.withOverrides("resources.cubicles = 0");

        runner.tell(new RunScenario("no-cubicles", parameters, results.getRef()));

        ScenarioResult result = results.receiveMessage(RUN_TIMEOUT);
        assertThat(result.success).isFalse();
        assertThat(result.summary).isNull();
        assertThat(result.errorMessage).contains("resources.cubicles");
        results.expectTerminated(runner, RUN_TIMEOUT);
    }
}
