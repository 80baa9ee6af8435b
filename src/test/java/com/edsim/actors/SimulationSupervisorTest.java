package com.edsim.actors;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import akka.actor.testkit.typed.javadsl.TestProbe;
import akka.actor.typed.ActorRef;
import com.edsim.config.ScenarioCatalog;
import com.edsim.messages.Messages.*;
import com.edsim.metrics.RunSummary;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SimulationSupervisorTest {

    private static final ActorTestKit testKit = ActorTestKit.create();
    private static final Duration COMPARISON_TIMEOUT = Duration.ofSeconds(60);

    private static final ScenarioCatalog CATALOG = new ScenarioCatalog(ConfigFactory.parseString(String.join("\n",
        "edsim.simulation.duration = 480",
        "edsim.simulation.warm-up = 60",
        "edsim.scenarios {",
        "  quiet { arrivals.rate-per-hour = 3 }",
        "  busy { arrivals.rate-per-hour = 24, resources.doctors = 2 }",
        "  broken { resources.doctors = 0 }",
        "}")).withFallback(ConfigFactory.load()).resolve());

    @AfterAll
    static void tearDown() {
        testKit.shutdownTestKit();
    }

    @Test
    void comparesScenariosInRequestedOrder() {
        ActorRef<SupervisorCommand> supervisor = testKit.spawn(SimulationSupervisor.create(CATALOG));
        TestProbe<ScenarioComparison> probe = testKit.createTestProbe();

        supervisor.tell(new CompareScenarios(List.of("busy", "quiet", "busy"), probe.getRef()));

        ScenarioComparison comparison = probe.receiveMessage(COMPARISON_TIMEOUT);
        assertThat(comparison.failures).isEmpty();
        assertThat(comparison.summaries).containsOnlyKeys("busy", "quiet");
        assertThat(comparison.summaries.keySet()).containsExactly("busy", "quiet");

        RunSummary busy = comparison.summaries.get("busy");
        RunSummary quiet = comparison.summaries.get("quiet");
        assertThat(busy.totalArrivals).isGreaterThan(quiet.totalArrivals);
        assertThat(busy.endTime).isEqualTo(480.0);
    }

    @Test
    void unknownAndInvalidScenariosAreReportedAsFailures() {
        ActorRef<SupervisorCommand> supervisor = testKit.spawn(SimulationSupervisor.create(CATALOG));
        TestProbe<ScenarioComparison> probe = testKit.createTestProbe();

        supervisor.tell(new CompareScenarios(List.of("holiday", "quiet", "broken"), probe.getRef()));

        ScenarioComparison comparison = probe.receiveMessage(COMPARISON_TIMEOUT);
        assertThat(comparison.summaries).containsOnlyKeys("quiet");
        assertThat(comparison.failures.keySet()).containsExactly("holiday", "broken");
        assertThat(comparison.failures.get("holiday")).contains("Unknown scenario");
        assertThat(comparison.failures.get("broken")).contains("resources.doctors");
    }

    @Test
    void emptyRequestRunsEveryScenario() {
        ActorRef<SupervisorCommand> supervisor = testKit.spawn(SimulationSupervisor.create(CATALOG));
        TestProbe<ScenarioComparison> probe = testKit.createTestProbe();

        supervisor.tell(new CompareScenarios(List.of(), probe.getRef()));

        ScenarioComparison comparison = probe.receiveMessage(COMPARISON_TIMEOUT);
        assertThat(comparison.summaries.size() + comparison.failures.size()).isEqualTo(CATALOG.names().size());
        assertThat(comparison.failures).containsOnlyKeys("broken");
    }
}
