package com.edsim.actors;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import akka.actor.testkit.typed.javadsl.TestProbe;
import akka.actor.typed.ActorRef;
import com.edsim.messages.Messages.*;
import com.edsim.metrics.RunSummary;
import com.edsim.patient.PatientStatus;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsActorTest {

    private static final ActorTestKit testKit = ActorTestKit.create();

    @AfterAll
    static void tearDown() {
        testKit.shutdownTestKit();
    }

    @Test
    void summarizesEventsToldBeforeTheAsk() {
        ActorRef<MetricsCommand> metrics = testKit.spawn(MetricsActor.create(0));
        TestProbe<RunSummary> probe = testKit.createTestProbe();

        metrics.tell(new PatientArrived(1, "P1", 30, "cough"));
        metrics.tell(new PatientArrived(2, "P2", 40, "rash"));
        metrics.tell(new PatientLeftWithoutBeingSeen(250, "P2", 2, null, PatientStatus.WAITING_TRIAGE, 248));
        metrics.tell(new SimulationFinished(300, 1, 42));
        metrics.tell(new GetSummary(probe.getRef()));

        RunSummary summary = probe.receiveMessage();
        assertThat(summary.totalArrivals).isEqualTo(2);
        assertThat(summary.leftWithoutBeingSeen).isEqualTo(1);
        assertThat(summary.stillInSystem).isEqualTo(1);
        assertThat(summary.endTime).isEqualTo(300.0);
    }

    @Test
    void recorderForwardsToTheActor() {
        ActorRef<MetricsCommand> metrics = testKit.spawn(MetricsActor.create(0));
        TestProbe<RunSummary> probe = testKit.createTestProbe();

        new ActorEventRecorder(metrics).record(new PatientArrived(5, "P1", 30, "cough"));
        metrics.tell(new GetSummary(probe.getRef()));

        assertThat(probe.receiveMessage().totalArrivals).isEqualTo(1);
    }
}
