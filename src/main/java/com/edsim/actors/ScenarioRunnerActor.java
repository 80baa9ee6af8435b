package com.edsim.actors;

import akka.actor.typed.*;
import akka.actor.typed.javadsl.*;
import com.edsim.config.ConfigurationException;
import com.edsim.department.EmergencyDepartmentSimulation;
import com.edsim.messages.Messages.*;
import com.edsim.metrics.RunSummary;

import java.time.Duration;
import java.util.concurrent.CompletionStage;

/**
 * ScenarioRunnerActor - runs a single scenario to completion.
 * The simulation runs inside the message handler, so the runner belongs on the blocking dispatcher.
 * Events flow to a child {@link MetricsActor} by tell; the summary comes back by ask and pipeToSelf.
 */
public class ScenarioRunnerActor extends AbstractBehavior<ScenarioCommand> {

    private static final Duration SUMMARY_TIMEOUT = Duration.ofSeconds(30);

    private final ActorRef<LogCommand> logger;
    private boolean busy = false;

    // Internal message: summary collected from the metrics child
    public static class SummaryReady implements ScenarioCommand {
        public final String scenario;
        public final ActorRef<ScenarioResult> replyTo;
        public final ActorRef<MetricsCommand> metrics;
        public final RunSummary summary;
        public final String error;

        public SummaryReady(String scenario, ActorRef<ScenarioResult> replyTo, ActorRef<MetricsCommand> metrics,
                            RunSummary summary, String error) {
            this.scenario = scenario;
            this.replyTo = replyTo;
            this.metrics = metrics;
            this.summary = summary;
            this.error = error;
        }
    }

    public static Behavior<ScenarioCommand> create(ActorRef<LogCommand> logger) {
        return Behaviors.setup(context -> new ScenarioRunnerActor(context, logger));
    }

    private ScenarioRunnerActor(ActorContext<ScenarioCommand> context, ActorRef<LogCommand> logger) {
        super(context);
        this.logger = logger;
    }

    @Override
    public Receive<ScenarioCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(RunScenario.class, this::onRunScenario)
                .onMessage(SummaryReady.class, this::onSummaryReady)
                .build();
    }

    private Behavior<ScenarioCommand> onRunScenario(RunScenario msg) {
        if (busy) {
            msg.replyTo.tell(ScenarioResult.failure(msg.scenario, "Runner is already running a scenario"));
            return this;
        }
        busy = true;
        logger.tell(new LogEvent(msg.scenario, "ScenarioRunner", "Starting scenario", "INFO"));

        ActorRef<MetricsCommand> metrics = getContext().spawn(
            MetricsActor.create(msg.parameters.warmUp), "metrics");

        EmergencyDepartmentSimulation simulation;
        try {
            simulation = EmergencyDepartmentSimulation.builder(msg.parameters)
                .eventRecorder(new ActorEventRecorder(metrics))
                .build();
            simulation.run();
        } catch (ConfigurationException e) {
            logger.tell(new LogEvent(msg.scenario, "ScenarioRunner",
                "Invalid configuration: " + String.join("; ", e.errors()), "ERROR"));
            msg.replyTo.tell(ScenarioResult.failure(msg.scenario, e.getMessage()));
            return Behaviors.stopped();
        } catch (RuntimeException e) {
            getContext().getLog().error("❌ Scenario {} failed", msg.scenario, e);
            logger.tell(new LogEvent(msg.scenario, "ScenarioRunner", "Simulation failed: " + e.getMessage(), "ERROR"));
            msg.replyTo.tell(ScenarioResult.failure(msg.scenario, e.toString()));
            return Behaviors.stopped();
        }

        logger.tell(new LogEvent(msg.scenario, "ScenarioRunner",
            String.format("Simulation complete: %d arrivals, %d still in ED",
                simulation.arrivals().generated(), simulation.department().patientsInSystem()),
            "INFO", simulation.context().now()));

        CompletionStage<RunSummary> summaryFuture = AskPattern.ask(
            metrics,
            replyTo -> new GetSummary(replyTo),
            SUMMARY_TIMEOUT,
            getContext().getSystem().scheduler()
        );

        getContext().pipeToSelf(summaryFuture, (summary, failure) -> {
            if (failure != null) {
                return new SummaryReady(msg.scenario, msg.replyTo, metrics, null, failure.getMessage());
            }
            return new SummaryReady(msg.scenario, msg.replyTo, metrics, summary, null);
        });
        return this;
    }

    private Behavior<ScenarioCommand> onSummaryReady(SummaryReady msg) {
        getContext().stop(msg.metrics);
        if (msg.summary == null) {
            logger.tell(new LogEvent(msg.scenario, "ScenarioRunner", "Metrics unavailable: " + msg.error, "ERROR"));
            msg.replyTo.tell(ScenarioResult.failure(msg.scenario, "Metrics unavailable: " + msg.error));
        } else {
            logger.tell(new LogEvent(msg.scenario, "ScenarioRunner",
                String.format("Summary ready: %d departures, %.1f%% admitted",
                    msg.summary.totalDepartures(), msg.summary.admissionRate() * 100),
                "INFO", msg.summary.endTime));
            msg.replyTo.tell(ScenarioResult.success(msg.scenario, msg.summary));
        }
        return Behaviors.stopped();
    }
}
