package com.edsim.actors;

import akka.actor.typed.*;
import akka.actor.typed.javadsl.*;
import com.edsim.config.ConfigurationException;
import com.edsim.config.ScenarioCatalog;
import com.edsim.config.SimulationParameters;
import com.edsim.messages.Messages.*;
import com.edsim.metrics.RunSummary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SimulationSupervisor - fans scenarios out to runner actors and gathers the results.
 * Each comparison gets its own collector child; runners are spawned on the blocking dispatcher.
 */
public class SimulationSupervisor extends AbstractBehavior<SupervisorCommand> {

    private final ScenarioCatalog catalog;
    private final ActorRef<LogCommand> logger;
    private int comparisons = 0;

    public static Behavior<SupervisorCommand> create(ScenarioCatalog catalog) {
        return Behaviors.setup(context -> new SimulationSupervisor(context, catalog));
    }

    private SimulationSupervisor(ActorContext<SupervisorCommand> context, ScenarioCatalog catalog) {
        super(context);
        this.catalog = catalog;
        this.logger = context.spawn(LoggerActor.create(), "logger");
        getContext().getLog().info("🏥 SimulationSupervisor ready with scenarios {}", catalog.names());
    }

    @Override
    public Receive<SupervisorCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(CompareScenarios.class, this::onCompareScenarios)
                .build();
    }

    private Behavior<SupervisorCommand> onCompareScenarios(CompareScenarios msg) {
        Set<String> names = new LinkedHashSet<>(msg.scenarios.isEmpty() ? catalog.names() : msg.scenarios);
        int comparison = ++comparisons;

        ActorRef<ScenarioResult> collector = getContext().spawn(
            ComparisonCollector.create(new ArrayList<>(names), msg.replyTo), "comparison-" + comparison);

        int index = 0;
        for (String name : names) {
            index++;
            SimulationParameters parameters;
            try {
                parameters = catalog.parameters(name);
            } catch (ConfigurationException e) {
                logger.tell(new LogEvent(name, "SimulationSupervisor", e.getMessage(), "WARNING"));
                collector.tell(ScenarioResult.failure(name, e.getMessage()));
                continue;
            }
            ActorRef<ScenarioCommand> runner = getContext().spawn(
                ScenarioRunnerActor.create(logger),
                "runner-" + comparison + "-" + index,
                DispatcherSelector.blocking());
            runner.tell(new RunScenario(name, parameters, collector));
        }
        return this;
    }

    // Collects one result per scenario, then replies and stops
    public static class ComparisonCollector extends AbstractBehavior<ScenarioResult> {
        private final List<String> expected;
        private final ActorRef<ScenarioComparison> replyTo;
        private final Map<String, RunSummary> summaries = new LinkedHashMap<>();
        private final Map<String, String> failures = new LinkedHashMap<>();

        public static Behavior<ScenarioResult> create(List<String> expected, ActorRef<ScenarioComparison> replyTo) {
            return Behaviors.setup(context -> new ComparisonCollector(context, expected, replyTo));
        }

        private ComparisonCollector(ActorContext<ScenarioResult> context, List<String> expected,
                                    ActorRef<ScenarioComparison> replyTo) {
            super(context);
            this.expected = List.copyOf(expected);
            this.replyTo = replyTo;
        }

        @Override
        public Receive<ScenarioResult> createReceive() {
            return newReceiveBuilder()
                    .onMessage(ScenarioResult.class, this::onResult)
                    .build();
        }

        private Behavior<ScenarioResult> onResult(ScenarioResult result) {
            if (result.success) {
                summaries.put(result.scenario, result.summary);
            } else {
                failures.put(result.scenario, result.errorMessage);
            }
            if (summaries.size() + failures.size() < expected.size()) {
                return this;
            }
            // report in the order requested
            Map<String, RunSummary> orderedSummaries = new LinkedHashMap<>();
            Map<String, String> orderedFailures = new LinkedHashMap<>();
            for (String name : expected) {
                if (summaries.containsKey(name)) {
                    orderedSummaries.put(name, summaries.get(name));
                } else if (failures.containsKey(name)) {
                    orderedFailures.put(name, failures.get(name));
                }
            }
            replyTo.tell(new ScenarioComparison(orderedSummaries, orderedFailures));
            return Behaviors.stopped();
        }
    }
}
