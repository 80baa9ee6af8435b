package com.edsim.actors;

import akka.actor.typed.*;
import akka.actor.typed.javadsl.*;
import com.edsim.messages.Messages.*;
import com.edsim.metrics.MetricsCollector;

/**
 * MetricsActor - accumulates the simulation events of one run.
 * Events arrive by tell; the summary is read with the ask pattern.
 */
public class MetricsActor extends AbstractBehavior<MetricsCommand> {

    private final MetricsCollector collector;

    public static Behavior<MetricsCommand> create(double warmUp) {
        return Behaviors.setup(context -> new MetricsActor(context, warmUp));
    }

    private MetricsActor(ActorContext<MetricsCommand> context, double warmUp) {
        super(context);
        this.collector = new MetricsCollector(warmUp);
    }

    @Override
    public Receive<MetricsCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(SimulationFinished.class, this::onFinished)
                .onMessage(SimulationEvent.class, this::onEvent)
                .onMessage(GetSummary.class, this::onGetSummary)
                .build();
    }

    private Behavior<MetricsCommand> onEvent(SimulationEvent event) {
        collector.record(event);
        return this;
    }

    private Behavior<MetricsCommand> onFinished(SimulationFinished event) {
        collector.record(event);
        getContext().getLog().debug("📊 Run finished at t={} after {} arrivals",
            event.time, collector.arrivals());
        return this;
    }

    private Behavior<MetricsCommand> onGetSummary(GetSummary msg) {
        msg.replyTo.tell(collector.summarize());
        return this;
    }
}
