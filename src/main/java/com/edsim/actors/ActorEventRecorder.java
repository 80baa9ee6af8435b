package com.edsim.actors;

import akka.actor.typed.ActorRef;
import com.edsim.messages.Messages.MetricsCommand;
import com.edsim.messages.Messages.SimulationEvent;
import com.edsim.metrics.EventRecorder;

/**
 * Forwards every simulation event to a metrics actor.
 */
public final class ActorEventRecorder implements EventRecorder {

    private final ActorRef<MetricsCommand> metrics;

    public ActorEventRecorder(ActorRef<MetricsCommand> metrics) {
        this.metrics = metrics;
    }

    @Override
    public void record(SimulationEvent event) {
        metrics.tell(event);
    }
}
