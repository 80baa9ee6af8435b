package com.edsim.metrics;

import com.edsim.messages.Messages.SimulationEvent;

/**
 * Receives every simulation event of a run, in simulated-time order.
 */
@FunctionalInterface
public interface EventRecorder {

    EventRecorder NONE = event -> { };

    void record(SimulationEvent event);

    default EventRecorder andThen(EventRecorder next) {
        return event -> {
            record(event);
            next.record(event);
        };
    }
}
