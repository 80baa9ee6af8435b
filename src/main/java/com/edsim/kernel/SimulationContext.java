package com.edsim.kernel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.PriorityQueue;

/**
 * SimulationContext - virtual clock and event queue for one simulation run.
 *
 * Time only moves forward by popping the earliest pending event; events
 * scheduled for the same instant run in the order they were scheduled.
 * Everything here is single-threaded: callbacks run one at a time and may
 * schedule further events or touch resource pools freely.
 */
public final class SimulationContext {

    private static final Logger log = LoggerFactory.getLogger(SimulationContext.class);

    private final PriorityQueue<ScheduledEvent> eventQueue = new PriorityQueue<>();
    private final SimulationRandom random;
    private final ResourceArbiter arbiter;
    private double now;
    private long nextSequence;
    private long processedEvents;

    public SimulationContext(long seed) {
        this.random = new SimulationRandom(seed);
        this.arbiter = new ResourceArbiter(this);
    }

    public double now() {
        return now;
    }

    public SimulationRandom random() {
        return random;
    }

    public ResourceArbiter arbiter() {
        return arbiter;
    }

    public ResourcePool createPool(String name, int capacity) {
        return new ResourcePool(name, capacity);
    }

    /**
     * Schedules {@code action} to run {@code delay} minutes from now.
     */
    public ScheduledEvent schedule(double delay, Runnable action) {
        if (delay < 0 || Double.isNaN(delay)) {
            throw new IllegalArgumentException("Delay must be non-negative, got " + delay);
        }
        ScheduledEvent event = new ScheduledEvent(now + delay, nextSequence++, action);
        eventQueue.add(event);
        return event;
    }

    /**
     * Runs every event due at or before {@code horizon}, then parks the clock at the horizon.
     * Events scheduled beyond the horizon stay queued for a later call.
     */
    public void runUntil(double horizon) {
        if (horizon < now) {
            throw new IllegalArgumentException(
                String.format("Horizon %.2f is before the current time %.2f", horizon, now));
        }
        log.debug("⏱️ Running simulation from t={} to t={}", now, horizon);

        while (!eventQueue.isEmpty() && eventQueue.peek().time() <= horizon) {
            ScheduledEvent event = eventQueue.poll();
            if (event.isCancelled()) {
                continue;
            }
            now = event.time();
            processedEvents++;
            event.fire();
        }
        now = horizon;
    }

    public int pendingEvents() {
        int pending = 0;
        for (ScheduledEvent event : eventQueue) {
            if (!event.isCancelled()) {
                pending++;
            }
        }
        return pending;
    }

    public long processedEvents() {
        return processedEvents;
    }

    /**
     * Formats a simulated minute offset as a day-relative clock, e.g. {@code 13:05}.
     */
    public static String formatClock(double minutes) {
        long total = (long) Math.floor(minutes);
        long day = total / 1440;
        long hour = (total % 1440) / 60;
        long minute = total % 60;
        return day > 0
            ? String.format("D%d %02d:%02d", day + 1, hour, minute)
            : String.format("%02d:%02d", hour, minute);
    }
}
