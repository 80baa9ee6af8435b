package com.edsim.kernel;

/**
 * A timed action held by the {@link SimulationContext}.
 * Cancelled events stay in the queue and are skipped when their time comes.
 */
public final class ScheduledEvent implements Comparable<ScheduledEvent> {

    private final double time;
    private final long sequence;
    private final Runnable action;
    private boolean cancelled;

    ScheduledEvent(double time, long sequence, Runnable action) {
        this.time = time;
        this.sequence = sequence;
        this.action = action;
    }

    public double time() {
        return time;
    }

    public long sequence() {
        return sequence;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void cancel() {
        cancelled = true;
    }

    void fire() {
        action.run();
    }

    @Override
    public int compareTo(ScheduledEvent other) {
        int byTime = Double.compare(time, other.time);
        return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
    }

    @Override
    public String toString() {
        return String.format("ScheduledEvent{t=%.2f, seq=%d%s}", time, sequence, cancelled ? ", cancelled" : "");
    }
}
