package com.edsim.kernel;

import java.util.List;
import java.util.function.Consumer;

/**
 * A request for one unit of each listed pool, waiting in the {@link ResourceArbiter}.
 */
public final class ResourceRequest {

    public enum State { PENDING, GRANTED, CANCELLED }

    private final List<ResourcePool> pools;
    private final int priority;
    private final long sequence;
    private final double requestedAt;
    private final Consumer<ResourceGrant> onGranted;
    private State state = State.PENDING;
    private ResourceGrant grant;

    ResourceRequest(List<ResourcePool> pools, int priority, long sequence, double requestedAt,
                    Consumer<ResourceGrant> onGranted) {
        this.pools = pools;
        this.priority = priority;
        this.sequence = sequence;
        this.requestedAt = requestedAt;
        this.onGranted = onGranted;
    }

    public List<ResourcePool> pools() {
        return pools;
    }

    public int priority() {
        return priority;
    }

    public long sequence() {
        return sequence;
    }

    public double requestedAt() {
        return requestedAt;
    }

    public State state() {
        return state;
    }

    public boolean isPending() {
        return state == State.PENDING;
    }

    public ResourceGrant grant() {
        return grant;
    }

    void markGranted(ResourceGrant grant) {
        this.grant = grant;
        this.state = State.GRANTED;
    }

    void markCancelled() {
        this.state = State.CANCELLED;
    }

    void notifyGranted() {
        onGranted.accept(grant);
    }
}
