package com.edsim.kernel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * ResourceArbiter - grants pool units to waiting requests.
 *
 * Pending requests are served in (priority, arrival) order. A compound request
 * is granted only when every one of its pools has a free unit, and then takes
 * all of them at once, so a partial hold is never visible. A request that
 * cannot be served blocks its pools for everything queued behind it: later
 * requests never overtake an earlier one on a shared pool.
 *
 * Grant callbacks run synchronously, in the same scheduler step as the
 * acquire or release that made the grant possible.
 */
public final class ResourceArbiter {

    /** Priority for plain first-come first-served requests. */
    public static final int FIFO = 0;

    private static final Logger log = LoggerFactory.getLogger(ResourceArbiter.class);

    private final SimulationContext context;
    private final TreeSet<ResourceRequest> pending = new TreeSet<>(
        Comparator.comparingInt(ResourceRequest::priority).thenComparingLong(ResourceRequest::sequence));
    private long nextSequence;

    ResourceArbiter(SimulationContext context) {
        this.context = context;
    }

    public ResourceRequest acquire(ResourcePool pool, Consumer<ResourceGrant> onGranted) {
        return acquireAll(List.of(pool), FIFO, onGranted);
    }

    /**
     * Requests one unit of every pool in {@code pools}. Lower priority values are served first.
     * When the units are free right away the callback fires before this method returns.
     */
    public ResourceRequest acquireAll(List<ResourcePool> pools, int priority, Consumer<ResourceGrant> onGranted) {
        if (pools.isEmpty()) {
            throw new IllegalArgumentException("A request needs at least one pool");
        }
        if (new HashSet<>(pools).size() != pools.size()) {
            throw new IllegalArgumentException("Duplicate pool in request: " + pools);
        }
        ResourceRequest request = new ResourceRequest(
            List.copyOf(pools), priority, nextSequence++, context.now(), onGranted);
        pending.add(request);
        pools.forEach(ResourcePool::requestQueued);
        dispatch();
        return request;
    }

    /**
     * Returns every unit held by {@code grant} and hands freed capacity to waiting requests.
     */
    public void release(ResourceGrant grant) {
        grant.markReleased();
        grant.pools().forEach(ResourcePool::returnUnit);
        dispatch();
    }

    /**
     * Withdraws a pending request. Nothing is released, because nothing was acquired.
     *
     * @return false when the request was no longer pending
     */
    public boolean cancel(ResourceRequest request) {
        if (!request.isPending() || !pending.remove(request)) {
            return false;
        }
        request.markCancelled();
        request.pools().forEach(ResourcePool::requestLeftQueue);
        // the cancelled request may have been blocking others behind it
        dispatch();
        return true;
    }

    public int pendingRequests() {
        return pending.size();
    }

    private void dispatch() {
        List<ResourceRequest> granted = new ArrayList<>();
        Set<ResourcePool> blocked = new HashSet<>();

        Iterator<ResourceRequest> iterator = pending.iterator();
        while (iterator.hasNext()) {
            ResourceRequest request = iterator.next();
            boolean canGrant = request.pools().stream()
                .allMatch(pool -> !blocked.contains(pool) && pool.hasFreeUnit());
            if (!canGrant) {
                blocked.addAll(request.pools());
                continue;
            }
            iterator.remove();
            for (ResourcePool pool : request.pools()) {
                pool.takeUnit();
                pool.requestLeftQueue();
            }
            request.markGranted(new ResourceGrant(request.pools(), context.now()));
            granted.add(request);
        }

        for (ResourceRequest request : granted) {
            if (log.isTraceEnabled()) {
                log.trace("🔑 Granted {} after {} min", request.pools(), context.now() - request.requestedAt());
            }
            request.notifyGranted();
        }
    }
}
