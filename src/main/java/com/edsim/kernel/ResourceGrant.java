package com.edsim.kernel;

import java.util.List;

/**
 * Token for units held on one or more pools. Released exactly once, all pools together.
 */
public final class ResourceGrant {

    private final List<ResourcePool> pools;
    private final double grantedAt;
    private boolean released;

    ResourceGrant(List<ResourcePool> pools, double grantedAt) {
        this.pools = pools;
        this.grantedAt = grantedAt;
    }

    public List<ResourcePool> pools() {
        return pools;
    }

    public double grantedAt() {
        return grantedAt;
    }

    public boolean isReleased() {
        return released;
    }

    void markReleased() {
        if (released) {
            throw new IllegalStateException("Grant on " + pools + " was already released");
        }
        released = true;
    }
}
