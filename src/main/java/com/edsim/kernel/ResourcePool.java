package com.edsim.kernel;

/**
 * ResourcePool - a named, capacity-limited resource such as doctors or cubicles.
 *
 * Units are taken and returned only by the {@link ResourceArbiter}, which keeps
 * {@code 0 <= held <= capacity} at all times.
 */
public final class ResourcePool {

    private final String name;
    private final int capacity;
    private int held;
    private int waiting;

    ResourcePool(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity of pool '" + name + "' must be positive, got " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
    }

    public String name() {
        return name;
    }

    public int capacity() {
        return capacity;
    }

    public int held() {
        return held;
    }

    public int available() {
        return capacity - held;
    }

    /**
     * Number of pending requests that include this pool.
     */
    public int queueLength() {
        return waiting;
    }

    public double utilization() {
        return (double) held / capacity;
    }

    boolean hasFreeUnit() {
        return held < capacity;
    }

    void takeUnit() {
        if (held >= capacity) {
            throw new IllegalStateException("Pool '" + name + "' is exhausted (" + held + "/" + capacity + ")");
        }
        held++;
    }

    void returnUnit() {
        if (held <= 0) {
            throw new IllegalStateException("Pool '" + name + "' has no held unit to release");
        }
        held--;
    }

    void requestQueued() {
        waiting++;
    }

    void requestLeftQueue() {
        waiting--;
    }

    @Override
    public String toString() {
        return String.format("%s[%d/%d, queue=%d]", name, held, capacity, waiting);
    }
}
