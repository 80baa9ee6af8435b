package com.edsim.kernel;

import java.util.List;
import java.util.Random;

/**
 * Seeded random source shared by every component of one run.
 */
public final class SimulationRandom {

    private final Random random;

    public SimulationRandom(long seed) {
        this.random = new Random(seed);
    }

    public double uniform() {
        return random.nextDouble();
    }

    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    public double normal(double mean, double std) {
        if (std <= 0) {
            return mean;
        }
        return mean + std * random.nextGaussian();
    }

    /**
     * Normal sample floored at {@code minimum}.
     */
    public double clampedNormal(double mean, double std, double minimum) {
        return Math.max(minimum, normal(mean, std));
    }

    /**
     * Exponential inter-event time for the given rate (events per minute).
     */
    public double exponential(double rate) {
        if (rate <= 0) {
            throw new IllegalArgumentException("Rate must be positive, got " + rate);
        }
        return -Math.log(1.0 - random.nextDouble()) / rate;
    }

    public boolean bernoulli(double probability) {
        return random.nextDouble() < probability;
    }

    public <T> T pick(List<T> options) {
        return options.get(random.nextInt(options.size()));
    }
}
