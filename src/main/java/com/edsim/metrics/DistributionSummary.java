package com.edsim.metrics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Descriptive statistics over a sample of minutes.
 */
public final class DistributionSummary {

    public static final DistributionSummary EMPTY = new DistributionSummary(0, 0, 0, 0, 0, 0, 0);

    public final int count;
    public final double mean;
    public final double median;
    public final double std;
    public final double min;
    public final double max;
    public final double p90;

    private DistributionSummary(int count, double mean, double median, double std, double min, double max, double p90) {
        this.count = count;
        this.mean = mean;
        this.median = median;
        this.std = std;
        this.min = min;
        this.max = max;
        this.p90 = p90;
    }

    public static DistributionSummary of(Collection<Double> values) {
        if (values.isEmpty()) {
            return EMPTY;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int n = sorted.size();

        double sum = 0.0;
        for (double v : sorted) {
            sum += v;
        }
        double mean = sum / n;
        double squares = 0.0;
        for (double v : sorted) {
            squares += (v - mean) * (v - mean);
        }
        double std = n > 1 ? Math.sqrt(squares / (n - 1)) : 0.0;

        return new DistributionSummary(n, mean, percentile(sorted, 50), std,
            sorted.get(0), sorted.get(n - 1), percentile(sorted, 90));
    }

    /** Linear interpolation between closest ranks. */
    static double percentile(List<Double> sorted, double percent) {
        if (sorted.size() == 1) {
            return sorted.get(0);
        }
        double rank = percent / 100.0 * (sorted.size() - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted.get(lower) + fraction * (sorted.get(upper) - sorted.get(lower));
    }

    @Override
    public String toString() {
        if (count == 0) {
            return "n=0";
        }
        return String.format("n=%d mean=%.1f median=%.1f sd=%.1f min=%.1f max=%.1f p90=%.1f",
            count, mean, median, std, min, max, p90);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DistributionSummary)) {
            return false;
        }
        DistributionSummary other = (DistributionSummary) o;
        return count == other.count && Double.compare(mean, other.mean) == 0
            && Double.compare(median, other.median) == 0 && Double.compare(std, other.std) == 0
            && Double.compare(min, other.min) == 0 && Double.compare(max, other.max) == 0
            && Double.compare(p90, other.p90) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, mean, median, std, min, max, p90);
    }
}
