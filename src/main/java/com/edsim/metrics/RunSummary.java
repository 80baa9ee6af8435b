package com.edsim.metrics;

import com.edsim.triage.TriageCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * End-of-run figures. Patient figures cover arrivals after the warm-up period only.
 */
public final class RunSummary {

    public static final double FOUR_HOURS = 240.0;

    public final double endTime;
    public final double warmUp;

    public final int totalArrivals;
    public final int admissions;
    public final int discharges;
    public final int leftWithoutBeingSeen;
    public final int stillInSystem;

    public final Map<TriageCategory, Integer> triageCounts;
    public final double averageTriageConfidence;
    public final DistributionSummary triageWaits;

    public final Map<TriageCategory, DistributionSummary> consultationWaitByCategory;
    public final DistributionSummary consultationWaits;
    public final DistributionSummary consultationTimes;
    public final DistributionSummary systemTimes;

    public final Map<TriageCategory, Integer> targetBreaches;
    public final int fourHourBreaches;

    public final Map<String, Double> averageUtilization;
    public final Map<String, Double> averageQueueLength;
    public final int peakPatientsInSystem;
    public final int snapshots;

    RunSummary(Builder b) {
        this.endTime = b.endTime;
        this.warmUp = b.warmUp;
        this.totalArrivals = b.totalArrivals;
        this.admissions = b.admissions;
        this.discharges = b.discharges;
        this.leftWithoutBeingSeen = b.leftWithoutBeingSeen;
        this.stillInSystem = b.stillInSystem;
        this.triageCounts = Collections.unmodifiableMap(new EnumMap<>(b.triageCounts));
        this.averageTriageConfidence = b.averageTriageConfidence;
        this.triageWaits = b.triageWaits;
        this.consultationWaitByCategory = Collections.unmodifiableMap(new EnumMap<>(b.consultationWaitByCategory));
        this.consultationWaits = b.consultationWaits;
        this.consultationTimes = b.consultationTimes;
        this.systemTimes = b.systemTimes;
        this.targetBreaches = Collections.unmodifiableMap(new EnumMap<>(b.targetBreaches));
        this.fourHourBreaches = b.fourHourBreaches;
        this.averageUtilization = Collections.unmodifiableMap(new LinkedHashMap<>(b.averageUtilization));
        this.averageQueueLength = Collections.unmodifiableMap(new LinkedHashMap<>(b.averageQueueLength));
        this.peakPatientsInSystem = b.peakPatientsInSystem;
        this.snapshots = b.snapshots;
    }

    public int totalDepartures() {
        return admissions + discharges + leftWithoutBeingSeen;
    }

    /** Admitted share of patients who finished a consultation. */
    public double admissionRate() {
        int seen = admissions + discharges;
        return seen == 0 ? 0.0 : (double) admissions / seen;
    }

    public double lwbsRate() {
        return totalArrivals == 0 ? 0.0 : (double) leftWithoutBeingSeen / totalArrivals;
    }

    /** Share of consultations in {@code category} that started after the category's target wait. */
    public double breachRate(TriageCategory category) {
        DistributionSummary waits = consultationWaitByCategory.get(category);
        if (waits == null || waits.count == 0) {
            return 0.0;
        }
        return (double) targetBreaches.getOrDefault(category, 0) / waits.count;
    }

    public int totalTargetBreaches() {
        int total = 0;
        for (int breaches : targetBreaches.values()) {
            total += breaches;
        }
        return total;
    }

    public double fourHourBreachRate() {
        return systemTimes.count == 0 ? 0.0 : (double) fourHourBreaches / systemTimes.count;
    }

    public String report() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("📊 Simulated %.0f min (warm-up %.0f)%n", endTime, warmUp));
        sb.append(String.format("   Arrivals %d | admitted %d | discharged %d | LWBS %d | still in ED %d%n",
            totalArrivals, admissions, discharges, leftWithoutBeingSeen, stillInSystem));
        sb.append(String.format("   Admission rate %.1f%% | LWBS rate %.1f%% | 4h breaches %d (%.1f%%)%n",
            admissionRate() * 100, lwbsRate() * 100, fourHourBreaches, fourHourBreachRate() * 100));
        sb.append(String.format("   Triage: %s, avg confidence %.2f%n", triageCounts, averageTriageConfidence));
        for (TriageCategory category : TriageCategory.values()) {
            DistributionSummary waits = consultationWaitByCategory.getOrDefault(category, DistributionSummary.EMPTY);
            sb.append(String.format("   %-6s wait %s | breaches %d (%.1f%%)%n",
                category, waits, targetBreaches.getOrDefault(category, 0), breachRate(category) * 100));
        }
        sb.append(String.format("   Consultation %s%n", consultationTimes));
        sb.append(String.format("   Time in system %s%n", systemTimes));
        averageUtilization.forEach((pool, utilization) -> sb.append(String.format(
            "   %-15s utilisation %.1f%% | avg queue %.2f%n",
            pool, utilization * 100, averageQueueLength.getOrDefault(pool, 0.0))));
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("RunSummary{arrivals=%d, admitted=%d, discharged=%d, lwbs=%d, inED=%d, triage=%s}",
            totalArrivals, admissions, discharges, leftWithoutBeingSeen, stillInSystem, triageCounts);
    }

    static final class Builder {
        double endTime;
        double warmUp;
        int totalArrivals;
        int admissions;
        int discharges;
        int leftWithoutBeingSeen;
        int stillInSystem;
        Map<TriageCategory, Integer> triageCounts = new EnumMap<>(TriageCategory.class);
        double averageTriageConfidence;
        DistributionSummary triageWaits = DistributionSummary.EMPTY;
        Map<TriageCategory, DistributionSummary> consultationWaitByCategory = new EnumMap<>(TriageCategory.class);
        DistributionSummary consultationWaits = DistributionSummary.EMPTY;
        DistributionSummary consultationTimes = DistributionSummary.EMPTY;
        DistributionSummary systemTimes = DistributionSummary.EMPTY;
        Map<TriageCategory, Integer> targetBreaches = new EnumMap<>(TriageCategory.class);
        int fourHourBreaches;
        Map<String, Double> averageUtilization = new LinkedHashMap<>();
        Map<String, Double> averageQueueLength = new LinkedHashMap<>();
        int peakPatientsInSystem;
        int snapshots;

        RunSummary build() {
            return new RunSummary(this);
        }
    }
}
