package com.edsim.metrics;

import com.edsim.messages.Messages.*;
import com.edsim.triage.TriageCategory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * MetricsCollector - in-memory event recorder that builds the {@link RunSummary}.
 *
 * Patients who arrived during the warm-up period are left out of every patient
 * figure; snapshots taken during warm-up are left out of the resource averages.
 */
public class MetricsCollector implements EventRecorder {

    private final double warmUp;

    private final Set<String> tracked = new HashSet<>();
    private final Map<TriageCategory, Integer> triageCounts = new EnumMap<>(TriageCategory.class);
    private final List<Double> triageWaits = new ArrayList<>();
    private double confidenceSum;
    private final Map<TriageCategory, List<Double>> waitsByCategory = new EnumMap<>(TriageCategory.class);
    private final List<Double> consultationWaits = new ArrayList<>();
    private final List<Double> consultationTimes = new ArrayList<>();
    private final List<Double> systemTimes = new ArrayList<>();
    private final Map<TriageCategory, Integer> breaches = new EnumMap<>(TriageCategory.class);
    private int admissions;
    private int discharges;
    private int leftWithoutBeingSeen;
    private int fourHourBreaches;

    private final Map<String, Double> utilizationSums = new LinkedHashMap<>();
    private final Map<String, Double> queueSums = new LinkedHashMap<>();
    private int snapshots;
    private int peakPatientsInSystem;

    private double endTime;

    public MetricsCollector(double warmUp) {
        this.warmUp = warmUp;
    }

    @Override
    public void record(SimulationEvent event) {
        endTime = Math.max(endTime, event.time());

        if (event instanceof PatientArrived) {
            onArrival((PatientArrived) event);
        } else if (event instanceof TriageCompleted) {
            onTriage((TriageCompleted) event);
        } else if (event instanceof ConsultationStarted) {
            onConsultationStarted((ConsultationStarted) event);
        } else if (event instanceof ConsultationCompleted) {
            onConsultationCompleted((ConsultationCompleted) event);
        } else if (event instanceof DispositionRecorded) {
            onDisposition((DispositionRecorded) event);
        } else if (event instanceof PatientLeftWithoutBeingSeen) {
            onLeft((PatientLeftWithoutBeingSeen) event);
        } else if (event instanceof ResourceSnapshot) {
            onSnapshot((ResourceSnapshot) event);
        }
    }

    private void onArrival(PatientArrived event) {
        if (event.time >= warmUp) {
            tracked.add(event.patientId);
        }
    }

    private void onTriage(TriageCompleted event) {
        if (!tracked.contains(event.patientId)) {
            return;
        }
        triageCounts.merge(event.verdict.category, 1, Integer::sum);
        confidenceSum += event.verdict.confidence;
        triageWaits.add(event.triageWait);
    }

    private void onConsultationStarted(ConsultationStarted event) {
        if (!tracked.contains(event.patientId)) {
            return;
        }
        waitsByCategory.computeIfAbsent(event.category, c -> new ArrayList<>()).add(event.waitMinutes);
        consultationWaits.add(event.waitMinutes);
        if (event.breachedTarget()) {
            breaches.merge(event.category, 1, Integer::sum);
        }
    }

    private void onConsultationCompleted(ConsultationCompleted event) {
        if (tracked.contains(event.patientId)) {
            consultationTimes.add(event.durationMinutes);
        }
    }

    private void onDisposition(DispositionRecorded event) {
        if (!tracked.contains(event.patientId)) {
            return;
        }
        if (event.admitted) {
            admissions++;
        } else {
            discharges++;
        }
        systemTimes.add(event.timeInSystem);
        if (event.timeInSystem > RunSummary.FOUR_HOURS) {
            fourHourBreaches++;
        }
    }

    private void onLeft(PatientLeftWithoutBeingSeen event) {
        if (tracked.contains(event.patientId)) {
            leftWithoutBeingSeen++;
        }
    }

    private void onSnapshot(ResourceSnapshot event) {
        if (event.time < warmUp) {
            return;
        }
        snapshots++;
        peakPatientsInSystem = Math.max(peakPatientsInSystem, event.patientsInSystem);
        event.pools.forEach((name, reading) -> {
            utilizationSums.merge(name, reading.utilization(), Double::sum);
            queueSums.merge(name, (double) reading.queueLength, Double::sum);
        });
    }

    public int arrivals() {
        return tracked.size();
    }

    public RunSummary summarize() {
        RunSummary.Builder b = new RunSummary.Builder();
        b.endTime = endTime;
        b.warmUp = warmUp;
        b.totalArrivals = tracked.size();
        b.admissions = admissions;
        b.discharges = discharges;
        b.leftWithoutBeingSeen = leftWithoutBeingSeen;
        b.stillInSystem = Math.max(0, tracked.size() - admissions - discharges - leftWithoutBeingSeen);

        int triaged = 0;
        for (TriageCategory category : TriageCategory.values()) {
            int count = triageCounts.getOrDefault(category, 0);
            b.triageCounts.put(category, count);
            b.targetBreaches.put(category, breaches.getOrDefault(category, 0));
            b.consultationWaitByCategory.put(category,
                DistributionSummary.of(waitsByCategory.getOrDefault(category, List.of())));
            triaged += count;
        }
        b.averageTriageConfidence = triaged == 0 ? 0.0 : confidenceSum / triaged;
        b.triageWaits = DistributionSummary.of(triageWaits);
        b.consultationWaits = DistributionSummary.of(consultationWaits);
        b.consultationTimes = DistributionSummary.of(consultationTimes);
        b.systemTimes = DistributionSummary.of(systemTimes);
        b.fourHourBreaches = fourHourBreaches;

        for (Map.Entry<String, Double> entry : utilizationSums.entrySet()) {
            b.averageUtilization.put(entry.getKey(), entry.getValue() / snapshots);
            b.averageQueueLength.put(entry.getKey(), queueSums.get(entry.getKey()) / snapshots);
        }
        b.peakPatientsInSystem = peakPatientsInSystem;
        b.snapshots = snapshots;
        return b.build();
    }
}
