package com.edsim.messages;

import akka.actor.typed.ActorRef;
import com.edsim.config.SimulationParameters;
import com.edsim.metrics.RunSummary;
import com.edsim.patient.PatientStatus;
import com.edsim.triage.TriageCategory;
import com.edsim.triage.TriageVerdict;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized message definitions for the ED simulation.
 * Simulation events double as metrics commands, so recorders can tell them straight to the metrics actor.
 */
public class Messages {

    // ========== METRICS MESSAGES ==========
    public interface MetricsCommand {}

    /** Something that happened at a simulated instant. */
    public interface SimulationEvent extends MetricsCommand {
        double time();
    }

    public static class PatientArrived implements SimulationEvent {
        public final double time;
        public final String patientId;
        public final int age;
        public final String complaint;

        public PatientArrived(double time, String patientId, int age, String complaint) {
            this.time = time;
            this.patientId = patientId;
            this.age = age;
            this.complaint = complaint;
        }

        @Override
        public double time() {
            return time;
        }
    }

    public static class TriageCompleted implements SimulationEvent {
        public final double time;
        public final String patientId;
        public final double arrivalTime;
        public final TriageVerdict verdict;
        public final double triageWait;
        public final double triageDuration;

        public TriageCompleted(double time, String patientId, double arrivalTime, TriageVerdict verdict,
                               double triageWait, double triageDuration) {
            this.time = time;
            this.patientId = patientId;
            this.arrivalTime = arrivalTime;
            this.verdict = verdict;
            this.triageWait = triageWait;
            this.triageDuration = triageDuration;
        }

        @Override
        public double time() {
            return time;
        }
    }

    public static class ConsultationStarted implements SimulationEvent {
        public final double time;
        public final String patientId;
        public final double arrivalTime;
        public final TriageCategory category;
        public final double waitMinutes;
        public final int targetWaitMinutes;

        public ConsultationStarted(double time, String patientId, double arrivalTime, TriageCategory category,
                                   double waitMinutes, int targetWaitMinutes) {
            this.time = time;
            this.patientId = patientId;
            this.arrivalTime = arrivalTime;
            this.category = category;
            this.waitMinutes = waitMinutes;
            this.targetWaitMinutes = targetWaitMinutes;
        }

        public boolean breachedTarget() {
            return waitMinutes > targetWaitMinutes;
        }

        @Override
        public double time() {
            return time;
        }
    }

    public static class ConsultationCompleted implements SimulationEvent {
        public final double time;
        public final String patientId;
        public final double arrivalTime;
        public final TriageCategory category;
        public final double durationMinutes;

        public ConsultationCompleted(double time, String patientId, double arrivalTime, TriageCategory category,
                                     double durationMinutes) {
            this.time = time;
            this.patientId = patientId;
            this.arrivalTime = arrivalTime;
            this.category = category;
            this.durationMinutes = durationMinutes;
        }

        @Override
        public double time() {
            return time;
        }
    }

    public static class DispositionRecorded implements SimulationEvent {
        public final double time;
        public final String patientId;
        public final double arrivalTime;
        public final TriageCategory category;
        public final boolean admitted;
        public final double timeInSystem;

        public DispositionRecorded(double time, String patientId, double arrivalTime, TriageCategory category,
                                   boolean admitted, double timeInSystem) {
            this.time = time;
            this.patientId = patientId;
            this.arrivalTime = arrivalTime;
            this.category = category;
            this.admitted = admitted;
            this.timeInSystem = timeInSystem;
        }

        @Override
        public double time() {
            return time;
        }
    }

    public static class PatientLeftWithoutBeingSeen implements SimulationEvent {
        public final double time;
        public final String patientId;
        public final double arrivalTime;
        public final TriageCategory category;   // null when triage never finished
        public final PatientStatus leftFrom;
        public final double waitedMinutes;

        public PatientLeftWithoutBeingSeen(double time, String patientId, double arrivalTime,
                                           TriageCategory category, PatientStatus leftFrom, double waitedMinutes) {
            this.time = time;
            this.patientId = patientId;
            this.arrivalTime = arrivalTime;
            this.category = category;
            this.leftFrom = leftFrom;
            this.waitedMinutes = waitedMinutes;
        }

        @Override
        public double time() {
            return time;
        }
    }

    public static class PoolReading {
        public final int held;
        public final int capacity;
        public final int queueLength;

        public PoolReading(int held, int capacity, int queueLength) {
            this.held = held;
            this.capacity = capacity;
            this.queueLength = queueLength;
        }

        public double utilization() {
            return capacity == 0 ? 0.0 : (double) held / capacity;
        }
    }

    public static class ResourceSnapshot implements SimulationEvent {
        public final double time;
        public final Map<String, PoolReading> pools;
        public final Map<TriageCategory, Integer> categoryQueues;
        public final int patientsInSystem;

        public ResourceSnapshot(double time, Map<String, PoolReading> pools,
                                Map<TriageCategory, Integer> categoryQueues, int patientsInSystem) {
            this.time = time;
            this.pools = Collections.unmodifiableMap(new LinkedHashMap<>(pools));
            this.categoryQueues = Collections.unmodifiableMap(new EnumMap<>(categoryQueues));
            this.patientsInSystem = patientsInSystem;
        }

        @Override
        public double time() {
            return time;
        }
    }

    public static class SimulationFinished implements SimulationEvent {
        public final double time;
        public final int patientsInSystem;
        public final long processedEvents;

        public SimulationFinished(double time, int patientsInSystem, long processedEvents) {
            this.time = time;
            this.patientsInSystem = patientsInSystem;
            this.processedEvents = processedEvents;
        }

        @Override
        public double time() {
            return time;
        }
    }

    public static class GetSummary implements MetricsCommand {
        public final ActorRef<RunSummary> replyTo;

        public GetSummary(ActorRef<RunSummary> replyTo) {
            this.replyTo = replyTo;
        }
    }

    // ========== SCENARIO MESSAGES ==========
    public interface ScenarioCommand {}

    public static class RunScenario implements ScenarioCommand {
        public final String scenario;
        public final SimulationParameters parameters;
        public final ActorRef<ScenarioResult> replyTo;

        public RunScenario(String scenario, SimulationParameters parameters, ActorRef<ScenarioResult> replyTo) {
            this.scenario = scenario;
            this.parameters = parameters;
            this.replyTo = replyTo;
        }
    }

    public static class ScenarioResult {
        public final String scenario;
        public final RunSummary summary;
        public final boolean success;
        public final String errorMessage;

        private ScenarioResult(String scenario, RunSummary summary, boolean success, String errorMessage) {
            this.scenario = scenario;
            this.summary = summary;
            this.success = success;
            this.errorMessage = errorMessage;
        }

        public static ScenarioResult success(String scenario, RunSummary summary) {
            return new ScenarioResult(scenario, summary, true, null);
        }

        public static ScenarioResult failure(String scenario, String errorMessage) {
            return new ScenarioResult(scenario, null, false, errorMessage);
        }
    }

    // ========== SUPERVISOR MESSAGES ==========
    public interface SupervisorCommand {}

    public static class CompareScenarios implements SupervisorCommand {
        public final List<String> scenarios;
        public final ActorRef<ScenarioComparison> replyTo;

        public CompareScenarios(List<String> scenarios, ActorRef<ScenarioComparison> replyTo) {
            this.scenarios = List.copyOf(scenarios);
            this.replyTo = replyTo;
        }
    }

    public static class ScenarioComparison {
        public final Map<String, RunSummary> summaries;
        public final Map<String, String> failures;

        public ScenarioComparison(Map<String, RunSummary> summaries, Map<String, String> failures) {
            this.summaries = Collections.unmodifiableMap(new LinkedHashMap<>(summaries));
            this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        }
    }

    // ========== LOGGING MESSAGES ==========
    public interface LogCommand {}

    public static class LogEvent implements LogCommand {
        public final String scenario;
        public final String source;
        public final String event;
        public final String level;
        public final Double simulatedTime;   // null for events outside a run
        public final Instant timestamp;

        public LogEvent(String scenario, String source, String event, String level) {
            this(scenario, source, event, level, null);
        }

        public LogEvent(String scenario, String source, String event, String level, Double simulatedTime) {
            this.scenario = scenario;
            this.source = source;
            this.event = event;
            this.level = level;
            this.simulatedTime = simulatedTime;
            this.timestamp = Instant.now();
        }
    }
}
