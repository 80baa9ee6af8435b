package com.edsim.department;

import com.edsim.config.SimulationParameters;
import com.edsim.kernel.SimulationContext;
import com.edsim.messages.Messages.SimulationFinished;
import com.edsim.metrics.EventRecorder;
import com.edsim.patient.PatientRecord;
import com.edsim.patient.PatientRecordProvider;
import com.edsim.patient.SyntheticPatientRecordProvider;
import com.edsim.triage.FuzzyTriageService;
import com.edsim.triage.TriageService;
import com.edsim.triage.llm.ExternalTriageService;
import com.edsim.triage.llm.LlmTriageClient;
import com.edsim.triage.llm.LlmTriageSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * EmergencyDepartmentSimulation - wires clock, department, triage and arrivals for one run.
 *
 * Parameters are validated when the simulation is built, before anything is
 * scheduled. A simulation runs once.
 */
public class EmergencyDepartmentSimulation {

    private static final Logger log = LoggerFactory.getLogger(EmergencyDepartmentSimulation.class);

    private final SimulationParameters parameters;
    private final SimulationContext context;
    private final EmergencyDepartment department;
    private final ArrivalProcess arrivals;
    private final EventRecorder recorder;
    private boolean finished;

    private EmergencyDepartmentSimulation(Builder builder) {
        this.parameters = builder.parameters;
        this.recorder = builder.recorder;
        this.context = new SimulationContext(parameters.seed);

        TriageService triageService = builder.triageService != null
            ? builder.triageService : defaultTriageService(parameters);
        AbandonmentPolicy abandonmentPolicy = builder.abandonmentPolicy != null
            ? builder.abandonmentPolicy : AbandonmentPolicy.from(parameters.abandonment);

        this.department = new EmergencyDepartment(context, parameters, triageService, recorder, abandonmentPolicy);
        this.arrivals = new ArrivalProcess(context, ArrivalPattern.from(parameters.arrivals), builder.provider,
            department::admit, parameters.arrivalCutoff());
    }

    public static Builder builder(SimulationParameters parameters) {
        return new Builder(parameters);
    }

    /**
     * The fuzzy service, or the LLM service with fuzzy fallback when {@code triage.system = llm}.
     *
     * @throws com.edsim.config.ConfigurationException when the LLM endpoint in {@code .env} is malformed
     */
    public static TriageService defaultTriageService(SimulationParameters parameters) {
        return defaultTriageService(parameters, LlmTriageSettings::fromEnvironment);
    }

    static TriageService defaultTriageService(SimulationParameters parameters,
                                              Supplier<LlmTriageSettings> llmSettings) {
        FuzzyTriageService fuzzy = FuzzyTriageService.create(parameters);
        if ("llm".equals(parameters.triage.system)) {
            LlmTriageClient client = new LlmTriageClient(llmSettings.get());
            return new ExternalTriageService(client, fuzzy, parameters.categories);
        }
        return fuzzy;
    }

    /**
     * Adds a patient arriving at an absolute simulated time, on top of the arrival process.
     */
    public void scheduleArrival(double time, PatientRecord record) {
        if (time < context.now()) {
            throw new IllegalArgumentException("Arrival at " + time + " is in the past (now " + context.now() + ")");
        }
        context.schedule(time - context.now(), () -> department.admit(record));
    }

    public void run() {
        run(parameters.duration);
    }

    /**
     * Runs the department until {@code horizon} minutes of simulated time.
     */
    public void run(double horizon) {
        if (finished) {
            throw new IllegalStateException("Simulation has already run");
        }
        finished = true;
        log.info("🏥 Simulation starting: {} min, seed {}, {}", horizon, parameters.seed, parameters.resources);

        arrivals.start();
        department.startMonitoring();
        context.runUntil(horizon);

        recorder.record(new SimulationFinished(context.now(), department.patientsInSystem(),
            context.processedEvents()));
        log.info("🏁 Simulation finished at t={}: {} arrivals, {} completed, {} still in ED, {} events",
            context.now(), arrivals.generated(), department.completedPatients().size(),
            department.patientsInSystem(), context.processedEvents());
        if (context.now() > 0 && arrivals.generated() == 0 && parameters.arrivals.ratePerHour > 0) {
            log.warn("⚠️ No patients arrived in {} min despite a rate of {}/h", context.now(),
                parameters.arrivals.ratePerHour);
        }
    }

    public SimulationContext context() {
        return context;
    }

    public EmergencyDepartment department() {
        return department;
    }

    public ArrivalProcess arrivals() {
        return arrivals;
    }

    public SimulationParameters parameters() {
        return parameters;
    }

    public static final class Builder {
        private final SimulationParameters parameters;
        private TriageService triageService;
        private PatientRecordProvider provider = new SyntheticPatientRecordProvider();
        private EventRecorder recorder = EventRecorder.NONE;
        private AbandonmentPolicy abandonmentPolicy;

        private Builder(SimulationParameters parameters) {
            this.parameters = parameters;
        }

        public Builder triageService(TriageService triageService) {
            this.triageService = triageService;
            return this;
        }

        public Builder recordProvider(PatientRecordProvider provider) {
            this.provider = provider;
            return this;
        }

        public Builder eventRecorder(EventRecorder recorder) {
            this.recorder = recorder;
            return this;
        }

        public Builder abandonmentPolicy(AbandonmentPolicy abandonmentPolicy) {
            this.abandonmentPolicy = abandonmentPolicy;
            return this;
        }

        /**
         * @throws com.edsim.config.ConfigurationException when the parameters are invalid
         */
        public EmergencyDepartmentSimulation build() {
            parameters.validate();
            return new EmergencyDepartmentSimulation(this);
        }
    }
}
