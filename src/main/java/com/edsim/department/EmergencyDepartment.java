package com.edsim.department;

import com.edsim.config.SimulationParameters;
import com.edsim.kernel.ResourcePool;
import com.edsim.kernel.SimulationContext;
import com.edsim.messages.Messages.*;
import com.edsim.metrics.EventRecorder;
import com.edsim.patient.Patient;
import com.edsim.patient.PatientRecord;
import com.edsim.triage.TriageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * EmergencyDepartment - resource pools, category queues and the patients currently inside.
 *
 * Also runs the two periodic monitors: resource snapshots and the abandonment check.
 */
public class EmergencyDepartment {

    public static final String TRIAGE_NURSES = "triage_nurses";
    public static final String DOCTORS = "doctors";
    public static final String CUBICLES = "cubicles";
    public static final String ADMISSION_BEDS = "admission_beds";

    private static final Logger log = LoggerFactory.getLogger(EmergencyDepartment.class);
    private static final int BOTTLENECK_QUEUE = 10;

    private final SimulationContext context;
    private final SimulationParameters parameters;
    private final TriageService triageService;
    private final EventRecorder recorder;
    private final AbandonmentPolicy abandonmentPolicy;
    private final ConsultationTimeModel consultationModel;

    private final ResourcePool triageNurses;
    private final ResourcePool doctors;
    private final ResourcePool cubicles;
    private final ResourcePool admissionBeds;
    private final CategoryQueues queues = new CategoryQueues();

    private final Map<String, PatientJourney> active = new LinkedHashMap<>();
    private final List<Patient> completed = new ArrayList<>();
    private int nextPatientNumber = 1;

    public EmergencyDepartment(SimulationContext context, SimulationParameters parameters,
                               TriageService triageService, EventRecorder recorder,
                               AbandonmentPolicy abandonmentPolicy) {
        this.context = context;
        this.parameters = parameters;
        this.triageService = triageService;
        this.recorder = recorder;
        this.abandonmentPolicy = abandonmentPolicy;
        this.consultationModel = ConsultationTimeModel.from(parameters);

        this.triageNurses = context.createPool(TRIAGE_NURSES, parameters.resources.triageNurses);
        this.doctors = context.createPool(DOCTORS, parameters.resources.doctors);
        this.cubicles = context.createPool(CUBICLES, parameters.resources.cubicles);
        this.admissionBeds = context.createPool(ADMISSION_BEDS, parameters.resources.admissionBeds);
    }

    /**
     * Creates a patient from {@code record} arriving now and starts their journey.
     */
    public Patient admit(PatientRecord record) {
        Patient patient = new Patient(String.format("P%06d", nextPatientNumber++), context.now(), record);
        PatientJourney journey = new PatientJourney(this, patient);
        active.put(patient.id(), journey);
        record(new PatientArrived(context.now(), patient.id(), patient.age(), patient.complaint()));
        log.debug("[{}] 🚑 {} arrived: '{}' (age {})", SimulationContext.formatClock(context.now()),
            patient.id(), patient.complaint(), patient.age());
        journey.start();
        return patient;
    }

    public void startMonitoring() {
        context.schedule(parameters.monitoringInterval, this::takeSnapshot);
        if (abandonmentPolicy != AbandonmentPolicy.NEVER) {
            context.schedule(parameters.abandonment.checkInterval, this::checkAbandonment);
        }
    }

    private void takeSnapshot() {
        ResourceSnapshot snapshot = snapshot();
        record(snapshot);

        for (Map.Entry<String, PoolReading> entry : snapshot.pools.entrySet()) {
            if (entry.getValue().queueLength >= BOTTLENECK_QUEUE) {
                log.warn("[{}] ⚠️ Bottleneck at {}: {} waiting, {}/{} busy",
                    SimulationContext.formatClock(context.now()), entry.getKey(), entry.getValue().queueLength,
                    entry.getValue().held, entry.getValue().capacity);
            }
        }
        log.debug("[{}] 📈 {} patients in ED, queues {}", SimulationContext.formatClock(context.now()),
            snapshot.patientsInSystem, snapshot.categoryQueues);
        context.schedule(parameters.monitoringInterval, this::takeSnapshot);
    }

    public ResourceSnapshot snapshot() {
        Map<String, PoolReading> readings = new LinkedHashMap<>();
        for (ResourcePool pool : pools()) {
            readings.put(pool.name(), new PoolReading(pool.held(), pool.capacity(), pool.queueLength()));
        }
        return new ResourceSnapshot(context.now(), readings, queues.lengths(), active.size());
    }

    void checkAbandonment() {
        // copy: abandoning removes journeys from the active map
        for (PatientJourney journey : new ArrayList<>(active.values())) {
            Patient patient = journey.patient();
            if (patient.status().isWaiting() && abandonmentPolicy.shouldLeave(patient, context.now())) {
                journey.abandon();
            }
        }
        context.schedule(parameters.abandonment.checkInterval, this::checkAbandonment);
    }

    void journeyFinished(PatientJourney journey) {
        active.remove(journey.patient().id());
        completed.add(journey.patient());
    }

    void record(SimulationEvent event) {
        recorder.record(event);
    }

    public PatientJourney journey(String patientId) {
        return active.get(patientId);
    }

    public List<Patient> activePatients() {
        List<Patient> patients = new ArrayList<>();
        for (PatientJourney journey : active.values()) {
            patients.add(journey.patient());
        }
        return patients;
    }

    public List<Patient> completedPatients() {
        return Collections.unmodifiableList(completed);
    }

    public int patientsInSystem() {
        return active.size();
    }

    public List<ResourcePool> pools() {
        return List.of(triageNurses, doctors, cubicles, admissionBeds);
    }

    public ResourcePool triageNurses() {
        return triageNurses;
    }

    public ResourcePool doctors() {
        return doctors;
    }

    public ResourcePool cubicles() {
        return cubicles;
    }

    public ResourcePool admissionBeds() {
        return admissionBeds;
    }

    public CategoryQueues queues() {
        return queues;
    }

    public SimulationContext context() {
        return context;
    }

    public SimulationParameters parameters() {
        return parameters;
    }

    public TriageService triageService() {
        return triageService;
    }

    ConsultationTimeModel consultationModel() {
        return consultationModel;
    }
}
