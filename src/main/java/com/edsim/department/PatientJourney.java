package com.edsim.department;

import com.edsim.config.SimulationParameters;
import com.edsim.config.SimulationParameters.TriageSettings;
import com.edsim.kernel.ResourceArbiter;
import com.edsim.kernel.ResourceGrant;
import com.edsim.kernel.ResourceRequest;
import com.edsim.kernel.SimulationContext;
import com.edsim.messages.Messages.*;
import com.edsim.patient.Patient;
import com.edsim.patient.PatientStatus;
import com.edsim.triage.TriageCategory;
import com.edsim.triage.TriageVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * PatientJourney - state machine for one patient, stepped by scheduler callbacks.
 *
 * <pre>
 * ARRIVED → WAITING_TRIAGE → IN_TRIAGE → WAITING_CONSULTATION → IN_CONSULTATION
 *        → WAITING_ADMISSION → ADMITTED
 *        → DISCHARGED
 * any WAITING_* → LEFT_WITHOUT_BEING_SEEN
 * </pre>
 *
 * While in a waiting state the journey holds exactly one pending resource
 * request and no units; {@link #abandon()} withdraws that request.
 */
public final class PatientJourney {

    private static final Logger log = LoggerFactory.getLogger(PatientJourney.class);

    private final EmergencyDepartment department;
    private final SimulationContext context;
    private final Patient patient;
    private ResourceRequest pendingRequest;

    PatientJourney(EmergencyDepartment department, Patient patient) {
        this.department = department;
        this.context = department.context();
        this.patient = patient;
    }

    public Patient patient() {
        return patient;
    }

    void start() {
        moveTo(PatientStatus.WAITING_TRIAGE);
        await(arbiter().acquire(department.triageNurses(), this::beginTriage));
    }

    private void beginTriage(ResourceGrant nurse) {
        pendingRequest = null;
        moveTo(PatientStatus.IN_TRIAGE);
        TriageSettings triage = parameters().triage;
        double duration = context.random().clampedNormal(
            triage.assessmentMean, triage.assessmentStd, triage.assessmentMinimum);
        context.schedule(duration, () -> completeTriage(nurse, duration));
    }

    private void completeTriage(ResourceGrant nurse, double duration) {
        TriageVerdict verdict = department.triageService().assess(patient);
        patient.assignVerdict(verdict);
        arbiter().release(nurse);
        department.record(new TriageCompleted(context.now(), patient.id(), patient.arrivalTime(), verdict,
            patient.triageWait(), duration));
        log.debug("[{}] 🏷️ {} triaged {} via {} (score {})", clock(), patient.id(), verdict.category,
            verdict.flowchart, String.format("%.2f", verdict.score));

        moveTo(PatientStatus.WAITING_CONSULTATION);
        department.queues().enqueue(patient);
        await(arbiter().acquireAll(
            List.of(department.doctors(), department.cubicles()), verdict.priority, this::beginConsultation));
    }

    private void beginConsultation(ResourceGrant doctorAndCubicle) {
        pendingRequest = null;
        Patient head = department.queues().peekNext();
        if (head != patient) {
            throw new IllegalStateException(String.format("Doctor granted to %s but %s heads the queues",
                patient.id(), head == null ? "nobody" : head.id()));
        }
        department.queues().remove(patient);
        moveTo(PatientStatus.IN_CONSULTATION);

        TriageVerdict verdict = patient.verdict();
        department.record(new ConsultationStarted(context.now(), patient.id(), patient.arrivalTime(),
            verdict.category, patient.consultationWait(), verdict.targetWaitMinutes));

        double duration = department.consultationModel().sample(patient, context.random());
        patient.recordConsultationDuration(duration);
        context.schedule(duration, () -> completeConsultation(doctorAndCubicle, duration));
    }

    private void completeConsultation(ResourceGrant doctorAndCubicle, double duration) {
        arbiter().release(doctorAndCubicle);
        department.record(new ConsultationCompleted(context.now(), patient.id(), patient.arrivalTime(),
            patient.category(), duration));

        double admissionProbability = parameters().category(patient.category()).admissionProbability;
        if (context.random().bernoulli(admissionProbability)) {
            moveTo(PatientStatus.WAITING_ADMISSION);
            await(arbiter().acquire(department.admissionBeds(), this::admit));
        } else {
            moveTo(PatientStatus.DISCHARGED);
            recordDisposition(false);
        }
    }

    private void admit(ResourceGrant bed) {
        pendingRequest = null;
        moveTo(PatientStatus.ADMITTED);
        recordDisposition(true);

        SimulationParameters parameters = parameters();
        double handover = context.random().clampedNormal(parameters.bedHandoverMean, parameters.bedHandoverStd, 1.0);
        context.schedule(handover, () -> arbiter().release(bed));
    }

    /**
     * Leaves the department from a waiting state.
     *
     * @return false when the patient is not waiting, so there is nothing to abandon
     */
    public boolean abandon() {
        PatientStatus leftFrom = patient.status();
        if (!leftFrom.isWaiting()) {
            return false;
        }
        double waited = patient.waitingFor(context.now());
        // leave the queue first: cancelling may grant the pools to the next patient straight away
        department.queues().remove(patient);
        if (pendingRequest != null) {
            arbiter().cancel(pendingRequest);
            pendingRequest = null;
        }
        moveTo(PatientStatus.LEFT_WITHOUT_BEING_SEEN);

        TriageCategory category = patient.category();
        department.record(new PatientLeftWithoutBeingSeen(context.now(), patient.id(), patient.arrivalTime(),
            category, leftFrom, waited));
        log.debug("[{}] 🚶 {} left without being seen after {} min in {}", clock(), patient.id(),
            Math.round(waited), leftFrom);
        department.journeyFinished(this);
        return true;
    }

    private void recordDisposition(boolean admitted) {
        department.record(new DispositionRecorded(context.now(), patient.id(), patient.arrivalTime(),
            patient.category(), admitted, patient.timeInSystem()));
        log.debug("[{}] {} {} {} after {} min", clock(), admitted ? "🛏️" : "🏠", patient.id(),
            admitted ? "admitted" : "discharged", Math.round(patient.timeInSystem()));
        department.journeyFinished(this);
    }

    /** Keeps the request only if the arbiter could not grant it on the spot. */
    private void await(ResourceRequest request) {
        if (request.isPending()) {
            pendingRequest = request;
        }
    }

    private void moveTo(PatientStatus status) {
        patient.transitionTo(status, context.now());
    }

    private ResourceArbiter arbiter() {
        return context.arbiter();
    }

    private SimulationParameters parameters() {
        return department.parameters();
    }

    private String clock() {
        return SimulationContext.formatClock(context.now());
    }
}
