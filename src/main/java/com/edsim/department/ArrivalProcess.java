package com.edsim.department;

import com.edsim.kernel.ScheduledEvent;
import com.edsim.kernel.SimulationContext;
import com.edsim.kernel.SimulationRandom;
import com.edsim.patient.PatientRecord;
import com.edsim.patient.PatientRecordProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * ArrivalProcess - Poisson arrivals, thinned to follow the arrival pattern.
 *
 * Candidates are drawn at the pattern's peak rate and each is kept with
 * probability rate(t) / peak rate. A zero rate produces no arrivals at all.
 */
public final class ArrivalProcess {

    private static final Logger log = LoggerFactory.getLogger(ArrivalProcess.class);

    private final SimulationContext context;
    private final ArrivalPattern pattern;
    private final PatientRecordProvider provider;
    private final Consumer<PatientRecord> onArrival;
    private final double stopAfter;
    private ScheduledEvent next;
    private boolean stopped;
    private int generated;

    public ArrivalProcess(SimulationContext context, ArrivalPattern pattern, PatientRecordProvider provider,
                          Consumer<PatientRecord> onArrival, double stopAfter) {
        this.context = context;
        this.pattern = pattern;
        this.provider = provider;
        this.onArrival = onArrival;
        this.stopAfter = stopAfter;
    }

    public void start() {
        if (pattern.maxRate() <= 0) {
            log.info("🚪 Arrival rate is zero, no patients will arrive");
            stopped = true;
            return;
        }
        log.info("🚪 Arrivals started: {} until t={}", pattern, stopAfter);
        scheduleNext();
    }

    public void stop() {
        stopped = true;
        if (next != null) {
            next.cancel();
            next = null;
        }
    }

    public boolean isStopped() {
        return stopped;
    }

    public int generated() {
        return generated;
    }

    private void scheduleNext() {
        SimulationRandom random = context.random();
        double gap = random.exponential(pattern.maxRate());
        if (context.now() + gap > stopAfter) {
            log.debug("🚪 Arrivals closed at t={}", stopAfter);
            stopped = true;
            next = null;
            return;
        }
        next = context.schedule(gap, this::candidate);
    }

    private void candidate() {
        if (stopped) {
            return;
        }
        double acceptance = pattern.rateAt(context.now()) / pattern.maxRate();
        if (context.random().uniform() < acceptance) {
            generated++;
            onArrival.accept(provider.nextRecord(context.random()));
        }
        scheduleNext();
    }
}
