package com.edsim.department;

import com.edsim.kernel.SimulationContext;
import com.edsim.patient.PatientRecord;
import com.edsim.patient.PatientRecordProvider;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ArrivalProcessTest {

    private static final PatientRecordProvider COUGH = random -> PatientRecord.of(30, "cough");

    @Test
    void zeroRateSchedulesNothing() {
        SimulationContext context = new SimulationContext(1L);
        List<Double> arrivals = new ArrayList<>();
        ArrivalProcess process = new ArrivalProcess(context, new ConstantArrivalPattern(0), COUGH,
            record -> arrivals.add(context.now()), 1000);

        process.start();
        context.runUntil(1000);

        assertThat(arrivals).isEmpty();
        assertThat(process.generated()).isZero();
        assertThat(process.isStopped()).isTrue();
        assertThat(context.processedEvents()).isZero();
    }

    @Test
    void noArrivalsAfterCutoff() {
        SimulationContext context = new SimulationContext(3L);
        List<Double> arrivals = new ArrayList<>();
        ArrivalProcess process = new ArrivalProcess(context, new ConstantArrivalPattern(1.0), COUGH,
            record -> arrivals.add(context.now()), 100);

        process.start();
        context.runUntil(1000);

        assertThat(arrivals).isNotEmpty().allMatch(time -> time <= 100.0).isSorted();
        assertThat(process.generated()).isEqualTo(arrivals.size()).isBetween(60, 140);
        assertThat(process.isStopped()).isTrue();
        assertThat(context.pendingEvents()).isZero();
    }

    @Test
    void stopCancelsTheNextArrival() {
        SimulationContext context = new SimulationContext(5L);
        List<PatientRecord> records = new ArrayList<>();
        ArrivalProcess process = new ArrivalProcess(context, new ConstantArrivalPattern(0.5), COUGH,
            records::add, 10_000);

        process.start();
        context.runUntil(50);
        int beforeStop = records.size();
        process.stop();
        context.runUntil(500);

        assertThat(records).hasSize(beforeStop);
        assertThat(process.isStopped()).isTrue();
        assertThat(context.pendingEvents()).isZero();
    }

    @Test
    void peakHoursReceiveMoreArrivals() {
        SimulationContext context = new SimulationContext(11L);
        TimeOfDayArrivalPattern pattern = new TimeOfDayArrivalPattern(0.2, 8, 20, 1.5, 0.5);
        int[] peakAndOffPeak = new int[2];
        ArrivalProcess process = new ArrivalProcess(context, pattern, COUGH,
            record -> peakAndOffPeak[pattern.isPeak(context.now()) ? 0 : 1]++, 1440);

        process.start();
        context.runUntil(1440);

        // expected 216 at peak, 72 off peak
        assertThat(peakAndOffPeak[0]).isGreaterThan(2 * peakAndOffPeak[1]);
        assertThat(process.generated()).isEqualTo(peakAndOffPeak[0] + peakAndOffPeak[1]);
    }

    @Test
    void timeOfDayRates() {
        TimeOfDayArrivalPattern pattern = new TimeOfDayArrivalPattern(0.2, 8, 20, 1.5, 0.5);

        assertThat(pattern.isPeak(7 * 60 + 59)).isFalse();
        assertThat(pattern.isPeak(8 * 60)).isTrue();
        assertThat(pattern.isPeak(20 * 60)).isFalse();
        assertThat(pattern.isPeak(1440 + 9 * 60)).isTrue();
        assertThat(pattern.rateAt(600)).isEqualTo(0.2 * 1.5);
        assertThat(pattern.rateAt(0)).isEqualTo(0.2 * 0.5);
        assertThat(pattern.maxRate()).isEqualTo(0.2 * 1.5);
    }
}
