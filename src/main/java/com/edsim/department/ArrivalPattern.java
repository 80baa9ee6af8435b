package com.edsim.department;

import com.edsim.config.SimulationParameters.ArrivalSettings;

/**
 * Arrival intensity over simulated time, in patients per minute.
 */
public interface ArrivalPattern {

    double rateAt(double minute);

    /** Upper bound of {@link #rateAt} over the whole day. */
    double maxRate();

    static ArrivalPattern from(ArrivalSettings settings) {
        double perMinute = settings.ratePerHour / 60.0;
        if (settings.isTimeOfDay()) {
            return new TimeOfDayArrivalPattern(perMinute, settings.peakStartHour, settings.peakEndHour,
                settings.peakMultiplier, settings.offPeakMultiplier);
        }
        return new ConstantArrivalPattern(perMinute);
    }
}
