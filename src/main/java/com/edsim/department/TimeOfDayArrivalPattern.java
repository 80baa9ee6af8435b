package com.edsim.department;

/**
 * Base rate scaled up between the peak hours and down outside them. Minute 0 is midnight.
 */
public final class TimeOfDayArrivalPattern implements ArrivalPattern {

    private static final double MINUTES_PER_DAY = 1440.0;

    private final double baseRatePerMinute;
    private final int peakStartHour;
    private final int peakEndHour;
    private final double peakMultiplier;
    private final double offPeakMultiplier;

    public TimeOfDayArrivalPattern(double baseRatePerMinute, int peakStartHour, int peakEndHour,
                                   double peakMultiplier, double offPeakMultiplier) {
        this.baseRatePerMinute = baseRatePerMinute;
        this.peakStartHour = peakStartHour;
        this.peakEndHour = peakEndHour;
        this.peakMultiplier = peakMultiplier;
        this.offPeakMultiplier = offPeakMultiplier;
    }

    public boolean isPeak(double minute) {
        double hour = (minute % MINUTES_PER_DAY) / 60.0;
        return hour >= peakStartHour && hour < peakEndHour;
    }

    @Override
    public double rateAt(double minute) {
        return baseRatePerMinute * (isPeak(minute) ? peakMultiplier : offPeakMultiplier);
    }

    @Override
    public double maxRate() {
        return baseRatePerMinute * Math.max(peakMultiplier, offPeakMultiplier);
    }

    @Override
    public String toString() {
        return String.format("time-of-day(%.2f/h, peak %02d-%02d x%.2f, off-peak x%.2f)",
            baseRatePerMinute * 60, peakStartHour, peakEndHour, peakMultiplier, offPeakMultiplier);
    }
}
