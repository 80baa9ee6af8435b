package com.edsim.department;

public final class ConstantArrivalPattern implements ArrivalPattern {

    private final double ratePerMinute;

    public ConstantArrivalPattern(double ratePerMinute) {
        this.ratePerMinute = ratePerMinute;
    }

    @Override
    public double rateAt(double minute) {
        return ratePerMinute;
    }

    @Override
    public double maxRate() {
        return ratePerMinute;
    }

    @Override
    public String toString() {
        return String.format("constant(%.2f/h)", ratePerMinute * 60);
    }
}
