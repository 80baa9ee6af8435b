package com.edsim.fuzzy;

/**
 * Trapezoid with a plateau on [b, c]. Infinite corners make open shoulders.
 */
public final class TrapezoidalMembership implements MembershipFunction {

    private final double a;
    private final double b;
    private final double c;
    private final double d;

    public TrapezoidalMembership(double a, double b, double c, double d) {
        if (!(a <= b && b <= c && c <= d)) {
            throw new IllegalArgumentException(
                String.format("Expected a <= b <= c <= d, got %s, %s, %s, %s", a, b, c, d));
        }
        this.a = a;
        this.b = b;
        this.c = c;
        this.d = d;
    }

    /** Full membership up to {@code plateauEnd}, falling to zero at {@code zeroAt}. */
    public static TrapezoidalMembership leftShoulder(double plateauEnd, double zeroAt) {
        return new TrapezoidalMembership(Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY, plateauEnd, zeroAt);
    }

    /** Zero up to {@code zeroAt}, full membership from {@code plateauStart} on. */
    public static TrapezoidalMembership rightShoulder(double zeroAt, double plateauStart) {
        return new TrapezoidalMembership(zeroAt, plateauStart, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    @Override
    public double degree(double x) {
        if (x >= b && x <= c) {
            return 1.0;
        }
        if (x <= a || x >= d) {
            return 0.0;
        }
        return x < b ? (x - a) / (b - a) : (d - x) / (d - c);
    }

    @Override
    public String toString() {
        return String.format("trap(%s, %s, %s, %s)", a, b, c, d);
    }
}
