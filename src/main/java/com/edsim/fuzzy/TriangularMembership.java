package com.edsim.fuzzy;

/**
 * Triangle rising from {@code a} to a peak at {@code b} and falling to {@code c}.
 * {@code a == b} or {@code b == c} give a right-angled triangle.
 */
public final class TriangularMembership implements MembershipFunction {

    private final double a;
    private final double b;
    private final double c;

    public TriangularMembership(double a, double b, double c) {
        if (!(a <= b && b <= c)) {
            throw new IllegalArgumentException(String.format("Expected a <= b <= c, got %s, %s, %s", a, b, c));
        }
        this.a = a;
        this.b = b;
        this.c = c;
    }

    @Override
    public double degree(double x) {
        if (x == b) {
            return 1.0;
        }
        if (x <= a || x >= c) {
            return 0.0;
        }
        return x < b ? (x - a) / (b - a) : (c - x) / (c - b);
    }

    public double peak() {
        return b;
    }

    @Override
    public String toString() {
        return String.format("tri(%s, %s, %s)", a, b, c);
    }
}
