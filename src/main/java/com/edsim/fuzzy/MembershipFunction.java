package com.edsim.fuzzy;

/**
 * Degree of membership of a crisp value in a fuzzy set, in [0, 1].
 */
@FunctionalInterface
public interface MembershipFunction {

    double degree(double x);
}
