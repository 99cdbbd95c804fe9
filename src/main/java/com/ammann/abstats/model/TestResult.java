/* (C)2026 */
package com.ammann.abstats.model;

/**
 * Outcome of a two-sided two-sample significance test.
 *
 * @param statistic z- or t-statistic, positive when treatment exceeds control
 * @param pValue two-sided p-value in {@code [0, 1]}
 * @param degreesOfFreedom Welch-Satterthwaite degrees of freedom, {@code null} for the z-test
 */
public record TestResult(double statistic, double pValue, Double degreesOfFreedom) {

    public static TestResult normal(double statistic, double pValue) {
        return new TestResult(statistic, pValue, null);
    }

    public static TestResult studentT(double statistic, double pValue, double degreesOfFreedom) {
        return new TestResult(statistic, pValue, degreesOfFreedom);
    }

    public boolean hasDegreesOfFreedom() {
        return degreesOfFreedom != null;
    }
}
