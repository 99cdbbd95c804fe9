/* (C)2026 */
package com.ammann.abstats.model;

/**
 * Per-call analysis parameters.
 *
 * @param alpha two-sided significance level in {@code (0, 1)}
 * @param power target power {@code 1 - beta} in {@code (0, 1)}
 * @param allocationRatio control observations per treatment observation used by the sample size
 *     solver, or {@code null} to use the configured allocation mode
 */
public record AnalysisOptions(double alpha, double power, Double allocationRatio) {

    public static final double DEFAULT_ALPHA = 0.05;
    public static final double DEFAULT_POWER = 0.8;

    public static AnalysisOptions of(double alpha, double power) {
        return new AnalysisOptions(alpha, power, null);
    }

    public static AnalysisOptions defaults() {
        return of(DEFAULT_ALPHA, DEFAULT_POWER);
    }

    public AnalysisOptions withAllocationRatio(double ratio) {
        return new AnalysisOptions(alpha, power, ratio);
    }
}
