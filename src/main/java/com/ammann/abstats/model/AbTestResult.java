/* (C)2026 */
package com.ammann.abstats.model;

import com.ammann.abstats.enumeration.TestType;

/**
 * Complete, unformatted result of one A/B comparison.
 *
 * <p>{@code uplift}, {@code relativeInterval} and {@code mss} are {@code null} when the relative
 * change or the post-hoc sample size is undefined for the observed data; all other fields are
 * always present.
 *
 * @param testType test that produced the result
 * @param metricFormula treatment numerator and denominator, e.g. {@code "122/1001"}
 * @param comparison arm summaries and test outcome
 * @param absoluteDifference {@code treatment - control}
 * @param uplift absolute and relative change, or {@code null} when the control estimate is zero
 * @param absoluteInterval interval for the absolute difference
 * @param relativeInterval interval for the relative change as a fraction, or {@code null}
 * @param criticalValue z or t quantile both intervals were built from
 * @param mss post-hoc minimum sample size, or {@code null} when no finite size exists
 * @param options alpha, power and allocation ratio in effect
 */
public record AbTestResult(
        TestType testType,
        String metricFormula,
        TwoSampleComparison comparison,
        double absoluteDifference,
        UpliftEstimate uplift,
        ConfidenceInterval absoluteInterval,
        ConfidenceInterval relativeInterval,
        double criticalValue,
        MssOutcome mss,
        AnalysisOptions options) {

    public double metricValue() {
        return comparison.treatment().estimate();
    }

    public TestResult test() {
        return comparison.test();
    }

    /** {@code true} when at least one optional field could not be computed. */
    public boolean partial() {
        return uplift == null || relativeInterval == null || mss == null;
    }
}
