/* (C)2026 */
package com.ammann.abstats.model;

/**
 * Output of the proportion or mean test stage: both arm summaries plus the test outcome. Everything
 * downstream (intervals, uplift, sample size) works from this record alone.
 */
public record TwoSampleComparison(GroupSummary control, GroupSummary treatment, TestResult test) {

    public double absoluteDifference() {
        return treatment.estimate() - control.estimate();
    }
}
