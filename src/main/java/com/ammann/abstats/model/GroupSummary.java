/* (C)2026 */
package com.ammann.abstats.model;

/**
 * Reduced view of one experiment arm: its observation count, point estimate and the variance of
 * that estimate.
 *
 * <p>For proportions the estimate is {@code successes / count} and the variance
 * {@code p(1-p) / count}. For means the estimate is the sample mean and the variance is the
 * unbiased sample variance divided by {@code count}, i.e. the variance of the mean.
 *
 * @param count number of observations, at least 1
 * @param estimate point estimate of the arm's metric
 * @param variance variance of {@code estimate}
 */
public record GroupSummary(long count, double estimate, double variance) {

    public GroupSummary {
        if (count < 1) {
            throw new IllegalArgumentException("Group count must be at least 1, got " + count);
        }
    }

    /**
     * Per-observation variance recovered from the variance of the estimate.
     */
    public double observationVariance() {
        return variance * count;
    }
}
