/* (C)2026 */
package com.ammann.abstats.service;

import com.ammann.abstats.exception.DegenerateVarianceException;
import com.ammann.abstats.exception.ValidationException;
import com.ammann.abstats.model.GroupSummary;
import com.ammann.abstats.model.TestResult;
import com.ammann.abstats.model.TwoSampleComparison;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.jboss.logging.Logger;

/**
 * Welch's unequal-variance t-test for the difference between two means.
 *
 * <p>Raw observations are reduced in a single pass to count, mean and unbiased sample variance.
 * The arm variance stored in {@link GroupSummary} is the variance of the mean
 * ({@code s^2 / n}), which is what the Welch statistic, the Welch-Satterthwaite degrees of
 * freedom and the downstream interval stage consume.
 */
@ApplicationScoped
public class MeanTestService {

    private static final Logger LOG = Logger.getLogger(MeanTestService.class);

    static final int MIN_OBSERVATIONS = 2;

    private final DistributionService distributions;

    @Inject
    public MeanTestService(DistributionService distributions) {
        this.distributions = distributions;
    }

    /**
     * Reduces one arm's observations. {@code NaN} entries are skipped.
     *
     * @throws ValidationException for null or infinite entries, fewer than two usable values, or a
     *     variance that overflows
     * @throws DegenerateVarianceException if every usable value is identical
     */
    public SampleReduction reduce(String group, Iterable<? extends Number> values) {
        if (values == null) {
            throw ValidationException.invalidParameter(group + "_values", null, "a sequence of numbers");
        }

        SummaryStatistics stats = new SummaryStatistics();
        int skipped = 0;
        int index = 0;
        for (Number value : values) {
            if (value == null) {
                throw ValidationException.invalidParameter(
                        group + "_values[" + index + "]", null, "a finite number");
            }
            double x = value.doubleValue();
            if (Double.isNaN(x)) {
                skipped++;
            } else if (Double.isInfinite(x)) {
                throw ValidationException.invalidParameter(
                        group + "_values[" + index + "]", x, "a finite number");
            } else {
                stats.addValue(x);
            }
            index++;
        }

        if (skipped > 0) {
            LOG.debugf("Dropped %d NaN observations from %s group", skipped, group);
        }
        if (stats.getN() < MIN_OBSERVATIONS) {
            throw ValidationException.insufficientData(
                    group + " observations", MIN_OBSERVATIONS, (int) stats.getN());
        }

        double sampleVariance = stats.getVariance();
        if (!Double.isFinite(sampleVariance)) {
            throw ValidationException.invalidParameter(
                    group + "_values", "variance " + sampleVariance, "observations with a finite variance");
        }
        if (sampleVariance == 0.0) {
            throw DegenerateVarianceException.zeroVariance(group);
        }

        long n = stats.getN();
        GroupSummary summary = new GroupSummary(n, stats.getMean(), sampleVariance / n);
        return new SampleReduction(summary, sampleVariance, stats.getSum());
    }

    /**
     * Runs the two-sided Welch t-test on two observation sequences.
     */
    public TwoSampleComparison test(
            Iterable<? extends Number> controlValues, Iterable<? extends Number> treatmentValues) {
        GroupSummary control = reduce("control", controlValues).summary();
        GroupSummary treatment = reduce("treatment", treatmentValues).summary();
        return test(control, treatment);
    }

    /**
     * Runs the two-sided Welch t-test on already reduced arms.
     */
    public TwoSampleComparison test(GroupSummary control, GroupSummary treatment) {
        if (control.count() < MIN_OBSERVATIONS || treatment.count() < MIN_OBSERVATIONS) {
            throw ValidationException.insufficientData(
                    "observations per group",
                    MIN_OBSERVATIONS,
                    (int) Math.min(control.count(), treatment.count()));
        }

        double varianceSum = control.variance() + treatment.variance();
        double t = (treatment.estimate() - control.estimate()) / Math.sqrt(varianceSum);
        double df = welchSatterthwaite(control, treatment);
        double pValue = distributions.twoSidedStudentTPValue(t, df);

        LOG.debugf("Welch t-test: mean_c=%.6g mean_t=%.6g t=%.4f df=%.4f p=%.6f",
                control.estimate(), treatment.estimate(), t, df, pValue);

        return new TwoSampleComparison(control, treatment, TestResult.studentT(t, pValue, df));
    }

    /**
     * Welch-Satterthwaite approximation of the degrees of freedom, using variances of the means.
     */
    static double welchSatterthwaite(GroupSummary control, GroupSummary treatment) {
        double vc = control.variance();
        double vt = treatment.variance();
        double numerator = (vc + vt) * (vc + vt);
        double denominator = vc * vc / (control.count() - 1) + vt * vt / (treatment.count() - 1);
        if (!(denominator > 0.0)) {
            throw new DegenerateVarianceException("Welch-Satterthwaite degrees of freedom are undefined");
        }
        return numerator / denominator;
    }

    /**
     * Single-pass reduction of one arm.
     *
     * @param summary count, mean and variance of the mean
     * @param sampleVariance unbiased per-observation variance
     * @param sum sum of all usable observations
     */
    public record SampleReduction(GroupSummary summary, double sampleVariance, double sum) {
    }
}
