/* (C)2026 */
package com.ammann.abstats.service;

import com.ammann.abstats.enumeration.ProportionVarianceMode;
import com.ammann.abstats.exception.ValidationException;
import com.ammann.abstats.model.GroupSummary;
import com.ammann.abstats.model.TestResult;
import com.ammann.abstats.model.TwoSampleComparison;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Two-sample z-test for the difference between two conversion proportions.
 *
 * <p>Each arm is reduced to a Bernoulli {@link GroupSummary} with its own observed proportion and
 * variance {@code p(1-p)/n}. Those per-arm summaries feed the interval and sample size stages
 * unchanged. The statistic's denominator follows the requested {@link ProportionVarianceMode}.
 */
@ApplicationScoped
public class ProportionTestService {

    private static final Logger LOG = Logger.getLogger(ProportionTestService.class);

    // Normal approximation rule of thumb: at least 5 successes and 5 failures per arm
    private static final long MIN_EXPECTED_OUTCOMES = 5;

    private final DistributionService distributions;

    @Inject
    public ProportionTestService(DistributionService distributions) {
        this.distributions = distributions;
    }

    /**
     * Builds the Bernoulli summary of one arm.
     *
     * @throws ValidationException if {@code n < 1} or {@code successes} is outside {@code [0, n]}
     */
    public GroupSummary summarize(String group, long n, long successes) {
        if (n < 1) {
            throw ValidationException.invalidParameter(group + "_n", n, "a positive count");
        }
        if (successes < 0 || successes > n) {
            throw ValidationException.invalidParameter(
                    group + "_success", successes, "a count between 0 and " + n);
        }
        double p = (double) successes / n;
        return new GroupSummary(n, p, p * (1.0 - p) / n);
    }

    /**
     * Runs the two-sided z-test.
     *
     * @throws ValidationException for malformed counts
     */
    public TwoSampleComparison test(
            long controlN,
            long controlSuccess,
            long treatmentN,
            long treatmentSuccess,
            ProportionVarianceMode mode) {
        GroupSummary control = summarize("control", controlN, controlSuccess);
        GroupSummary treatment = summarize("treatment", treatmentN, treatmentSuccess);

        warnIfSmallSample(controlN, controlSuccess, treatmentN, treatmentSuccess);

        double diff = treatment.estimate() - control.estimate();
        if (diff == 0.0) {
            LOG.debug("Identical proportions, z-statistic is 0");
            return new TwoSampleComparison(control, treatment, TestResult.normal(0.0, 1.0));
        }

        double standardError = mode == ProportionVarianceMode.POOLED
                ? pooledStandardError(controlN, controlSuccess, treatmentN, treatmentSuccess)
                : Math.sqrt(control.variance() + treatment.variance());

        if (!(standardError > 0.0)) {
            // only reachable with proportions of exactly 0 and 1: the difference is certain
            LOG.warnf("Zero standard error for proportions %d/%d and %d/%d, statistic is unbounded",
                    controlSuccess, controlN, treatmentSuccess, treatmentN);
            double z = diff > 0 ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
            return new TwoSampleComparison(control, treatment, TestResult.normal(z, 0.0));
        }

        double z = diff / standardError;
        double pValue = distributions.twoSidedNormalPValue(z);

        LOG.debugf("Proportion z-test (%s): p_c=%.6f p_t=%.6f se=%.6g z=%.4f p=%.6f",
                mode, control.estimate(), treatment.estimate(), standardError, z, pValue);

        return new TwoSampleComparison(control, treatment, TestResult.normal(z, pValue));
    }

    private static double pooledStandardError(
            long controlN, long controlSuccess, long treatmentN, long treatmentSuccess) {
        double pooled = (double) (controlSuccess + treatmentSuccess) / (controlN + treatmentN);
        double variance = pooled * (1.0 - pooled) * (1.0 / controlN + 1.0 / treatmentN);
        return Math.sqrt(Math.max(0.0, variance));
    }

    private static void warnIfSmallSample(
            long controlN, long controlSuccess, long treatmentN, long treatmentSuccess) {
        if (controlSuccess < MIN_EXPECTED_OUTCOMES
                || treatmentSuccess < MIN_EXPECTED_OUTCOMES
                || controlN - controlSuccess < MIN_EXPECTED_OUTCOMES
                || treatmentN - treatmentSuccess < MIN_EXPECTED_OUTCOMES) {
            LOG.warnf("Small-sample warning: control=%d/%d, treatment=%d/%d -- normal approximation may be unreliable",
                    controlSuccess, controlN, treatmentSuccess, treatmentN);
        }
    }
}
