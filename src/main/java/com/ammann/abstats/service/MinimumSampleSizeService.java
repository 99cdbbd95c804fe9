/* (C)2026 */
package com.ammann.abstats.service;

import com.ammann.abstats.enumeration.AllocationMode;
import com.ammann.abstats.exception.UndefinedMssException;
import com.ammann.abstats.exception.ValidationException;
import com.ammann.abstats.model.MssOutcome;
import com.ammann.abstats.model.TwoSampleComparison;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Post-hoc minimum sample size: the treatment-arm size that would have been needed to detect the
 * observed effect, with the observed variances, at the configured alpha and power.
 *
 * <p>With allocation ratio {@code k = n_c / n_t}, the variance of the difference is
 * {@code (sigma_c^2 / k + sigma_t^2) / n_t}, which gives the closed form
 *
 * <pre>
 *   n_t = ceil( (z_{1-alpha/2} + z_power)^2 * (sigma_c^2 / k + sigma_t^2) / delta^2 )
 * </pre>
 *
 * where the sigmas are per-observation variances. This is a diagnostic of the run just analysed,
 * not a pre-experiment sizing tool.
 */
@ApplicationScoped
public class MinimumSampleSizeService {

    private static final Logger LOG = Logger.getLogger(MinimumSampleSizeService.class);

    private final DistributionService distributions;

    @Inject
    public MinimumSampleSizeService(DistributionService distributions) {
        this.distributions = distributions;
    }

    /**
     * Solves for the required treatment-arm size of a completed comparison.
     *
     * @param allocationRatio control observations per treatment observation
     */
    public MssOutcome solve(
            TwoSampleComparison comparison, double alpha, double power, double allocationRatio) {
        return solve(
                comparison.absoluteDifference(),
                comparison.control().observationVariance(),
                comparison.treatment().observationVariance(),
                comparison.treatment().count(),
                alpha,
                power,
                allocationRatio);
    }

    /**
     * Closed-form solver.
     *
     * @param delta observed absolute effect
     * @param controlVariance per-observation variance of the control arm
     * @param treatmentVariance per-observation variance of the treatment arm
     * @param treatmentN observed treatment-arm size
     * @param allocationRatio control observations per treatment observation
     * @throws UndefinedMssException if {@code delta} is zero or no finite positive size results
     */
    public MssOutcome solve(
            double delta,
            double controlVariance,
            double treatmentVariance,
            long treatmentN,
            double alpha,
            double power,
            double allocationRatio) {
        if (!(alpha > 0.0 && alpha < 1.0)) {
            throw ValidationException.notAProbability("alpha", alpha);
        }
        if (!(power > 0.0 && power < 1.0)) {
            throw ValidationException.notAProbability("power", power);
        }
        if (!(allocationRatio > 0.0) || Double.isInfinite(allocationRatio)) {
            throw ValidationException.invalidParameter(
                    "allocationRatio", allocationRatio, "a positive finite ratio");
        }
        if (delta == 0.0 || Double.isNaN(delta)) {
            throw new UndefinedMssException(
                    "Minimum sample size is undefined because the observed effect is zero");
        }

        double zAlpha = distributions.standardNormalQuantile(1.0 - alpha / 2.0);
        double zPower = distributions.standardNormalQuantile(power);
        double zSum = zAlpha + zPower;

        double required = zSum * zSum
                * (controlVariance / allocationRatio + treatmentVariance)
                / (delta * delta);

        if (!(required > 0.0) || Double.isInfinite(required) || required >= Long.MAX_VALUE) {
            throw new UndefinedMssException(String.format(
                    "Minimum sample size is not computable (delta=%s, variances=%s/%s, z=%s)",
                    delta, controlVariance, treatmentVariance, zSum));
        }

        long requiredN = (long) Math.ceil(required);
        MssOutcome outcome = new MssOutcome(requiredN, (double) treatmentN / requiredN);

        LOG.debugf("MSS: delta=%.6g k=%.4f z_alpha=%.4f z_power=%.4f -> n_t=%d (%.2f%% reached)",
                delta, allocationRatio, zAlpha, zPower, requiredN, outcome.actualPercent());
        return outcome;
    }

    /**
     * Allocation ratio implied by a comparison under the given mode.
     */
    public static double allocationRatio(TwoSampleComparison comparison, AllocationMode mode) {
        if (mode == AllocationMode.EQUAL) {
            return 1.0;
        }
        return (double) comparison.control().count() / comparison.treatment().count();
    }
}
