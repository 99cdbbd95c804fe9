/* (C)2026 */
package com.ammann.abstats.service;

import com.ammann.abstats.exception.DomainException;
import com.ammann.abstats.exception.ValidationException;
import com.ammann.abstats.model.ConfidenceInterval;
import com.ammann.abstats.model.GroupSummary;
import com.ammann.abstats.model.UpliftEstimate;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Uplift estimates and their confidence intervals.
 *
 * <p>The absolute difference {@code T - C} has variance {@code Var(T) + Var(C)}. The relative
 * uplift {@code r = T/C - 1} is linearised around the observed estimates (first-order Taylor
 * expansion, treating both arms as independent):
 *
 * <pre>
 *   Var(r) ~ Var(T) / C^2 + T^2 * Var(C) / C^4
 * </pre>
 *
 * <p>Both intervals must be built from the same critical value: a normal quantile after the
 * proportion test, a Student-t quantile with the Welch degrees of freedom after the mean test.
 */
@ApplicationScoped
public class DeltaMethodService {

    private static final Logger LOG = Logger.getLogger(DeltaMethodService.class);

    /**
     * Absolute and relative change of treatment over control.
     *
     * @throws DomainException if the control estimate is zero
     */
    public UpliftEstimate uplift(GroupSummary control, GroupSummary treatment) {
        requireNonZeroControl(control);
        double absolute = treatment.estimate() - control.estimate();
        return new UpliftEstimate(absolute, absolute / control.estimate());
    }

    /**
     * {@code (T - C) +/- criticalValue * sqrt(Var(T) + Var(C))}.
     */
    public ConfidenceInterval absoluteInterval(
            GroupSummary control, GroupSummary treatment, double criticalValue) {
        requireCriticalValue(criticalValue);
        double delta = treatment.estimate() - control.estimate();
        double halfWidth = criticalValue * Math.sqrt(control.variance() + treatment.variance());
        return ConfidenceInterval.around(delta, halfWidth);
    }

    /**
     * Interval for the relative uplift, as a fraction of the control estimate.
     *
     * @throws DomainException if the control estimate is zero
     */
    public ConfidenceInterval relativeInterval(
            GroupSummary control, GroupSummary treatment, double criticalValue) {
        requireNonZeroControl(control);
        requireCriticalValue(criticalValue);

        double c = control.estimate();
        double t = treatment.estimate();
        double relative = (t - c) / c;

        double c2 = c * c;
        double variance = treatment.variance() / c2 + (t * t) * control.variance() / (c2 * c2);
        double halfWidth = criticalValue * Math.sqrt(variance);

        LOG.debugf("Delta method: r=%.6g var(r)=%.6g half-width=%.6g", relative, variance, halfWidth);
        return ConfidenceInterval.around(relative, halfWidth);
    }

    private static void requireNonZeroControl(GroupSummary control) {
        if (control.estimate() == 0.0) {
            throw DomainException.zeroControlEstimate();
        }
    }

    private static void requireCriticalValue(double criticalValue) {
        if (!(criticalValue >= 0.0) || Double.isInfinite(criticalValue)) {
            throw ValidationException.invalidParameter(
                    "criticalValue", criticalValue, "a non-negative finite number");
        }
    }
}
