/* (C)2026 */
package com.ammann.abstats.service;

import com.ammann.abstats.exception.ConvergenceException;
import com.ammann.abstats.exception.DomainException;
import com.ammann.abstats.exception.ValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.special.Beta;
import org.jboss.logging.Logger;

/**
 * Normal and Student-t distribution kernel shared by both two-sample tests.
 *
 * <p>Standard normal probabilities come from Commons Math's {@link NormalDistribution}. The
 * Student-t tail probability is evaluated through the regularized incomplete beta function
 * {@code I_x(df/2, 1/2)} with {@code x = df / (df + t^2)}, and the Student-t quantile is found by
 * Brent root finding on that CDF.
 *
 * <p>Every iterative step is bounded:
 * <ul>
 *   <li>incomplete beta continued fraction: {@value #DEFAULT_MAX_BETA_ITERATIONS} terms</li>
 *   <li>quantile bracket expansion: {@value #MAX_BRACKET_DOUBLINGS} doublings</li>
 *   <li>quantile root finding: {@value #DEFAULT_MAX_SOLVER_EVALUATIONS} CDF evaluations</li>
 * </ul>
 * Exhausting a bound raises {@link ConvergenceException}.
 */
@ApplicationScoped
public class DistributionService {

    private static final Logger LOG = Logger.getLogger(DistributionService.class);

    static final int DEFAULT_MAX_BETA_ITERATIONS = 10_000;
    static final int DEFAULT_MAX_SOLVER_EVALUATIONS = 100;
    static final int MAX_BRACKET_DOUBLINGS = 64;

    private static final double BETA_EPSILON = 1e-14;
    private static final double QUANTILE_ABSOLUTE_ACCURACY = 1e-12;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private final int maxBetaIterations;
    private final int maxSolverEvaluations;

    public DistributionService() {
        this(DEFAULT_MAX_BETA_ITERATIONS, DEFAULT_MAX_SOLVER_EVALUATIONS);
    }

    DistributionService(int maxBetaIterations, int maxSolverEvaluations) {
        this.maxBetaIterations = maxBetaIterations;
        this.maxSolverEvaluations = maxSolverEvaluations;
    }

    /**
     * Standard normal cumulative probability {@code Phi(x)}.
     */
    public double standardNormalCdf(double x) {
        if (Double.isNaN(x)) {
            throw ValidationException.invalidParameter("x", x, "a number");
        }
        try {
            return STANDARD_NORMAL.cumulativeProbability(x);
        } catch (MathIllegalStateException e) {
            throw new ConvergenceException("Normal CDF did not converge at x=" + x, e);
        }
    }

    /**
     * Inverse of {@link #standardNormalCdf(double)}.
     *
     * @throws DomainException if {@code p} is not strictly between 0 and 1
     */
    public double standardNormalQuantile(double p) {
        requireOpenUnitInterval(p);
        return STANDARD_NORMAL.inverseCumulativeProbability(p);
    }

    /**
     * Two-sided p-value {@code 2 * (1 - Phi(|z|))}, evaluated as {@code 2 * Phi(-|z|)}.
     */
    public double twoSidedNormalPValue(double z) {
        double p = 2.0 * standardNormalCdf(-Math.abs(z));
        return Math.min(1.0, p);
    }

    /**
     * Student-t cumulative probability with {@code df} degrees of freedom (non-integer allowed).
     */
    public double studentTCdf(double t, double df) {
        requireDegreesOfFreedom(df);
        if (Double.isNaN(t)) {
            throw ValidationException.invalidParameter("t", t, "a number");
        }
        double tail = 0.5 * twoSidedTailProbability(Math.abs(t), df);
        return t >= 0 ? 1.0 - tail : tail;
    }

    /**
     * Two-sided p-value {@code P(|T| >= |t|)} of the Student-t distribution.
     */
    public double twoSidedStudentTPValue(double t, double df) {
        requireDegreesOfFreedom(df);
        if (Double.isNaN(t)) {
            throw ValidationException.invalidParameter("t", t, "a number");
        }
        return Math.min(1.0, twoSidedTailProbability(Math.abs(t), df));
    }

    /**
     * Inverse of {@link #studentTCdf(double, double)}.
     *
     * @throws DomainException if {@code p} is not strictly between 0 and 1
     * @throws ConvergenceException if the bracket or root search exceeds its budget
     */
    public double studentTQuantile(double p, double df) {
        requireOpenUnitInterval(p);
        requireDegreesOfFreedom(df);
        if (p == 0.5) {
            return 0.0;
        }

        double upper = p > 0.5 ? p : 1.0 - p;
        UnivariateFunction excess = x -> studentTCdf(x, df) - upper;

        double lo = 0.0;
        double hi = Math.max(1.0, 2.0 * standardNormalQuantile(upper));
        int doublings = 0;
        while (excess.value(hi) < 0) {
            if (++doublings > MAX_BRACKET_DOUBLINGS) {
                throw new ConvergenceException(String.format(
                        "Could not bracket Student-t quantile p=%s df=%s", p, df));
            }
            lo = hi;
            hi *= 2.0;
        }

        double root;
        try {
            root = new BrentSolver(QUANTILE_ABSOLUTE_ACCURACY)
                    .solve(maxSolverEvaluations, excess, lo, hi);
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            throw new ConvergenceException(String.format(
                    "Student-t quantile did not converge within %d evaluations (p=%s, df=%s)",
                    maxSolverEvaluations, p, df), e);
        }

        LOG.debugf("Student-t quantile p=%.6f df=%.4f -> %.8f (bracket [%.4f, %.4f])",
                p, df, root, lo, hi);
        return p > 0.5 ? root : -root;
    }

    private double twoSidedTailProbability(double absT, double df) {
        if (absT == 0.0) {
            return 1.0;
        }
        if (Double.isInfinite(absT)) {
            return 0.0;
        }
        double x = df / (df + absT * absT);
        try {
            return Beta.regularizedBeta(x, df / 2.0, 0.5, BETA_EPSILON, maxBetaIterations);
        } catch (MathIllegalStateException e) {
            throw new ConvergenceException(String.format(
                    "Incomplete beta did not converge within %d iterations (t=%s, df=%s)",
                    maxBetaIterations, absT, df), e);
        }
    }

    private static void requireOpenUnitInterval(double p) {
        if (!(p > 0.0 && p < 1.0)) {
            throw new DomainException(
                    "Quantile is only defined for probabilities in (0, 1), got " + p);
        }
    }

    private static void requireDegreesOfFreedom(double df) {
        if (!(df > 0.0) || Double.isInfinite(df)) {
            throw ValidationException.invalidParameter("df", df, "a positive finite number");
        }
    }
}
