/* (C)2026 */
package com.ammann.abstats.exception;

/**
 * Exception indicating that a sample has zero variance, which leaves the test statistic or the
 * Welch-Satterthwaite degrees of freedom undefined.
 *
 * <p>Mapped to HTTP 422 (Unprocessable Entity) by {@link GlobalExceptionHandler}.
 */
public class DegenerateVarianceException extends ApiException {

    public DegenerateVarianceException(String message) {
        super(message);
    }

    public static DegenerateVarianceException zeroVariance(String group) {
        return new DegenerateVarianceException(
                String.format("Sample variance of the %s group is zero", group));
    }
}
