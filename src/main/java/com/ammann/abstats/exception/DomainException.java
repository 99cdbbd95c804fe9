/* (C)2026 */
package com.ammann.abstats.exception;

/**
 * Exception indicating that an argument lies outside the mathematical domain of a function:
 * a quantile requested for a probability outside {@code (0, 1)}, or a relative uplift whose
 * control estimate is zero.
 *
 * <p>Mapped to HTTP 422 (Unprocessable Entity) by {@link GlobalExceptionHandler}. During result
 * assembly an undefined relative uplift only blanks the relative fields.
 */
public class DomainException extends ApiException {

    public DomainException(String message) {
        super(message);
    }

    public static DomainException zeroControlEstimate() {
        return new DomainException("Relative uplift is undefined because the control estimate is zero");
    }
}
