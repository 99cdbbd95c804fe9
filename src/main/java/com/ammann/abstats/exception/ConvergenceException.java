/* (C)2026 */
package com.ammann.abstats.exception;

/**
 * Exception indicating that a bounded iterative evaluation (incomplete beta continued fraction,
 * quantile root finding) exhausted its iteration budget.
 *
 * <p>Mapped to HTTP 500 (Internal Server Error) by {@link GlobalExceptionHandler}.
 */
public class ConvergenceException extends ApiException {

    public ConvergenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConvergenceException(String message) {
        super(message);
    }
}
