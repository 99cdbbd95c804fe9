/* (C)2026 */
package com.ammann.abstats.exception;

/**
 * Base unchecked exception for all application-level errors raised by the A/B statistics engine.
 *
 * <p>Subclasses represent specific failure categories (invalid input, degenerate samples,
 * undefined uplift or sample size, numeric non-convergence) and are mapped to HTTP status codes
 * by {@link GlobalExceptionHandler}. None of them is retryable: every computation is pure and
 * deterministic.
 */
public class ApiException extends RuntimeException {
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiException(String message) {
        super(message);
    }
}
