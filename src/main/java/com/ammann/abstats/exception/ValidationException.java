/* (C)2026 */
package com.ammann.abstats.exception;

/**
 * Exception indicating that a caller-supplied count, probability or observation sequence does not
 * meet the constraints of the requested test.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}. Provides factory methods
 * for common validation failure patterns.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for insufficient data.
     */
    public static ValidationException insufficientData(String resourceType, int required, int actual) {
        return new ValidationException(
                String.format(
                        "Insufficient %s: need at least %d, but got %d",
                        resourceType, required, actual));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format(
                        "Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    /**
     * Creates validation exception for a probability that must lie strictly between 0 and 1.
     */
    public static ValidationException notAProbability(String paramName, double value) {
        return invalidParameter(paramName, value, "a value in the open interval (0, 1)");
    }
}
