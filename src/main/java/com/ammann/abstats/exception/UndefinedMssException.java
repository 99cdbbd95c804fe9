/* (C)2026 */
package com.ammann.abstats.exception;

/**
 * Exception indicating that no finite minimum sample size exists for the observed effect, most
 * commonly because the observed difference is exactly zero.
 *
 * <p>Mapped to HTTP 422 (Unprocessable Entity) by {@link GlobalExceptionHandler}. During result
 * assembly it only blanks the post-hoc sample size field.
 */
public class UndefinedMssException extends ApiException {

    public UndefinedMssException(String message) {
        super(message);
    }
}
