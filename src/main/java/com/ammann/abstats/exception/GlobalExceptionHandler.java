/* (C)2026 */
package com.ammann.abstats.exception;

import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.time.LocalDateTime;
import org.jboss.logging.Logger;

/**
 * Global JAX-RS exception mapper that translates statistics and framework exceptions into
 * structured JSON error responses with appropriate HTTP status codes.
 *
 * <p>Invalid input maps to 400, statistically undefined results (degenerate variance, zero
 * control estimate, zero observed effect) to 422, and numeric non-convergence to 500. Client
 * errors raised by JAX-RS itself (malformed body, wrong method or media type) keep their status.
 * Unhandled exceptions are logged at ERROR level and returned as HTTP 500 responses.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception> {
    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    static final int UNPROCESSABLE_ENTITY = 422;

    @Context UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception) {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof ValidationException) {
            return createResponse(
                    Response.Status.BAD_REQUEST.getStatusCode(),
                    exception.getMessage(),
                    "VALIDATION_ERROR",
                    path);
        }

        if (exception instanceof DegenerateVarianceException) {
            LOG.debugf("Degenerate sample for path %s: %s", path, exception.getMessage());
            return createResponse(
                    UNPROCESSABLE_ENTITY, exception.getMessage(), "DEGENERATE_VARIANCE", path);
        }

        if (exception instanceof DomainException) {
            return createResponse(
                    UNPROCESSABLE_ENTITY, exception.getMessage(), "DOMAIN_ERROR", path);
        }

        if (exception instanceof UndefinedMssException) {
            return createResponse(
                    UNPROCESSABLE_ENTITY, exception.getMessage(), "UNDEFINED_MSS", path);
        }

        if (exception instanceof ConvergenceException) {
            LOG.warnf("Numeric evaluation did not converge: %s", exception.getMessage());
            return createResponse(
                    Response.Status.INTERNAL_SERVER_ERROR.getStatusCode(),
                    exception.getMessage(),
                    "CONVERGENCE_ERROR",
                    path);
        }

        if (exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND.getStatusCode(),
                    exception.getMessage(),
                    "NOT_FOUND",
                    path);
        }

        if (exception instanceof WebApplicationException webException) {
            int status = webException.getResponse().getStatus();
            if (status < Response.Status.INTERNAL_SERVER_ERROR.getStatusCode()) {
                LOG.debugf("Request rejected with %d for path %s: %s", status, path, exception.getMessage());
                return createResponse(status, exception.getMessage(), "REQUEST_ERROR", path);
            }
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR.getStatusCode(),
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                path);
    }

    private Response createResponse(int status, String message, String code, String path) {
        ErrorResponse errorResponse = new ErrorResponse(code, message, path, status);
        return Response.status(status).entity(errorResponse).build();
    }

    /**
     * Structured error response body returned to API clients.
     */
    public static class ErrorResponse {
        public String code;
        public String message;
        public LocalDateTime timestamp;
        public String path;
        public Integer status;

        public ErrorResponse(String code, String message) {
            this.code = code;
            this.message = message;
            this.timestamp = LocalDateTime.now();
        }

        public ErrorResponse(String code, String message, String path, Integer status) {
            this(code, message);
            this.path = path;
            this.status = status;
        }
    }
}
