package com.ammann.qkd.exception;

import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.time.LocalDateTime;

/**
 * Global JAX-RS exception mapper that translates simulator and framework exceptions
 * into structured JSON error responses with appropriate HTTP status codes.
 *
 * <p>Configuration mistakes ({@link InvalidParameterException}) and missing data
 * ({@link EmptyInputException}) are reported with the originating pipeline component.
 * Unhandled exceptions are logged at ERROR level and returned as HTTP 500 responses.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception>
{
    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    static final int UNPROCESSABLE_ENTITY = 422;

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception)
    {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof InvalidParameterException invalid) {
            LOG.debugf("Rejected simulation parameters for path %s: %s", path, invalid.getMessage());
            return createResponse(
                    Response.Status.BAD_REQUEST.getStatusCode(),
                    invalid.getMessage(),
                    "INVALID_PARAMETER",
                    invalid.getComponent(),
                    path
            );
        }

        if (exception instanceof EmptyInputException empty) {
            LOG.warnf("Empty input for path %s: %s", path, empty.getMessage());
            return createResponse(
                    UNPROCESSABLE_ENTITY,
                    empty.getMessage(),
                    "EMPTY_INPUT",
                    empty.getComponent(),
                    path
            );
        }

        if (exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND.getStatusCode(),
                    exception.getMessage(),
                    "NOT_FOUND",
                    null,
                    path
            );
        }

        if (exception instanceof SomeThingWentWrongException failure) {
            LOG.error("Internal simulation failure", exception);
            return createResponse(
                    Response.Status.INTERNAL_SERVER_ERROR.getStatusCode(),
                    failure.getMessage(),
                    "INTERNAL_ERROR",
                    failure.getComponent(),
                    path
            );
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR.getStatusCode(),
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                null,
                path
        );
    }

    private Response createResponse(int status, String message, String code, String component, String path)
    {
        ErrorResponse errorResponse = new ErrorResponse(code, message, path, status);
        errorResponse.component = component;
        return Response.status(status).entity(errorResponse).build();
    }


    /**
     * Structured error response body returned to API clients.
     */
    public static class ErrorResponse
    {
        public String code;
        public String message;
        public String component;
        public LocalDateTime timestamp;
        public String path;
        public Integer status;

        public ErrorResponse(String code, String message)
        {
            this.code = code;
            this.message = message;
            this.timestamp = LocalDateTime.now();
        }

        public ErrorResponse(String code, String message, String path, Integer status)
        {
            this(code, message);
            this.path = path;
            this.status = status;
        }
    }
}
