package com.ammann.qkd.exception;

/**
 * Exception indicating that a numeric input of a pipeline component is out of range or malformed.
 *
 * <p>Carries the name of the component that rejected the value so callers can tell which stage
 * aborted the run. Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 */
public class InvalidParameterException extends ApiException {

    public InvalidParameterException(String component, String message) {
        super(component, message);
    }

    /**
     * Creates an exception for a parameter whose value violates its expected range.
     */
    public static InvalidParameterException of(String component, String paramName, Object value, String expected) {
        return new InvalidParameterException(component,
                String.format("%s: invalid parameter '%s': got '%s', expected %s",
                        component, paramName, value, expected));
    }
}
