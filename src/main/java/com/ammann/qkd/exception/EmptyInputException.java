package com.ammann.qkd.exception;

/**
 * Exception indicating that a component received no data to work on, for example
 * an empty detection record handed to the histogram builder.
 *
 * <p>Mapped to HTTP 422 (Unprocessable Entity) by {@link GlobalExceptionHandler}.
 */
public class EmptyInputException extends ApiException
{
    public EmptyInputException(String component, String message)
    {
        super(component, component + ": " + message);
    }
}
