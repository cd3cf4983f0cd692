package com.ammann.qkd.exception;

/**
 * Unexpected failure inside a component, for example a batch worker dying with an
 * unchecked exception that is not an {@link ApiException}.
 *
 * <p>Mapped to HTTP 500 (Internal Server Error) by {@link GlobalExceptionHandler}.
 */
public class SomeThingWentWrongException extends ApiException
{
    public SomeThingWentWrongException(String component, Throwable cause)
    {
        super(component, component + ": some thing went wrong", cause);
    }
}
