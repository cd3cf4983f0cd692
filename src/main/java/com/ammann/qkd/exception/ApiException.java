package com.ammann.qkd.exception;

/**
 * Base unchecked exception for all application-level errors of the channel simulator.
 *
 * <p>Every error names the component that raised it, a pipeline stage such as
 * {@code CorrelationEngine} or a surrounding service such as {@code SimulationBatch}, so that
 * a client can tell which step aborted a run. Subclasses are mapped to HTTP status codes by
 * {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    private final String component;

    public ApiException(String component, String message)
    {
        super(message);
        this.component = component;
    }

    public ApiException(String component, String message, Throwable cause)
    {
        super(message, cause);
        this.component = component;
    }

    public String getComponent()
    {
        return component;
    }
}
