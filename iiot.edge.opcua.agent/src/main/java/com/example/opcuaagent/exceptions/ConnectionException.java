package com.example.opcuaagent.exceptions;

/**
 * Thrown when the OPC UA or MQTT transport fails. Transient failures are retried with backoff;
 * a fatal one (rejected identity, no usable endpoint, retries exhausted) ends the affected
 * lifecycle.
 */
public class ConnectionException extends AgentException {

    private static final long serialVersionUID = 1L;

    private final boolean fatal;

    public ConnectionException(ExceptionContext context, Throwable cause) {
        this(context, cause, false);
    }

    public ConnectionException(ExceptionContext context, Throwable cause, boolean fatal) {
        super(context, cause);
        this.fatal = fatal;
    }

    public ConnectionException(ExceptionContext context, String detail, boolean fatal) {
        super(context, detail);
        this.fatal = fatal;
    }

    /**
     * @return true if retrying cannot succeed without a configuration change
     */
    public boolean isFatal() {
        return fatal;
    }
}
