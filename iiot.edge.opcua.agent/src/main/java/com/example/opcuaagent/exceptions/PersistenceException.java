package com.example.opcuaagent.exceptions;

/**
 * Thrown when ratchet state could not be durably written or read. Encryption for the device cannot continue, since it could reuse a ratchet step.
 */
public class PersistenceException extends AgentException {

    private static final long serialVersionUID = 1L;

    public PersistenceException(ExceptionContext context) {
        super(context);
    }

    public PersistenceException(ExceptionContext context, String detail) {
        super(context, detail);
    }

    public PersistenceException(ExceptionContext context, Throwable cause) {
        super(context, cause);
    }

    public PersistenceException(ExceptionContext context, String detail, Throwable cause) {
        super(context, detail, cause);
    }
}
