package com.example.opcuaagent.exceptions;

/**
 * Thrown on MAC or signature failure, unknown session, ratchet replay or misuse. The message is dropped and reported as a potential integrity violation.
 */
public class CryptoException extends AgentException {

    private static final long serialVersionUID = 1L;

    public CryptoException(ExceptionContext context) {
        super(context);
    }

    public CryptoException(ExceptionContext context, String detail) {
        super(context, detail);
    }

    public CryptoException(ExceptionContext context, Throwable cause) {
        super(context, cause);
    }

    public CryptoException(ExceptionContext context, String detail, Throwable cause) {
        super(context, detail, cause);
    }
}
