package com.example.opcuaagent.exceptions;

/**
 * Thrown when an OPC UA value cannot be mapped to a telemetry envelope. The sample is dropped, the channel continues.
 */
public class DecodingException extends AgentException {

    private static final long serialVersionUID = 1L;

    public DecodingException(ExceptionContext context) {
        super(context);
    }

    public DecodingException(ExceptionContext context, String detail) {
        super(context, detail);
    }

    public DecodingException(ExceptionContext context, Throwable cause) {
        super(context, cause);
    }

    public DecodingException(ExceptionContext context, String detail, Throwable cause) {
        super(context, detail, cause);
    }
}
