package com.example.opcuaagent.exceptions;

/**
 * Base of all checked failures raised by the agent. The concrete subclass tells the caller
 * how to react: retry, skip the sample, drop the message or stop the channel.
 */
public abstract class AgentException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ExceptionContext context;

    protected AgentException(ExceptionContext context) {
        super(context.getMessage());
        this.context = context;
    }

    protected AgentException(ExceptionContext context, String detail) {
        super(context.getMessage() + " " + detail);
        this.context = context;
    }

    protected AgentException(ExceptionContext context, Throwable cause) {
        super(context.getMessage(), cause);
        this.context = context;
    }

    protected AgentException(ExceptionContext context, String detail, Throwable cause) {
        super(context.getMessage() + " " + detail, cause);
        this.context = context;
    }

    public ExceptionContext getContext() {
        return context;
    }
}
