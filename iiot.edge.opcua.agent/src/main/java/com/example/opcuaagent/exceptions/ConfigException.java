package com.example.opcuaagent.exceptions;

/**
 * Thrown when the configuration is unusable. Fatal at startup; at runtime only the affected channel is skipped.
 */
public class ConfigException extends AgentException {

    private static final long serialVersionUID = 1L;

    public ConfigException(ExceptionContext context) {
        super(context);
    }

    public ConfigException(ExceptionContext context, String detail) {
        super(context, detail);
    }

    public ConfigException(ExceptionContext context, Throwable cause) {
        super(context, cause);
    }

    public ConfigException(ExceptionContext context, String detail, Throwable cause) {
        super(context, detail, cause);
    }
}
