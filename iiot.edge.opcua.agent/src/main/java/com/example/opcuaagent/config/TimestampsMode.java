package com.example.opcuaagent.config;

import org.eclipse.milo.opcua.stack.core.types.enumerated.TimestampsToReturn;

/**
 * Which timestamps the server is asked to return with each sample.
 */
public enum TimestampsMode {
    NONE(TimestampsToReturn.Neither),
    SOURCE(TimestampsToReturn.Source),
    SERVER(TimestampsToReturn.Server),
    BOTH(TimestampsToReturn.Both);

    private final TimestampsToReturn opcUa;

    TimestampsMode(TimestampsToReturn opcUa) {
        this.opcUa = opcUa;
    }

    public TimestampsToReturn toOpcUa() {
        return opcUa;
    }
}
