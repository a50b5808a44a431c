package com.example.opcuaagent.opcua;

import org.eclipse.milo.opcua.stack.core.types.builtin.DataValue;

/**
 * A value change notification of one monitored node of a channel.
 */
public final class ValueChange {

    private final String deviceId;
    private final String node;
    private final String feature;
    private final DataValue value;

    public ValueChange(String deviceId, String node, String feature, DataValue value) {
        this.deviceId = deviceId;
        this.node = node;
        this.feature = feature;
        this.value = value;
    }

    public String getDeviceId() { return deviceId; }
    public String getNode() { return node; }
    public String getFeature() { return feature; }
    public DataValue getValue() { return value; }

    @Override
    public String toString() {
        return "ValueChange{" + deviceId + "/" + feature + " " + value + "}";
    }
}
