package com.example.opcuaagent.mqtt;

/**
 * What {@link MqttPublisher#publish} does while the delivery queue is full.
 */
public enum BackpressurePolicy {
    /** Wait for capacity; stalls the caller instead of losing telemetry. */
    BLOCK,
    /** Reject the message immediately; the drop is logged and counted. */
    DROP
}
