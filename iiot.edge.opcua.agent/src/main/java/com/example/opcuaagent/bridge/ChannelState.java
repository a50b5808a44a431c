package com.example.opcuaagent.bridge;

/**
 * Lifecycle of a device channel.
 * <pre>
 * STARTING -> SUBSCRIBING -> STREAMING <-> RECONNECTING
 *                                 any  ->  FAILED
 * </pre>
 */
public enum ChannelState {
    STARTING,
    SUBSCRIBING,
    STREAMING,
    RECONNECTING,
    /** Terminal: the session cannot be established or ratchet state cannot be persisted. */
    FAILED
}
