package com.example.opcuaagent.opcua;

import com.example.opcuaagent.exceptions.ConnectionException;
import com.example.opcuaagent.model.StatusUpdate;

/**
 * Receives the events of the channels served by a {@link SubscriptionManager}. Value changes
 * of one node arrive in notification order.
 */
public interface ChannelEventListener {

    /** Monitored items of the channel were (re)created; values flow from now on. */
    void onStreaming(String deviceId);

    void onValueChange(ValueChange change);

    /** The connection of the channel went up or down, or one of its nodes is not monitored. */
    void onStatus(StatusUpdate update);

    /** The session of the channel was lost; it is being re-established. */
    void onInterrupted(String deviceId, String reason);

    /** The session of the channel cannot be established; no further events follow. */
    void onFatal(String deviceId, ConnectionException error);
}
