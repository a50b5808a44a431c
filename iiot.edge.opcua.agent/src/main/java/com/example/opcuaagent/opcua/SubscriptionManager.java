package com.example.opcuaagent.opcua;

/**
 * Owns the OPC UA sessions, subscriptions and monitored items of all channels.
 */
public interface SubscriptionManager {

    /**
     * Starts connecting in the background. Events are reported to the listener.
     */
    void start(ChannelEventListener listener);

    /**
     * Deletes subscriptions and closes all sessions. No events are reported afterwards.
     */
    void stop();
}
