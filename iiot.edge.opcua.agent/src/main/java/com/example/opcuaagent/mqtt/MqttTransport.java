package com.example.opcuaagent.mqtt;

import com.example.opcuaagent.exceptions.ConnectionException;

/**
 * The broker connection used by {@link MqttPublisher}. Only the delivery thread calls it.
 */
public interface MqttTransport {

    /**
     * Opens the connection; a no-op if already connected.
     *
     * @throws ConnectionException if the broker cannot be reached or refuses the client;
     *                             {@link ConnectionException#isFatal()} if retrying cannot help
     */
    void connect() throws ConnectionException;

    boolean isConnected();

    /**
     * Sends one message and returns once the broker acknowledged it as the QoS requires.
     *
     * @throws ConnectionException if the message could not be sent
     */
    void publish(String topic, byte[] payload, int qos) throws ConnectionException;

    void disconnect();
}
