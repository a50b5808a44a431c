package com.example.opcuaagent.exceptions;

/**
 * Reasons and situations which may trigger an {@link AgentException}.
 */
public enum ExceptionContext {
    CONFIG_FILE("Could not read the agent configuration file."),
    CONFIG_INVALID("The agent configuration is invalid."),
    NODE_ID_SYNTAX("The node identifier has an incorrect syntax."),
    TOPIC_TEMPLATE("The MQTT topic template is malformed."),
    SECRET("Could not resolve credentials from the secret store."),
    OPCUA_CONNECT("Could not connect to the OPC UA server."),
    OPCUA_ENDPOINT("No suitable OPC UA endpoint was offered by the server."),
    OPCUA_AUTH("The OPC UA server rejected the configured identity or security settings."),
    CREATE_SUBSCRIPTION("Could not create a subscription."),
    CREATE_MONITORED_ITEM("Could not create a monitored item."),
    MQTT_CONNECT("Could not connect to the MQTT broker."),
    MQTT_PUBLISH("Could not publish to the MQTT broker."),
    MQTT_QUEUE_FULL("The MQTT delivery queue is full."),
    TLS("Could not set up the TLS socket factory."),
    VALUE_UNSUPPORTED("The OPC UA value type is not supported."),
    VALUE_MALFORMED("The OPC UA value could not be mapped."),
    PAYLOAD_MALFORMED("The telemetry payload could not be parsed."),
    MESSAGE_MALFORMED("The ciphertext message is malformed."),
    MESSAGE_VERSION("The ciphertext message version is not supported."),
    SIGNATURE("The ciphertext signature does not verify."),
    MAC("The ciphertext MAC does not verify."),
    DECRYPT("The ciphertext could not be decrypted."),
    UNKNOWN_SESSION("No inbound session is known for the message."),
    REPLAY("The ratchet index was already accepted for this session."),
    SESSION_KEY("The session key is malformed or its signature does not verify."),
    NO_OUTBOUND_SESSION("No outbound session exists for the device."),
    PERSIST_WRITE("Could not durably write the ratchet state."),
    PERSIST_READ("Could not read the persisted ratchet state."),
    STATE_LOCKED("The ratchet state directory is in use by another process.");

    private final String message;

    ExceptionContext(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
