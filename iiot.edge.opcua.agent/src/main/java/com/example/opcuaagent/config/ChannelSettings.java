package com.example.opcuaagent.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * A device channel: the nodes of one OPC UA connection published under one device id.
 */
public class ChannelSettings {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    /** Stable device id, e.g. {@code pump-1}. Also keys the device's ratchet session. */
    private String device;

    /** Key into the connections map. */
    private String connection;

    private List<NodeSettings> nodes = new ArrayList<>();

    /** Topic template; placeholders {device}, {application} and {feature}. */
    private String topic = "telemetry/{device}";

    private int qos = 1;

    private boolean encrypted;

    @JsonDeserialize(using = FlexibleDurationDeserializer.class)
    private Duration samplingInterval = Duration.ofSeconds(1);

    private TimestampsMode timestamps = TimestampsMode.SOURCE;

    public String getDevice() { return device; }
    public String getConnection() { return connection; }
    public List<NodeSettings> getNodes() { return nodes; }
    public String getTopic() { return topic; }
    public int getQos() { return qos; }
    public boolean isEncrypted() { return encrypted; }
    public Duration getSamplingInterval() { return samplingInterval; }
    public TimestampsMode getTimestamps() { return timestamps; }

    public void setDevice(String device) { this.device = device; }
    public void setConnection(String connection) { this.connection = connection; }
    public void setNodes(List<NodeSettings> nodes) { this.nodes = nodes == null ? new ArrayList<>() : nodes; }
    public void setTopic(String topic) { this.topic = topic; }
    public void setEncrypted(boolean encrypted) { this.encrypted = encrypted; }
    public void setSamplingInterval(Duration samplingInterval) { this.samplingInterval = samplingInterval; }
    public void setTimestamps(TimestampsMode timestamps) { this.timestamps = timestamps; }

    /**
     * Parses qos from String input for YAML compatibility. Out of range values are kept and
     * rejected by validation.
     *
     * @param value the qos as configured
     */
    @JsonSetter("qos")
    public void setQos(String value) {
        try {
            this.qos = Integer.parseInt(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            logger.error("Invalid qos '{}' for channel {}", value, device);
            this.qos = -1;
        }
    }

    @Override
    public String toString() {
        return "ChannelSettings{device=" + device + ", connection=" + connection + ", nodes=" + nodes.size()
                + ", topic=" + topic + ", qos=" + qos + ", encrypted=" + encrypted + "}";
    }
}
