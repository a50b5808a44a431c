package com.example.opcuaagent.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.google.gson.JsonElement;

/**
 * Canonical, protocol-agnostic telemetry record produced for every OPC UA value change.
 * <p>
 * The sequence number is strictly increasing per channel for the lifetime of a subscription,
 * so downstream consumers can detect gaps. All timestamps are UTC instants.
 */
public final class TelemetryEnvelope {

    /** Logical device (channel) identifier, e.g. "pump-1". */
    private final String deviceId;

    /** Node the sample was read from, in parseable OPC UA form (e.g. "ns=2;s=Pump1.Speed"). */
    private final String node;

    /** Feature name inside the channel: the node alias or the last node identifier segment. */
    private final String feature;

    private final TelemetryValue value;

    /** Effective timestamp: source, else server, else time of reception. */
    private final Instant timestamp;

    /** May be null when the server did not report one. */
    private final Instant sourceTimestamp;

    /** May be null when the server did not report one. */
    private final Instant serverTimestamp;

    private final Quality quality;
    private final long sequence;

    /** Values added by source overrides; never null, read-only. */
    private final Map<String, JsonElement> extensions;

    public TelemetryEnvelope(String deviceId, String node, String feature, TelemetryValue value,
                             Instant timestamp, Instant sourceTimestamp, Instant serverTimestamp,
                             Quality quality, long sequence) {
        this(deviceId, node, feature, value, timestamp, sourceTimestamp, serverTimestamp, quality, sequence,
                Collections.emptyMap());
    }

    public TelemetryEnvelope(String deviceId, String node, String feature, TelemetryValue value,
                             Instant timestamp, Instant sourceTimestamp, Instant serverTimestamp,
                             Quality quality, long sequence, Map<String, JsonElement> extensions) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.node = Objects.requireNonNull(node, "node");
        this.feature = Objects.requireNonNull(feature, "feature");
        this.value = Objects.requireNonNull(value, "value");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.sourceTimestamp = sourceTimestamp;
        this.serverTimestamp = serverTimestamp;
        this.quality = Objects.requireNonNull(quality, "quality");
        this.sequence = sequence;
        this.extensions = extensions.isEmpty() ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    /**
     * @return a copy of this envelope carrying the given extensions instead
     */
    public TelemetryEnvelope withExtensions(Map<String, JsonElement> replacement) {
        return new TelemetryEnvelope(deviceId, node, feature, value, timestamp, sourceTimestamp, serverTimestamp,
                quality, sequence, replacement);
    }

    public String getDeviceId() { return deviceId; }
    public String getNode() { return node; }
    public String getFeature() { return feature; }
    public TelemetryValue getValue() { return value; }
    public Instant getTimestamp() { return timestamp; }
    public Instant getSourceTimestamp() { return sourceTimestamp; }
    public Instant getServerTimestamp() { return serverTimestamp; }
    public Quality getQuality() { return quality; }
    public long getSequence() { return sequence; }
    public Map<String, JsonElement> getExtensions() { return extensions; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TelemetryEnvelope)) return false;
        TelemetryEnvelope other = (TelemetryEnvelope) o;
        return sequence == other.sequence
                && deviceId.equals(other.deviceId)
                && node.equals(other.node)
                && feature.equals(other.feature)
                && value.equals(other.value)
                && timestamp.equals(other.timestamp)
                && Objects.equals(sourceTimestamp, other.sourceTimestamp)
                && Objects.equals(serverTimestamp, other.serverTimestamp)
                && quality.equals(other.quality)
                && extensions.equals(other.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, node, feature, value, timestamp, sequence);
    }

    @Override
    public String toString() {
        return "TelemetryEnvelope{" + deviceId + "#" + sequence + " " + feature + "=" + value
                + " @" + timestamp + " " + quality + "}";
    }
}
