package com.example.opcuaagent.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.google.gson.JsonElement;

/**
 * State change of an OPC UA connection or of one monitored node, published to the channels it
 * affects. Unlike samples, status updates carry no sequence number.
 */
public final class StatusUpdate {

    public enum Kind {
        /** The session of the channel's connection came up or went down. */
        CONNECTION,
        /** A node of the channel is no longer (or could never be) monitored. */
        SUBSCRIPTION
    }

    public static final String CONNECTION_FEATURE = "connection";

    private final Kind kind;
    private final String deviceId;

    /** Null for {@link Kind#CONNECTION}. */
    private final String node;

    private final String feature;

    /** Connected for {@link Kind#CONNECTION}, subscribed for {@link Kind#SUBSCRIPTION}. */
    private final boolean active;

    /** Symbolic OPC UA status code name; may be null. */
    private final String status;

    private final Instant timestamp;
    private final Map<String, JsonElement> extensions;

    public StatusUpdate(Kind kind, String deviceId, String node, String feature, boolean active, String status,
                        Instant timestamp, Map<String, JsonElement> extensions) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.node = kind == Kind.SUBSCRIPTION ? Objects.requireNonNull(node, "node") : null;
        this.feature = Objects.requireNonNull(feature, "feature");
        this.active = active;
        this.status = status;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.extensions = extensions.isEmpty() ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    public static StatusUpdate connection(String deviceId, boolean connected, String status, Instant timestamp) {
        return new StatusUpdate(Kind.CONNECTION, deviceId, null, CONNECTION_FEATURE, connected, status, timestamp,
                Collections.emptyMap());
    }

    public static StatusUpdate subscription(String deviceId, String node, String feature, boolean subscribed,
                                            String status, Instant timestamp) {
        return new StatusUpdate(Kind.SUBSCRIPTION, deviceId, node, feature, subscribed, status, timestamp,
                Collections.emptyMap());
    }

    /**
     * @return a copy published under another feature name with the given extensions
     */
    public StatusUpdate routed(String routedFeature, Map<String, JsonElement> routedExtensions) {
        return new StatusUpdate(kind, deviceId, node, routedFeature, active, status, timestamp, routedExtensions);
    }

    public Kind getKind() { return kind; }
    public String getDeviceId() { return deviceId; }
    public String getNode() { return node; }
    public String getFeature() { return feature; }
    public boolean isActive() { return active; }
    public String getStatus() { return status; }
    public Instant getTimestamp() { return timestamp; }
    public Map<String, JsonElement> getExtensions() { return extensions; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatusUpdate)) return false;
        StatusUpdate other = (StatusUpdate) o;
        return kind == other.kind
                && active == other.active
                && deviceId.equals(other.deviceId)
                && Objects.equals(node, other.node)
                && feature.equals(other.feature)
                && Objects.equals(status, other.status)
                && timestamp.equals(other.timestamp)
                && extensions.equals(other.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, deviceId, node, feature, active, timestamp);
    }

    @Override
    public String toString() {
        return "StatusUpdate{" + deviceId + " " + kind + " " + feature + "=" + active
                + (status == null ? "" : " " + status) + " @" + timestamp + "}";
    }
}
