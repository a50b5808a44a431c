package com.example.opcuaagent.store;

import java.util.List;

/**
 * Read-only view of a device's sessions, for tooling and logs.
 */
public final class SessionSummary {

    private final String deviceId;
    private final String outboundSessionId;
    private final long nextOutboundIndex;
    private final List<Inbound> inbound;

    SessionSummary(String deviceId, String outboundSessionId, long nextOutboundIndex, List<Inbound> inbound) {
        this.deviceId = deviceId;
        this.outboundSessionId = outboundSessionId;
        this.nextOutboundIndex = nextOutboundIndex;
        this.inbound = List.copyOf(inbound);
    }

    public String getDeviceId() {
        return deviceId;
    }

    /** Null if the device has no outbound session. */
    public String getOutboundSessionId() {
        return outboundSessionId;
    }

    public long getNextOutboundIndex() {
        return nextOutboundIndex;
    }

    public List<Inbound> getInbound() {
        return inbound;
    }

    public static final class Inbound {
        private final String sessionId;
        private final long nextIndex;
        private final Long lastAcceptedIndex;

        Inbound(String sessionId, long nextIndex, Long lastAcceptedIndex) {
            this.sessionId = sessionId;
            this.nextIndex = nextIndex;
            this.lastAcceptedIndex = lastAcceptedIndex;
        }

        public String getSessionId() {
            return sessionId;
        }

        public long getNextIndex() {
            return nextIndex;
        }

        public Long getLastAcceptedIndex() {
            return lastAcceptedIndex;
        }
    }
}
