package com.example.opcuaagent.store;

/**
 * Persisted outbound session of a device.
 */
public class OutboundSessionState {

    private String sessionId;

    /** Index the next message will be encrypted with. */
    private long nextIndex;

    /** Base64 of the 128 ratchet bytes at {@link #nextIndex}. */
    private String ratchet;

    /** Base64 of the Ed25519 seed. */
    private String signingKey;

    private String createdAt;

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public long getNextIndex() {
        return nextIndex;
    }

    public void setNextIndex(long nextIndex) {
        this.nextIndex = nextIndex;
    }

    public String getRatchet() {
        return ratchet;
    }

    public void setRatchet(String ratchet) {
        this.ratchet = ratchet;
    }

    public String getSigningKey() {
        return signingKey;
    }

    public void setSigningKey(String signingKey) {
        this.signingKey = signingKey;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }
}
