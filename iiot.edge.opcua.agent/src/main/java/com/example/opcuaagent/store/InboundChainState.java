package com.example.opcuaagent.store;

/**
 * Persisted inbound chain for one sender session. The ratchet is stored at the lowest index
 * that may still be accepted, so earlier keys cannot be derived from it.
 */
public class InboundChainState {

    private String sessionId;
    private long nextIndex;
    private String ratchet;
    private String signingPublicKey;

    /** Null until the first message of the chain was accepted. */
    private Long lastAcceptedIndex;

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

    public String getSigningPublicKey() {
        return signingPublicKey;
    }

    public void setSigningPublicKey(String signingPublicKey) {
        this.signingPublicKey = signingPublicKey;
    }

    public Long getLastAcceptedIndex() {
        return lastAcceptedIndex;
    }

    public void setLastAcceptedIndex(Long lastAcceptedIndex) {
        this.lastAcceptedIndex = lastAcceptedIndex;
    }
}
