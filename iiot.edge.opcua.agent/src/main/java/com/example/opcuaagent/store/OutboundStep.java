package com.example.opcuaagent.store;

import com.example.opcuaagent.crypto.MessageKeys;
import com.example.opcuaagent.crypto.SigningKey;

/**
 * Key material of exactly one outbound message. The ratchet has already been advanced past
 * {@link #getIndex()} and persisted, so the step is never handed out twice.
 */
public final class OutboundStep {

    private final String sessionId;
    private final long index;
    private final MessageKeys keys;
    private final SigningKey signer;

    OutboundStep(String sessionId, long index, MessageKeys keys, SigningKey signer) {
        this.sessionId = sessionId;
        this.index = index;
        this.keys = keys;
        this.signer = signer;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getIndex() {
        return index;
    }

    public MessageKeys getKeys() {
        return keys;
    }

    public SigningKey getSigner() {
        return signer;
    }
}
