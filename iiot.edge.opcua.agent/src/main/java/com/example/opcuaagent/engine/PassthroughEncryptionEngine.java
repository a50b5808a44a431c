package com.example.opcuaagent.engine;

import com.example.opcuaagent.codec.EnvelopeSerializer;
import com.example.opcuaagent.model.StatusUpdate;
import com.example.opcuaagent.model.TelemetryEnvelope;

/**
 * Publishes serialized documents as they are.
 */
public class PassthroughEncryptionEngine implements EncryptionEngine {

    private final EnvelopeSerializer serializer;

    public PassthroughEncryptionEngine(EnvelopeSerializer serializer) {
        this.serializer = serializer;
    }

    @Override
    public byte[] protect(TelemetryEnvelope envelope) {
        return serializer.toBytes(envelope);
    }

    @Override
    public byte[] protect(StatusUpdate update) {
        return serializer.toBytes(update);
    }

    @Override
    public boolean isEncrypting() {
        return false;
    }
}
