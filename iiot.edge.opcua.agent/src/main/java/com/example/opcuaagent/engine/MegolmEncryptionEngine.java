package com.example.opcuaagent.engine;

import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.opcuaagent.codec.EnvelopeSerializer;
import com.example.opcuaagent.crypto.Base64Text;
import com.example.opcuaagent.crypto.CiphertextMessage;
import com.example.opcuaagent.crypto.MegolmMessage;
import com.example.opcuaagent.exceptions.CryptoException;
import com.example.opcuaagent.exceptions.DecodingException;
import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.exceptions.PersistenceException;
import com.example.opcuaagent.model.StatusUpdate;
import com.example.opcuaagent.model.TelemetryEnvelope;
import com.example.opcuaagent.store.OutboundStep;
import com.example.opcuaagent.store.RatchetSessionStore;

/**
 * Encrypts envelopes and status updates with the outbound Megolm session of their device, one
 * ratchet step per document, and decrypts ciphertext messages with the matching inbound chain.
 */
public class MegolmEncryptionEngine implements EncryptionEngine {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final RatchetSessionStore store;
    private final EnvelopeSerializer serializer;

    public MegolmEncryptionEngine(RatchetSessionStore store, EnvelopeSerializer serializer) {
        this.store = store;
        this.serializer = serializer;
    }

    @Override
    public byte[] protect(TelemetryEnvelope envelope) throws PersistenceException {
        return encrypt(envelope).toBytes();
    }

    /**
     * @return the ciphertext message of the envelope, encrypted with a fresh ratchet index
     * @throws PersistenceException if the ratchet step could not be persisted
     */
    public CiphertextMessage encrypt(TelemetryEnvelope envelope) throws PersistenceException {
        return encrypt(envelope.getDeviceId(), serializer.toBytes(envelope), "#" + envelope.getSequence());
    }

    @Override
    public byte[] protect(StatusUpdate update) throws PersistenceException {
        return encrypt(update.getDeviceId(), serializer.toBytes(update), update.getFeature() + " status").toBytes();
    }

    private CiphertextMessage encrypt(String deviceId, byte[] plaintext, String label) throws PersistenceException {
        OutboundStep step = store.advanceOutbound(deviceId);
        MegolmMessage message = MegolmMessage.encrypt(step.getIndex(), plaintext, step.getKeys(), step.getSigner());

        logger.trace("Encrypted {} {} with session {} index {}", deviceId, label, step.getSessionId(), step.getIndex());
        return new CiphertextMessage(deviceId, step.getSessionId(), Base64Text.encode(message.toBytes()));
    }

    @Override
    public boolean isEncrypting() {
        return true;
    }

    /**
     * Parses and decrypts a published payload.
     *
     * @throws CryptoException      on a malformed message, unknown session, replay, bad signature, MAC or padding
     * @throws PersistenceException if the accepted index could not be persisted
     */
    public TelemetryEnvelope unprotect(byte[] payload) throws CryptoException, PersistenceException {
        return unprotect(CiphertextMessage.fromBytes(payload));
    }

    public TelemetryEnvelope unprotect(CiphertextMessage ciphertext) throws CryptoException, PersistenceException {
        MegolmMessage message = parseBody(ciphertext);

        TelemetryEnvelope envelope = store.acceptInbound(ciphertext.getDevice(), ciphertext.getSessionId(),
                message.getIndex(), (keys, signingPublicKey) -> {
                    byte[] plaintext = message.decrypt(keys, signingPublicKey);
                    TelemetryEnvelope decrypted;
                    try {
                        decrypted = serializer.fromBytes(plaintext);
                    } catch (DecodingException e) {
                        // authenticated but not an envelope
                        throw new CryptoException(ExceptionContext.DECRYPT, "Plaintext is not an envelope.", e);
                    }
                    if (!decrypted.getDeviceId().equals(ciphertext.getDevice())) {
                        throw new CryptoException(ExceptionContext.MESSAGE_MALFORMED,
                                "Envelope of " + decrypted.getDeviceId() + " sent as " + ciphertext.getDevice() + ".");
                    }
                    return decrypted;
                });

        logger.trace("Decrypted {} #{} from session {} index {}", envelope.getDeviceId(), envelope.getSequence(),
                ciphertext.getSessionId(), message.getIndex());
        return envelope;
    }

    /**
     * Decrypts a published payload of either kind, envelope or status update.
     *
     * @return the plaintext document
     * @throws CryptoException      on a malformed message, unknown session, replay, bad signature, MAC or padding
     * @throws PersistenceException if the accepted index could not be persisted
     */
    public String unprotectDocument(byte[] payload) throws CryptoException, PersistenceException {
        CiphertextMessage ciphertext = CiphertextMessage.fromBytes(payload);
        MegolmMessage message = parseBody(ciphertext);

        return store.acceptInbound(ciphertext.getDevice(), ciphertext.getSessionId(),
                message.getIndex(), (keys, signingPublicKey) -> {
                    String document = new String(message.decrypt(keys, signingPublicKey), StandardCharsets.UTF_8);
                    String device;
                    try {
                        device = serializer.deviceOf(document);
                    } catch (DecodingException e) {
                        throw new CryptoException(ExceptionContext.DECRYPT, "Plaintext is not a telemetry document.", e);
                    }
                    if (!device.equals(ciphertext.getDevice())) {
                        throw new CryptoException(ExceptionContext.MESSAGE_MALFORMED,
                                "Document of " + device + " sent as " + ciphertext.getDevice() + ".");
                    }
                    return document;
                });
    }

    private static MegolmMessage parseBody(CiphertextMessage ciphertext) throws CryptoException {
        try {
            return MegolmMessage.parse(Base64Text.decode(ciphertext.getCiphertext()));
        } catch (IllegalArgumentException e) {
            throw new CryptoException(ExceptionContext.MESSAGE_MALFORMED, "Ciphertext is not base64.", e);
        }
    }
}
