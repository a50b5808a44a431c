package com.example.opcuaagent.crypto;

import java.nio.ByteBuffer;
import java.util.Arrays;

import com.example.opcuaagent.exceptions.CryptoException;
import com.example.opcuaagent.exceptions.ExceptionContext;

/**
 * Shareable key of an outbound session, letting a receiver decrypt every message from its
 * ratchet index onwards.
 * <pre>
 * 0x02 | counter (4, big endian) | ratchet (128) | Ed25519 public key (32) | signature (64)
 * </pre>
 * The signature is made with the session's own signing key over all preceding bytes. The
 * text form is unpadded base64.
 */
public final class SessionKey {

    public static final int VERSION = 0x02;

    private static final int SIGNED_LENGTH = 1 + 4 + MegolmRatchet.LENGTH + SigningKey.PUBLIC_KEY_LENGTH;
    private static final int LENGTH = SIGNED_LENGTH + SigningKey.SIGNATURE_LENGTH;

    private final long index;
    private final byte[] ratchet;
    private final byte[] signingPublicKey;

    private SessionKey(long index, byte[] ratchet, byte[] signingPublicKey) {
        this.index = index;
        this.ratchet = ratchet;
        this.signingPublicKey = signingPublicKey;
    }

    /**
     * @param ratchet the outbound ratchet at the first index the receiver may decrypt
     * @param signer  the session's signing key
     * @return the base64 session key
     */
    public static String export(MegolmRatchet ratchet, SigningKey signer) {
        ByteBuffer buffer = ByteBuffer.allocate(LENGTH);
        buffer.put((byte) VERSION);
        buffer.putInt((int) ratchet.getIndex());
        buffer.put(ratchet.toBytes());
        buffer.put(signer.getPublicKey());

        byte[] bytes = buffer.array();
        byte[] signature = signer.sign(bytes, 0, SIGNED_LENGTH);
        System.arraycopy(signature, 0, bytes, SIGNED_LENGTH, signature.length);
        return Base64Text.encode(bytes);
    }

    /**
     * Parses a session key and verifies its self-signature.
     *
     * @throws CryptoException if the key is malformed or the signature does not verify
     */
    public static SessionKey parse(String text) throws CryptoException {
        byte[] bytes;
        try {
            bytes = Base64Text.decode(text.trim());
        } catch (IllegalArgumentException e) {
            throw new CryptoException(ExceptionContext.SESSION_KEY, "Not base64.", e);
        }
        if (bytes.length != LENGTH) {
            throw new CryptoException(ExceptionContext.SESSION_KEY, "Expected " + LENGTH + " bytes, got " + bytes.length + ".");
        }
        if ((bytes[0] & 0xFF) != VERSION) {
            throw new CryptoException(ExceptionContext.SESSION_KEY, String.format("Version 0x%02X.", bytes[0] & 0xFF));
        }

        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        buffer.get();
        long index = Integer.toUnsignedLong(buffer.getInt());
        byte[] ratchet = new byte[MegolmRatchet.LENGTH];
        buffer.get(ratchet);
        byte[] publicKey = new byte[SigningKey.PUBLIC_KEY_LENGTH];
        buffer.get(publicKey);
        byte[] signature = Arrays.copyOfRange(bytes, SIGNED_LENGTH, LENGTH);

        if (!SigningKey.verify(publicKey, bytes, 0, SIGNED_LENGTH, signature)) {
            throw new CryptoException(ExceptionContext.SESSION_KEY, "Signature does not verify.");
        }
        return new SessionKey(index, ratchet, publicKey);
    }

    public long getIndex() {
        return index;
    }

    public MegolmRatchet toRatchet() {
        return MegolmRatchet.fromBytes(ratchet, index);
    }

    public byte[] getSigningPublicKey() {
        return signingPublicKey.clone();
    }

    public String getSessionId() {
        return Base64Text.encode(signingPublicKey);
    }
}
