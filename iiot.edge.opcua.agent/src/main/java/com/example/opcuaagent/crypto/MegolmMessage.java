package com.example.opcuaagent.crypto;

import java.io.ByteArrayOutputStream;
import java.security.MessageDigest;
import java.util.Arrays;

import com.example.opcuaagent.exceptions.CryptoException;
import com.example.opcuaagent.exceptions.ExceptionContext;

/**
 * Binary Megolm group message.
 * <pre>
 * +---------+------+----------------+------+----------------------+---------+---------------+
 * | 0x03    | 0x08 | varint index   | 0x12 | varint len + AES-CBC | MAC (8) | Ed25519 (64)  |
 * +---------+------+----------------+------+----------------------+---------+---------------+
 * </pre>
 * The MAC covers everything before it, the signature everything before the signature.
 */
public final class MegolmMessage {

    public static final int VERSION = 0x03;

    private static final int INDEX_TAG = 0x08;
    private static final int CIPHERTEXT_TAG = 0x12;
    private static final int TRAILER_LENGTH = MessageKeys.MAC_LENGTH + SigningKey.SIGNATURE_LENGTH;

    private final long index;
    private final byte[] ciphertext;

    /** The complete message as sent or received; MAC and signature are checked against it. */
    private final byte[] encoded;

    private MegolmMessage(long index, byte[] ciphertext, byte[] encoded) {
        this.index = index;
        this.ciphertext = ciphertext;
        this.encoded = encoded;
    }

    /**
     * Encrypts, MACs and signs a plaintext.
     *
     * @param index  ratchet index the keys were derived at
     * @param keys   message keys of that index
     * @param signer signing key of the outbound session
     */
    public static MegolmMessage encrypt(long index, byte[] plaintext, MessageKeys keys, SigningKey signer) {
        byte[] ciphertext = keys.encrypt(plaintext);

        ByteArrayOutputStream out = new ByteArrayOutputStream(ciphertext.length + 16 + TRAILER_LENGTH);
        out.write(VERSION);
        out.write(INDEX_TAG);
        writeVarint(out, index);
        out.write(CIPHERTEXT_TAG);
        writeVarint(out, ciphertext.length);
        out.write(ciphertext, 0, ciphertext.length);

        byte[] body = out.toByteArray();
        byte[] mac = keys.mac(body, 0, body.length);
        out.write(mac, 0, mac.length);

        byte[] withMac = out.toByteArray();
        byte[] signature = signer.sign(withMac, 0, withMac.length);
        out.write(signature, 0, signature.length);

        return new MegolmMessage(index, ciphertext, out.toByteArray());
    }

    /**
     * Parses the structure only; nothing is verified.
     *
     * @throws CryptoException if the message is truncated, malformed or of another version
     */
    public static MegolmMessage parse(byte[] encoded) throws CryptoException {
        if (encoded.length < 1 + TRAILER_LENGTH) {
            throw new CryptoException(ExceptionContext.MESSAGE_MALFORMED, "Message is only " + encoded.length + " bytes.");
        }
        if ((encoded[0] & 0xFF) != VERSION) {
            throw new CryptoException(ExceptionContext.MESSAGE_VERSION, String.format("Version 0x%02X.", encoded[0] & 0xFF));
        }

        int end = encoded.length - TRAILER_LENGTH;
        int[] pos = {1};
        Long index = null;
        byte[] ciphertext = null;

        while (pos[0] < end) {
            int tag = encoded[pos[0]++] & 0xFF;
            if (tag == INDEX_TAG) {
                long value = readVarint(encoded, pos, end);
                if (value > 0xFFFFFFFFL) {
                    throw new CryptoException(ExceptionContext.MESSAGE_MALFORMED, "Ratchet index out of range.");
                }
                index = value;
            } else if (tag == CIPHERTEXT_TAG) {
                ciphertext = readBytes(encoded, pos, end);
            } else if ((tag & 0x07) == 0) {
                readVarint(encoded, pos, end);
            } else if ((tag & 0x07) == 2) {
                readBytes(encoded, pos, end);
            } else {
                throw new CryptoException(ExceptionContext.MESSAGE_MALFORMED, String.format("Unknown field 0x%02X.", tag));
            }
        }

        if (index == null || ciphertext == null) {
            throw new CryptoException(ExceptionContext.MESSAGE_MALFORMED, "Missing index or ciphertext.");
        }
        return new MegolmMessage(index, ciphertext, encoded.clone());
    }

    /**
     * Verifies signature and MAC, then decrypts.
     *
     * @param keys             message keys derived at {@link #getIndex()}
     * @param signingPublicKey public key of the sending session
     * @throws CryptoException on any verification or padding failure
     */
    public byte[] decrypt(MessageKeys keys, byte[] signingPublicKey) throws CryptoException {
        int signatureOffset = encoded.length - SigningKey.SIGNATURE_LENGTH;
        int macOffset = signatureOffset - MessageKeys.MAC_LENGTH;

        byte[] signature = Arrays.copyOfRange(encoded, signatureOffset, encoded.length);
        if (!SigningKey.verify(signingPublicKey, encoded, 0, signatureOffset, signature)) {
            throw new CryptoException(ExceptionContext.SIGNATURE);
        }

        byte[] expectedMac = keys.mac(encoded, 0, macOffset);
        byte[] mac = Arrays.copyOfRange(encoded, macOffset, signatureOffset);
        if (!MessageDigest.isEqual(expectedMac, mac)) {
            throw new CryptoException(ExceptionContext.MAC);
        }

        return keys.decrypt(ciphertext);
    }

    public long getIndex() {
        return index;
    }

    public byte[] toBytes() {
        return encoded.clone();
    }

    private static void writeVarint(ByteArrayOutputStream out, long value) {
        while ((value & ~0x7FL) != 0) {
            out.write((int) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        out.write((int) value);
    }

    private static long readVarint(byte[] in, int[] pos, int end) throws CryptoException {
        long value = 0;
        for (int shift = 0; shift < 64; shift += 7) {
            if (pos[0] >= end) {
                throw new CryptoException(ExceptionContext.MESSAGE_MALFORMED, "Truncated varint.");
            }
            int b = in[pos[0]++] & 0xFF;
            value |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return value;
            }
        }
        throw new CryptoException(ExceptionContext.MESSAGE_MALFORMED, "Varint too long.");
    }

    private static byte[] readBytes(byte[] in, int[] pos, int end) throws CryptoException {
        long length = readVarint(in, pos, end);
        if (length > end - pos[0]) {
            throw new CryptoException(ExceptionContext.MESSAGE_MALFORMED, "Field length exceeds message.");
        }
        byte[] value = Arrays.copyOfRange(in, pos[0], pos[0] + (int) length);
        pos[0] += (int) length;
        return value;
    }
}
