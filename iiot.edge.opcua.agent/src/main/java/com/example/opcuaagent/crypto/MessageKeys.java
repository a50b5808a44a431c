package com.example.opcuaagent.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.modes.CBCBlockCipher;
import org.bouncycastle.crypto.paddings.PKCS7Padding;
import org.bouncycastle.crypto.paddings.PaddedBufferedBlockCipher;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;

import com.example.opcuaagent.exceptions.CryptoException;
import com.example.opcuaagent.exceptions.ExceptionContext;

/**
 * AES-256 key, HMAC-SHA256 key and IV for one ratchet index, derived with
 * HKDF-SHA256(salt = none, ikm = ratchet, info = "MEGOLM_KEYS").
 */
public final class MessageKeys {

    private static final byte[] KDF_INFO = "MEGOLM_KEYS".getBytes(StandardCharsets.US_ASCII);

    static final int AES_KEY_LENGTH = 32;
    static final int MAC_KEY_LENGTH = 32;
    static final int IV_LENGTH = 16;

    /** Length of the truncated MAC appended to a message. */
    public static final int MAC_LENGTH = 8;

    private final byte[] aesKey;
    private final byte[] macKey;
    private final byte[] iv;

    private MessageKeys(byte[] aesKey, byte[] macKey, byte[] iv) {
        this.aesKey = aesKey;
        this.macKey = macKey;
        this.iv = iv;
    }

    static MessageKeys derive(byte[] ratchetBytes) {
        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(ratchetBytes, null, KDF_INFO));

        byte[] okm = new byte[AES_KEY_LENGTH + MAC_KEY_LENGTH + IV_LENGTH];
        hkdf.generateBytes(okm, 0, okm.length);

        MessageKeys keys = new MessageKeys(
                Arrays.copyOfRange(okm, 0, AES_KEY_LENGTH),
                Arrays.copyOfRange(okm, AES_KEY_LENGTH, AES_KEY_LENGTH + MAC_KEY_LENGTH),
                Arrays.copyOfRange(okm, AES_KEY_LENGTH + MAC_KEY_LENGTH, okm.length));
        Arrays.fill(okm, (byte) 0);
        return keys;
    }

    public byte[] encrypt(byte[] plaintext) {
        PaddedBufferedBlockCipher cipher = newCipher(true);
        byte[] out = new byte[cipher.getOutputSize(plaintext.length)];
        int length = cipher.processBytes(plaintext, 0, plaintext.length, out, 0);
        try {
            length += cipher.doFinal(out, length);
        } catch (InvalidCipherTextException e) {
            // padding is only checked when decrypting
            throw new IllegalStateException(e);
        }
        return length == out.length ? out : Arrays.copyOf(out, length);
    }

    /**
     * @throws CryptoException if the ciphertext length or the padding is invalid
     */
    public byte[] decrypt(byte[] ciphertext) throws CryptoException {
        PaddedBufferedBlockCipher cipher = newCipher(false);
        byte[] out = new byte[cipher.getOutputSize(ciphertext.length)];
        try {
            int length = cipher.processBytes(ciphertext, 0, ciphertext.length, out, 0);
            length += cipher.doFinal(out, length);
            return Arrays.copyOf(out, length);
        } catch (InvalidCipherTextException | DataLengthException e) {
            throw new CryptoException(ExceptionContext.DECRYPT, e);
        }
    }

    /**
     * @return HMAC-SHA256 of the given range, truncated to {@link #MAC_LENGTH} bytes
     */
    public byte[] mac(byte[] data, int offset, int length) {
        HMac hmac = new HMac(new SHA256Digest());
        hmac.init(new KeyParameter(macKey));
        hmac.update(data, offset, length);
        byte[] full = new byte[hmac.getMacSize()];
        hmac.doFinal(full, 0);
        return Arrays.copyOf(full, MAC_LENGTH);
    }

    private PaddedBufferedBlockCipher newCipher(boolean forEncryption) {
        PaddedBufferedBlockCipher cipher =
                new PaddedBufferedBlockCipher(new CBCBlockCipher(new AESEngine()), new PKCS7Padding());
        cipher.init(forEncryption, new ParametersWithIV(new KeyParameter(aesKey), iv));
        return cipher;
    }
}
