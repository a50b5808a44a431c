package com.example.opcuaagent.crypto;

import java.util.Base64;

/**
 * Unpadded standard base64, as used for session ids, session keys and ciphertext bodies.
 * Decoding accepts padded input as well.
 */
public final class Base64Text {

    private Base64Text() {
    }

    public static String encode(byte[] data) {
        return Base64.getEncoder().withoutPadding().encodeToString(data);
    }

    /**
     * @throws IllegalArgumentException if the text is not base64
     */
    public static byte[] decode(String text) {
        return Base64.getDecoder().decode(text);
    }
}
