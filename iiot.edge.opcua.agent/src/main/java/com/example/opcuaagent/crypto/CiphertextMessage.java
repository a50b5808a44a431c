package com.example.opcuaagent.crypto;

import java.nio.charset.StandardCharsets;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import com.example.opcuaagent.exceptions.CryptoException;
import com.example.opcuaagent.exceptions.ExceptionContext;

/**
 * Published form of an encrypted envelope.
 * <pre>
 * {"algorithm":"m.megolm.v1.aes-sha2","device":"pump-1","session_id":"...","ciphertext":"..."}
 * </pre>
 * {@code ciphertext} is the unpadded base64 of a {@link MegolmMessage}.
 */
public class CiphertextMessage {

    public static final String ALGORITHM = "m.megolm.v1.aes-sha2";

    private static final Gson GSON = new Gson();

    private String algorithm;
    private String device;

    @SerializedName("session_id")
    private String sessionId;

    private String ciphertext;

    public CiphertextMessage() {
    }

    public CiphertextMessage(String device, String sessionId, String ciphertext) {
        this.algorithm = ALGORITHM;
        this.device = device;
        this.sessionId = sessionId;
        this.ciphertext = ciphertext;
    }

    public byte[] toBytes() {
        return GSON.toJson(this).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @throws CryptoException if the payload is not a complete ciphertext message of a known algorithm
     */
    public static CiphertextMessage fromBytes(byte[] payload) throws CryptoException {
        CiphertextMessage message;
        try {
            message = GSON.fromJson(new String(payload, StandardCharsets.UTF_8), CiphertextMessage.class);
        } catch (JsonParseException e) {
            throw new CryptoException(ExceptionContext.MESSAGE_MALFORMED, e);
        }
        if (message == null || message.device == null || message.sessionId == null || message.ciphertext == null) {
            throw new CryptoException(ExceptionContext.MESSAGE_MALFORMED, "Missing fields.");
        }
        if (!ALGORITHM.equals(message.algorithm)) {
            throw new CryptoException(ExceptionContext.MESSAGE_VERSION, "Algorithm " + message.algorithm + ".");
        }
        return message;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public String getDevice() {
        return device;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getCiphertext() {
        return ciphertext;
    }
}
