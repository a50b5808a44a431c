package com.example.opcuaagent.tools;

import java.nio.charset.StandardCharsets;

import com.example.opcuaagent.codec.EnvelopeSerializer;
import com.example.opcuaagent.engine.MegolmEncryptionEngine;
import com.example.opcuaagent.exceptions.AgentException;

/**
 * Encrypts telemetry envelopes and status updates (one JSON document per line) with the
 * outbound session of their device and prints the ciphertext messages. Every document advances
 * the ratchet once.
 * <pre>
 * encode [--state-dir DIR] [FILE]
 * </pre>
 */
public final class EncodeTool extends DocumentFilter {

    private static final String USAGE = "Usage: encode [--state-dir DIR] [FILE]"
            + System.lineSeparator() + "Reads one envelope or status update per line from FILE or standard input.";

    private final EnvelopeSerializer serializer = new EnvelopeSerializer();

    EncodeTool() {
        super(USAGE);
    }

    public static void main(String[] args) {
        System.exit(new EncodeTool().run(args, System.getenv(), System.in, System.out, System.err));
    }

    @Override
    String transform(MegolmEncryptionEngine engine, String document) throws AgentException {
        byte[] payload = serializer.isStatus(document)
                ? engine.protect(serializer.statusFromJson(document))
                : engine.protect(serializer.fromJson(document));
        return new String(payload, StandardCharsets.UTF_8);
    }
}
