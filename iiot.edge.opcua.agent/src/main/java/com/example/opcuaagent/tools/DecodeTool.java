package com.example.opcuaagent.tools;

import java.nio.charset.StandardCharsets;

import com.example.opcuaagent.engine.MegolmEncryptionEngine;
import com.example.opcuaagent.exceptions.AgentException;

/**
 * Decrypts ciphertext messages (one JSON document per line) with the inbound sessions of
 * their device and prints the telemetry envelopes and status updates. A message is accepted once; replays,
 * forgeries and unknown sessions are reported.
 * <pre>
 * decode [--state-dir DIR] [FILE]
 * </pre>
 */
public final class DecodeTool extends DocumentFilter {

    private static final String USAGE = "Usage: decode [--state-dir DIR] [FILE]"
            + System.lineSeparator() + "Reads one ciphertext message per line from FILE or standard input.";

    DecodeTool() {
        super(USAGE);
    }

    public static void main(String[] args) {
        System.exit(new DecodeTool().run(args, System.getenv(), System.in, System.out, System.err));
    }

    @Override
    String transform(MegolmEncryptionEngine engine, String document) throws AgentException {
        return engine.unprotectDocument(document.getBytes(StandardCharsets.UTF_8));
    }
}
