package com.example.opcuaagent.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.opcuaagent.codec.EnvelopeSerializer;
import com.example.opcuaagent.model.Quality;
import com.example.opcuaagent.model.StatusUpdate;
import com.example.opcuaagent.model.TelemetryEnvelope;
import com.example.opcuaagent.model.TelemetryValue;
import com.example.opcuaagent.store.FileRatchetStatePersistence;
import com.example.opcuaagent.store.RatchetSessionStore;

public class EncodeDecodeToolTest {

    @TempDir
    Path directory;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private static String envelope(long sequence) {
        return new EnvelopeSerializer().toJson(new TelemetryEnvelope("valve-2", "ns=2;i=1042", "1042",
                TelemetryValue.ofFloat(sequence * 1.5), Instant.parse("2024-05-01T10:15:30Z"), null, null,
                Quality.GOOD, sequence));
    }

    private int run(DocumentFilter tool, String input, String... args) {
        out.reset();
        err.reset();
        InputStream in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
        return tool.run(args, Collections.emptyMap(), in,
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String[] outputLines() {
        return out.toString(StandardCharsets.UTF_8).trim().split("\\R");
    }

    private String stateDir() {
        return "--state-dir=" + directory.resolve("state");
    }

    @Test
    public void decodeReversesEncode() {
        String input = envelope(1) + "\n\n" + envelope(2) + "\n";
        assertEquals(0, run(new EncodeTool(), input, stateDir()));
        String[] ciphertexts = outputLines();
        assertEquals(2, ciphertexts.length);
        assertTrue(ciphertexts[0].startsWith("{\"algorithm\":\"m.megolm.v1.aes-sha2\""));
        assertFalse(ciphertexts[0].contains("1042"));

        assertEquals(0, run(new DecodeTool(), String.join("\n", ciphertexts), stateDir()));
        String[] envelopes = outputLines();
        assertEquals(envelope(1), envelopes[0]);
        assertEquals(envelope(2), envelopes[1]);
    }

    @Test
    public void statusUpdatesPassThroughEncodeAndDecode() {
        String status = new EnvelopeSerializer().toJson(StatusUpdate.subscription("valve-2", "ns=2;i=1042", "1042",
                false, "Bad_NodeIdUnknown", Instant.parse("2024-05-01T10:15:30Z")));
        assertEquals(0, run(new EncodeTool(), status + "\n" + envelope(1), stateDir()));
        String[] ciphertexts = outputLines();
        assertFalse(ciphertexts[0].contains("subscribed"));

        assertEquals(0, run(new DecodeTool(), String.join("\n", ciphertexts), stateDir()));
        String[] documents = outputLines();
        assertEquals(status, documents[0]);
        assertEquals(envelope(1), documents[1]);
    }

    @Test
    public void replayedMessageIsReportedPerLine() {
        run(new EncodeTool(), envelope(1), stateDir());
        String ciphertext = outputLines()[0];

        assertEquals(1, run(new DecodeTool(), ciphertext + "\n" + ciphertext, stateDir()));
        assertEquals(1, outputLines().length);
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Line 2: "));
    }

    @Test
    public void decodeRefusesTheStateDirectoryOfARunningAgent() throws Exception {
        assertEquals(0, run(new EncodeTool(), envelope(1), stateDir()));
        String ciphertext = outputLines()[0];

        RatchetSessionStore agent = new RatchetSessionStore(new FileRatchetStatePersistence(directory.resolve("state")));
        for (long index = 1; index <= 3; index++) {
            assertEquals(index, agent.advanceOutbound("valve-2").getIndex());
        }

        assertEquals(1, run(new DecodeTool(), ciphertext, stateDir()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("in use by another process"));
        assertEquals("", out.toString(StandardCharsets.UTF_8));

        assertEquals(4, agent.advanceOutbound("valve-2").getIndex());
        agent.close();

        try (RatchetSessionStore restarted = new RatchetSessionStore(new FileRatchetStatePersistence(directory.resolve("state")))) {
            assertEquals(5, restarted.advanceOutbound("valve-2").getIndex());
        }
    }

    @Test
    public void malformedEnvelopeIsReportedAndOthersEncoded() {
        assertEquals(1, run(new EncodeTool(), "{\"device\":\n" + envelope(1), stateDir()));
        assertEquals(1, outputLines().length);
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Line 1: "));
    }

    @Test
    public void readsInputFile() throws Exception {
        Path input = directory.resolve("envelopes.jsonl");
        Files.write(input, (envelope(1) + "\n").getBytes(StandardCharsets.UTF_8));
        assertEquals(0, run(new EncodeTool(), "", stateDir(), input.toString()));
        assertEquals(1, outputLines().length);
    }

    @Test
    public void missingInputFileFails() {
        assertEquals(1, run(new DecodeTool(), "", stateDir(), directory.resolve("absent.jsonl").toString()));
    }

    @Test
    public void tooManyArgumentsIsAUsageError() {
        assertEquals(2, run(new DecodeTool(), "", stateDir(), "a", "b"));
    }
}
