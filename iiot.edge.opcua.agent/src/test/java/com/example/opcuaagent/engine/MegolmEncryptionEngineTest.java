package com.example.opcuaagent.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.opcuaagent.codec.EnvelopeSerializer;
import com.example.opcuaagent.crypto.Base64Text;
import com.example.opcuaagent.crypto.CiphertextMessage;
import com.example.opcuaagent.crypto.MegolmMessage;
import com.example.opcuaagent.exceptions.CryptoException;
import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.exceptions.PersistenceException;
import com.example.opcuaagent.model.Quality;
import com.example.opcuaagent.model.StatusUpdate;
import com.example.opcuaagent.model.TelemetryEnvelope;
import com.example.opcuaagent.model.TelemetryValue;
import com.example.opcuaagent.store.InMemoryRatchetStatePersistence;
import com.example.opcuaagent.store.RatchetSessionStore;

public class MegolmEncryptionEngineTest {

    private final EnvelopeSerializer serializer = new EnvelopeSerializer();
    private InMemoryRatchetStatePersistence persistence;
    private MegolmEncryptionEngine engine;

    @BeforeEach
    public void setUp() {
        persistence = new InMemoryRatchetStatePersistence();
        engine = new MegolmEncryptionEngine(new RatchetSessionStore(persistence), serializer);
    }

    private static TelemetryEnvelope envelope(String device, long sequence) {
        return new TelemetryEnvelope(device, "ns=2;i=1042", "ns=2;i=1042", TelemetryValue.ofBool(sequence % 2 == 0),
                Instant.parse("2024-05-01T10:15:30Z"), null, null, Quality.GOOD, sequence);
    }

    @Test
    public void firstMessageOfADeviceUsesIndexZero() throws Exception {
        CiphertextMessage message = engine.encrypt(envelope("valve-2", 1));
        assertEquals(CiphertextMessage.ALGORITHM, message.getAlgorithm());
        assertEquals("valve-2", message.getDevice());
        assertEquals(0, MegolmMessage.parse(Base64Text.decode(message.getCiphertext())).getIndex());
    }

    @Test
    public void payloadCarriesNoPlaintext() throws Exception {
        String payload = new String(engine.protect(envelope("valve-2", 1)), StandardCharsets.UTF_8);
        assertTrue(payload.startsWith("{\"algorithm\":\"m.megolm.v1.aes-sha2\",\"device\":\"valve-2\",\"session_id\":"), payload);
        assertFalse(payload.contains("ns=2;i=1042"));
    }

    @Test
    public void decryptsInOrder() throws Exception {
        byte[] first = engine.protect(envelope("valve-2", 1));
        byte[] second = engine.protect(envelope("valve-2", 2));

        assertEquals(envelope("valve-2", 1), engine.unprotect(first));
        assertEquals(envelope("valve-2", 2), engine.unprotect(second));
    }

    @Test
    public void replayIsRejected() throws Exception {
        byte[] payload = engine.protect(envelope("valve-2", 1));
        engine.unprotect(payload);
        CryptoException e = assertThrows(CryptoException.class, () -> engine.unprotect(payload));
        assertEquals(ExceptionContext.REPLAY, e.getContext());
    }

    @Test
    public void flippedBitIsRejected() throws Exception {
        CiphertextMessage message = engine.encrypt(envelope("valve-2", 1));
        byte[] body = Base64Text.decode(message.getCiphertext());
        body[body.length / 2] ^= 0x01;
        CiphertextMessage tampered = new CiphertextMessage("valve-2", message.getSessionId(), Base64Text.encode(body));

        assertThrows(CryptoException.class, () -> engine.unprotect(tampered));
        // the untouched message is still accepted afterwards
        assertEquals(1, engine.unprotect(message).getSequence());
    }

    @Test
    public void chainOfAnotherDeviceIsNotUsed() throws Exception {
        CiphertextMessage message = engine.encrypt(envelope("valve-2", 1));
        engine.encrypt(envelope("pump-1", 1));
        CiphertextMessage relabelled = new CiphertextMessage("pump-1", message.getSessionId(), message.getCiphertext());

        CryptoException e = assertThrows(CryptoException.class, () -> engine.unprotect(relabelled));
        assertEquals(ExceptionContext.UNKNOWN_SESSION, e.getContext());
    }

    @Test
    public void devicesHaveIndependentSessions() throws Exception {
        CiphertextMessage valve = engine.encrypt(envelope("valve-2", 1));
        CiphertextMessage pump = engine.encrypt(envelope("pump-1", 1));
        assertFalse(valve.getSessionId().equals(pump.getSessionId()));
        assertEquals(0, MegolmMessage.parse(Base64Text.decode(pump.getCiphertext())).getIndex());
    }

    @Test
    public void malformedPayloadsAreRejected() {
        assertThrows(CryptoException.class, () -> engine.unprotect("{}".getBytes(StandardCharsets.UTF_8)));
        assertThrows(CryptoException.class, () -> engine.unprotect("not json".getBytes(StandardCharsets.UTF_8)));
        CryptoException algorithm = assertThrows(CryptoException.class, () -> engine.unprotect(
                "{\"algorithm\":\"m.olm.v1\",\"device\":\"d\",\"session_id\":\"s\",\"ciphertext\":\"c\"}"
                        .getBytes(StandardCharsets.UTF_8)));
        assertEquals(ExceptionContext.MESSAGE_VERSION, algorithm.getContext());
        assertThrows(CryptoException.class, () -> engine.unprotect(new CiphertextMessage("valve-2", "s", "%%%")));
    }

    @Test
    public void failedWriteProducesNoPayload() {
        persistence.setFailWrites(true);
        assertThrows(PersistenceException.class,
                () -> engine.protect(envelope("valve-2", 1)));
    }

    private static long indexOf(byte[] payload) throws CryptoException {
        return MegolmMessage.parse(Base64Text.decode(CiphertextMessage.fromBytes(payload).getCiphertext())).getIndex();
    }

    @Test
    public void statusUpdatesAdvanceTheDeviceChain() throws Exception {
        StatusUpdate lost = StatusUpdate.connection("valve-2", false, "Bad_ConnectionClosed",
                Instant.parse("2024-05-01T10:15:31Z"));
        byte[] status = engine.protect(lost);
        byte[] sample = engine.protect(envelope("valve-2", 1));

        assertEquals(0, indexOf(status));
        assertEquals(1, indexOf(sample));
        assertFalse(new String(status, StandardCharsets.UTF_8).contains("Bad_ConnectionClosed"));
        assertEquals(lost, serializer.statusFromJson(engine.unprotectDocument(status)));
        assertEquals(serializer.toJson(envelope("valve-2", 1)), engine.unprotectDocument(sample));
    }

    @Test
    public void relabelledOrReplayedDocumentsAreRejected() throws Exception {
        byte[] payload = engine.protect(StatusUpdate.connection("valve-2", true, null, Instant.parse("2024-05-01T10:15:31Z")));
        CiphertextMessage message = CiphertextMessage.fromBytes(payload);
        engine.protect(envelope("pump-1", 1));
        CiphertextMessage resent = new CiphertextMessage("pump-1", message.getSessionId(), message.getCiphertext());

        assertThrows(CryptoException.class, () -> engine.unprotectDocument(resent.toBytes()));
        byte[] replayed = engine.protect(envelope("valve-2", 2));
        engine.unprotectDocument(replayed);
        CryptoException e = assertThrows(CryptoException.class, () -> engine.unprotectDocument(replayed));
        assertEquals(ExceptionContext.REPLAY, e.getContext());
    }
}
