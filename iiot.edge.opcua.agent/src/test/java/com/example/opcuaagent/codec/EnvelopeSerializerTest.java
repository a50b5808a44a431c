package com.example.opcuaagent.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import com.example.opcuaagent.exceptions.DecodingException;
import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.model.Quality;
import com.example.opcuaagent.model.StatusUpdate;
import com.example.opcuaagent.model.TelemetryEnvelope;
import com.example.opcuaagent.model.TelemetryValue;

public class EnvelopeSerializerTest {

    private static final Instant TIME = Instant.parse("2024-05-01T10:15:30.123Z");

    private final EnvelopeSerializer serializer = new EnvelopeSerializer();

    private static TelemetryEnvelope envelope(TelemetryValue value, Instant source, Instant server) {
        return new TelemetryEnvelope("pump-1", "ns=2;s=Pump1.Pressure", "Pressure", value,
                TIME, source, server, Quality.GOOD, 3);
    }

    @Test
    public void writesFieldsInFixedOrderOnOneLine() {
        String json = serializer.toJson(envelope(TelemetryValue.ofFloat(12.5), TIME, null));
        assertEquals("{\"device\":\"pump-1\",\"node\":\"ns=2;s=Pump1.Pressure\",\"feature\":\"Pressure\","
                + "\"sequence\":3,\"timestamp\":\"2024-05-01T10:15:30.123Z\","
                + "\"sourceTimestamp\":\"2024-05-01T10:15:30.123Z\","
                + "\"status\":{\"code\":0,\"name\":\"Good\"},"
                + "\"value\":{\"type\":\"float\",\"value\":12.5}}", json);
    }

    @Test
    public void omitsAbsentTimestamps() {
        String json = serializer.toJson(envelope(TelemetryValue.ofInt(1), null, null));
        assertFalse(json.contains("sourceTimestamp"));
        assertFalse(json.contains("serverTimestamp"));
    }

    @Test
    public void doesNotEscapeHtmlCharacters() {
        String json = serializer.toJson(envelope(TelemetryValue.ofString("<a&b>='c'"), null, null));
        assertTrue(json.contains("\"value\":\"<a&b>='c'\""), json);
    }

    @Test
    public void writesNonFiniteFloatsAsStrings() throws DecodingException {
        TelemetryEnvelope nan = envelope(TelemetryValue.ofFloat(Double.NaN), null, null);
        String json = serializer.toJson(nan);
        assertTrue(json.contains("{\"type\":\"float\",\"value\":\"NaN\"}"), json);
        assertTrue(Double.isNaN(serializer.fromJson(json).getValue().asFloat()));

        TelemetryEnvelope infinite = envelope(TelemetryValue.ofFloat(Double.NEGATIVE_INFINITY), null, null);
        assertEquals(Double.NEGATIVE_INFINITY, serializer.fromJson(serializer.toJson(infinite)).getValue().asFloat());
    }

    @Test
    public void writesBytesAsBase64() {
        String json = serializer.toJson(envelope(TelemetryValue.ofBytes(new byte[]{1, 2, 3}), null, null));
        assertTrue(json.contains("{\"type\":\"bytes\",\"value\":\"AQID\"}"), json);
    }

    @Test
    public void writesEmptyValueWithoutValueMember() {
        String json = serializer.toJson(envelope(TelemetryValue.empty(), null, null));
        assertTrue(json.endsWith("\"value\":{\"type\":\"empty\"}}"), json);
    }

    @Test
    public void readsBackWhatItWrites() throws DecodingException {
        TelemetryValue nested = TelemetryValue.ofArray(List.of(
                TelemetryValue.ofArray(List.of(TelemetryValue.ofInt(-1), TelemetryValue.ofBool(true))),
                TelemetryValue.ofString("x"),
                TelemetryValue.ofFloat(0.30000000000000004)));
        TelemetryEnvelope original = new TelemetryEnvelope("valve-2", "ns=2;i=1042", "ns=2;i=1042", nested,
                TIME, TIME, TIME.plusMillis(5), new Quality(0x80AB0000L, "Bad_NoCommunication"), Long.MAX_VALUE);

        assertEquals(original, serializer.fromBytes(serializer.toBytes(original)));
    }

    @Test
    public void rejectsMalformedPayloads() {
        DecodingException e = assertThrows(DecodingException.class, () -> serializer.fromJson("{\"device\":"));
        assertEquals(ExceptionContext.PAYLOAD_MALFORMED, e.getContext());
        assertThrows(DecodingException.class, () -> serializer.fromJson("[]"));
        assertThrows(DecodingException.class, () -> serializer.fromJson("{\"device\":\"pump-1\"}"));

        String json = serializer.toJson(envelope(TelemetryValue.ofInt(1), null, null));
        assertThrows(DecodingException.class, () -> serializer.fromJson(json.replace("\"int\"", "\"decimal\"")));
        assertThrows(DecodingException.class, () -> serializer.fromJson(json.replace(TIME.toString(), "yesterday")));
    }

    private static Map<String, JsonElement> extensions() {
        Map<String, JsonElement> extensions = new LinkedHashMap<>();
        extensions.put("site", new JsonPrimitive("hall-3"));
        extensions.put("limits", JsonParser.parseString("{\"max\":6.5}"));
        return extensions;
    }

    @Test
    public void writesExtensionsAfterTheValue() throws DecodingException {
        TelemetryEnvelope extended = envelope(TelemetryValue.ofFloat(4.5), null, null).withExtensions(extensions());
        String json = serializer.toJson(extended);
        assertTrue(json.endsWith("\"value\":{\"type\":\"float\",\"value\":4.5},"
                + "\"extensions\":{\"site\":\"hall-3\",\"limits\":{\"max\":6.5}}}"), json);
        assertEquals(extended, serializer.fromJson(json));
        assertFalse(serializer.toJson(envelope(TelemetryValue.ofFloat(4.5), null, null)).contains("extensions"));
    }

    @Test
    public void writesConnectionStatus() throws DecodingException {
        StatusUpdate lost = StatusUpdate.connection("pump-1", false, "Bad_ConnectionClosed", TIME);
        String json = serializer.toJson(lost);
        assertEquals("{\"device\":\"pump-1\",\"feature\":\"connection\",\"connected\":false,"
                + "\"status\":\"Bad_ConnectionClosed\",\"timestamp\":\"2024-05-01T10:15:30.123Z\"}", json);
        assertTrue(serializer.isStatus(json));
        assertEquals(lost, serializer.statusFromJson(json));
        assertEquals("pump-1", serializer.deviceOf(json));
    }

    @Test
    public void writesNodeSubscriptionStatus() throws DecodingException {
        StatusUpdate skipped = StatusUpdate.subscription("pump-1", "ns=2;s=Pump1.Missing", "Missing", false,
                "Bad_NodeIdUnknown", TIME).routed("missing", extensions());
        String json = serializer.toJson(skipped);
        assertEquals("{\"device\":\"pump-1\",\"node\":\"ns=2;s=Pump1.Missing\",\"feature\":\"missing\","
                + "\"subscribed\":false,\"status\":\"Bad_NodeIdUnknown\",\"timestamp\":\"2024-05-01T10:15:30.123Z\","
                + "\"extensions\":{\"site\":\"hall-3\",\"limits\":{\"max\":6.5}}}", json);
        assertEquals(skipped, serializer.statusFromJson(json));

        StatusUpdate restored = StatusUpdate.connection("pump-1", true, null, TIME);
        assertFalse(serializer.toJson(restored).contains("status"));
        assertEquals(restored, serializer.statusFromJson(serializer.toJson(restored)));
    }

    @Test
    public void envelopesAreNotStatusUpdates() throws DecodingException {
        String json = serializer.toJson(envelope(TelemetryValue.ofInt(1), null, null));
        assertFalse(serializer.isStatus(json));
        assertEquals("pump-1", serializer.deviceOf(json));
        DecodingException e = assertThrows(DecodingException.class, () -> serializer.statusFromJson(json));
        assertEquals(ExceptionContext.PAYLOAD_MALFORMED, e.getContext());
        assertThrows(DecodingException.class, () -> serializer.deviceOf("{\"connected\":true}"));
        assertThrows(DecodingException.class, () -> serializer.isStatus("[1]"));
    }
}
