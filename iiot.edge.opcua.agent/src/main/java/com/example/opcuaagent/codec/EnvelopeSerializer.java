package com.example.opcuaagent.codec;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import com.example.opcuaagent.exceptions.DecodingException;
import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.model.Quality;
import com.example.opcuaagent.model.StatusUpdate;
import com.example.opcuaagent.model.TelemetryEnvelope;
import com.example.opcuaagent.model.TelemetryValue;

/**
 * Converts telemetry envelopes to and from their JSON payload form.
 * <p>
 * Example payload:
 * <pre>
 * {
 *   "device": "pump-1",
 *   "node": "ns=2;s=Pump1.Pressure",
 *   "feature": "Pressure",
 *   "sequence": 1,
 *   "timestamp": "2024-05-01T10:15:30.123456700Z",
 *   "sourceTimestamp": "2024-05-01T10:15:30.123456700Z",
 *   "status": { "code": 0, "name": "Good" },
 *   "value": { "type": "float", "value": 12.5 }
 * }
 * </pre>
 * Doubles are written in their shortest exact decimal form, non-finite doubles as the strings
 * {@code NaN}, {@code Infinity} and {@code -Infinity}, bytes as base64. Extensions, when
 * present, are written as an {@code extensions} object.
 * <p>
 * Status updates share the payload channel and are told apart by their {@code connected} or
 * {@code subscribed} member:
 * <pre>
 * { "device": "pump-1", "feature": "connection", "connected": false,
 *   "status": "Bad_ConnectionClosed", "timestamp": "2024-05-01T10:15:30Z" }
 * { "device": "pump-1", "node": "ns=2;s=Pump1.Pressure", "feature": "Pressure",
 *   "subscribed": false, "status": "Bad_NodeIdUnknown", "timestamp": "2024-05-01T10:15:30Z" }
 * </pre>
 */
public class EnvelopeSerializer {

    private static final String CONNECTED = "connected";
    private static final String SUBSCRIBED = "subscribed";
    private static final String EXTENSIONS = "extensions";

    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    public byte[] toBytes(TelemetryEnvelope envelope) {
        return toJson(envelope).getBytes(StandardCharsets.UTF_8);
    }

    public String toJson(TelemetryEnvelope envelope) {
        JsonObject json = new JsonObject();
        json.addProperty("device", envelope.getDeviceId());
        json.addProperty("node", envelope.getNode());
        json.addProperty("feature", envelope.getFeature());
        json.addProperty("sequence", envelope.getSequence());
        json.addProperty("timestamp", envelope.getTimestamp().toString());
        if (envelope.getSourceTimestamp() != null) {
            json.addProperty("sourceTimestamp", envelope.getSourceTimestamp().toString());
        }
        if (envelope.getServerTimestamp() != null) {
            json.addProperty("serverTimestamp", envelope.getServerTimestamp().toString());
        }

        JsonObject status = new JsonObject();
        status.addProperty("code", envelope.getQuality().getCode());
        status.addProperty("name", envelope.getQuality().getName());
        json.add("status", status);

        json.add("value", valueToJson(envelope.getValue()));
        addExtensions(json, envelope.getExtensions());
        return gson.toJson(json);
    }

    public byte[] toBytes(StatusUpdate update) {
        return toJson(update).getBytes(StandardCharsets.UTF_8);
    }

    public String toJson(StatusUpdate update) {
        JsonObject json = new JsonObject();
        json.addProperty("device", update.getDeviceId());
        if (update.getNode() != null) {
            json.addProperty("node", update.getNode());
        }
        json.addProperty("feature", update.getFeature());
        json.addProperty(update.getKind() == StatusUpdate.Kind.CONNECTION ? CONNECTED : SUBSCRIBED, update.isActive());
        if (update.getStatus() != null) {
            json.addProperty("status", update.getStatus());
        }
        json.addProperty("timestamp", update.getTimestamp().toString());
        addExtensions(json, update.getExtensions());
        return gson.toJson(json);
    }

    private static void addExtensions(JsonObject json, Map<String, JsonElement> extensions) {
        if (extensions.isEmpty()) {
            return;
        }
        JsonObject object = new JsonObject();
        for (Map.Entry<String, JsonElement> extension : extensions.entrySet()) {
            object.add(extension.getKey(), extension.getValue().deepCopy());
        }
        json.add(EXTENSIONS, object);
    }

    /**
     * @return true if the document is a status update rather than a telemetry envelope
     * @throws DecodingException if the document is not a JSON object
     */
    public boolean isStatus(String document) throws DecodingException {
        JsonObject json = parseObject(document);
        return json.has(CONNECTED) || json.has(SUBSCRIBED);
    }

    public StatusUpdate statusFromJson(String payload) throws DecodingException {
        JsonObject json = parseObject(payload);
        try {
            boolean connection = json.has(CONNECTED);
            if (!connection && !json.has(SUBSCRIBED)) {
                throw new DecodingException(ExceptionContext.PAYLOAD_MALFORMED, "Not a status update.");
            }
            return new StatusUpdate(
                    connection ? StatusUpdate.Kind.CONNECTION : StatusUpdate.Kind.SUBSCRIPTION,
                    json.get("device").getAsString(),
                    connection ? null : json.get("node").getAsString(),
                    json.get("feature").getAsString(),
                    json.get(connection ? CONNECTED : SUBSCRIBED).getAsBoolean(),
                    optionalString(json, "status"),
                    Instant.parse(json.get("timestamp").getAsString()),
                    extensionsFromJson(json));
        } catch (IllegalStateException | NullPointerException | UnsupportedOperationException
                 | ClassCastException | DateTimeParseException e) {
            throw new DecodingException(ExceptionContext.PAYLOAD_MALFORMED, e);
        }
    }

    /**
     * Parses a document of either kind.
     *
     * @return the device the document belongs to
     * @throws DecodingException if the document is neither a valid envelope nor a valid status update
     */
    public String deviceOf(String document) throws DecodingException {
        return isStatus(document) ? statusFromJson(document).getDeviceId() : fromJson(document).getDeviceId();
    }

    public TelemetryEnvelope fromBytes(byte[] payload) throws DecodingException {
        return fromJson(new String(payload, StandardCharsets.UTF_8));
    }

    public TelemetryEnvelope fromJson(String payload) throws DecodingException {
        try {
            JsonObject json = JsonParser.parseString(payload).getAsJsonObject();
            JsonObject status = json.getAsJsonObject("status");

            return new TelemetryEnvelope(
                    json.get("device").getAsString(),
                    json.get("node").getAsString(),
                    json.get("feature").getAsString(),
                    valueFromJson(json.getAsJsonObject("value")),
                    Instant.parse(json.get("timestamp").getAsString()),
                    optionalInstant(json, "sourceTimestamp"),
                    optionalInstant(json, "serverTimestamp"),
                    new Quality(status.get("code").getAsLong(), status.get("name").getAsString()),
                    json.get("sequence").getAsLong(),
                    extensionsFromJson(json));
        } catch (JsonParseException | IllegalStateException | NullPointerException | ClassCastException
                 | UnsupportedOperationException | NumberFormatException | DateTimeParseException e) {
            throw new DecodingException(ExceptionContext.PAYLOAD_MALFORMED, e);
        }
    }

    private JsonObject valueToJson(TelemetryValue value) {
        JsonObject json = new JsonObject();
        json.addProperty("type", value.getKind().name().toLowerCase(Locale.ROOT));
        switch (value.getKind()) {
            case EMPTY:
                break;
            case BOOL:
                json.addProperty("value", value.asBool());
                break;
            case INT:
                json.addProperty("value", value.asInt());
                break;
            case FLOAT:
                double d = value.asFloat();
                if (Double.isFinite(d)) {
                    json.addProperty("value", d);
                } else {
                    json.addProperty("value", Double.toString(d));
                }
                break;
            case STRING:
                json.addProperty("value", value.asString());
                break;
            case BYTES:
                json.addProperty("value", Base64.getEncoder().encodeToString(value.asBytes()));
                break;
            case ARRAY:
                JsonArray elements = new JsonArray();
                for (TelemetryValue element : value.asArray()) {
                    elements.add(valueToJson(element));
                }
                json.add("value", elements);
                break;
            default:
                throw new IllegalStateException("Unhandled kind " + value.getKind());
        }
        return json;
    }

    private TelemetryValue valueFromJson(JsonObject json) throws DecodingException {
        TelemetryValue.Kind kind;
        try {
            kind = TelemetryValue.Kind.valueOf(json.get("type").getAsString().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new DecodingException(ExceptionContext.PAYLOAD_MALFORMED, "Unknown value type.", e);
        }

        switch (kind) {
            case EMPTY:
                return TelemetryValue.empty();
            case BOOL:
                return TelemetryValue.ofBool(json.get("value").getAsBoolean());
            case INT:
                return TelemetryValue.ofInt(json.get("value").getAsLong());
            case FLOAT:
                JsonPrimitive number = json.getAsJsonPrimitive("value");
                return TelemetryValue.ofFloat(number.isString()
                        ? Double.parseDouble(number.getAsString())
                        : number.getAsDouble());
            case STRING:
                return TelemetryValue.ofString(json.get("value").getAsString());
            case BYTES:
                try {
                    return TelemetryValue.ofBytes(Base64.getDecoder().decode(json.get("value").getAsString()));
                } catch (IllegalArgumentException e) {
                    throw new DecodingException(ExceptionContext.PAYLOAD_MALFORMED, "Invalid base64 bytes.", e);
                }
            case ARRAY:
                List<TelemetryValue> elements = new ArrayList<>();
                for (JsonElement element : json.getAsJsonArray("value")) {
                    elements.add(valueFromJson(element.getAsJsonObject()));
                }
                return TelemetryValue.ofArray(elements);
            default:
                throw new IllegalStateException("Unhandled kind " + kind);
        }
    }

    private static JsonObject parseObject(String document) throws DecodingException {
        try {
            return JsonParser.parseString(document).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new DecodingException(ExceptionContext.PAYLOAD_MALFORMED, e);
        }
    }

    private static Map<String, JsonElement> extensionsFromJson(JsonObject json) {
        JsonElement element = json.get(EXTENSIONS);
        if (element == null || element.isJsonNull()) {
            return Collections.emptyMap();
        }
        Map<String, JsonElement> extensions = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
            extensions.put(entry.getKey(), entry.getValue());
        }
        return extensions;
    }

    private static String optionalString(JsonObject json, String member) {
        JsonElement element = json.get(member);
        return element == null || element.isJsonNull() ? null : element.getAsString();
    }

    private static Instant optionalInstant(JsonObject json, String member) {
        JsonElement element = json.get(member);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        return Instant.parse(element.getAsString());
    }
}
