package com.example.opcuaagent.codec;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.eclipse.milo.opcua.stack.core.StatusCodes;
import org.eclipse.milo.opcua.stack.core.types.builtin.ByteString;
import org.eclipse.milo.opcua.stack.core.types.builtin.DataValue;
import org.eclipse.milo.opcua.stack.core.types.builtin.DateTime;
import org.eclipse.milo.opcua.stack.core.types.builtin.ExpandedNodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.LocalizedText;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.QualifiedName;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.builtin.Variant;
import org.eclipse.milo.opcua.stack.core.types.builtin.XmlElement;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UByte;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.ULong;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UShort;

import com.example.opcuaagent.exceptions.DecodingException;
import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.model.Quality;
import com.example.opcuaagent.model.TelemetryEnvelope;
import com.example.opcuaagent.model.TelemetryValue;

/**
 * Maps OPC UA {@link DataValue}s as delivered by the Milo client to {@link TelemetryEnvelope}s.
 * <p>
 * The mapping is stateless and deterministic. Floating point values keep full double precision
 * (Float is widened, which is exact), and all timestamps are normalized to UTC instants.
 * Structured extension types are rejected with a {@link DecodingException}; the caller drops
 * the sample and carries on.
 */
public class ValueCodec {

    private final Clock clock;

    public ValueCodec() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock source of the reception time, used when the server reports no timestamp
     */
    public ValueCodec(Clock clock) {
        this.clock = clock;
    }

    /**
     * Builds the envelope for one sample.
     *
     * @param deviceId  channel the sample belongs to
     * @param node      parseable node identifier the sample was read from
     * @param feature   feature name of the node inside the channel
     * @param sequence  per channel sequence number assigned by the caller
     * @param dataValue the sample
     * @return the canonical envelope
     * @throws DecodingException if the value type is not supported
     */
    public TelemetryEnvelope encode(String deviceId, String node, String feature, long sequence, DataValue dataValue)
            throws DecodingException {
        if (dataValue == null) {
            throw new DecodingException(ExceptionContext.VALUE_MALFORMED, "Sample for " + node + " is null.");
        }

        Variant variant = dataValue.getValue();
        TelemetryValue value = toTelemetryValue(variant == null ? null : variant.getValue());

        Instant sourceTime = toInstant(dataValue.getSourceTime());
        Instant serverTime = toInstant(dataValue.getServerTime());
        Instant timestamp = sourceTime != null ? sourceTime
                : serverTime != null ? serverTime
                : clock.instant();

        return new TelemetryEnvelope(deviceId, node, feature, value, timestamp, sourceTime, serverTime,
                toQuality(dataValue.getStatusCode()), sequence);
    }

    /**
     * Maps the Java object carried by a Milo {@link Variant} to a telemetry value.
     *
     * @param raw the variant content, null for an empty variant
     * @return the mapped value
     * @throws DecodingException if the type (or an array element type) is not supported
     */
    public TelemetryValue toTelemetryValue(Object raw) throws DecodingException {
        if (raw == null) {
            return TelemetryValue.empty();
        }
        if (raw instanceof Boolean) {
            return TelemetryValue.ofBool((Boolean) raw);
        }
        if (raw instanceof Byte || raw instanceof Short || raw instanceof Integer || raw instanceof Long) {
            return TelemetryValue.ofInt(((Number) raw).longValue());
        }
        if (raw instanceof UByte || raw instanceof UShort || raw instanceof UInteger) {
            return TelemetryValue.ofInt(((Number) raw).longValue());
        }
        if (raw instanceof ULong) {
            BigInteger big = ((ULong) raw).toBigInteger();
            if (big.bitLength() > 63) {
                throw new DecodingException(ExceptionContext.VALUE_UNSUPPORTED, "UInt64 value " + big + " exceeds the signed 64 bit range.");
            }
            return TelemetryValue.ofInt(big.longValue());
        }
        if (raw instanceof Float || raw instanceof Double) {
            return TelemetryValue.ofFloat(((Number) raw).doubleValue());
        }
        if (raw instanceof String) {
            return TelemetryValue.ofString((String) raw);
        }
        if (raw instanceof LocalizedText) {
            String text = ((LocalizedText) raw).getText();
            return TelemetryValue.ofString(text == null ? "" : text);
        }
        if (raw instanceof QualifiedName) {
            return TelemetryValue.ofString(((QualifiedName) raw).toParseableString());
        }
        if (raw instanceof NodeId) {
            return TelemetryValue.ofString(((NodeId) raw).toParseableString());
        }
        if (raw instanceof ExpandedNodeId) {
            return TelemetryValue.ofString(((ExpandedNodeId) raw).toParseableString());
        }
        if (raw instanceof UUID) {
            return TelemetryValue.ofString(raw.toString());
        }
        if (raw instanceof XmlElement) {
            String fragment = ((XmlElement) raw).getFragment();
            return TelemetryValue.ofString(fragment == null ? "" : fragment);
        }
        if (raw instanceof StatusCode) {
            return TelemetryValue.ofString(statusName(((StatusCode) raw).getValue()));
        }
        if (raw instanceof DateTime) {
            Instant instant = toInstant((DateTime) raw);
            return TelemetryValue.ofString(instant == null ? "" : instant.toString());
        }
        if (raw instanceof ByteString) {
            return TelemetryValue.ofBytes(((ByteString) raw).bytesOrEmpty());
        }
        if (raw instanceof byte[]) {
            return TelemetryValue.ofBytes((byte[]) raw);
        }
        if (raw instanceof Object[]) {
            Object[] array = (Object[]) raw;
            List<TelemetryValue> elements = new ArrayList<>(array.length);
            for (Object element : array) {
                elements.add(toTelemetryValue(element));
            }
            return TelemetryValue.ofArray(elements);
        }
        if (raw instanceof boolean[]) {
            boolean[] array = (boolean[]) raw;
            List<TelemetryValue> elements = new ArrayList<>(array.length);
            for (boolean element : array) {
                elements.add(TelemetryValue.ofBool(element));
            }
            return TelemetryValue.ofArray(elements);
        }
        if (raw instanceof short[]) {
            short[] array = (short[]) raw;
            List<TelemetryValue> elements = new ArrayList<>(array.length);
            for (short element : array) {
                elements.add(TelemetryValue.ofInt(element));
            }
            return TelemetryValue.ofArray(elements);
        }
        if (raw instanceof int[]) {
            List<TelemetryValue> elements = new ArrayList<>();
            for (int element : (int[]) raw) {
                elements.add(TelemetryValue.ofInt(element));
            }
            return TelemetryValue.ofArray(elements);
        }
        if (raw instanceof long[]) {
            List<TelemetryValue> elements = new ArrayList<>();
            for (long element : (long[]) raw) {
                elements.add(TelemetryValue.ofInt(element));
            }
            return TelemetryValue.ofArray(elements);
        }
        if (raw instanceof float[]) {
            float[] array = (float[]) raw;
            List<TelemetryValue> elements = new ArrayList<>(array.length);
            for (float element : array) {
                elements.add(TelemetryValue.ofFloat(element));
            }
            return TelemetryValue.ofArray(elements);
        }
        if (raw instanceof double[]) {
            List<TelemetryValue> elements = new ArrayList<>();
            for (double element : (double[]) raw) {
                elements.add(TelemetryValue.ofFloat(element));
            }
            return TelemetryValue.ofArray(elements);
        }

        // ExtensionObject, DiagnosticInfo, nested DataValue/Variant and anything unknown
        throw new DecodingException(ExceptionContext.VALUE_UNSUPPORTED, raw.getClass().getSimpleName());
    }

    /**
     * @return the UTC instant, or null if the server did not provide a timestamp
     */
    static Instant toInstant(DateTime dateTime) {
        if (dateTime == null || dateTime.getUtcTime() <= 0) {
            return null;
        }
        return dateTime.getJavaInstant();
    }

    static Quality toQuality(StatusCode statusCode) {
        if (statusCode == null) {
            return Quality.GOOD;
        }
        long code = statusCode.getValue();
        return new Quality(code, statusName(code));
    }

    /**
     * Resolves the symbolic name of a status code, ignoring the info bits.
     */
    public static String statusName(long code) {
        if (code == 0L) {
            return "Good";
        }
        return StatusCodes.lookup(code & 0xFFFF0000L)
                .map(names -> names[0])
                .orElse(String.format("0x%08X", code));
    }
}
