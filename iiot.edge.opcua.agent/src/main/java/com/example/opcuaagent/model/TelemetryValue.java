package com.example.opcuaagent.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A typed telemetry value.
 * <p>
 * The set of variants is closed: every value is one of {@link Kind}. Instances are created only
 * through the static factories, so code switching on {@link #getKind()} handles every case.
 */
public abstract class TelemetryValue {

    /** The value variants carried by a telemetry envelope. */
    public enum Kind {
        EMPTY, BOOL, INT, FLOAT, STRING, BYTES, ARRAY
    }

    private static final TelemetryValue EMPTY = new EmptyValue();

    private TelemetryValue() {
    }

    public abstract Kind getKind();

    public static TelemetryValue empty() {
        return EMPTY;
    }

    public static TelemetryValue ofBool(boolean value) {
        return new BoolValue(value);
    }

    public static TelemetryValue ofInt(long value) {
        return new IntValue(value);
    }

    public static TelemetryValue ofFloat(double value) {
        return new FloatValue(value);
    }

    public static TelemetryValue ofString(String value) {
        return new StrValue(Objects.requireNonNull(value, "value"));
    }

    public static TelemetryValue ofBytes(byte[] value) {
        return new BytesValue(Objects.requireNonNull(value, "value").clone());
    }

    public static TelemetryValue ofArray(List<TelemetryValue> elements) {
        return new ArrayValue(Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public boolean asBool() {
        throw wrongKind(Kind.BOOL);
    }

    public long asInt() {
        throw wrongKind(Kind.INT);
    }

    public double asFloat() {
        throw wrongKind(Kind.FLOAT);
    }

    public String asString() {
        throw wrongKind(Kind.STRING);
    }

    public byte[] asBytes() {
        throw wrongKind(Kind.BYTES);
    }

    public List<TelemetryValue> asArray() {
        throw wrongKind(Kind.ARRAY);
    }

    private IllegalStateException wrongKind(Kind requested) {
        return new IllegalStateException("Value of kind " + getKind() + " is not " + requested);
    }


    private static final class EmptyValue extends TelemetryValue {
        @Override
        public Kind getKind() { return Kind.EMPTY; }

        @Override
        public boolean equals(Object o) { return o instanceof EmptyValue; }

        @Override
        public int hashCode() { return 0; }

        @Override
        public String toString() { return "empty"; }
    }

    private static final class BoolValue extends TelemetryValue {
        private final boolean value;

        BoolValue(boolean value) { this.value = value; }

        @Override
        public Kind getKind() { return Kind.BOOL; }

        @Override
        public boolean asBool() { return value; }

        @Override
        public boolean equals(Object o) { return o instanceof BoolValue && ((BoolValue) o).value == value; }

        @Override
        public int hashCode() { return Boolean.hashCode(value); }

        @Override
        public String toString() { return Boolean.toString(value); }
    }

    private static final class IntValue extends TelemetryValue {
        private final long value;

        IntValue(long value) { this.value = value; }

        @Override
        public Kind getKind() { return Kind.INT; }

        @Override
        public long asInt() { return value; }

        @Override
        public boolean equals(Object o) { return o instanceof IntValue && ((IntValue) o).value == value; }

        @Override
        public int hashCode() { return Long.hashCode(value); }

        @Override
        public String toString() { return Long.toString(value); }
    }

    private static final class FloatValue extends TelemetryValue {
        private final double value;

        FloatValue(double value) { this.value = value; }

        @Override
        public Kind getKind() { return Kind.FLOAT; }

        @Override
        public double asFloat() { return value; }

        // bitwise comparison, so NaN equals NaN and -0.0 differs from 0.0
        @Override
        public boolean equals(Object o) {
            return o instanceof FloatValue && Double.doubleToLongBits(((FloatValue) o).value) == Double.doubleToLongBits(value);
        }

        @Override
        public int hashCode() { return Double.hashCode(value); }

        @Override
        public String toString() { return Double.toString(value); }
    }

    private static final class StrValue extends TelemetryValue {
        private final String value;

        StrValue(String value) { this.value = value; }

        @Override
        public Kind getKind() { return Kind.STRING; }

        @Override
        public String asString() { return value; }

        @Override
        public boolean equals(Object o) { return o instanceof StrValue && ((StrValue) o).value.equals(value); }

        @Override
        public int hashCode() { return value.hashCode(); }

        @Override
        public String toString() { return '"' + value + '"'; }
    }

    private static final class BytesValue extends TelemetryValue {
        private final byte[] value;

        BytesValue(byte[] value) { this.value = value; }

        @Override
        public Kind getKind() { return Kind.BYTES; }

        @Override
        public byte[] asBytes() { return value.clone(); }

        @Override
        public boolean equals(Object o) { return o instanceof BytesValue && Arrays.equals(((BytesValue) o).value, value); }

        @Override
        public int hashCode() { return Arrays.hashCode(value); }

        @Override
        public String toString() { return "bytes:" + Base64.getEncoder().encodeToString(value); }
    }

    private static final class ArrayValue extends TelemetryValue {
        private final List<TelemetryValue> elements;

        ArrayValue(List<TelemetryValue> elements) { this.elements = elements; }

        @Override
        public Kind getKind() { return Kind.ARRAY; }

        @Override
        public List<TelemetryValue> asArray() { return elements; }

        @Override
        public boolean equals(Object o) { return o instanceof ArrayValue && ((ArrayValue) o).elements.equals(elements); }

        @Override
        public int hashCode() { return elements.hashCode(); }

        @Override
        public String toString() { return elements.toString(); }
    }
}
