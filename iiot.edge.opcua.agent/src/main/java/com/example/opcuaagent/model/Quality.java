package com.example.opcuaagent.model;

import java.util.Objects;

/**
 * OPC UA status of a sample: the raw 32-bit status code and its symbolic name
 * (e.g. {@code Good}, {@code Bad_CommunicationError}).
 */
public final class Quality {

    public static final Quality GOOD = new Quality(0L, "Good");

    private final long code;
    private final String name;

    public Quality(long code, String name) {
        this.code = code;
        this.name = Objects.requireNonNull(name, "name");
    }

    public long getCode() { return code; }
    public String getName() { return name; }

    /** Severity is encoded in the two most significant bits; 00 means good. */
    public boolean isGood() {
        return (code & 0xC0000000L) == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Quality)) return false;
        Quality other = (Quality) o;
        return code == other.code && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, name);
    }

    @Override
    public String toString() {
        return name + "(0x" + Long.toHexString(code).toUpperCase() + ")";
    }
}
