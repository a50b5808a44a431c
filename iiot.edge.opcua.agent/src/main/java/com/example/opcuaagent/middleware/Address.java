package com.example.opcuaagent.middleware;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Hierarchical origin of an update, e.g. {@code opcua/plc-1/pump-1/ns=2;s=Pump1.Speed}.
 * <p>
 * In text form segments are separated by {@code /}; a backslash takes the next character
 * literally, so {@code ns=2;s=Line\/1} is one segment. The empty string is the empty address,
 * which is a prefix of every address.
 */
public final class Address {

    private static final Address EMPTY = new Address(Collections.emptyList());

    private final List<String> segments;

    private Address(List<String> segments) {
        this.segments = segments;
    }

    public static Address of(String... segments) {
        return new Address(List.of(segments));
    }

    public static Address parse(String text) {
        if (text == null || text.isEmpty()) {
            return EMPTY;
        }
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '/') {
                segments.add(current.toString());
                current.setLength(0);
            } else if (c == '\\') {
                // a trailing backslash escapes nothing and is dropped
                if (++i < text.length()) {
                    current.append(text.charAt(i));
                }
            } else {
                current.append(c);
            }
        }
        segments.add(current.toString());
        return new Address(Collections.unmodifiableList(segments));
    }

    public int size() {
        return segments.size();
    }

    public List<String> getSegments() {
        return segments;
    }

    /**
     * @return the last segment, or null for the empty address
     */
    public String last() {
        return segments.isEmpty() ? null : segments.get(segments.size() - 1);
    }

    /**
     * @return the address made of the first {@code length} segments
     */
    public Address prefix(int length) {
        if (length == segments.size()) {
            return this;
        }
        return length == 0 ? EMPTY : new Address(segments.subList(0, length));
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof Address && segments.equals(((Address) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    /**
     * @return the text form, escaping separators and backslashes inside segments
     */
    @Override
    public String toString() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) {
                text.append('/');
            }
            for (char c : segments.get(i).toCharArray()) {
                if (c == '/' || c == '\\') {
                    text.append('\\');
                }
                text.append(c);
            }
        }
        return text.toString();
    }
}
