package com.example.opcuaagent.config;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Jackson deserializer for {@link Duration} settings accepting operator friendly input.
 * <pre>
 * "PT5S", "pt5s"  -> 5 seconds
 * "250ms"         -> 250 milliseconds
 * "5s", "2m", "1h"
 * 5000            -> 5000 milliseconds
 * </pre>
 * Anything else is rejected, so a typo fails the configuration instead of silently
 * becoming a default.
 */
public final class FlexibleDurationDeserializer extends JsonDeserializer<Duration> {

    private static final Pattern SHORTHAND = Pattern.compile("^(\\d+)\\s*(ms|s|m|h)$", Pattern.CASE_INSENSITIVE);

    @Override
    public Duration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.getCodec().readTree(p);

        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return Duration.ofMillis(node.asLong());
        }

        String raw = node.asText("").trim();
        Duration parsed = parse(raw);
        if (parsed == null) {
            return (Duration) ctxt.handleWeirdStringValue(Duration.class, raw,
                    "expected e.g. 250ms, 5s, 2m, 1h, PT5S or a number of milliseconds");
        }
        return parsed;
    }

    /**
     * @return the duration, or null if the text is not in a supported format
     */
    public static Duration parse(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }

        Matcher m = SHORTHAND.matcher(text);
        if (m.matches()) {
            long n = Long.parseLong(m.group(1));
            switch (m.group(2).toLowerCase(Locale.ROOT)) {
                case "ms":
                    return Duration.ofMillis(n);
                case "s":
                    return Duration.ofSeconds(n);
                case "m":
                    return Duration.ofMinutes(n);
                default:
                    return Duration.ofHours(n);
            }
        }

        if (text.chars().allMatch(Character::isDigit)) {
            return Duration.ofMillis(Long.parseLong(text));
        }

        try {
            return Duration.parse(text.toUpperCase(Locale.ROOT));
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
