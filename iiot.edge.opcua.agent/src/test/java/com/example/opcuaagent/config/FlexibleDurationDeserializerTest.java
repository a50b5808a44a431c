package com.example.opcuaagent.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.time.Duration;

import org.junit.jupiter.api.Test;

public class FlexibleDurationDeserializerTest {

    @Test
    public void parsesShorthand() {
        assertEquals(Duration.ofMillis(250), FlexibleDurationDeserializer.parse("250ms"));
        assertEquals(Duration.ofSeconds(5), FlexibleDurationDeserializer.parse("5s"));
        assertEquals(Duration.ofSeconds(5), FlexibleDurationDeserializer.parse("5 S"));
        assertEquals(Duration.ofMinutes(2), FlexibleDurationDeserializer.parse("2m"));
        assertEquals(Duration.ofHours(1), FlexibleDurationDeserializer.parse("1h"));
    }

    @Test
    public void parsesIsoAndPlainMilliseconds() {
        assertEquals(Duration.ofSeconds(5), FlexibleDurationDeserializer.parse("PT5S"));
        assertEquals(Duration.ofSeconds(5), FlexibleDurationDeserializer.parse("pt5s"));
        assertEquals(Duration.ofMillis(5000), FlexibleDurationDeserializer.parse("5000"));
    }

    @Test
    public void rejectsEverythingElse() {
        assertNull(FlexibleDurationDeserializer.parse(""));
        assertNull(FlexibleDurationDeserializer.parse("soon"));
        assertNull(FlexibleDurationDeserializer.parse("5 minutes"));
        assertNull(FlexibleDurationDeserializer.parse("-5s"));
        assertNull(FlexibleDurationDeserializer.parse("1.5s"));
    }
}
