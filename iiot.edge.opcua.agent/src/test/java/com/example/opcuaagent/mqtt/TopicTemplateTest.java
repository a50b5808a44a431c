package com.example.opcuaagent.mqtt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.example.opcuaagent.exceptions.ConfigException;
import com.example.opcuaagent.exceptions.ExceptionContext;

public class TopicTemplateTest {

    @Test
    public void rendersPlaceholders() throws ConfigException {
        TopicTemplate template = TopicTemplate.parse("{application}/{device}/{feature}");
        assertEquals("plant-a/valve-2/Position", template.render("valve-2", "plant-a", "Position"));
    }

    @Test
    public void keepsLiteralParts() throws ConfigException {
        assertEquals("telemetry/pump-1", TopicTemplate.parse("telemetry/{device}").render("pump-1", null, "rpm"));
        assertEquals("fixed/topic", TopicTemplate.parse("fixed/topic").render("pump-1", "a", "f"));
        assertEquals("x-pump-1-y", TopicTemplate.parse("x-{device}-y").render("pump-1", "a", "f"));
    }

    @Test
    public void reportsUsedPlaceholders() throws ConfigException {
        TopicTemplate template = TopicTemplate.parse("telemetry/{device}");
        assertTrue(template.uses(TopicTemplate.DEVICE));
        assertFalse(template.uses(TopicTemplate.APPLICATION));
    }

    @Test
    public void rejectsInvalidTemplates() {
        for (String invalid : new String[]{"", "  ", "telemetry/+", "telemetry/#", "t/{unknown}", "t/{device", "t/device}", "t/}{device"}) {
            ConfigException e = assertThrows(ConfigException.class, () -> TopicTemplate.parse(invalid), invalid);
            assertEquals(ExceptionContext.TOPIC_TEMPLATE, e.getContext());
        }
    }
}
