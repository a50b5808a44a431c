package com.example.opcuaagent.mqtt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.example.opcuaagent.exceptions.ConfigException;
import com.example.opcuaagent.exceptions.ExceptionContext;

/**
 * MQTT topic with placeholders, e.g. {@code {application}/telemetry/{device}/{feature}}.
 * Templates are publish topics, so wildcards are not allowed.
 */
public final class TopicTemplate {

    public static final String DEVICE = "device";
    public static final String APPLICATION = "application";
    public static final String FEATURE = "feature";

    private static final Set<String> PLACEHOLDERS = Set.of(DEVICE, APPLICATION, FEATURE);

    private final String template;

    /** Alternating literal and placeholder parts; placeholders are stored without braces. */
    private final List<String> parts;
    private final List<Boolean> placeholder;

    private TopicTemplate(String template, List<String> parts, List<Boolean> placeholder) {
        this.template = template;
        this.parts = parts;
        this.placeholder = placeholder;
    }

    /**
     * @throws ConfigException if the template is empty, contains a wildcard, an unknown
     *                         placeholder or an unbalanced brace
     */
    public static TopicTemplate parse(String template) throws ConfigException {
        if (template == null || template.isBlank()) {
            throw new ConfigException(ExceptionContext.TOPIC_TEMPLATE, "Template is empty.");
        }
        if (template.indexOf('+') >= 0 || template.indexOf('#') >= 0) {
            throw new ConfigException(ExceptionContext.TOPIC_TEMPLATE, "Wildcards are not allowed in '" + template + "'.");
        }

        List<String> parts = new ArrayList<>();
        List<Boolean> placeholder = new ArrayList<>();
        int pos = 0;
        while (pos < template.length()) {
            int open = template.indexOf('{', pos);
            int close = template.indexOf('}', pos);
            if (open < 0) {
                if (close >= 0) {
                    throw new ConfigException(ExceptionContext.TOPIC_TEMPLATE, "Unbalanced '}' in '" + template + "'.");
                }
                parts.add(template.substring(pos));
                placeholder.add(false);
                break;
            }
            if (close < open) {
                throw new ConfigException(ExceptionContext.TOPIC_TEMPLATE, "Unbalanced braces in '" + template + "'.");
            }
            if (open > pos) {
                parts.add(template.substring(pos, open));
                placeholder.add(false);
            }
            String name = template.substring(open + 1, close);
            if (!PLACEHOLDERS.contains(name)) {
                throw new ConfigException(ExceptionContext.TOPIC_TEMPLATE,
                        "Unknown placeholder {" + name + "} in '" + template + "'.");
            }
            parts.add(name);
            placeholder.add(true);
            pos = close + 1;
        }
        return new TopicTemplate(template, Collections.unmodifiableList(parts), Collections.unmodifiableList(placeholder));
    }

    public boolean uses(String name) {
        for (int i = 0; i < parts.size(); i++) {
            if (placeholder.get(i) && parts.get(i).equals(name)) {
                return true;
            }
        }
        return false;
    }

    public String render(String device, String application, String feature) {
        StringBuilder topic = new StringBuilder(template.length() + 32);
        for (int i = 0; i < parts.size(); i++) {
            String part = parts.get(i);
            if (!placeholder.get(i)) {
                topic.append(part);
            } else if (DEVICE.equals(part)) {
                topic.append(device);
            } else if (APPLICATION.equals(part)) {
                topic.append(application);
            } else {
                topic.append(feature);
            }
        }
        return topic.toString();
    }

    @Override
    public String toString() {
        return template;
    }
}
