package com.example.opcuaagent.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Overrides for all updates whose address starts with the configured one. For drop and topic
 * the most specific source that sets them wins; extensions of all matching sources are merged,
 * more specific ones overwriting less specific ones.
 */
public class SourceSettings {

    /** Whether updates are discarded; null leaves the decision to less specific sources. */
    private Boolean drop;

    /** Topic template replacing the channel's topic; null keeps it. */
    private String topic;

    /**
     * Free-form values added to the published document. The string extension {@code feature}
     * replaces the feature name instead.
     */
    private Map<String, Object> extensions = new LinkedHashMap<>();

    public Boolean getDrop() { return drop; }
    public String getTopic() { return topic; }
    public Map<String, Object> getExtensions() { return extensions; }

    public void setDrop(Boolean drop) { this.drop = drop; }
    public void setTopic(String topic) { this.topic = topic; }

    public void setExtensions(Map<String, Object> extensions) {
        this.extensions = extensions == null ? new LinkedHashMap<>() : extensions;
    }
}
