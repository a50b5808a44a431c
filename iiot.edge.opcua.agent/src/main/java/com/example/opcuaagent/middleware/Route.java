package com.example.opcuaagent.middleware;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.JsonElement;

import com.example.opcuaagent.mqtt.TopicTemplate;

/**
 * Overrides resolved for one address.
 */
public final class Route {

    static final Route UNCHANGED = new Route(false, null, null, Collections.emptyMap());

    private final boolean drop;
    private final TopicTemplate topic;
    private final String feature;
    private final Map<String, JsonElement> extensions;

    Route(boolean drop, TopicTemplate topic, String feature, Map<String, JsonElement> extensions) {
        this.drop = drop;
        this.topic = topic;
        this.feature = feature;
        this.extensions = extensions.isEmpty() ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    public boolean isDrop() {
        return drop;
    }

    /**
     * @return the topic template to publish with, {@code fallback} if no source replaces it
     */
    public TopicTemplate topicOr(TopicTemplate fallback) {
        return topic == null ? fallback : topic;
    }

    /**
     * @return the feature name set by the {@code feature} extension, {@code fallback} if none
     */
    public String featureOr(String fallback) {
        return feature == null ? fallback : feature;
    }

    /** Extensions other than {@code feature}. */
    public Map<String, JsonElement> getExtensions() {
        return extensions;
    }

    @Override
    public String toString() {
        return "Route{drop=" + drop + ", topic=" + topic + ", feature=" + feature + ", extensions=" + extensions.keySet() + "}";
    }
}
