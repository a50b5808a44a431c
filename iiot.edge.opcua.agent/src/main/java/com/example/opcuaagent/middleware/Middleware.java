package com.example.opcuaagent.middleware;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonElement;

import com.example.opcuaagent.config.MiddlewareSettings;
import com.example.opcuaagent.config.SourceSettings;
import com.example.opcuaagent.exceptions.ConfigException;
import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.mqtt.TopicTemplate;

/**
 * Applies the configured source overrides to updates by their address.
 * <p>
 * Every source whose address is a prefix of the update's address matches, the empty address
 * matching everything. Of the matching sources, the most specific one that sets {@code drop}
 * or {@code topic} decides it; extensions are merged from the least to the most specific
 * source. Routes are computed once per address.
 * <p>
 * Addresses of the OPC UA side:
 * <ul>
 * <li>{@code opcua/<connection>/<device>/<node id>} for samples and node status</li>
 * <li>{@code opcua/<connection>/connection} for connection status</li>
 * </ul>
 */
public class Middleware {

    public static final String SOURCE = "opcua";
    public static final String CONNECTION = "connection";
    public static final String FEATURE_EXTENSION = "feature";

    private static final Middleware NONE = new Middleware(Collections.emptyMap());

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final Map<Address, Source> sources;
    private final ConcurrentMap<Address, Route> routes = new ConcurrentHashMap<>();

    private Middleware(Map<Address, Source> sources) {
        this.sources = sources;
    }

    /**
     * @return middleware without any source, routing every update unchanged
     */
    public static Middleware none() {
        return NONE;
    }

    /**
     * @throws ConfigException if a source topic is not a valid template or the {@code feature}
     *                         extension is not a usable feature name
     */
    public static Middleware create(MiddlewareSettings settings) throws ConfigException {
        if (settings.getSources().isEmpty()) {
            return NONE;
        }
        Gson gson = new Gson();
        Map<Address, Source> sources = new HashMap<>();
        for (Map.Entry<String, SourceSettings> entry : settings.getSources().entrySet()) {
            SourceSettings source = entry.getValue() == null ? new SourceSettings() : entry.getValue();
            Address address = Address.parse(entry.getKey());

            TopicTemplate topic = source.getTopic() == null ? null : TopicTemplate.parse(source.getTopic());
            Map<String, JsonElement> extensions = new LinkedHashMap<>();
            for (Map.Entry<String, Object> extension : source.getExtensions().entrySet()) {
                extensions.put(extension.getKey(), gson.toJsonTree(extension.getValue()));
            }
            JsonElement feature = extensions.get(FEATURE_EXTENSION);
            if (feature != null && !isFeatureName(feature)) {
                throw new ConfigException(ExceptionContext.CONFIG_INVALID,
                        "Extension feature of source " + entry.getKey() + " must be a string without '+' or '#'.");
            }
            if (sources.put(address, new Source(source.getDrop(), topic, extensions)) != null) {
                throw new ConfigException(ExceptionContext.CONFIG_INVALID, "Source " + entry.getKey() + " is configured twice.");
            }
        }
        return new Middleware(sources);
    }

    private static boolean isFeatureName(JsonElement feature) {
        if (!feature.isJsonPrimitive() || !feature.getAsJsonPrimitive().isString()) {
            return false;
        }
        String name = feature.getAsString();
        return !name.isEmpty() && name.indexOf('+') < 0 && name.indexOf('#') < 0;
    }

    public static Address valueAddress(String connection, String device, String node) {
        return Address.of(SOURCE, connection, device, node);
    }

    public static Address connectionAddress(String connection) {
        return Address.of(SOURCE, connection, CONNECTION);
    }

    /**
     * @return the overrides of updates from the address
     */
    public Route resolve(Address address) {
        if (sources.isEmpty()) {
            return Route.UNCHANGED;
        }
        return routes.computeIfAbsent(address, this::compute);
    }

    private Route compute(Address address) {
        List<Source> matching = new ArrayList<>();
        for (int length = 0; length <= address.size(); length++) {
            Source source = sources.get(address.prefix(length));
            if (source != null) {
                matching.add(source);
            }
        }

        boolean drop = false;
        TopicTemplate topic = null;
        Map<String, JsonElement> extensions = new LinkedHashMap<>();
        for (Source source : matching) {
            if (source.drop != null) {
                drop = source.drop;
            }
            if (source.topic != null) {
                topic = source.topic;
            }
            extensions.putAll(source.extensions);
        }

        JsonElement feature = extensions.remove(FEATURE_EXTENSION);
        Route route = new Route(drop, topic, feature == null ? null : feature.getAsString(), extensions);
        logger.debug("Address {} matches {} source(s): {}", address, matching.size(), route);
        return route;
    }

    private static final class Source {
        private final Boolean drop;
        private final TopicTemplate topic;
        private final Map<String, JsonElement> extensions;

        Source(Boolean drop, TopicTemplate topic, Map<String, JsonElement> extensions) {
            this.drop = drop;
            this.topic = topic;
            this.extensions = extensions;
        }
    }
}
