package com.example.opcuaagent.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Overrides applied to updates by the address they originate from.
 * <pre>
 * middleware:
 *   sources:
 *     "opcua/plc-1":
 *       extensions: { site: hall-3 }
 *     "opcua/plc-1/pump-1/ns=2;s=Pump1.Debug":
 *       drop: true
 *     "opcua/plc-1/connection":
 *       topic: "status/plc-1"
 * </pre>
 * Keys are addresses in text form: segments separated by {@code /}, with {@code \} escaping
 * the next character.
 */
public class MiddlewareSettings {

    private Map<String, SourceSettings> sources = new LinkedHashMap<>();

    public Map<String, SourceSettings> getSources() { return sources; }

    public void setSources(Map<String, SourceSettings> sources) {
        this.sources = sources == null ? new LinkedHashMap<>() : sources;
    }
}
