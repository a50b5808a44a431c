package com.example.opcuaagent.config;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * One monitored node of a channel. In YAML either a plain node id string or an object with
 * {@code id} and an optional {@code alias}.
 */
public class NodeSettings {

    /** Parseable OPC UA node id, e.g. {@code ns=2;s=Pump1.Pressure}. */
    private String id;

    /** Feature name published for the node; defaults to the last segment of the identifier. */
    private String alias;

    public NodeSettings() {
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public NodeSettings(String id) {
        this.id = id;
    }

    public NodeSettings(String id, String alias) {
        this.id = id;
        this.alias = alias;
    }

    public String getId() { return id; }
    public String getAlias() { return alias; }

    public void setId(String id) { this.id = id; }
    public void setAlias(String alias) { this.alias = alias; }

    /**
     * @return the alias, or the identifier part after the last {@code '/'} or {@code '.'}
     */
    public String getFeature() {
        if (alias != null && !alias.isBlank()) {
            return alias;
        }
        String identifier = id;
        int separator = identifier.indexOf(";s=");
        if (separator < 0) {
            separator = identifier.indexOf(";i=");
        }
        if (separator >= 0) {
            identifier = identifier.substring(separator + 3);
        }
        int last = Math.max(identifier.lastIndexOf('/'), identifier.lastIndexOf('.'));
        return last >= 0 && last < identifier.length() - 1 ? identifier.substring(last + 1) : identifier;
    }
}
