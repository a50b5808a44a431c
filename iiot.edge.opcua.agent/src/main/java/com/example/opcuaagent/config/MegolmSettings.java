package com.example.opcuaagent.config;

/**
 * Settings of the ratchet encryption used by encrypted channels.
 */
public class MegolmSettings {

    /** Directory of the per-device state files. */
    private String stateDirectory = "/var/lib/opcua-agent/megolm";

    /**
     * If true, an encrypted channel whose ratchet state cannot be persisted stops publishing.
     * If false it falls back to publishing plaintext.
     */
    private boolean mandatory = true;

    public String getStateDirectory() { return stateDirectory; }
    public boolean isMandatory() { return mandatory; }

    public void setStateDirectory(String stateDirectory) { this.stateDirectory = stateDirectory; }
    public void setMandatory(boolean mandatory) { this.mandatory = mandatory; }
}
