package com.example.opcuaagent.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of the agent configuration file.
 * <pre>
 * connections:
 *   plc-1:
 *     url: opc.tcp://plc-1:4840
 * channels:
 *   - device: pump-1
 *     connection: plc-1
 *     nodes: [ "ns=2;s=Pump1.Pressure" ]
 * mqtt:
 *   host: broker.example.com
 * </pre>
 */
public class AgentSettings {

    private Map<String, OpcUaConnectionSettings> connections = new LinkedHashMap<>();
    private List<ChannelSettings> channels = new ArrayList<>();
    private MqttSettings mqtt;
    private MegolmSettings megolm = new MegolmSettings();
    private MiddlewareSettings middleware = new MiddlewareSettings();

    /** Threads processing value changes, shared by all channels. */
    private int workerThreads = 4;

    /** AWS region of the secrets referenced by credential settings. */
    private String awsRegion;

    public Map<String, OpcUaConnectionSettings> getConnections() { return connections; }
    public List<ChannelSettings> getChannels() { return channels; }
    public MqttSettings getMqtt() { return mqtt; }
    public MegolmSettings getMegolm() { return megolm; }
    public MiddlewareSettings getMiddleware() { return middleware; }
    public int getWorkerThreads() { return workerThreads; }
    public String getAwsRegion() { return awsRegion; }

    public void setConnections(Map<String, OpcUaConnectionSettings> connections) {
        this.connections = connections == null ? new LinkedHashMap<>() : connections;
    }

    public void setChannels(List<ChannelSettings> channels) {
        this.channels = channels == null ? new ArrayList<>() : channels;
    }

    public void setMqtt(MqttSettings mqtt) { this.mqtt = mqtt; }
    public void setMegolm(MegolmSettings megolm) { this.megolm = megolm == null ? new MegolmSettings() : megolm; }

    public void setMiddleware(MiddlewareSettings middleware) {
        this.middleware = middleware == null ? new MiddlewareSettings() : middleware;
    }

    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    public void setAwsRegion(String awsRegion) { this.awsRegion = awsRegion; }
}
