package com.example.opcuaagent.opcua;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.opcuaagent.config.AgentSettings;
import com.example.opcuaagent.config.ChannelSettings;

/**
 * {@link SubscriptionManager} on top of the Eclipse Milo client: one session per configured
 * connection that at least one channel uses.
 */
public class MiloSubscriptionManager implements SubscriptionManager {

    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final List<OpcUaConnection> connections = new ArrayList<>();

    public MiloSubscriptionManager(AgentSettings settings) {
        this(settings, new OpcUaClientFactory());
    }

    MiloSubscriptionManager(AgentSettings settings, OpcUaClientFactory clientFactory) {
        Map<String, List<ChannelSettings>> channelsByConnection = new LinkedHashMap<>();
        for (ChannelSettings channel : settings.getChannels()) {
            channelsByConnection.computeIfAbsent(channel.getConnection(), c -> new ArrayList<>()).add(channel);
        }
        for (String name : settings.getConnections().keySet()) {
            List<ChannelSettings> channels = channelsByConnection.get(name);
            if (channels == null) {
                logger.info("Connection {} is not used by any channel", name);
                continue;
            }
            connections.add(new OpcUaConnection(name, settings.getConnections().get(name), channels, clientFactory));
        }
    }

    @Override
    public void start(ChannelEventListener listener) {
        for (OpcUaConnection connection : connections) {
            logger.info("Starting connection {} for {} channel(s)", connection.getName(), connection.getChannels().size());
            connection.start(listener);
        }
    }

    @Override
    public void stop() {
        for (OpcUaConnection connection : connections) {
            connection.stop();
        }
    }

    List<OpcUaConnection> getConnections() {
        return connections;
    }
}
