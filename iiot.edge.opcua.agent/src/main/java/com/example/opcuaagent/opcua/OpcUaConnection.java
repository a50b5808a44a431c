package com.example.opcuaagent.opcua;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.eclipse.milo.opcua.sdk.client.OpcUaClient;
import org.eclipse.milo.opcua.sdk.client.SessionActivityListener;
import org.eclipse.milo.opcua.sdk.client.api.UaSession;
import org.eclipse.milo.opcua.sdk.client.api.subscriptions.UaSubscription;
import org.eclipse.milo.opcua.sdk.client.api.subscriptions.UaSubscriptionManager;
import org.eclipse.milo.opcua.sdk.client.subscriptions.ManagedDataItem;
import org.eclipse.milo.opcua.sdk.client.subscriptions.ManagedSubscription;
import org.eclipse.milo.opcua.stack.core.StatusCodes;
import org.eclipse.milo.opcua.stack.core.UaException;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.opcuaagent.codec.ValueCodec;
import com.example.opcuaagent.config.ChannelSettings;
import com.example.opcuaagent.config.NodeSettings;
import com.example.opcuaagent.config.OpcUaConnectionSettings;
import com.example.opcuaagent.config.TimestampsMode;
import com.example.opcuaagent.exceptions.ConnectionException;
import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.model.StatusUpdate;
import com.example.opcuaagent.util.Backoff;

/**
 * One OPC UA session and the subscriptions of the channels using it.
 * <p>
 * Connecting, subscription creation and teardown all run on the connection's own scheduler
 * thread. A failed connect is retried with exponential backoff and random jitter until
 * {@code maxConnectAttempts} is reached; authentication and certificate errors are fatal at
 * once. After the first successful connect, the Milo client keeps the session alive itself and
 * transfers subscriptions to a new session. Subscriptions whose transfer failed are recreated.
 * <p>
 * Channels sharing a sampling interval and timestamps mode share one subscription. Every node
 * becomes one monitored item; a node that cannot be monitored is retried
 * {@code nodeResolveAttempts} times and then skipped.
 * <p>
 * Every channel is told about the session as a status update: connected after each connect
 * and reactivation, disconnected (with every node unsubscribed) when the session is lost.
 * A skipped node is reported as unsubscribed with its last status.
 */
class OpcUaConnection {

    private static final Duration NODE_RETRY_DELAY = Duration.ofSeconds(1);

    /** Reported when the session is lost; Milo does not tell why. */
    private static final String SESSION_LOST_STATUS = ValueCodec.statusName(StatusCodes.Bad_ConnectionClosed);

    private static final Set<Long> FATAL_STATUS_CODES = Set.of(
            StatusCodes.Bad_UserAccessDenied,
            StatusCodes.Bad_IdentityTokenInvalid,
            StatusCodes.Bad_IdentityTokenRejected,
            StatusCodes.Bad_CertificateUntrusted,
            StatusCodes.Bad_CertificateInvalid,
            StatusCodes.Bad_CertificateUriInvalid,
            StatusCodes.Bad_CertificateHostNameInvalid,
            StatusCodes.Bad_SecurityChecksFailed,
            StatusCodes.Bad_SecurityPolicyRejected,
            StatusCodes.Bad_SecurityModeRejected,
            StatusCodes.Bad_ApplicationSignatureInvalid);

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final String name;
    private final OpcUaConnectionSettings settings;
    private final List<ChannelSettings> channels;
    private final OpcUaClientFactory clientFactory;
    private final SubscriptionFactory subscriptionFactory;
    private final Duration nodeRetryDelay;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Backoff backoff;

    private final AtomicBoolean recreatePending = new AtomicBoolean();
    private volatile ChannelEventListener listener;
    private volatile boolean stopped;
    private volatile boolean sessionLost;

    // Scheduler thread only
    private OpcUaClient client;
    private final List<ManagedSubscription> subscriptions = new ArrayList<>();
    private int failedAttempts;

    OpcUaConnection(String name, OpcUaConnectionSettings settings, List<ChannelSettings> channels,
                    OpcUaClientFactory clientFactory) {
        this(name, settings, channels, clientFactory, ManagedSubscription::create, NODE_RETRY_DELAY, Clock.systemUTC());
    }

    OpcUaConnection(String name, OpcUaConnectionSettings settings, List<ChannelSettings> channels,
                    OpcUaClientFactory clientFactory, SubscriptionFactory subscriptionFactory,
                    Duration nodeRetryDelay, Clock clock) {
        this.name = name;
        this.settings = settings;
        this.channels = List.copyOf(channels);
        this.clientFactory = clientFactory;
        this.subscriptionFactory = subscriptionFactory;
        this.nodeRetryDelay = nodeRetryDelay;
        this.clock = clock;
        this.backoff = Backoff.withMax(settings.getReconnectMaxDelay());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "opcua-" + name));
    }

    void start(ChannelEventListener listener) {
        this.listener = listener;
        scheduler.execute(this::tryConnect);
    }

    /**
     * Deletes the subscriptions and closes the session, waiting at most twice the request timeout.
     */
    void stop() {
        stopped = true;
        try {
            Future<?> closed = scheduler.submit(() -> {
                deleteSubscriptions();
                disconnectClient();
            });
            closed.get(settings.getRequestTimeout().toMillis() * 2, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            logger.warn("Closing connection {} did not complete cleanly: {}", name, e.toString());
        }
        scheduler.shutdownNow();
        logger.info("Connection {} closed", name);
    }

    String getName() {
        return name;
    }

    List<ChannelSettings> getChannels() {
        return channels;
    }

    private void tryConnect() {
        if (stopped) {
            return;
        }
        try {
            logger.info("Connecting to {} ({}), attempt #{}", name, settings.getUrl(), failedAttempts + 1);
            disconnectClient();
            client = clientFactory.create(settings);
            // Secure channel, session creation and activation
            client.connect().get(settings.getRequestTimeout().toMillis() * 3, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (ConnectionException e) {
            onConnectFailure(e);
            return;
        } catch (ExecutionException | TimeoutException e) {
            onConnectFailure(classify(e));
            return;
        }

        logger.info("Connected to {}", name);
        failedAttempts = 0;
        backoff.reset();
        registerSessionListeners(client);
        for (ChannelSettings channel : channels) {
            listener.onStatus(StatusUpdate.connection(channel.getDevice(), true, null, clock.instant()));
        }
        createSubscriptions();
    }

    private void onConnectFailure(ConnectionException e) {
        failedAttempts++;
        String reason = e.getCause() == null ? e.getMessage() : e.getMessage() + " " + e.getCause().getMessage();
        if (e.isFatal() || failedAttempts >= settings.getMaxConnectAttempts()) {
            ConnectionException fatal = e.isFatal() ? e
                    : new ConnectionException(e.getContext(),
                    "Gave up after " + failedAttempts + " attempts, last error: " + reason, true);
            logger.error("Connection {} failed permanently: {}", name, fatal.getMessage(), e);
            disconnectClient();
            for (ChannelSettings channel : channels) {
                listener.onFatal(channel.getDevice(), fatal);
            }
            return;
        }
        Duration delay = backoff.nextDelay();
        logger.warn("Connection {} failed: {} Reconnecting in {} ms (attempt #{})",
                name, reason, delay.toMillis(), failedAttempts);
        schedule(this::tryConnect, delay);
    }

    private void registerSessionListeners(OpcUaClient connected) {
        connected.addSessionActivityListener(new SessionActivityListener() {
            @Override
            public void onSessionActive(UaSession session) {
                if (sessionLost) {
                    sessionLost = false;
                    logger.info("OPC UA session of {} is active again", name);
                    for (ChannelSettings channel : channels) {
                        listener.onStatus(StatusUpdate.connection(channel.getDevice(), true, null, clock.instant()));
                        listener.onStreaming(channel.getDevice());
                    }
                }
            }

            @Override
            public void onSessionInactive(UaSession session) {
                if (stopped) {
                    return;
                }
                sessionLost = true;
                logger.warn("OPC UA session of {} is inactive", name);
                for (ChannelSettings channel : channels) {
                    String device = channel.getDevice();
                    listener.onStatus(StatusUpdate.connection(device, false, SESSION_LOST_STATUS, clock.instant()));
                    for (NodeSettings node : channel.getNodes()) {
                        listener.onStatus(StatusUpdate.subscription(device, node.getId(), node.getFeature(), false,
                                null, clock.instant()));
                    }
                    listener.onInterrupted(device, "session inactive");
                }
            }
        });

        connected.getSubscriptionManager().addSubscriptionListener(new UaSubscriptionManager.SubscriptionListener() {
            @Override
            public void onSubscriptionTransferFailed(UaSubscription subscription, StatusCode statusCode) {
                logger.warn("Subscription transfer on {} failed: {}", name, statusCode);
                if (recreatePending.compareAndSet(false, true)) {
                    scheduler.execute(OpcUaConnection.this::createSubscriptions);
                }
            }
        });
    }

    private void createSubscriptions() {
        recreatePending.set(false);
        if (stopped || client == null) {
            return;
        }
        deleteSubscriptions();
        try {
            for (Map.Entry<SubscriptionKey, List<ChannelSettings>> group : groupChannels(channels).entrySet()) {
                SubscriptionKey key = group.getKey();
                ManagedSubscription subscription = subscriptionFactory.create(client, key.intervalMillis);
                subscription.setDefaultSamplingInterval(key.intervalMillis);
                subscription.setDefaultTimestamps(key.timestamps.toOpcUa());
                subscriptions.add(subscription);
                logger.info("Created subscription on {} with interval {} ms for {} channel(s)",
                        name, key.intervalMillis, group.getValue().size());

                for (ChannelSettings channel : group.getValue()) {
                    monitorChannel(subscription, channel);
                }
            }
            backoff.reset();
        } catch (UaException e) {
            Duration delay = backoff.nextDelay();
            logger.error("Creating subscriptions on {} failed, retrying in {} ms: {}", name, delay.toMillis(), e.getMessage(), e);
            for (ChannelSettings channel : channels) {
                listener.onInterrupted(channel.getDevice(), e.getStatusCode().toString());
            }
            schedule(this::createSubscriptions, delay);
        }
    }

    private void monitorChannel(ManagedSubscription subscription, ChannelSettings channel) {
        String device = channel.getDevice();
        int monitored = 0;
        for (NodeSettings node : channel.getNodes()) {
            ManagedDataItem item = createItem(subscription, device, node);
            if (item == null) {
                continue;
            }
            String nodeId = node.getId();
            String feature = node.getFeature();
            item.addDataValueListener((dataItem, value) -> {
                if (!stopped) {
                    listener.onValueChange(new ValueChange(device, nodeId, feature, value));
                }
            });
            monitored++;
        }
        if (monitored == 0) {
            logger.error("No node of channel {} could be monitored", device);
        } else {
            logger.info("Monitoring {}/{} nodes of channel {}", monitored, channel.getNodes().size(), device);
        }
        listener.onStreaming(device);
    }

    /**
     * @return the monitored item of the node, or null if the node was skipped
     */
    private ManagedDataItem createItem(ManagedSubscription subscription, String device, NodeSettings node) {
        NodeId nodeId = NodeId.parse(node.getId());
        int attempts = settings.getNodeResolveAttempts();
        String lastStatus = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                ManagedDataItem item = subscription.createDataItem(nodeId);
                if (item.getStatusCode().isGood()) {
                    return item;
                }
                lastStatus = ValueCodec.statusName(item.getStatusCode().getValue());
                logger.warn("Monitoring {} of {} failed with {} (attempt {}/{})",
                        node.getId(), device, lastStatus, attempt, attempts);
                deleteItem(item);
            } catch (UaException e) {
                lastStatus = ValueCodec.statusName(e.getStatusCode().getValue());
                logger.warn("Monitoring {} of {} failed: {} (attempt {}/{})",
                        node.getId(), device, e.getMessage(), attempt, attempts);
            }
            if (attempt < attempts) {
                try {
                    Thread.sleep(nodeRetryDelay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return null;
                }
            }
        }
        logger.error("Skipping node {} of {} after {} attempts", node.getId(), device, attempts);
        listener.onStatus(StatusUpdate.subscription(device, node.getId(), node.getFeature(), false, lastStatus,
                clock.instant()));
        return null;
    }

    private void deleteItem(ManagedDataItem item) {
        try {
            item.delete();
        } catch (UaException e) {
            logger.debug("Deleting monitored item {} failed: {}", item.getNodeId(), e.getMessage());
        }
    }

    private void deleteSubscriptions() {
        for (ManagedSubscription subscription : subscriptions) {
            try {
                subscription.delete();
            } catch (UaException e) {
                logger.debug("Deleting subscription on {} failed: {}", name, e.getMessage());
            }
        }
        subscriptions.clear();
    }

    private void disconnectClient() {
        if (client == null) {
            return;
        }
        try {
            logger.info("Disconnecting OPC UA client of {}", name);
            client.disconnect().get(settings.getRequestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Failed to disconnect OPC UA client of {} cleanly: {}", name, e.toString());
        } finally {
            client = null;
        }
    }

    private void schedule(Runnable task, Duration delay) {
        if (!stopped) {
            scheduler.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    static ConnectionException classify(Throwable failure) {
        Optional<StatusCode> status = UaException.extractStatusCode(failure);
        Throwable cause = failure instanceof ExecutionException && failure.getCause() != null ? failure.getCause() : failure;
        if (status.isPresent() && isFatal(status.get())) {
            return new ConnectionException(ExceptionContext.OPCUA_AUTH, cause, true);
        }
        return new ConnectionException(ExceptionContext.OPCUA_CONNECT, cause, false);
    }

    /**
     * @return whether retrying cannot help: rejected credentials or certificates
     */
    static boolean isFatal(StatusCode status) {
        return FATAL_STATUS_CODES.contains(status.getValue());
    }

    static Map<SubscriptionKey, List<ChannelSettings>> groupChannels(List<ChannelSettings> channels) {
        Map<SubscriptionKey, List<ChannelSettings>> groups = new LinkedHashMap<>();
        for (ChannelSettings channel : channels) {
            SubscriptionKey key = new SubscriptionKey(channel.getSamplingInterval().toMillis(), channel.getTimestamps());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(channel);
        }
        return groups;
    }

    /**
     * Creates the subscription of one channel group; {@link ManagedSubscription#create} outside tests.
     */
    @FunctionalInterface
    interface SubscriptionFactory {
        ManagedSubscription create(OpcUaClient client, double intervalMillis) throws UaException;
    }

    static final class SubscriptionKey {
        final double intervalMillis;
        final TimestampsMode timestamps;

        SubscriptionKey(double intervalMillis, TimestampsMode timestamps) {
            this.intervalMillis = intervalMillis;
            this.timestamps = timestamps;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof SubscriptionKey)) {
                return false;
            }
            SubscriptionKey other = (SubscriptionKey) o;
            return Double.compare(intervalMillis, other.intervalMillis) == 0 && timestamps == other.timestamps;
        }

        @Override
        public int hashCode() {
            return Objects.hash(intervalMillis, timestamps);
        }
    }
}
