package com.example.opcuaagent.bridge;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.opcuaagent.codec.EnvelopeSerializer;
import com.example.opcuaagent.codec.ValueCodec;
import com.example.opcuaagent.config.AgentSettings;
import com.example.opcuaagent.config.ChannelSettings;
import com.example.opcuaagent.engine.EncryptionEngine;
import com.example.opcuaagent.engine.MegolmEncryptionEngine;
import com.example.opcuaagent.engine.PassthroughEncryptionEngine;
import com.example.opcuaagent.exceptions.ConfigException;
import com.example.opcuaagent.exceptions.ConnectionException;
import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.middleware.Middleware;
import com.example.opcuaagent.model.StatusUpdate;
import com.example.opcuaagent.mqtt.MqttPublisher;
import com.example.opcuaagent.opcua.ChannelEventListener;
import com.example.opcuaagent.opcua.SubscriptionManager;
import com.example.opcuaagent.opcua.ValueChange;
import com.example.opcuaagent.store.RatchetSessionStore;

/**
 * Wires the subscription manager, one {@link ChannelPipeline} per device channel and the MQTT
 * publisher, and drives the channel lifecycle.
 * <p>
 * All pipelines share one bounded worker pool. Each pipeline hands at most one task to the
 * pool at a time, which keeps the samples of a channel in order without a thread per channel.
 */
public class BridgeOrchestrator implements ChannelEventListener {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final AgentSettings settings;
    private final SubscriptionManager subscriptions;
    private final MqttPublisher publisher;
    private final RatchetSessionStore store;
    private final ThreadPoolExecutor workers;
    private final Map<String, ChannelPipeline> pipelines = new LinkedHashMap<>();
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile boolean stopped;

    /**
     * @param store ratchet sessions for encrypted channels; may be null if no channel is encrypted
     * @throws ConfigException if a channel's topic template or a source override is invalid
     */
    public BridgeOrchestrator(AgentSettings settings, SubscriptionManager subscriptions, MqttPublisher publisher,
                              RatchetSessionStore store) throws ConfigException {
        this.settings = settings;
        this.subscriptions = subscriptions;
        this.publisher = publisher;
        this.store = store;

        int threads = settings.getWorkerThreads();
        this.workers = new ThreadPoolExecutor(
                threads, threads,
                60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1000),
                new WorkerThreadFactory(),
                new ThreadPoolExecutor.CallerRunsPolicy());

        ValueCodec codec = new ValueCodec();
        EnvelopeSerializer serializer = new EnvelopeSerializer();
        EncryptionEngine passthrough = new PassthroughEncryptionEngine(serializer);
        EncryptionEngine megolm = store == null ? null : new MegolmEncryptionEngine(store, serializer);
        Middleware middleware = Middleware.create(settings.getMiddleware());

        for (ChannelSettings channel : settings.getChannels()) {
            EncryptionEngine engine = passthrough;
            if (channel.isEncrypted()) {
                if (megolm == null) {
                    throw new ConfigException(ExceptionContext.CONFIG_INVALID,
                            "Channel " + channel.getDevice() + " is encrypted but no ratchet store is available.");
                }
                engine = megolm;
            }
            pipelines.put(channel.getDevice(), new ChannelPipeline(channel, settings.getMqtt().getApplication(),
                    codec, engine, serializer, middleware, settings.getMegolm().isMandatory(), publisher, workers,
                    this::checkAllFailed));
        }
    }

    /**
     * Connects to the broker and starts the subscriptions.
     *
     * @throws ConnectionException (fatal) if the broker cannot be reached
     */
    public void start() throws ConnectionException, InterruptedException {
        publisher.start(settings.getMqtt().getMaxConnectAttempts());
        for (ChannelPipeline pipeline : pipelines.values()) {
            pipeline.transition(ChannelState.SUBSCRIBING);
        }
        subscriptions.start(this);
        logger.info("Bridge started with {} channel(s), {} worker thread(s)", pipelines.size(), workers.getCorePoolSize());
    }

    /**
     * Stops the subscriptions, processes the samples already received and delivers queued
     * messages, each within the drain timeout. Releases the ratchet store afterwards.
     */
    public void stop(Duration drainTimeout) {
        if (stopped) {
            return;
        }
        stopped = true;
        logger.info("Stopping bridge");
        subscriptions.stop();

        try {
            long deadline = System.currentTimeMillis() + drainTimeout.toMillis();
            for (ChannelPipeline pipeline : pipelines.values()) {
                long remaining = Math.max(0, deadline - System.currentTimeMillis());
                if (!pipeline.awaitIdle(remaining)) {
                    logger.warn("Channel {} still had samples pending at shutdown", pipeline.getDevice());
                }
            }
            workers.shutdown();
            if (!workers.awaitTermination(Math.max(0, deadline - System.currentTimeMillis()), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }

        publisher.stop(drainTimeout);
        if (store != null) {
            store.close();
        }
        for (ChannelPipeline pipeline : pipelines.values()) {
            logger.info("Channel {}: {} published, {} dropped, {} decode errors, {} crypto errors, {} persistence errors",
                    pipeline.getDevice(), pipeline.getPublishedCount(), pipeline.getDroppedCount(),
                    pipeline.getDecodeErrorCount(), pipeline.getCryptoErrorCount(), pipeline.getPersistErrorCount());
        }
        finished.countDown();
    }

    /**
     * Blocks until the bridge is stopped or every channel has failed.
     */
    public void awaitFinished() throws InterruptedException {
        finished.await();
    }

    public boolean allChannelsFailed() {
        return pipelines.values().stream().allMatch(p -> p.getState() == ChannelState.FAILED);
    }

    @Override
    public void onStreaming(String deviceId) {
        ChannelPipeline pipeline = pipelines.get(deviceId);
        if (pipeline != null) {
            pipeline.transition(ChannelState.STREAMING);
        }
    }

    @Override
    public void onValueChange(ValueChange change) {
        ChannelPipeline pipeline = pipelines.get(change.getDeviceId());
        if (pipeline == null) {
            logger.warn("Value change for unknown channel {}", change.getDeviceId());
            return;
        }
        try {
            pipeline.submit(change);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void onStatus(StatusUpdate update) {
        ChannelPipeline pipeline = pipelines.get(update.getDeviceId());
        if (pipeline == null) {
            logger.warn("Status update for unknown channel {}", update.getDeviceId());
            return;
        }
        try {
            pipeline.submitStatus(update);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void onInterrupted(String deviceId, String reason) {
        ChannelPipeline pipeline = pipelines.get(deviceId);
        if (pipeline != null && pipeline.transition(ChannelState.RECONNECTING)) {
            logger.warn("Channel {} interrupted: {}", deviceId, reason);
        }
    }

    @Override
    public void onFatal(String deviceId, ConnectionException error) {
        ChannelPipeline pipeline = pipelines.get(deviceId);
        if (pipeline == null) {
            return;
        }
        logger.error("Channel {} failed: {}", deviceId, error.getMessage());
        pipeline.transition(ChannelState.FAILED);
    }

    private void checkAllFailed() {
        if (!stopped && allChannelsFailed() && finished.getCount() > 0) {
            logger.error("All channels have failed");
            finished.countDown();
        }
    }

    public Collection<ChannelPipeline> getPipelines() {
        return Collections.unmodifiableCollection(pipelines.values());
    }

    public ChannelPipeline getPipeline(String deviceId) {
        return pipelines.get(deviceId);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "bridge-worker-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
