package com.example.opcuaagent.bridge;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.example.opcuaagent.codec.EnvelopeSerializer;
import com.example.opcuaagent.codec.ValueCodec;
import com.example.opcuaagent.config.ChannelSettings;
import com.example.opcuaagent.engine.EncryptionEngine;
import com.example.opcuaagent.exceptions.ConfigException;
import com.example.opcuaagent.exceptions.CryptoException;
import com.example.opcuaagent.exceptions.DecodingException;
import com.example.opcuaagent.exceptions.PersistenceException;
import com.example.opcuaagent.middleware.Address;
import com.example.opcuaagent.middleware.Middleware;
import com.example.opcuaagent.middleware.Route;
import com.example.opcuaagent.model.StatusUpdate;
import com.example.opcuaagent.model.TelemetryEnvelope;
import com.example.opcuaagent.mqtt.MqttPublisher;
import com.example.opcuaagent.mqtt.TopicTemplate;
import com.example.opcuaagent.opcua.ValueChange;

/**
 * Turns the value changes of one device channel into MQTT messages: route, decode, number,
 * protect, publish. Value changes and status updates are processed one at a time in arrival
 * order; a status update carries no sequence number. Updates the middleware drops are discarded
 * before they are numbered.
 * <p>
 * A sample that cannot be decoded is dropped. When the ratchet state cannot be persisted the
 * sample is never published encrypted; with mandatory encryption the channel fails, otherwise
 * it is published in plaintext.
 */
public class ChannelPipeline {

    static final String MDC_DEVICE = "device";

    /** Pending value changes per channel before the notification thread is held back. */
    static final int BACKLOG_CAPACITY = 1000;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final ChannelSettings channel;
    private final TopicTemplate topic;
    private final String application;
    private final ValueCodec codec;
    private final EncryptionEngine engine;
    private final EnvelopeSerializer plaintext;
    private final Middleware middleware;
    private final boolean encryptionMandatory;
    private final MqttPublisher publisher;
    private final SerialExecutor executor;
    private final Runnable onFailed;

    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong decodeErrors = new AtomicLong();
    private final AtomicLong cryptoErrors = new AtomicLong();
    private final AtomicLong persistErrors = new AtomicLong();

    private volatile ChannelState state = ChannelState.STARTING;

    ChannelPipeline(ChannelSettings channel, String application, ValueCodec codec, EncryptionEngine engine,
                    EnvelopeSerializer plaintext, Middleware middleware, boolean encryptionMandatory,
                    MqttPublisher publisher, Executor workers, Runnable onFailed) throws ConfigException {
        this.channel = channel;
        this.topic = TopicTemplate.parse(channel.getTopic());
        this.application = application;
        this.codec = codec;
        this.engine = engine;
        this.plaintext = plaintext;
        this.middleware = middleware;
        this.encryptionMandatory = encryptionMandatory;
        this.publisher = publisher;
        this.executor = new SerialExecutor(workers, BACKLOG_CAPACITY);
        this.onFailed = onFailed;
    }

    /**
     * Queues a value change. Blocks while the channel's backlog is full.
     */
    void submit(ValueChange change) throws InterruptedException {
        if (state == ChannelState.FAILED) {
            dropped.incrementAndGet();
            return;
        }
        executor.submit(() -> process(change));
    }

    /**
     * Queues a status update behind the value changes already queued.
     */
    void submitStatus(StatusUpdate update) throws InterruptedException {
        if (state == ChannelState.FAILED) {
            dropped.incrementAndGet();
            return;
        }
        executor.submit(() -> processStatus(update));
    }

    void process(ValueChange change) {
        if (state == ChannelState.FAILED) {
            dropped.incrementAndGet();
            return;
        }
        Route route = middleware.resolve(Middleware.valueAddress(channel.getConnection(), channel.getDevice(), change.getNode()));
        if (route.isDrop()) {
            logger.trace("Source override drops samples of {}", change.getNode());
            return;
        }
        String feature = route.featureOr(change.getFeature());

        MDC.put(MDC_DEVICE, channel.getDevice());
        try {
            long next = sequence.get() + 1;
            TelemetryEnvelope envelope;
            try {
                envelope = codec.encode(channel.getDevice(), change.getNode(), feature, next, change.getValue());
            } catch (DecodingException e) {
                decodeErrors.incrementAndGet();
                logger.warn("Dropping sample of {} ({}): {}", feature, change.getNode(), e.getMessage());
                return;
            }
            sequence.set(next);
            TelemetryEnvelope routed = route.getExtensions().isEmpty() ? envelope : envelope.withExtensions(route.getExtensions());

            byte[] payload = protect("#" + next, () -> engine.protect(routed), () -> plaintext.toBytes(routed));
            publish(route, feature, payload, "#" + next);
        } finally {
            MDC.remove(MDC_DEVICE);
        }
    }

    void processStatus(StatusUpdate update) {
        if (state == ChannelState.FAILED) {
            dropped.incrementAndGet();
            return;
        }
        Address address = update.getKind() == StatusUpdate.Kind.CONNECTION
                ? Middleware.connectionAddress(channel.getConnection())
                : Middleware.valueAddress(channel.getConnection(), channel.getDevice(), update.getNode());
        Route route = middleware.resolve(address);
        if (route.isDrop()) {
            logger.trace("Source override drops status of {}", address);
            return;
        }
        StatusUpdate routed = update.routed(route.featureOr(update.getFeature()), route.getExtensions());
        String label = routed.getFeature() + " status";

        MDC.put(MDC_DEVICE, channel.getDevice());
        try {
            byte[] payload = protect(label, () -> engine.protect(routed), () -> plaintext.toBytes(routed));
            publish(route, routed.getFeature(), payload, label);
        } finally {
            MDC.remove(MDC_DEVICE);
        }
    }

    private void publish(Route route, String feature, byte[] payload, String label) {
        if (payload == null) {
            dropped.incrementAndGet();
            return;
        }
        String destination = route.topicOr(topic).render(channel.getDevice(), application, feature);
        try {
            if (publisher.publish(destination, payload, channel.getQos())) {
                published.incrementAndGet();
                logger.debug("Queued {} of {} for {}", label, feature, destination);
            } else {
                dropped.incrementAndGet();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IllegalStateException e) {
            dropped.incrementAndGet();
            logger.warn("{} of {} not published: {}", label, feature, e.getMessage());
        }
    }

    @FunctionalInterface
    private interface Protection {
        byte[] apply() throws PersistenceException, CryptoException;
    }

    /**
     * @return the payload to publish, or null if the document must not be published
     */
    private byte[] protect(String label, Protection protection, Supplier<byte[]> unprotected) {
        try {
            return protection.apply();
        } catch (CryptoException e) {
            cryptoErrors.incrementAndGet();
            logger.error("Possible integrity violation, dropping {}: {}", label, e.getMessage(), e);
            return null;
        } catch (PersistenceException e) {
            persistErrors.incrementAndGet();
            if (encryptionMandatory) {
                logger.error("Ratchet state cannot be persisted, stopping the channel: {}", e.getMessage(), e);
                transition(ChannelState.FAILED);
                return null;
            }
            logger.error("Ratchet state cannot be persisted, publishing {} in plaintext: {}", label, e.getMessage(), e);
            return unprotected.get();
        }
    }

    /**
     * Moves the channel to another state. A failed channel stays failed; entering
     * {@link ChannelState#FAILED} runs the failure callback.
     *
     * @return false if the channel has already failed
     */
    boolean transition(ChannelState next) {
        synchronized (this) {
            ChannelState previous = state;
            if (previous == ChannelState.FAILED) {
                return false;
            }
            if (previous == next) {
                return true;
            }
            state = next;
            logger.info("Channel {}: {} -> {}", channel.getDevice(), previous, next);
        }
        if (next == ChannelState.FAILED) {
            onFailed.run();
        }
        return true;
    }

    boolean awaitIdle(long timeoutMillis) throws InterruptedException {
        return executor.awaitIdle(timeoutMillis);
    }

    public String getDevice() {
        return channel.getDevice();
    }

    public ChannelState getState() {
        return state;
    }

    public boolean isEncrypted() {
        return engine.isEncrypting();
    }

    /** @return the sequence number of the last numbered sample */
    public long getSequence() {
        return sequence.get();
    }

    public long getPublishedCount() {
        return published.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getDecodeErrorCount() {
        return decodeErrors.get();
    }

    public long getCryptoErrorCount() {
        return cryptoErrors.get();
    }

    public long getPersistErrorCount() {
        return persistErrors.get();
    }
}
