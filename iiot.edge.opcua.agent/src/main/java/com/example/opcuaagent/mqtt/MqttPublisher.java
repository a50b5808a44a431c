package com.example.opcuaagent.mqtt;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.opcuaagent.exceptions.ConnectionException;
import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.util.Backoff;

/**
 * Queues messages for the broker and delivers them from a single thread.
 * <p>
 * {@link #publish} only enqueues. The delivery thread sends messages one at a time in enqueue
 * order, so messages of the same topic are never reordered. While the broker is unreachable
 * the thread reconnects with backoff and the queue fills up; once it is full, {@link #publish}
 * blocks or drops depending on the {@link BackpressurePolicy}. A message whose send failed is
 * sent again after reconnect for QoS 1 and 2, and dropped for QoS 0.
 */
public class MqttPublisher implements AutoCloseable {

    private static final long IDLE_POLL_MILLIS = 500;
    private static final long ENQUEUE_POLL_MILLIS = 100;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final MqttTransport transport;
    private final BlockingQueue<OutgoingMessage> queue;
    private final BackpressurePolicy policy;
    private final Backoff backoff;

    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    private volatile boolean running;
    private Thread deliveryThread;

    /**
     * @param transport broker connection
     * @param capacity  maximum number of queued messages
     * @param policy    what {@link #publish} does on a full queue
     * @param backoff   delays between connect attempts
     */
    public MqttPublisher(MqttTransport transport, int capacity, BackpressurePolicy policy, Backoff backoff) {
        this.transport = transport;
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.policy = policy;
        this.backoff = backoff;
    }

    /**
     * Connects and starts the delivery thread.
     *
     * @param maxConnectAttempts connect attempts before giving up
     * @throws ConnectionException  (fatal) if the broker rejects the client or stays unreachable
     * @throws InterruptedException if interrupted while waiting between attempts
     */
    public synchronized void start(int maxConnectAttempts) throws ConnectionException, InterruptedException {
        if (running) {
            return;
        }

        ConnectionException last = null;
        for (int attempt = 1; attempt <= maxConnectAttempts; attempt++) {
            try {
                transport.connect();
                last = null;
                break;
            } catch (ConnectionException e) {
                if (e.isFatal()) {
                    throw e;
                }
                last = e;
                if (attempt < maxConnectAttempts) {
                    Duration delay = backoff.nextDelay();
                    logger.warn("MQTT connect attempt {}/{} failed: {}. Retrying in {} ms",
                            attempt, maxConnectAttempts, rootMessage(e), delay.toMillis());
                    Thread.sleep(delay.toMillis());
                }
            }
        }
        if (last != null) {
            throw new ConnectionException(ExceptionContext.MQTT_CONNECT,
                    "Broker unreachable after " + maxConnectAttempts + " attempts.", true);
        }
        backoff.reset();

        running = true;
        deliveryThread = new Thread(this::deliveryLoop, "mqtt-delivery");
        deliveryThread.setDaemon(true);
        deliveryThread.start();
        logger.info("MQTT publisher started");
    }

    /**
     * Enqueues a message for delivery.
     *
     * @return false if the message was dropped because the queue is full ({@link BackpressurePolicy#DROP})
     * @throws InterruptedException if interrupted while waiting for capacity ({@link BackpressurePolicy#BLOCK})
     * @throws IllegalStateException if the publisher is not running, or is stopped while waiting
     */
    public boolean publish(String topic, byte[] payload, int qos) throws InterruptedException {
        if (!running) {
            throw new IllegalStateException("MQTT publisher is not running");
        }
        OutgoingMessage message = new OutgoingMessage(topic, payload, qos);

        if (policy == BackpressurePolicy.DROP) {
            if (!queue.offer(message)) {
                long count = dropped.incrementAndGet();
                logger.warn("{} Dropped message for {} ({} dropped so far)",
                        ExceptionContext.MQTT_QUEUE_FULL.getMessage(), topic, count);
                return false;
            }
            return true;
        }

        if (queue.offer(message)) {
            return true;
        }
        logger.debug("Delivery queue full, waiting to enqueue for {}", topic);
        while (!queue.offer(message, ENQUEUE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
            if (!running) {
                throw new IllegalStateException("MQTT publisher stopped while waiting to enqueue for " + topic);
            }
        }
        return true;
    }

    private void deliveryLoop() {
        try {
            while (running || !queue.isEmpty()) {
                OutgoingMessage message = queue.poll(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (message == null) {
                    if (running && !transport.isConnected()) {
                        reconnect();
                    }
                    continue;
                }
                if (!deliver(message)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (!queue.isEmpty()) {
            logger.warn("MQTT publisher stopped with {} undelivered messages", queue.size());
        }
        logger.info("MQTT delivery thread finished ({} delivered, {} dropped)", delivered.get(), dropped.get());
    }

    /**
     * Sends one message, reconnecting as often as needed.
     *
     * @return false if the publisher was stopped before the message could be sent
     */
    private boolean deliver(OutgoingMessage message) throws InterruptedException {
        while (true) {
            if (!transport.isConnected() && !reconnect()) {
                return false;
            }
            try {
                transport.publish(message.topic, message.payload, message.qos);
                delivered.incrementAndGet();
                logger.trace("Delivered message to {}", message.topic);
                return true;
            } catch (ConnectionException e) {
                if (message.qos == 0) {
                    dropped.incrementAndGet();
                    logger.warn("Dropping QoS 0 message for {}: {}", message.topic, rootMessage(e));
                    return true;
                }
                logger.warn("Publishing to {} failed: {}. Retrying after reconnect", message.topic, rootMessage(e));
                if (transport.isConnected()) {
                    Thread.sleep(backoff.nextDelay().toMillis());
                }
            } catch (IllegalArgumentException e) {
                dropped.incrementAndGet();
                logger.error("Dropping message with invalid topic {}: {}", message.topic, e.getMessage());
                return true;
            }
        }
    }

    /**
     * Connects with backoff until connected or stopped.
     *
     * @return true once connected, false if the publisher was stopped
     */
    private boolean reconnect() throws InterruptedException {
        while (running) {
            try {
                transport.connect();
                logger.info("Reconnected to MQTT broker after {} attempts", backoff.getAttempt() + 1);
                backoff.reset();
                return true;
            } catch (ConnectionException e) {
                Duration delay = backoff.nextDelay();
                if (e.isFatal()) {
                    logger.error("MQTT broker rejected the client: {}. Retrying in {} ms", rootMessage(e), delay.toMillis());
                } else {
                    logger.warn("MQTT reconnect failed: {}. Retrying in {} ms", rootMessage(e), delay.toMillis());
                }
                Thread.sleep(delay.toMillis());
            }
        }
        return false;
    }

    /**
     * Stops accepting messages, delivers what is queued within the timeout and disconnects.
     */
    public void stop(Duration drainTimeout) {
        Thread thread;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            thread = deliveryThread;
        }
        try {
            thread.join(drainTimeout.toMillis());
            if (thread.isAlive()) {
                thread.interrupt();
                thread.join(1000);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        transport.disconnect();
        logger.info("MQTT publisher stopped");
    }

    @Override
    public void close() {
        stop(Duration.ofSeconds(5));
    }

    public long getDeliveredCount() {
        return delivered.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public int getQueueSize() {
        return queue.size();
    }

    public boolean isRunning() {
        return running;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root == e ? e.getMessage() : e.getMessage() + " (" + root + ")";
    }

    private static final class OutgoingMessage {
        private final String topic;
        private final byte[] payload;
        private final int qos;

        OutgoingMessage(String topic, byte[] payload, int qos) {
            this.topic = topic;
            this.payload = payload;
            this.qos = qos;
        }
    }
}
