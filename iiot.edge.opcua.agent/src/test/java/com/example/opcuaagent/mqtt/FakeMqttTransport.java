package com.example.opcuaagent.mqtt;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.example.opcuaagent.exceptions.ConnectionException;
import com.example.opcuaagent.exceptions.ExceptionContext;

/**
 * In-memory broker connection recording what was published.
 */
public class FakeMqttTransport implements MqttTransport {

    public static final class Sent {
        public final String topic;
        public final byte[] payload;
        public final int qos;

        Sent(String topic, byte[] payload, int qos) {
            this.topic = topic;
            this.payload = payload;
            this.qos = qos;
        }

        public String text() {
            return new String(payload, StandardCharsets.UTF_8);
        }
    }

    private final List<Sent> sent = new ArrayList<>();
    private final AtomicInteger connects = new AtomicInteger();
    private final AtomicInteger failingConnects = new AtomicInteger();
    private final AtomicInteger failingPublishes = new AtomicInteger();

    private volatile boolean connected;
    private volatile boolean fatalConnect;
    private volatile CountDownLatch publishGate;
    private final CountDownLatch publishEntered = new CountDownLatch(1);

    @Override
    public void connect() throws ConnectionException {
        connects.incrementAndGet();
        if (fatalConnect) {
            throw new ConnectionException(ExceptionContext.MQTT_CONNECT, "Not authorized.", true);
        }
        if (failingConnects.get() > 0) {
            failingConnects.decrementAndGet();
            throw new ConnectionException(ExceptionContext.MQTT_CONNECT, "Connection refused.", false);
        }
        connected = true;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void publish(String topic, byte[] payload, int qos) throws ConnectionException {
        publishEntered.countDown();
        CountDownLatch gate = publishGate;
        if (gate != null) {
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionException(ExceptionContext.MQTT_PUBLISH, e);
            }
        }
        if (failingPublishes.get() > 0) {
            failingPublishes.decrementAndGet();
            connected = false;
            throw new ConnectionException(ExceptionContext.MQTT_PUBLISH, "Connection lost.", false);
        }
        synchronized (sent) {
            sent.add(new Sent(topic, payload.clone(), qos));
        }
    }

    @Override
    public void disconnect() {
        connected = false;
    }

    public List<Sent> getSent() {
        synchronized (sent) {
            return new ArrayList<>(sent);
        }
    }

    public int getConnectCount() {
        return connects.get();
    }

    public void failConnects(int count) {
        failingConnects.set(count);
    }

    public void failPublishes(int count) {
        failingPublishes.set(count);
    }

    public void setFatalConnect(boolean fatal) {
        fatalConnect = fatal;
    }

    /** Holds every publish call until the returned latch is counted down. */
    public CountDownLatch holdPublishes() {
        CountDownLatch gate = new CountDownLatch(1);
        publishGate = gate;
        return gate;
    }

    public boolean awaitPublishEntered(long millis) throws InterruptedException {
        return publishEntered.await(millis, TimeUnit.MILLISECONDS);
    }

    /** Waits until at least {@code count} messages were published. */
    public boolean awaitSent(int count, long millis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + millis;
        while (System.currentTimeMillis() < deadline) {
            if (getSent().size() >= count) {
                return true;
            }
            Thread.sleep(10);
        }
        return getSent().size() >= count;
    }
}
