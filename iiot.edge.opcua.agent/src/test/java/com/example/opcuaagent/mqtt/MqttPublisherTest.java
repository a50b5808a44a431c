package com.example.opcuaagent.mqtt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.opcuaagent.exceptions.ConnectionException;
import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.util.Backoff;

public class MqttPublisherTest {

    private FakeMqttTransport transport;
    private MqttPublisher publisher;

    @BeforeEach
    public void setUp() {
        transport = new FakeMqttTransport();
    }

    @AfterEach
    public void tearDown() {
        if (publisher != null) {
            publisher.stop(Duration.ofSeconds(1));
        }
    }

    private MqttPublisher publisher(int capacity, BackpressurePolicy policy) {
        publisher = new MqttPublisher(transport, capacity, policy,
                new Backoff(Duration.ofMillis(1), Duration.ofMillis(5), Duration.ZERO));
        return publisher;
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void deliversInEnqueueOrder() throws Exception {
        publisher(1000, BackpressurePolicy.BLOCK).start(1);
        for (int i = 0; i < 200; i++) {
            assertTrue(publisher.publish("telemetry/pump-1", bytes(Integer.toString(i)), 1));
        }
        assertTrue(transport.awaitSent(200, 5000));

        List<String> texts = transport.getSent().stream().map(FakeMqttTransport.Sent::text).collect(Collectors.toList());
        for (int i = 0; i < 200; i++) {
            assertEquals(Integer.toString(i), texts.get(i));
        }
        assertEquals(200, publisher.getDeliveredCount());
    }

    @Test
    public void retriesQos1MessageAfterReconnect() throws Exception {
        publisher(10, BackpressurePolicy.BLOCK).start(1);
        transport.failConnects(2);
        transport.failPublishes(1);

        publisher.publish("telemetry/pump-1", bytes("kept"), 1);
        publisher.publish("telemetry/pump-1", bytes("next"), 1);
        assertTrue(transport.awaitSent(2, 5000));

        List<FakeMqttTransport.Sent> sent = transport.getSent();
        assertEquals("kept", sent.get(0).text());
        assertEquals("next", sent.get(1).text());
        assertEquals(4, transport.getConnectCount());
    }

    @Test
    public void dropsQos0MessageWhoseSendFailed() throws Exception {
        publisher(10, BackpressurePolicy.BLOCK).start(1);
        transport.failPublishes(1);

        publisher.publish("telemetry/valve-2", bytes("lost"), 0);
        publisher.publish("telemetry/valve-2", bytes("after"), 0);
        assertTrue(transport.awaitSent(1, 5000));

        assertEquals("after", transport.getSent().get(0).text());
        assertEquals(1, publisher.getDroppedCount());
    }

    @Test
    public void dropPolicyRejectsWhenFull() throws Exception {
        publisher(1, BackpressurePolicy.DROP).start(1);
        CountDownLatch gate = transport.holdPublishes();

        assertTrue(publisher.publish("t", bytes("in flight"), 1));
        assertTrue(transport.awaitPublishEntered(5000));
        assertTrue(publisher.publish("t", bytes("queued"), 1));
        assertFalse(publisher.publish("t", bytes("dropped"), 1));
        assertEquals(1, publisher.getDroppedCount());

        gate.countDown();
        assertTrue(transport.awaitSent(2, 5000));
        assertEquals("queued", transport.getSent().get(1).text());
    }

    @Test
    public void blockPolicyWaitsForCapacity() throws Exception {
        publisher(1, BackpressurePolicy.BLOCK).start(1);
        CountDownLatch gate = transport.holdPublishes();
        publisher.publish("t", bytes("in flight"), 1);
        assertTrue(transport.awaitPublishEntered(5000));
        publisher.publish("t", bytes("queued"), 1);

        Thread producer = new Thread(() -> {
            try {
                publisher.publish("t", bytes("waiting"), 1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();
        producer.join(200);
        assertTrue(producer.isAlive());

        gate.countDown();
        producer.join(5000);
        assertFalse(producer.isAlive());
        assertTrue(transport.awaitSent(3, 5000));
        assertEquals(0, publisher.getDroppedCount());
    }

    @Test
    public void outageInMidStreamBlocksProducersAndLosesNothing() throws Exception {
        publisher(4, BackpressurePolicy.BLOCK).start(1);
        CountDownLatch gate = transport.holdPublishes();
        transport.failPublishes(1);
        transport.failConnects(20);

        Thread[] producers = new Thread[2];
        for (int p = 0; p < producers.length; p++) {
            String topic = "telemetry/pump-" + p;
            producers[p] = new Thread(() -> {
                try {
                    for (int i = 0; i < 100; i++) {
                        publisher.publish(topic, bytes(Integer.toString(i)), 1);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            producers[p].start();
        }

        assertTrue(transport.awaitPublishEntered(5000));
        Thread.sleep(200);
        for (Thread producer : producers) {
            assertTrue(producer.isAlive());
        }
        assertEquals(4, publisher.getQueueSize());

        gate.countDown();
        for (Thread producer : producers) {
            producer.join(10000);
            assertFalse(producer.isAlive());
        }
        assertTrue(transport.awaitSent(200, 10000));

        List<FakeMqttTransport.Sent> sent = transport.getSent();
        assertEquals(200, sent.size());
        for (int p = 0; p < producers.length; p++) {
            String topic = "telemetry/pump-" + p;
            List<String> texts = sent.stream().filter(m -> m.topic.equals(topic))
                    .map(FakeMqttTransport.Sent::text).collect(Collectors.toList());
            assertEquals(100, texts.size());
            for (int i = 0; i < 100; i++) {
                assertEquals(Integer.toString(i), texts.get(i));
            }
        }
        assertEquals(0, publisher.getDroppedCount());
        assertEquals(200, publisher.getDeliveredCount());
        assertEquals(22, transport.getConnectCount());
    }

    @Test
    public void stopReleasesBlockedProducer() throws Exception {
        publisher(1, BackpressurePolicy.BLOCK).start(1);
        CountDownLatch gate = transport.holdPublishes();
        publisher.publish("t", bytes("in flight"), 1);
        assertTrue(transport.awaitPublishEntered(5000));
        publisher.publish("t", bytes("queued"), 1);

        AtomicReference<Exception> failure = new AtomicReference<>();
        Thread producer = new Thread(() -> {
            try {
                publisher.publish("t", bytes("waiting"), 1);
            } catch (InterruptedException | IllegalStateException e) {
                failure.set(e);
            }
        });
        producer.start();
        producer.join(200);
        assertTrue(producer.isAlive());

        publisher.stop(Duration.ofMillis(100));
        producer.join(2000);
        assertFalse(producer.isAlive());
        assertTrue(failure.get() instanceof IllegalStateException);
        gate.countDown();
    }

    @Test
    public void rejectedClientFailsStartImmediately() {
        transport.setFatalConnect(true);
        ConnectionException e = assertThrows(ConnectionException.class,
                () -> publisher(10, BackpressurePolicy.BLOCK).start(5));
        assertTrue(e.isFatal());
        assertEquals(1, transport.getConnectCount());
        assertFalse(publisher.isRunning());
    }

    @Test
    public void unreachableBrokerFailsAfterMaxAttempts() {
        transport.failConnects(10);
        ConnectionException e = assertThrows(ConnectionException.class,
                () -> publisher(10, BackpressurePolicy.BLOCK).start(3));
        assertTrue(e.isFatal());
        assertEquals(ExceptionContext.MQTT_CONNECT, e.getContext());
        assertEquals(3, transport.getConnectCount());
    }

    @Test
    public void connectsAfterTransientFailures() throws Exception {
        transport.failConnects(2);
        publisher(10, BackpressurePolicy.BLOCK).start(3);
        assertTrue(publisher.isRunning());
        assertEquals(3, transport.getConnectCount());
    }

    @Test
    public void publishBeforeStartIsRejected() {
        assertThrows(IllegalStateException.class,
                () -> publisher(10, BackpressurePolicy.BLOCK).publish("t", bytes("x"), 0));
    }

    @Test
    public void stopDeliversQueuedMessagesAndDisconnects() throws Exception {
        publisher(100, BackpressurePolicy.BLOCK).start(1);
        for (int i = 0; i < 20; i++) {
            publisher.publish("t", bytes("m" + i), 1);
        }
        publisher.stop(Duration.ofSeconds(5));

        assertEquals(20, transport.getSent().size());
        assertFalse(transport.isConnected());
        assertThrows(IllegalStateException.class, () -> publisher.publish("t", bytes("late"), 1));
    }
}
