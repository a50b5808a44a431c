package com.example.opcuaagent.bridge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class SerialExecutorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    public void tearDown() {
        pool.shutdownNow();
    }

    @Test
    public void runsTasksInOrderOneAtATime() throws Exception {
        SerialExecutor executor = new SerialExecutor(pool, 1000);
        List<Integer> order = new ArrayList<>();
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();

        for (int i = 0; i < 500; i++) {
            int n = i;
            executor.submit(() -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                synchronized (order) {
                    order.add(n);
                }
                running.decrementAndGet();
            });
        }
        assertTrue(executor.awaitIdle(5000));

        assertEquals(500, order.size());
        for (int i = 0; i < 500; i++) {
            assertEquals(i, order.get(i));
        }
        assertEquals(1, maxRunning.get());
    }

    @Test
    public void failingTaskDoesNotStopTheQueue() throws Exception {
        SerialExecutor executor = new SerialExecutor(pool, 10);
        AtomicInteger ran = new AtomicInteger();
        executor.submit(() -> {
            throw new IllegalStateException("boom");
        });
        executor.submit(ran::incrementAndGet);
        assertTrue(executor.awaitIdle(5000));
        assertEquals(1, ran.get());
    }

    @Test
    public void submitBlocksWhileBacklogIsFull() throws Exception {
        List<Runnable> handedOver = new ArrayList<>();
        SerialExecutor executor = new SerialExecutor(handedOver::add, 2);
        AtomicInteger ran = new AtomicInteger();

        executor.submit(ran::incrementAndGet);
        executor.submit(ran::incrementAndGet);
        assertEquals(2, executor.getBacklog());
        assertEquals(1, handedOver.size());

        Thread producer = new Thread(() -> {
            try {
                executor.submit(ran::incrementAndGet);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();
        producer.join(200);
        assertTrue(producer.isAlive());
        assertFalse(executor.awaitIdle(50));

        handedOver.get(0).run();
        producer.join(5000);
        assertFalse(producer.isAlive());

        // the third task was queued while the batch was running and is picked up by it or by a new batch
        while (ran.get() < 3) {
            handedOver.get(handedOver.size() - 1).run();
        }
        assertTrue(executor.awaitIdle(1000));
        assertEquals(3, ran.get());
    }

    @Test
    public void errorInTaskDoesNotLeaveExecutorScheduled() throws Exception {
        SerialExecutor executor = new SerialExecutor(Runnable::run, 10);
        AtomicInteger ran = new AtomicInteger();

        assertThrows(AssertionError.class, () -> executor.submit(() -> {
            throw new AssertionError("out of memory");
        }));
        assertTrue(executor.awaitIdle(100));

        executor.submit(ran::incrementAndGet);
        assertEquals(1, ran.get());
        assertTrue(executor.awaitIdle(100));
    }

    @Test
    public void tasksSubmittedAfterPoolShutdownAreDiscarded() throws Exception {
        ThreadPoolExecutor workers = new ThreadPoolExecutor(1, 1, 0, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new ThreadPoolExecutor.CallerRunsPolicy());
        workers.shutdown();
        SerialExecutor executor = new SerialExecutor(workers, 10);
        AtomicInteger ran = new AtomicInteger();

        executor.submit(ran::incrementAndGet);
        assertTrue(executor.awaitIdle(100));
        assertEquals(0, executor.getBacklog());
        assertEquals(0, ran.get());
    }

    @Test
    public void rejectedHandOverDoesNotLeaveExecutorScheduled() throws Exception {
        SerialExecutor executor = new SerialExecutor(task -> {
            throw new RejectedExecutionException("saturated");
        }, 10);

        executor.submit(() -> { });
        executor.submit(() -> { });
        assertTrue(executor.awaitIdle(100));
        assertEquals(0, executor.getBacklog());
    }
}
