package com.example.opcuaagent.bridge;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs tasks one at a time, in submission order, on a shared executor. At most one task of
 * this executor is handed to the shared executor at any time, so a busy channel cannot
 * occupy more than one worker. The backlog is bounded; {@link #submit} blocks while it is full.
 * Tasks that can no longer be handed over because the shared executor is shut down are discarded.
 */
final class SerialExecutor {

    /** Tasks run per turn on a worker before yielding it to other channels. */
    private static final int BATCH = 64;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final Executor executor;
    private final int capacity;
    private final Deque<Runnable> tasks = new ArrayDeque<>();

    // Guarded by this
    private boolean scheduled;

    SerialExecutor(Executor executor, int capacity) {
        this.executor = executor;
        this.capacity = capacity;
    }

    /**
     * @throws InterruptedException if interrupted while the backlog is full
     */
    void submit(Runnable task) throws InterruptedException {
        synchronized (this) {
            while (tasks.size() >= capacity) {
                wait();
            }
            tasks.add(task);
            if (scheduled) {
                return;
            }
            scheduled = true;
        }
        dispatch();
    }

    private void runBatch() {
        boolean drained = false;
        try {
            drained = runTasks();
        } finally {
            // also reached when a task throws an Error
            if (!drained) {
                dispatch();
            }
        }
    }

    /**
     * @return true if the backlog was drained and the executor is no longer scheduled
     */
    private boolean runTasks() {
        for (int i = 0; i < BATCH; i++) {
            Runnable task;
            synchronized (this) {
                task = tasks.poll();
                if (task == null) {
                    scheduled = false;
                    notifyAll();
                    return true;
                }
                notifyAll();
            }
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("Unexpected failure of a channel task", e);
            }
        }
        return false;
    }

    private void dispatch() {
        if (executor instanceof ExecutorService && ((ExecutorService) executor).isShutdown()) {
            discardBacklog();
            return;
        }
        try {
            executor.execute(this::runBatch);
        } catch (RejectedExecutionException e) {
            discardBacklog();
        }
    }

    private void discardBacklog() {
        int discarded;
        synchronized (this) {
            discarded = tasks.size();
            tasks.clear();
            scheduled = false;
            notifyAll();
        }
        logger.warn("Worker pool is shut down, discarding {} channel tasks", discarded);
    }

    /**
     * Waits until every submitted task has run.
     *
     * @return false if tasks were still pending when the timeout elapsed
     */
    synchronized boolean awaitIdle(long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (scheduled || !tasks.isEmpty()) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return false;
            }
            wait(remaining);
        }
        return true;
    }

    synchronized int getBacklog() {
        return tasks.size();
    }
}
