package com.example.opcuaagent.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential reconnect backoff with random jitter.
 * <p>
 * The n-th delay is {@code initial * 2^(n-1)} plus a random jitter of up to {@code maxJitter},
 * never more than {@code max}. The jitter spreads out reconnects of many agents after a
 * shared outage.
 */
public class Backoff {

    private final long initialMillis;
    private final long maxMillis;
    private final long maxJitterMillis;

    private int attempt;

    public Backoff(Duration initial, Duration max, Duration maxJitter) {
        if (initial.isNegative() || initial.isZero() || max.compareTo(initial) < 0 || maxJitter.isNegative()) {
            throw new IllegalArgumentException("Invalid backoff " + initial + ".." + max + " jitter " + maxJitter);
        }
        this.initialMillis = initial.toMillis();
        this.maxMillis = max.toMillis();
        this.maxJitterMillis = maxJitter.toMillis();
    }

    /**
     * 2s, 4s, 8s, ... capped at {@code max}, with up to 4s jitter.
     */
    public static Backoff withMax(Duration max) {
        return new Backoff(Duration.ofSeconds(2), max.compareTo(Duration.ofSeconds(2)) < 0 ? Duration.ofSeconds(2) : max,
                Duration.ofSeconds(4));
    }

    /**
     * @return the delay before the next attempt
     */
    public synchronized Duration nextDelay() {
        attempt++;
        int shift = Math.min(attempt - 1, 30);
        long base = initialMillis << shift;
        if (base <= 0 || base > maxMillis) {
            base = maxMillis;
        }
        long jitter = maxJitterMillis == 0 ? 0 : ThreadLocalRandom.current().nextLong(maxJitterMillis + 1);
        return Duration.ofMillis(Math.min(maxMillis, base + jitter));
    }

    /** Called after a successful connect. */
    public synchronized void reset() {
        attempt = 0;
    }

    public synchronized int getAttempt() {
        return attempt;
    }
}
