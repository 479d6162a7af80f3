package com.williamcallahan.kbingest.service;

import com.williamcallahan.kbingest.support.Sleeper;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide throttle enforcing a minimum spacing between calls and a sliding one-minute quota.
 *
 * <p>One instance is shared by every remote call in a run. {@link #acquire()} blocks until the call is
 * permitted and never rejects.</p>
 */
public class RequestRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RequestRateLimiter.class);

    private static final long WINDOW_NANOS = Duration.ofSeconds(60).toNanos();

    private final long minSpacingNanos;
    private final int requestsPerMinute;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;

    private final Deque<Long> recentCalls = new ArrayDeque<>();
    private long lastCallNanos;
    private boolean hasLastCall;

    public RequestRateLimiter(int requestsPerSecond, int requestsPerMinute) {
        this(requestsPerSecond, requestsPerMinute, System::nanoTime, Sleeper.SYSTEM);
    }

    public RequestRateLimiter(int requestsPerSecond, int requestsPerMinute, LongSupplier nanoClock, Sleeper sleeper) {
        if (requestsPerSecond <= 0) {
            throw new IllegalArgumentException("requestsPerSecond must be positive");
        }
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be positive");
        }
        this.minSpacingNanos = Duration.ofSeconds(1).toNanos() / requestsPerSecond;
        this.requestsPerMinute = requestsPerMinute;
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Blocks until a call is permitted under both limits, then records it.
     *
     * @throws IllegalStateException when interrupted while waiting
     */
    public synchronized void acquire() {
        if (hasLastCall) {
            long sinceLast = nanoClock.getAsLong() - lastCallNanos;
            if (sinceLast < minSpacingNanos) {
                pause(minSpacingNanos - sinceLast);
            }
        }

        pruneWindow(nanoClock.getAsLong());
        while (recentCalls.size() >= requestsPerMinute) {
            long untilOldestExpires = WINDOW_NANOS - (nanoClock.getAsLong() - recentCalls.peekFirst());
            log.info("[RATE-LIMIT] Per-minute quota of {} reached; waiting {}ms",
                    requestsPerMinute, Duration.ofNanos(Math.max(0L, untilOldestExpires)).toMillis());
            pause(untilOldestExpires);
            pruneWindow(nanoClock.getAsLong());
        }

        long now = nanoClock.getAsLong();
        lastCallNanos = now;
        hasLastCall = true;
        recentCalls.addLast(now);
    }

    /**
     * Returns how many permitted calls fall inside the current one-minute window.
     */
    public synchronized int callsInWindow() {
        pruneWindow(nanoClock.getAsLong());
        return recentCalls.size();
    }

    private void pruneWindow(long now) {
        while (!recentCalls.isEmpty() && now - recentCalls.peekFirst() >= WINDOW_NANOS) {
            recentCalls.pollFirst();
        }
    }

    private void pause(long nanos) {
        if (nanos <= 0) {
            return;
        }
        try {
            sleeper.sleep(Duration.ofNanos(nanos));
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Rate limiter wait interrupted", interruptedException);
        }
    }
}
