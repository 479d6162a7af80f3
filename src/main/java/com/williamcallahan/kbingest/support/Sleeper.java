package com.williamcallahan.kbingest.support;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocking pause used by throttling and retry backoff.
 */
@FunctionalInterface
public interface Sleeper {

    /** Sleeps on the calling thread. */
    Sleeper SYSTEM = duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());

    /**
     * Blocks the calling thread for the given duration.
     *
     * @param duration time to wait; non-positive durations return immediately
     * @throws InterruptedException when the thread is interrupted while waiting
     */
    void sleep(Duration duration) throws InterruptedException;
}
