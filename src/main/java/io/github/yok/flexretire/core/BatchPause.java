package io.github.yok.flexretire.core;

import java.time.Duration;

/**
 * Pause between two batches of the same job, giving concurrent workloads a chance at the locks.
 */
@FunctionalInterface
public interface BatchPause {

    /**
     * Waits for the given duration.
     *
     * @param duration pause length
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void pause(Duration duration) throws InterruptedException;

    /**
     * Returns a pause backed by {@link Thread#sleep(long)}.
     *
     * @return sleeping pause
     */
    static BatchPause sleeping() {
        return duration -> {
            if (duration != null && !duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }

    /**
     * Returns a pause that returns immediately.
     *
     * @return no-op pause
     */
    static BatchPause none() {
        return duration -> {
        };
    }
}
