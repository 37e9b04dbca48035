package org.codenode.fbp.testutils;

import org.codenode.fbp.runtime.TimeSource;

import java.time.Duration;

/**
 * A virtual clock for tests. Time only moves on {@link #advanceBy(Duration)}, which wakes every thread
 * whose deadline has been reached.
 */
public class ManualTimeSource implements TimeSource {

    private long now;
    private int sleepers;

    @Override
    public synchronized long nanoTime() {
        return now;
    }

    @Override
    public synchronized void sleepUntil(long deadlineNanos) throws InterruptedException {
        sleepers++;
        notifyAll();
        try {
            while (now < deadlineNanos) {
                wait();
            }
        } finally {
            sleepers--;
        }
    }

    public synchronized void advanceBy(Duration duration) {
        now += duration.toNanos();
        notifyAll();
    }

    /**
     * @return Number of threads currently blocked in {@link #sleepUntil(long)}.
     */
    public synchronized int getSleepers() {
        return sleepers;
    }
}
