package org.codenode.fbp.runtime;

import java.util.concurrent.TimeUnit;

/**
 * {@link TimeSource} backed by {@link System#nanoTime()}.
 */
final class SystemTimeSource implements TimeSource {

    static final SystemTimeSource INSTANCE = new SystemTimeSource();

    private SystemTimeSource() {
    }

    @Override
    public long nanoTime() {
        return System.nanoTime();
    }

    @Override
    public void sleepUntil(long deadlineNanos) throws InterruptedException {
        long remaining = deadlineNanos - System.nanoTime();
        while (remaining > 0) {
            TimeUnit.NANOSECONDS.sleep(remaining);
            remaining = deadlineNanos - System.nanoTime();
        }
    }
}
