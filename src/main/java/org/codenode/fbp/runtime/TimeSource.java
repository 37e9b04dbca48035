package org.codenode.fbp.runtime;

/**
 * Clock used by node runtimes for timed generators and speed attenuation.
 * Replaceable so that flows can run against a manually advanced clock.
 */
public interface TimeSource {

    /**
     * @return The current time in nanoseconds. Only differences between values are meaningful.
     */
    long nanoTime();

    /**
     * Blocks until {@link #nanoTime()} reaches {@code deadlineNanos}. Returns immediately if it already has.
     *
     * @throws InterruptedException if the waiting thread is interrupted.
     */
    void sleepUntil(long deadlineNanos) throws InterruptedException;

    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }
}
