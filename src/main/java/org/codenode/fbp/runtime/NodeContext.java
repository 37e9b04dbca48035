package org.codenode.fbp.runtime;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Per-run context handed to generator functions.
 * <p>
 * {@link #sleep(Duration)} advances a schedule cursor instead of sleeping relative to "now", so a
 * generator that sleeps 100ms per value produces one value per 100ms regardless of how long emitting
 * took. After a pause the cursor is moved to the current time so that no burst of overdue values follows.
 * <p>
 * A context is created for each start and used only by the runtime's task thread.
 */
public final class NodeContext {

    private final String nodeId;
    private final TimeSource timeSource;
    private final BooleanSupplier active;
    private final long startedAt;
    private long cursor;

    NodeContext(String nodeId, TimeSource timeSource, BooleanSupplier active) {
        this.nodeId = nodeId;
        this.timeSource = timeSource;
        this.active = active;
        this.startedAt = timeSource.nanoTime();
        this.cursor = startedAt;
    }

    public String getNodeId() {
        return nodeId;
    }

    /**
     * Sleeps until {@code period} after the previous scheduled wake-up (or the start).
     *
     * @throws InterruptedException if the runtime is stopped while sleeping.
     */
    public void sleep(Duration period) throws InterruptedException {
        cursor += period.toNanos();
        timeSource.sleepUntil(cursor);
    }

    /**
     * Sleeps for {@code duration} from now, independent of the schedule cursor.
     *
     * @throws InterruptedException if the runtime is stopped while sleeping.
     */
    public void delay(Duration duration) throws InterruptedException {
        long deadline = timeSource.nanoTime() + duration.toNanos();
        timeSource.sleepUntil(deadline);
        cursor = Math.max(cursor, deadline);
    }

    /**
     * @return Time since the runtime started, measured by the runtime's {@link TimeSource}.
     */
    public Duration elapsed() {
        return Duration.ofNanos(timeSource.nanoTime() - startedAt);
    }

    /**
     * @return {@code false} once the runtime has been stopped.
     */
    public boolean isActive() {
        return active.getAsBoolean();
    }

    void resync() {
        cursor = Math.max(cursor, timeSource.nanoTime());
    }
}
