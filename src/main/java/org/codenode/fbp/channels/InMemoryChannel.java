package org.codenode.fbp.channels;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.codenode.fbp.api.channels.ChannelClosedException;
import org.codenode.fbp.api.channels.IChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A thread-safe, in-memory, closable channel connecting exactly one producer to one consumer.
 * <p>
 * Three buffering modes are supported, selected by the capacity:
 * <ul>
 *   <li><b>0 (rendezvous)</b>: {@link #send(Object)} returns only after a receiver has taken the value.</li>
 *   <li><b>&gt; 0 (bounded)</b>: up to {@code capacity} values are buffered, further sends block. This is
 *       the backpressure mechanism between nodes.</li>
 *   <li><b>-1 (unbounded)</b>: sends never block.</li>
 * </ul>
 * After {@link #close()} no value can be sent, but values already buffered are still delivered. Once the
 * buffer is drained every receive fails with {@link ChannelClosedException}.
 *
 * @param <T> The type of the values carried by the channel.
 */
public class InMemoryChannel<T> implements IChannel<T> {

    public static final int RENDEZVOUS = 0;
    public static final int UNLIMITED = -1;

    private static final Logger log = LoggerFactory.getLogger(InMemoryChannel.class);

    private final String name;
    private final int capacity;
    private final ArrayDeque<T> buffer = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final Condition delivered = lock.newCondition();

    // Guarded by lock. Used to tell a rendezvous sender when its value was taken.
    private long enqueued;
    private long dequeued;
    private boolean closed;

    /**
     * @param name     Name used in log and error messages.
     * @param capacity {@link #RENDEZVOUS}, a positive buffer size, or {@link #UNLIMITED}.
     * @throws IllegalArgumentException if the capacity is below {@code -1}.
     */
    public InMemoryChannel(String name, int capacity) {
        if (capacity < UNLIMITED) {
            throw new IllegalArgumentException("Capacity must be -1, 0 or positive for channel '" + name + "', got " + capacity);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
    }

    /**
     * Creates a channel from a configuration block with an optional {@code capacity} key.
     *
     * @param name    Name of the channel.
     * @param options Channel options. Missing keys fall back to the defaults.
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    public static <T> InMemoryChannel<T> fromConfig(String name, Config options) {
        Config defaults = ConfigFactory.parseMap(Map.of("capacity", 64));
        try {
            return new InMemoryChannel<>(name, options.withFallback(defaults).getInt("capacity"));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for InMemoryChannel '" + name + "'", e);
        }
    }

    @Override
    public void send(T value) throws InterruptedException {
        put(value, -1L);
    }

    @Override
    public boolean offer(T value, long timeout, TimeUnit unit) throws InterruptedException {
        return put(value, Math.max(0L, unit.toNanos(timeout)));
    }

    private boolean put(T value, long timeoutNanos) throws InterruptedException {
        Objects.requireNonNull(value, "Channel '" + name + "' does not accept null values");
        boolean timed = timeoutNanos >= 0;
        long nanos = timeoutNanos;
        lock.lockInterruptibly();
        try {
            ensureOpenForSend();
            while (isFull()) {
                if (!timed) {
                    notFull.await();
                } else {
                    if (nanos <= 0L) {
                        return false;
                    }
                    nanos = notFull.awaitNanos(nanos);
                }
                ensureOpenForSend();
            }
            buffer.addLast(value);
            long ticket = ++enqueued;
            notEmpty.signal();
            if (capacity != RENDEZVOUS) {
                return true;
            }
            try {
                while (dequeued < ticket) {
                    if (!timed) {
                        delivered.await();
                    } else {
                        if (nanos <= 0L) {
                            withdrawLast();
                            return false;
                        }
                        nanos = delivered.awaitNanos(nanos);
                    }
                }
            } catch (InterruptedException e) {
                if (dequeued < ticket) {
                    withdrawLast();
                }
                throw e;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty()) {
                if (closed) {
                    throw new ChannelClosedException("Channel '" + name + "' is closed");
                }
                notEmpty.await();
            }
            return takeFirst();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty()) {
                if (closed) {
                    throw new ChannelClosedException("Channel '" + name + "' is closed");
                }
                if (nanos <= 0L) {
                    return Optional.empty();
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return Optional.of(takeFirst());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean close() {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
            delivered.signalAll();
        } finally {
            lock.unlock();
        }
        log.debug("Channel '{}' closed", name);
        return true;
    }

    @Override
    public boolean isClosedForSend() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosedForReceive() {
        lock.lock();
        try {
            return closed && buffer.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getCapacity() {
        return capacity;
    }

    public String getName() {
        return name;
    }

    private boolean isFull() {
        if (capacity == UNLIMITED) {
            return false;
        }
        if (capacity == RENDEZVOUS) {
            return !buffer.isEmpty();
        }
        return buffer.size() >= capacity;
    }

    private void ensureOpenForSend() {
        if (closed) {
            throw new ChannelClosedException("Channel '" + name + "' is closed for sending");
        }
    }

    private T takeFirst() {
        T value = buffer.pollFirst();
        dequeued++;
        notFull.signal();
        delivered.signalAll();
        return value;
    }

    // Rendezvous only: the buffer holds at most the caller's own value.
    private void withdrawLast() {
        buffer.pollLast();
        enqueued--;
        notFull.signal();
    }

    @Override
    public String toString() {
        return "InMemoryChannel[" + name + ", capacity=" + capacity + "]";
    }
}
