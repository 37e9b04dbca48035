package org.codenode.fbp.runtime;

import org.codenode.fbp.api.channels.IReceiveChannel;
import org.codenode.fbp.channels.InMemoryChannel;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * An output channel owned by a runtime, seen from the consumer side.
 * <p>
 * The slot keeps its identity across restarts of the owning runtime while the channel behind it is
 * replaced: the owner closes the channel when its run ends and {@link #renew()} creates a fresh one
 * at the next start. Consumers wired to the slot therefore never have to be rewired.
 *
 * @param <T> The type of the values carried.
 */
public final class OutputSlot<T> implements IReceiveChannel<T> {

    private final String name;
    private final int capacity;
    private volatile InMemoryChannel<T> current;

    OutputSlot(String name, int capacity) {
        this.name = name;
        this.capacity = capacity;
        this.current = new InMemoryChannel<>(name, capacity);
    }

    void renew() {
        if (current.isClosedForSend()) {
            current = new InMemoryChannel<>(name, capacity);
        }
    }

    void send(T value) throws InterruptedException {
        current.send(value);
    }

    boolean close() {
        return current.close();
    }

    @Override
    public T receive() throws InterruptedException {
        return current.receive();
    }

    @Override
    public Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException {
        return current.poll(timeout, unit);
    }

    @Override
    public boolean isClosedForReceive() {
        return current.isClosedForReceive();
    }

    @Override
    public int size() {
        return current.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "OutputSlot[" + name + ", capacity=" + capacity + "]";
    }
}
