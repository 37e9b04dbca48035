package org.codenode.fbp.api.channels;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * The consuming end of a channel.
 *
 * @param <T> The type of the values carried by the channel.
 */
public interface IReceiveChannel<T> {

    /**
     * Takes the next value, blocking until one is available.
     *
     * @return The next value, never {@code null}.
     * @throws ChannelClosedException if the channel was closed and every buffered value has been received.
     * @throws InterruptedException   if the calling thread is interrupted while waiting.
     */
    T receive() throws InterruptedException;

    /**
     * Takes the next value, waiting at most the given time.
     *
     * @return The next value, or empty if none arrived within the timeout.
     * @throws ChannelClosedException if the channel was closed and every buffered value has been received.
     * @throws InterruptedException   if the calling thread is interrupted while waiting.
     */
    Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * @return {@code true} once the channel is closed and drained.
     */
    boolean isClosedForReceive();

    /**
     * @return The number of values currently buffered.
     */
    int size();
}
