package org.codenode.fbp.api.channels;

import java.util.concurrent.TimeUnit;

/**
 * The producing end of a channel.
 *
 * @param <T> The type of the values carried by the channel.
 */
public interface ISendChannel<T> {

    /**
     * Sends a value, blocking while the channel is full. On a rendezvous channel this blocks until a
     * receiver has taken the value.
     *
     * @param value The value to send, must not be {@code null}.
     * @throws ChannelClosedException if the channel is closed for sending.
     * @throws InterruptedException   if the calling thread is interrupted while waiting. The value is not
     *                                delivered in that case.
     */
    void send(T value) throws InterruptedException;

    /**
     * Sends a value, waiting at most the given time for it to be accepted.
     *
     * @return {@code true} if the value was delivered, {@code false} on timeout.
     * @throws ChannelClosedException if the channel is closed for sending.
     * @throws InterruptedException   if the calling thread is interrupted while waiting.
     */
    boolean offer(T value, long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Closes the channel. Values already buffered can still be received.
     *
     * @return {@code true} if this call closed the channel, {@code false} if it was already closed.
     */
    boolean close();

    boolean isClosedForSend();
}
