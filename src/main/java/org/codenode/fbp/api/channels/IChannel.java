package org.codenode.fbp.api.channels;

/**
 * A point-to-point channel used both by its producer and its consumer.
 *
 * @param <T> The type of the values carried by the channel.
 */
public interface IChannel<T> extends ISendChannel<T>, IReceiveChannel<T> {

    /**
     * @return {@code 0} for a rendezvous channel, the buffer size for a bounded one, {@code -1} if unbounded.
     */
    int getCapacity();
}
