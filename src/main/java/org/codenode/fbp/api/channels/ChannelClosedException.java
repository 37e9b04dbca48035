package org.codenode.fbp.api.channels;

/**
 * Signals that a channel can no longer be used in the attempted direction. Inside a processing loop this is
 * the normal end-of-stream signal, not a failure.
 */
public class ChannelClosedException extends RuntimeException {

    public ChannelClosedException(String message) {
        super(message);
    }
}
