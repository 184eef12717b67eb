package io.flux.core.channel;

/**
 * Thrown to a sender when the channel is closed before its item was taken.
 */
public class ChannelClosedException extends RuntimeException {

    public ChannelClosedException() {
        super("Channel is closed");
    }
}
