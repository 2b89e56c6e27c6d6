package dev.tmcp.transport;

import dev.tmcp.TmcpException;

/**
 * Raised by a {@link RendezvousChannel} operation that cannot complete because the channel was closed.
 */
public class ChannelClosedException extends TmcpException {

    public ChannelClosedException(String channelName) {
        super("Channel closed: " + channelName);
    }
}
