package dev.tmcp.transport;

import io.modelcontextprotocol.spec.McpSchema;

/**
 * The pair of channels a transport hands to the RPC layer for one connection. Receive from
 * {@link #inbound()}, send to {@link #outbound()}; closing the pair closes the whole connection.
 * @param peerDid identity of the remote party
 * @param inbound messages arriving from the peer
 * @param outbound messages to seal and send to the peer
 * @param scope cancellation scope owning the connection's tasks
 */
public record DuplexStreams(String peerDid, RendezvousChannel<InboundMessage> inbound,
        RendezvousChannel<McpSchema.JSONRPCMessage> outbound, ConnectionScope scope) implements AutoCloseable {

    /**
     * Create a fresh pair of channels bound to {@code scope}; both close with it.
     */
    public static DuplexStreams open(String peerDid, ConnectionScope scope) {
        RendezvousChannel<InboundMessage> inbound = new RendezvousChannel<>(scope.name() + "-inbound");
        RendezvousChannel<McpSchema.JSONRPCMessage> outbound = new RendezvousChannel<>(scope.name() + "-outbound");
        scope.onClose(inbound);
        scope.onClose(outbound);
        return new DuplexStreams(peerDid, inbound, outbound, scope);
    }

    public boolean isOpen() {
        return !this.scope.isClosed();
    }

    @Override
    public void close() {
        this.scope.close();
    }

}
