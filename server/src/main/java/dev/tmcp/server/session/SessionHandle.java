package dev.tmcp.server.session;

import dev.tmcp.identity.Connection;
import dev.tmcp.transport.DuplexStreams;
import dev.tmcp.transport.InboundMessage;

/**
 * A live SSE session: the connection used to open the peer's messages and the streams they are
 * delivered to.
 */
public final class SessionHandle {

	private final Connection connection;

	private final DuplexStreams streams;

	public SessionHandle(Connection connection, DuplexStreams streams) {
		this.connection = connection;
		this.streams = streams;
	}

	public String peerDid() {
		return this.connection.peerDid();
	}

	public Connection connection() {
		return this.connection;
	}

	public DuplexStreams streams() {
		return this.streams;
	}

	public boolean isOpen() {
		return this.streams.isOpen();
	}

	/**
	 * Hand a message to the session's consumer, blocking until it is taken.
	 * @throws dev.tmcp.transport.ChannelClosedException when the session closes first
	 */
	public void deliver(InboundMessage message) throws InterruptedException {
		this.streams.inbound().send(message);
	}

	@Override
	public String toString() {
		return "SessionHandle[" + peerDid() + ", " + this.streams.scope().name() + "]";
	}

}
