package dev.tmcp.server.transport;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.SubProtocolCapable;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import dev.tmcp.channel.EnvelopeDecodeException;
import dev.tmcp.identity.Connection;
import dev.tmcp.server.config.TmcpTransportProperties.FrameFormat;
import dev.tmcp.server.handler.DuplexSessionHandler;
import dev.tmcp.transport.ChannelClosedException;
import dev.tmcp.transport.ConnectionScope;
import dev.tmcp.transport.DuplexStreams;
import dev.tmcp.transport.InboundMessage;
import dev.tmcp.transport.JsonRpcCodec;
import dev.tmcp.transport.TmcpProtocol;

/**
 * Server side of the WebSocket transport. Each socket carries one secure session with the peer
 * authenticated during the handshake by {@link DidHandshakeInterceptor}. Inbound frames are opened
 * on the container's dispatch thread; a scoped writer task seals and sends outbound messages.
 */
public class WebSocketServerTransport extends AbstractWebSocketHandler implements SubProtocolCapable {

	private static final Logger logger = LoggerFactory.getLogger(WebSocketServerTransport.class);

	private final ConcurrentHashMap<String, ActiveSession> sessionsByWebSocketId = new ConcurrentHashMap<>();

	private final DuplexSessionHandler handler;

	private final ExecutorService executor;

	private final JsonRpcCodec codec;

	private final FrameFormat frameFormat;

	public WebSocketServerTransport(DuplexSessionHandler handler, ExecutorService executor, JsonRpcCodec codec,
			FrameFormat frameFormat) {
		this.handler = handler;
		this.executor = executor;
		this.codec = codec;
		this.frameFormat = frameFormat;
		logger.info("Initialized WebSocket transport using {} frames", frameFormat);
	}

	@Override
	public List<String> getSubProtocols() {
		return List.of(TmcpProtocol.SUBPROTOCOL);
	}

	@Override
	public void afterConnectionEstablished(WebSocketSession socketSession) {
		Connection connection = (Connection) socketSession.getAttributes().get(DidHandshakeInterceptor.CONNECTION_ATTRIBUTE);
		if (connection == null) {
			logger.error("WebSocket {} established without an authenticated peer", socketSession.getId());
			closeSocket(socketSession, new ReentrantLock(), CloseStatus.POLICY_VIOLATION);
			return;
		}
		ConnectionScope scope = new ConnectionScope("ws-" + socketSession.getId(), this.executor);
		DuplexStreams streams = DuplexStreams.open(connection.peerDid(), scope);
		ActiveSession active = new ActiveSession(socketSession, connection, streams);
		this.sessionsByWebSocketId.put(socketSession.getId(), active);
		scope.onClose(() -> {
			this.sessionsByWebSocketId.remove(socketSession.getId(), active);
			closeSocket(socketSession, active.sendLock, CloseStatus.NORMAL);
		});
		logger.info("WebSocket connection {} established for {}", socketSession.getId(), connection.peerDid());
		scope.launch("ws-writer", () -> writeMessages(active));
		scope.launch("session-handler", () -> this.handler.handle(streams));
	}

	@Override
	protected void handleTextMessage(WebSocketSession socketSession, TextMessage message) {
		receive(socketSession, message, connection -> connection.open(message.getPayload()));
	}

	@Override
	protected void handleBinaryMessage(WebSocketSession socketSession, BinaryMessage message) {
		ByteBuffer payload = message.getPayload();
		byte[] envelope = new byte[payload.remaining()];
		payload.get(envelope);
		receive(socketSession, message, connection -> connection.open(envelope));
	}

	private void receive(WebSocketSession socketSession, WebSocketMessage<?> frame, Opener opener) {
		ActiveSession active = this.sessionsByWebSocketId.get(socketSession.getId());
		if (active == null) {
			logger.warn("Frame received on unknown WebSocket {}", socketSession.getId());
			return;
		}
		InboundMessage inbound;
		try {
			inbound = InboundMessage.delivered(this.codec.parse(opener.open(active.connection)));
		}
		catch (EnvelopeDecodeException ex) {
			logger.warn("Undecodable {} byte frame on WebSocket {}: {}", frame.getPayloadLength(),
					socketSession.getId(), ex.getMessage());
			inbound = InboundMessage.failed(ex);
		}
		try {
			active.streams.inbound().send(inbound);
		}
		catch (ChannelClosedException ex) {
			logger.debug("WebSocket {} closed before delivery", socketSession.getId());
		}
		catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			active.streams.close();
		}
	}

	private void writeMessages(ActiveSession active) throws InterruptedException, IOException {
		while (true) {
			String json = this.codec.serialize(active.streams.outbound().receive());
			WebSocketMessage<?> frame = this.frameFormat == FrameFormat.BINARY
					? new BinaryMessage(active.connection.sealToBytes(json))
					: new TextMessage(active.connection.seal(json));
			active.sendLock.lock();
			try {
				active.webSocketSession.sendMessage(frame);
			}
			finally {
				active.sendLock.unlock();
			}
		}
	}

	@Override
	public void handleTransportError(WebSocketSession socketSession, Throwable exception) {
		logger.warn("Transport error detected on WebSocket {}", socketSession.getId(), exception);
		closeActiveSession(socketSession);
	}

	@Override
	public void afterConnectionClosed(WebSocketSession socketSession, CloseStatus status) {
		logger.info("WebSocket connection {} closed with status {}", socketSession.getId(), status);
		closeActiveSession(socketSession);
	}

	private void closeActiveSession(WebSocketSession socketSession) {
		ActiveSession active = this.sessionsByWebSocketId.remove(socketSession.getId());
		if (active != null) {
			active.streams.close();
		}
	}

	private static void closeSocket(WebSocketSession socketSession, ReentrantLock sendLock, CloseStatus status) {
		sendLock.lock();
		try {
			if (socketSession.isOpen()) {
				socketSession.close(status);
			}
		}
		catch (IOException ex) {
			logger.warn("Failed to close WebSocket session {}", socketSession.getId(), ex);
		}
		finally {
			sendLock.unlock();
		}
	}

	int activeSessions() {
		return this.sessionsByWebSocketId.size();
	}

	@FunctionalInterface
	private interface Opener {

		String open(Connection connection);

	}

	/**
	 * Holder for the state of one socket.
	 */
	private static final class ActiveSession {

		private final WebSocketSession webSocketSession;

		private final Connection connection;

		private final DuplexStreams streams;

		private final ReentrantLock sendLock = new ReentrantLock();

		private ActiveSession(WebSocketSession webSocketSession, Connection connection, DuplexStreams streams) {
			this.webSocketSession = webSocketSession;
			this.connection = connection;
			this.streams = streams;
		}

	}

}
