package dev.tmcp.server.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import dev.tmcp.identity.Connection;
import dev.tmcp.identity.IdentityManager;
import dev.tmcp.server.config.TmcpTransportProperties.FrameFormat;
import dev.tmcp.testing.InMemoryDirectoryClient;
import dev.tmcp.testing.TestIdentities;
import dev.tmcp.transport.InboundMessage;
import dev.tmcp.transport.JsonRpcCodec;
import io.modelcontextprotocol.spec.McpSchema;

class WebSocketServerTransportTest {

	private static final String PING = "{\"jsonrpc\":\"2.0\",\"id\":\"c-1\",\"method\":\"ping\"}";

	private final JsonRpcCodec codec = new JsonRpcCodec();

	private final ExecutorService executor = Executors.newCachedThreadPool();

	private IdentityManager server;

	private Connection clientSide;

	private RecordingSessionHandler handler;

	private WebSocketSession socket;

	@BeforeEach
	void setUp() {
		InMemoryDirectoryClient directory = new InMemoryDirectoryClient();
		this.server = TestIdentities.create(directory, "Server", "ws://localhost:8080/ws");
		IdentityManager client = TestIdentities.create(directory, "Client", "tmcpclient://");
		this.clientSide = client.connect(this.server.localDid());
		this.handler = new RecordingSessionHandler();

		Map<String, Object> attributes = new HashMap<>();
		attributes.put(DidHandshakeInterceptor.CONNECTION_ATTRIBUTE, this.server.connect(client.localDid()));
		this.socket = mock(WebSocketSession.class);
		when(this.socket.getId()).thenReturn("1");
		when(this.socket.getAttributes()).thenReturn(attributes);
		when(this.socket.isOpen()).thenReturn(true);
	}

	@AfterEach
	void tearDown() {
		this.executor.shutdownNow();
	}

	@Test
	void offersTheMcpSubprotocol() {
		assertThat(transport(FrameFormat.TEXT).getSubProtocols()).containsExactly("mcp");
	}

	@Test
	void textFrameIsDeliveredAndAnswerIsSealed() throws Exception {
		WebSocketServerTransport transport = transport(FrameFormat.TEXT);
		transport.afterConnectionEstablished(this.socket);

		transport.handleMessage(this.socket, new TextMessage(this.clientSide.seal(PING)));

		assertThat(this.handler.next(Duration.ofSeconds(5))).isInstanceOf(InboundMessage.Delivered.class);
		ArgumentCaptor<TextMessage> frame = ArgumentCaptor.forClass(TextMessage.class);
		verify(this.socket, timeout(5000)).sendMessage(frame.capture());
		String payload = frame.getValue().getPayload();
		McpSchema.JSONRPCResponse reply = (McpSchema.JSONRPCResponse) this.codec.parse(this.clientSide.open(payload));
		assertThat(reply.id()).isEqualTo("c-1");
	}

	@Test
	void binaryFramesCarryRawEnvelopes() throws Exception {
		WebSocketServerTransport transport = transport(FrameFormat.BINARY);
		transport.afterConnectionEstablished(this.socket);

		transport.handleMessage(this.socket, new BinaryMessage(this.clientSide.sealToBytes(PING)));

		assertThat(this.handler.next(Duration.ofSeconds(5))).isInstanceOf(InboundMessage.Delivered.class);
		ArgumentCaptor<BinaryMessage> frame = ArgumentCaptor.forClass(BinaryMessage.class);
		verify(this.socket, timeout(5000)).sendMessage(frame.capture());
		ByteBuffer buffer = frame.getValue().getPayload();
		byte[] envelope = new byte[buffer.remaining()];
		buffer.get(envelope);
		assertThat(this.clientSide.open(envelope)).contains("\"id\":\"c-1\"");
	}

	@Test
	void malformedFrameIsReportedWithoutClosingTheSocket() throws Exception {
		WebSocketServerTransport transport = transport(FrameFormat.TEXT);
		transport.afterConnectionEstablished(this.socket);

		transport.handleMessage(this.socket, new TextMessage("not an envelope"));
		transport.handleMessage(this.socket, new TextMessage(this.clientSide.seal(PING)));

		assertThat(this.handler.next(Duration.ofSeconds(5))).isInstanceOf(InboundMessage.Failed.class);
		assertThat(this.handler.next(Duration.ofSeconds(5))).isInstanceOf(InboundMessage.Delivered.class);
		verify(this.socket, never()).close(any());
		assertThat(transport.activeSessions()).isEqualTo(1);
	}

	@Test
	void closingTheSocketEndsTheSession() throws Exception {
		WebSocketServerTransport transport = transport(FrameFormat.TEXT);
		transport.afterConnectionEstablished(this.socket);

		transport.afterConnectionClosed(this.socket, CloseStatus.NORMAL);

		assertThat(transport.activeSessions()).isZero();
	}

	@Test
	void socketWithoutAuthenticatedPeerIsClosed() throws Exception {
		WebSocketServerTransport transport = transport(FrameFormat.TEXT);
		this.socket.getAttributes().clear();

		transport.afterConnectionEstablished(this.socket);

		verify(this.socket).close(CloseStatus.POLICY_VIOLATION);
		assertThat(transport.activeSessions()).isZero();
	}

	private WebSocketServerTransport transport(FrameFormat frameFormat) {
		return new WebSocketServerTransport(this.handler, this.executor, this.codec, frameFormat);
	}

}
