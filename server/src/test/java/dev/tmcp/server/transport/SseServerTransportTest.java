package dev.tmcp.server.transport;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import dev.tmcp.identity.Connection;
import dev.tmcp.identity.IdentityManager;
import dev.tmcp.server.config.TransportSecurityProperties;
import dev.tmcp.server.handler.DuplexSessionHandler;
import dev.tmcp.server.security.TransportSecurityValidator;
import dev.tmcp.server.session.ReconnectPolicy;
import dev.tmcp.server.session.SessionRegistry;
import dev.tmcp.testing.InMemoryDirectoryClient;
import dev.tmcp.testing.TestIdentities;
import dev.tmcp.transport.InboundMessage;
import dev.tmcp.transport.JsonRpcCodec;
import dev.tmcp.transport.SessionEvent;
import dev.tmcp.transport.SessionEventType;
import io.modelcontextprotocol.spec.McpSchema;

class SseServerTransportTest {

	private static final String PING = "{\"jsonrpc\":\"2.0\",\"id\":\"c-1\",\"method\":\"ping\"}";

	private final JsonRpcCodec codec = new JsonRpcCodec();

	private final ExecutorService executor = Executors.newCachedThreadPool();

	private InMemoryDirectoryClient directory;

	private IdentityManager server;

	private IdentityManager client;

	private Connection clientSide;

	private SessionRegistry registry;

	private RecordingSessionHandler handler;

	private Duration keepAliveInterval = Duration.ofSeconds(15);

	private SseServerTransport transport;

	@BeforeEach
	void setUp() {
		this.directory = new InMemoryDirectoryClient();
		this.server = TestIdentities.create(this.directory, "Server", "sse://localhost:8080/sse");
		this.client = TestIdentities.create(this.directory, "Client", "tmcpclient://");
		this.clientSide = this.client.connect(this.server.localDid());
		this.handler = new RecordingSessionHandler();
		this.transport = transport(ReconnectPolicy.REPLACE);
	}

	@AfterEach
	void tearDown() {
		this.executor.shutdownNow();
	}

	@Test
	void getOutsideStreamPathIsNotFound() throws Exception {
		MockHttpServletResponse response = get("/other", this.client.localDid());

		assertThat(response.getStatus()).isEqualTo(404);
		assertThat(this.registry.size()).isZero();
	}

	@Test
	void getWithoutDidIsRejected() throws Exception {
		MockHttpServletResponse response = get("/sse", null);

		assertThat(response.getStatus()).isEqualTo(400);
		assertThat(response.getContentAsString()).isEqualTo("did is required");
		assertThat(this.registry.size()).isZero();
	}

	@Test
	void getForUnknownIdentityIsForbidden() throws Exception {
		MockHttpServletResponse response = get("/sse", "did:web:test.local:endpoint:nobody");

		assertThat(response.getStatus()).isEqualTo(403);
		assertThat(this.registry.size()).isZero();
	}

	@Test
	void getFromForeignHostIsMisdirected() throws Exception {
		MockHttpServletRequest request = getRequest("/sse", this.client.localDid());
		request.addHeader("Host", "evil.example");
		MockHttpServletResponse response = new MockHttpServletResponse();

		this.transport.doGet(request, response);

		assertThat(response.getStatus()).isEqualTo(421);
		assertThat(this.registry.size()).isZero();
	}

	@Test
	void getWhenDirectoryIsDownIsBadGateway() throws Exception {
		this.directory.setOffline(true);

		MockHttpServletResponse response = get("/sse", this.client.localDid());

		assertThat(response.getStatus()).isEqualTo(502);
	}

	@Test
	void streamStartsWithSealedEndpointEvent() throws Exception {
		MockHttpServletResponse response = get("/sse", this.client.localDid());

		assertThat(response.getStatus()).isEqualTo(200);
		assertThat(response.getContentType()).startsWith("text/event-stream");
		assertThat(this.registry.lookup(this.client.localDid())).isPresent();
		SessionEvent endpoint = awaitEvent(response, "endpoint");
		assertThat(endpoint).isEqualTo(new SessionEvent(SessionEventType.ENDPOINT, "/messages/"));
	}

	@Test
	void postedMessageIsDeliveredAndAnswerIsStreamed() throws Exception {
		MockHttpServletResponse stream = get("/sse", this.client.localDid());

		MockHttpServletResponse response = post(this.clientSide.seal(PING), "application/tsp");

		assertThat(response.getStatus()).isEqualTo(202);
		assertThat(response.getContentAsString()).isEqualTo("Accepted");
		InboundMessage inbound = this.handler.next(Duration.ofSeconds(5));
		assertThat(inbound).isInstanceOf(InboundMessage.Delivered.class);
		assertThat(((InboundMessage.Delivered) inbound).message()).isInstanceOf(McpSchema.JSONRPCRequest.class);

		SessionEvent answer = awaitEvent(stream, "message");
		McpSchema.JSONRPCResponse reply = (McpSchema.JSONRPCResponse) this.codec.parse(answer.data());
		assertThat(reply.id()).isEqualTo("c-1");
		assertThat(reply.result()).isEqualTo(Map.of("echo", "ping"));
	}

	@Test
	void postWithWrongContentTypeIsRejected() throws Exception {
		get("/sse", this.client.localDid());

		MockHttpServletResponse response = post(this.clientSide.seal(PING), "application/json");

		assertThat(response.getStatus()).isEqualTo(400);
		assertThat(response.getContentAsString()).isEqualTo("Invalid Content-Type header");
	}

	@Test
	void postWithGarbageIsMalformed() throws Exception {
		get("/sse", this.client.localDid());

		MockHttpServletResponse response = post("%%%", "application/tsp");

		assertThat(response.getStatus()).isEqualTo(400);
		assertThat(response.getContentAsString()).isEqualTo("Malformed envelope");
	}

	@Test
	void postAddressedToAnotherServerIsRejected() throws Exception {
		IdentityManager other = TestIdentities.create(this.directory, "Other", "sse://localhost:9090/sse");
		get("/sse", this.client.localDid());

		MockHttpServletResponse response = post(this.client.connect(other.localDid()).seal(PING), "application/tsp");

		assertThat(response.getStatus()).isEqualTo(400);
		assertThat(response.getContentAsString()).isEqualTo("Incorrect receiver");
		assertThat(this.registry.size()).isEqualTo(1);
		assertThat(this.registry.lookup(this.client.localDid())).isPresent();
		assertThat(this.handler.next(Duration.ofMillis(200))).isNull();
	}

	@Test
	void postWithoutOpenStreamIsNotFound() throws Exception {
		MockHttpServletResponse response = post(this.clientSide.seal(PING), "application/tsp");

		assertThat(response.getStatus()).isEqualTo(404);
		assertThat(response.getContentAsString()).isEqualTo("Could not find session");
		assertThat(this.registry.size()).isZero();
		assertThat(this.registry.lookup(this.client.localDid())).isEmpty();
	}

	@Test
	void postNextToTheMessagePathIsNotRouted() throws Exception {
		get("/sse", this.client.localDid());

		MockHttpServletResponse response = post("/messagesX", this.clientSide.seal(PING), "application/tsp");

		assertThat(response.getStatus()).isEqualTo(405);
		assertThat(this.handler.next(Duration.ofMillis(200))).isNull();
	}

	@Test
	void postWithUnparseablePayloadIsRejectedAndReportedToTheSession() throws Exception {
		get("/sse", this.client.localDid());

		MockHttpServletResponse response = post(this.clientSide.seal("not json-rpc"), "application/tsp");

		assertThat(response.getStatus()).isEqualTo(400);
		assertThat(response.getContentAsString()).isEqualTo("Could not parse message");
		InboundMessage inbound = this.handler.next(Duration.ofSeconds(5));
		assertThat(inbound).isInstanceOf(InboundMessage.Failed.class);
		assertThat(((InboundMessage.Failed) inbound).error()).hasMessage("Could not parse message");
		assertThat(this.registry.lookup(this.client.localDid())).isPresent();
	}

	@Test
	void tamperedPostIsRejectedAndReportedToTheSession() throws Exception {
		get("/sse", this.client.localDid());
		byte[] envelope = this.clientSide.sealToBytes(PING);
		envelope[envelope.length - 1] ^= 0x01;

		MockHttpServletResponse response = post(Base64.getUrlEncoder().encodeToString(envelope), "application/tsp");

		assertThat(response.getStatus()).isEqualTo(400);
		assertThat(this.handler.next(Duration.ofSeconds(5))).isInstanceOf(InboundMessage.Failed.class);
	}

	@Test
	void rejectionIsCommittedBeforeTheSessionTakesTheFailure() throws Exception {
		CountDownLatch release = new CountDownLatch(1);
		this.transport = transport(ReconnectPolicy.REPLACE, streams -> release.await());
		get("/sse", this.client.localDid());
		byte[] envelope = this.clientSide.sealToBytes(PING);
		envelope[envelope.length - 1] ^= 0x01;
		MockHttpServletRequest request = postRequest("/messages/", Base64.getUrlEncoder().encodeToString(envelope),
				"application/tsp");
		MockHttpServletResponse response = new MockHttpServletResponse();

		Future<?> posting = this.executor.submit(() -> {
			this.transport.doPost(request, response);
			return null;
		});

		awaitCommitted(response);
		assertThat(response.getStatus()).isEqualTo(400);
		assertThat(posting.isDone()).isFalse();
		release.countDown();
		posting.get(5, TimeUnit.SECONDS);
	}

	@Test
	void idleStreamCarriesKeepAliveComments() throws Exception {
		this.keepAliveInterval = Duration.ofMillis(50);
		this.transport = transport(ReconnectPolicy.REPLACE);

		MockHttpServletResponse stream = get("/sse", this.client.localDid());

		awaitEvent(stream, "endpoint");
		long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
		while (!stream.getContentAsString().contains(": ping\n\n") && System.nanoTime() < deadline) {
			Thread.sleep(20);
		}
		assertThat(stream.getContentAsString()).contains(": ping\n\n");
	}

	@Test
	void secondStreamIsRefusedUnderRejectPolicy() throws Exception {
		this.transport = transport(ReconnectPolicy.REJECT);
		get("/sse", this.client.localDid());

		MockHttpServletResponse second = get("/sse", this.client.localDid());

		assertThat(second.getStatus()).isEqualTo(409);
		assertThat(this.registry.size()).isEqualTo(1);
	}

	private SseServerTransport transport(ReconnectPolicy policy) {
		return transport(policy, this.handler);
	}

	private SseServerTransport transport(ReconnectPolicy policy, DuplexSessionHandler sessionHandler) {
		this.registry = new SessionRegistry(policy);
		return new SseServerTransport(this.server, this.registry,
				new TransportSecurityValidator(TransportSecurityProperties.defaults()), sessionHandler, this.executor,
				this.codec, "/sse", "/messages/", Duration.ZERO, this.keepAliveInterval);
	}

	private MockHttpServletResponse get(String path, String did) throws Exception {
		MockHttpServletRequest request = getRequest(path, did);
		request.addHeader("Host", "localhost:8080");
		MockHttpServletResponse response = new MockHttpServletResponse();
		this.transport.doGet(request, response);
		return response;
	}

	private static MockHttpServletRequest getRequest(String path, String did) {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", path);
		request.setAsyncSupported(true);
		if (did != null) {
			request.setParameter("did", did);
		}
		return request;
	}

	private MockHttpServletResponse post(String body, String contentType) throws Exception {
		return post("/messages/", body, contentType);
	}

	private MockHttpServletResponse post(String path, String body, String contentType) throws Exception {
		MockHttpServletResponse response = new MockHttpServletResponse();
		this.transport.doPost(postRequest(path, body, contentType), response);
		return response;
	}

	private static MockHttpServletRequest postRequest(String path, String body, String contentType) {
		MockHttpServletRequest request = new MockHttpServletRequest("POST", path);
		request.addHeader("Host", "localhost:8080");
		request.setContentType(contentType);
		request.setContent(body.getBytes(StandardCharsets.US_ASCII));
		return request;
	}

	private static void awaitCommitted(MockHttpServletResponse response) throws InterruptedException {
		long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
		while (!response.isCommitted() && System.nanoTime() < deadline) {
			Thread.sleep(20);
		}
		assertThat(response.isCommitted()).isTrue();
	}

	private SessionEvent awaitEvent(MockHttpServletResponse response, String type) throws Exception {
		long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
		while (System.nanoTime() < deadline) {
			for (String frame : response.getContentAsString().split("\n\n")) {
				if (frame.startsWith("event: " + type + "\n")) {
					String data = frame.substring(frame.indexOf("data: ") + "data: ".length());
					return this.codec.decodeEvent(this.clientSide.open(data));
				}
			}
			Thread.sleep(20);
		}
		throw new AssertionError("No " + type + " event in " + response.getContentAsString());
	}

}
