package dev.tmcp.server.transport;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriUtils;

import dev.tmcp.channel.EnvelopeAddress;
import dev.tmcp.channel.EnvelopeDecodeException;
import dev.tmcp.channel.EnvelopeEncoding;
import dev.tmcp.identity.Connection;
import dev.tmcp.identity.IdentityManager;
import dev.tmcp.identity.IdentityNotFoundException;
import dev.tmcp.identity.IdentityUnreachableException;
import dev.tmcp.server.handler.DuplexSessionHandler;
import dev.tmcp.server.security.TransportSecurityValidator;
import dev.tmcp.server.security.ValidationFailure;
import dev.tmcp.server.session.SessionConflictException;
import dev.tmcp.server.session.SessionHandle;
import dev.tmcp.server.session.SessionRegistry;
import dev.tmcp.transport.ChannelClosedException;
import dev.tmcp.transport.ConnectionScope;
import dev.tmcp.transport.DuplexStreams;
import dev.tmcp.transport.InboundMessage;
import dev.tmcp.transport.JsonRpcCodec;
import dev.tmcp.transport.SessionEvent;
import dev.tmcp.transport.TmcpProtocol;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * Server side of the SSE transport. A GET on the stream path opens a session for the peer named by
 * the {@code did} parameter and streams sealed events to it; the peer POSTs sealed messages to the
 * callback path announced in the first event.
 */
public class SseServerTransport extends HttpServlet {

	private static final Logger logger = LoggerFactory.getLogger(SseServerTransport.class);

	private static final byte[] ACCEPTED = "Accepted".getBytes(StandardCharsets.US_ASCII);

	private static final byte[] KEEP_ALIVE = ": ping\n\n".getBytes(StandardCharsets.US_ASCII);

	private final IdentityManager identityManager;

	private final SessionRegistry registry;

	private final TransportSecurityValidator validator;

	private final DuplexSessionHandler handler;

	private final ExecutorService executor;

	private final JsonRpcCodec codec;

	private final String ssePath;

	private final String messagePath;

	private final Duration asyncTimeout;

	private final Duration keepAliveInterval;

	public SseServerTransport(IdentityManager identityManager, SessionRegistry registry,
			TransportSecurityValidator validator, DuplexSessionHandler handler, ExecutorService executor,
			JsonRpcCodec codec, String ssePath, String messagePath, Duration asyncTimeout,
			Duration keepAliveInterval) {
		this.identityManager = identityManager;
		this.registry = registry;
		this.validator = validator;
		this.handler = handler;
		this.executor = executor;
		this.codec = codec;
		this.ssePath = ssePath;
		this.messagePath = messagePath;
		this.asyncTimeout = asyncTimeout;
		Assert.isTrue(keepAliveInterval.toMillis() > 0, "keepAliveInterval must be positive");
		this.keepAliveInterval = keepAliveInterval;
		logger.info("Initialized SSE transport on {} with message path {}", ssePath, messagePath);
	}

	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
		if (!this.ssePath.equals(pathWithinApplication(request))) {
			response.sendError(HttpServletResponse.SC_NOT_FOUND);
			return;
		}
		Optional<ValidationFailure> failure = this.validator.validate(headers(request), false);
		if (failure.isPresent()) {
			reject(response, failure.get().status(), failure.get().message());
			return;
		}
		String peerDid = request.getParameter(TmcpProtocol.DID_PARAMETER);
		if (!StringUtils.hasText(peerDid)) {
			reject(response, HttpServletResponse.SC_BAD_REQUEST, "did is required");
			return;
		}
		Connection connection;
		try {
			connection = this.identityManager.connect(peerDid);
		}
		catch (IdentityNotFoundException ex) {
			logger.warn("Refusing SSE stream for unknown identity {}", peerDid);
			reject(response, HttpServletResponse.SC_FORBIDDEN, "Unknown identity");
			return;
		}
		catch (IdentityUnreachableException ex) {
			logger.error("Identity directory unreachable while connecting {}", peerDid, ex);
			reject(response, HttpServletResponse.SC_BAD_GATEWAY, "Identity directory unreachable");
			return;
		}

		ConnectionScope scope = new ConnectionScope("sse-" + UUID.randomUUID().toString().substring(0, 8),
				this.executor);
		DuplexStreams streams = DuplexStreams.open(peerDid, scope);
		SessionHandle handle = new SessionHandle(connection, streams);
		try {
			this.registry.register(handle);
		}
		catch (SessionConflictException ex) {
			scope.close();
			reject(response, HttpServletResponse.SC_CONFLICT, ex.getMessage());
			return;
		}
		scope.onClose(() -> this.registry.remove(handle));

		response.setStatus(HttpServletResponse.SC_OK);
		response.setContentType(MediaType.TEXT_EVENT_STREAM_VALUE);
		response.setCharacterEncoding(StandardCharsets.UTF_8.name());
		response.setHeader(HttpHeaders.CACHE_CONTROL, "no-cache");
		response.setHeader("X-Accel-Buffering", "no");

		AsyncContext asyncContext = request.startAsync();
		asyncContext.setTimeout(this.asyncTimeout.toMillis());
		asyncContext.addListener(new ScopeClosingListener(scope));
		scope.onClose(() -> complete(asyncContext, scope));

		OutputStream out = response.getOutputStream();
		String endpoint = endpointPath(request);
		logger.info("SSE session {} opened for {}", scope.name(), peerDid);
		scope.launch("sse-writer", () -> writeEvents(out, connection, streams, endpoint));
		scope.launch("session-handler", () -> this.handler.handle(streams));
	}

	@Override
	protected void doPost(HttpServletRequest request, HttpServletResponse response) throws IOException {
		if (!isMessagePath(pathWithinApplication(request))) {
			response.sendError(HttpServletResponse.SC_METHOD_NOT_ALLOWED);
			return;
		}
		Optional<ValidationFailure> failure = this.validator.validate(headers(request), true);
		if (failure.isPresent()) {
			reject(response, failure.get().status(), failure.get().message());
			return;
		}
		String body = new String(request.getInputStream().readAllBytes(), StandardCharsets.US_ASCII);
		byte[] envelope;
		EnvelopeAddress address;
		try {
			envelope = EnvelopeEncoding.decode(body);
			address = this.identityManager.provider().peek(envelope);
		}
		catch (EnvelopeDecodeException ex) {
			logger.warn("Malformed envelope: {}", ex.getMessage());
			reject(response, HttpServletResponse.SC_BAD_REQUEST, "Malformed envelope");
			return;
		}
		if (!this.identityManager.localDid().equals(address.receiver())) {
			logger.warn("Envelope from {} addressed to {}", address.sender(), address.receiver());
			reject(response, HttpServletResponse.SC_BAD_REQUEST, "Incorrect receiver");
			return;
		}
		Optional<SessionHandle> session = this.registry.lookup(address.sender());
		if (session.isEmpty()) {
			logger.warn("Could not find session for {}", address.sender());
			reject(response, HttpServletResponse.SC_NOT_FOUND, "Could not find session");
			return;
		}
		SessionHandle handle = session.get();

		McpSchema.JSONRPCMessage message;
		try {
			message = this.codec.parse(handle.connection().open(envelope));
		}
		catch (EnvelopeDecodeException ex) {
			logger.warn("Failed to open message from {}: {}", address.sender(), ex.getMessage());
			reject(response, HttpServletResponse.SC_BAD_REQUEST, ex.getMessage());
			response.flushBuffer();
			deliver(handle, InboundMessage.failed(ex));
			return;
		}
		logger.debug("Received message from {}: {}", address.sender(), message);
		response.setStatus(HttpServletResponse.SC_ACCEPTED);
		response.setContentType(MediaType.TEXT_PLAIN_VALUE);
		response.setContentLength(ACCEPTED.length);
		response.getOutputStream().write(ACCEPTED);
		response.flushBuffer();
		deliver(handle, InboundMessage.delivered(message));
	}

	private void deliver(SessionHandle handle, InboundMessage message) {
		try {
			handle.deliver(message);
		}
		catch (ChannelClosedException ex) {
			logger.debug("Session {} closed before delivery", handle);
		}
		catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			logger.warn("Interrupted while delivering to {}", handle);
		}
	}

	private void writeEvents(OutputStream out, Connection connection, DuplexStreams streams, String endpoint)
			throws InterruptedException {
		try {
			writeEvent(out, connection, SessionEvent.endpoint(endpoint));
			while (true) {
				McpSchema.JSONRPCMessage message = streams.outbound().poll(this.keepAliveInterval);
				if (message == null) {
					out.write(KEEP_ALIVE);
					out.flush();
					continue;
				}
				writeEvent(out, connection, SessionEvent.message(this.codec.serialize(message)));
			}
		}
		catch (IOException ex) {
			logger.info("SSE client {} disconnected: {}", streams.peerDid(), ex.getMessage());
		}
	}

	private void writeEvent(OutputStream out, Connection connection, SessionEvent event) throws IOException {
		String sealed = connection.seal(this.codec.encodeEvent(event));
		String frame = "event: " + event.type().wireName() + "\ndata: " + sealed + "\n\n";
		out.write(frame.getBytes(StandardCharsets.UTF_8));
		out.flush();
	}

	private String endpointPath(HttpServletRequest request) {
		String path = trimTrailingSlash(request.getContextPath()) + this.messagePath;
		return UriUtils.encodePath(path, StandardCharsets.UTF_8);
	}

	private boolean isMessagePath(String path) {
		String base = trimTrailingSlash(this.messagePath);
		return path.equals(base) || path.startsWith(base + "/");
	}

	private static String pathWithinApplication(HttpServletRequest request) {
		return request.getRequestURI().substring(request.getContextPath().length());
	}

	private static String trimTrailingSlash(String path) {
		return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
	}

	private static HttpHeaders headers(HttpServletRequest request) {
		return new ServletServerHttpRequest(request).getHeaders();
	}

	private static void reject(HttpServletResponse response, int status, String message) throws IOException {
		byte[] body = message.getBytes(StandardCharsets.UTF_8);
		response.setStatus(status);
		response.setContentType(MediaType.TEXT_PLAIN_VALUE);
		response.setCharacterEncoding(StandardCharsets.UTF_8.name());
		response.setContentLength(body.length);
		response.getOutputStream().write(body);
	}

	private static void complete(AsyncContext asyncContext, ConnectionScope scope) {
		try {
			asyncContext.complete();
		}
		catch (IllegalStateException ex) {
			logger.debug("Async context of {} already completed", scope.name());
		}
		logger.info("SSE session {} closed", scope.name());
	}

	/**
	 * Closes the session scope when the container ends the async request.
	 */
	private static final class ScopeClosingListener implements AsyncListener {

		private final ConnectionScope scope;

		private ScopeClosingListener(ConnectionScope scope) {
			this.scope = scope;
		}

		@Override
		public void onComplete(AsyncEvent event) {
			this.scope.close();
		}

		@Override
		public void onTimeout(AsyncEvent event) {
			logger.info("SSE session {} timed out", this.scope.name());
			this.scope.close();
		}

		@Override
		public void onError(AsyncEvent event) {
			logger.warn("SSE session {} failed", this.scope.name(), event.getThrowable());
			this.scope.close();
		}

		@Override
		public void onStartAsync(AsyncEvent event) {
			// re-registered by the container; nothing to do
		}

	}

}
