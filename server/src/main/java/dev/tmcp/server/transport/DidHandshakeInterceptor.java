package dev.tmcp.server.transport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import dev.tmcp.identity.Connection;
import dev.tmcp.identity.IdentityManager;
import dev.tmcp.identity.IdentityNotFoundException;
import dev.tmcp.identity.IdentityUnreachableException;
import dev.tmcp.server.security.TransportSecurityValidator;
import dev.tmcp.server.security.ValidationFailure;
import dev.tmcp.transport.TmcpProtocol;

/**
 * Authenticates a WebSocket handshake: applies the transport security checks, requires the
 * {@code mcp} subprotocol and resolves the peer named by the {@code did} query parameter.
 */
public class DidHandshakeInterceptor implements HandshakeInterceptor {

	private static final Logger logger = LoggerFactory.getLogger(DidHandshakeInterceptor.class);

	static final String CONNECTION_ATTRIBUTE = DidHandshakeInterceptor.class.getName() + ".connection";

	private final IdentityManager identityManager;

	private final TransportSecurityValidator validator;

	public DidHandshakeInterceptor(IdentityManager identityManager, TransportSecurityValidator validator) {
		this.identityManager = identityManager;
		this.validator = validator;
	}

	@Override
	public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response, WebSocketHandler wsHandler,
			Map<String, Object> attributes) throws Exception {
		Optional<ValidationFailure> failure = this.validator.validate(request.getHeaders(), false);
		if (failure.isPresent()) {
			return reject(response, HttpStatusCode.valueOf(failure.get().status()), failure.get().message());
		}
		List<String> protocols = new WebSocketHttpHeaders(request.getHeaders()).getSecWebSocketProtocol();
		if (!protocols.contains(TmcpProtocol.SUBPROTOCOL)) {
			logger.warn("Handshake without the {} subprotocol: {}", TmcpProtocol.SUBPROTOCOL, protocols);
			return reject(response, HttpStatus.BAD_REQUEST, "Subprotocol " + TmcpProtocol.SUBPROTOCOL + " is required");
		}
		String peerDid = UriComponentsBuilder.fromUri(request.getURI())
			.build()
			.getQueryParams()
			.getFirst(TmcpProtocol.DID_PARAMETER);
		if (!StringUtils.hasText(peerDid)) {
			return reject(response, HttpStatus.BAD_REQUEST, "did is required");
		}
		peerDid = UriUtils.decode(peerDid, StandardCharsets.UTF_8);
		try {
			Connection connection = this.identityManager.connect(peerDid);
			attributes.put(CONNECTION_ATTRIBUTE, connection);
			return true;
		}
		catch (IdentityNotFoundException ex) {
			logger.warn("Refusing WebSocket for unknown identity {}", peerDid);
			return reject(response, HttpStatus.FORBIDDEN, "Unknown identity");
		}
		catch (IdentityUnreachableException ex) {
			logger.error("Identity directory unreachable while connecting {}", peerDid, ex);
			return reject(response, HttpStatus.BAD_GATEWAY, "Identity directory unreachable");
		}
	}

	@Override
	public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response, WebSocketHandler wsHandler,
			Exception exception) {
		if (exception != null) {
			logger.warn("WebSocket handshake failed", exception);
		}
	}

	private static boolean reject(ServerHttpResponse response, HttpStatusCode status, String message)
			throws IOException {
		response.setStatusCode(status);
		response.getHeaders().setContentType(MediaType.TEXT_PLAIN);
		response.getBody().write(message.getBytes(StandardCharsets.UTF_8));
		return false;
	}

}
