package dev.tmcp.server.config;

import java.util.concurrent.ExecutorService;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.tmcp.identity.IdentityManager;
import dev.tmcp.server.handler.DuplexSessionHandler;
import dev.tmcp.server.security.TransportSecurityValidator;
import dev.tmcp.server.transport.DidHandshakeInterceptor;
import dev.tmcp.server.transport.WebSocketServerTransport;
import dev.tmcp.transport.JsonRpcCodec;

/**
 * Declares the WebSocket transport when {@code tmcp.transport.type=websocket}.
 */
@Configuration
@ConditionalOnProperty(prefix = "tmcp.transport", name = "type", havingValue = "websocket")
public class WebSocketTransportConfig {

	@Bean
	public WebSocketServerTransport webSocketServerTransport(DuplexSessionHandler handler,
			ExecutorService transportExecutor, JsonRpcCodec codec, TmcpTransportProperties transportProperties) {
		return new WebSocketServerTransport(handler, transportExecutor, codec, transportProperties.getFrameFormat());
	}

	@Bean
	public DidHandshakeInterceptor didHandshakeInterceptor(IdentityManager identityManager,
			TransportSecurityValidator validator) {
		return new DidHandshakeInterceptor(identityManager, validator);
	}

}
