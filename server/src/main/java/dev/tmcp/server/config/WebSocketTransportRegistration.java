package dev.tmcp.server.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import lombok.RequiredArgsConstructor;

import dev.tmcp.server.transport.DidHandshakeInterceptor;
import dev.tmcp.server.transport.WebSocketServerTransport;

/**
 * Registers the WebSocket handler with the servlet container whenever the WebSocket transport is
 * active. Origins are checked by the handshake interceptor.
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "tmcp.transport", name = "type", havingValue = "websocket")
public class WebSocketTransportRegistration implements WebSocketConfigurer {

	private final WebSocketServerTransport transport;

	private final TmcpTransportProperties transportProperties;

	private final DidHandshakeInterceptor handshakeInterceptor;

	@Override
	public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
		registry.addHandler(this.transport, this.transportProperties.getWebSocketPath())
			.addInterceptors(this.handshakeInterceptor)
			.setAllowedOrigins("*");
	}

}
