package dev.tmcp.server.config;

import java.util.concurrent.ExecutorService;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.servlet.ServletRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.tmcp.identity.IdentityManager;
import dev.tmcp.server.handler.DuplexSessionHandler;
import dev.tmcp.server.security.TransportSecurityValidator;
import dev.tmcp.server.session.SessionRegistry;
import dev.tmcp.server.transport.SseServerTransport;
import dev.tmcp.transport.JsonRpcCodec;

/**
 * Exposes the SSE transport when {@code tmcp.transport.type=sse}.
 */
@Configuration
@ConditionalOnProperty(prefix = "tmcp.transport", name = "type", havingValue = "sse", matchIfMissing = true)
public class SseTransportConfig {

	@Bean
	public SessionRegistry sessionRegistry(TmcpTransportProperties transportProperties) {
		return new SessionRegistry(transportProperties.getReconnectPolicy());
	}

	@Bean
	public SseServerTransport sseServerTransport(IdentityManager identityManager, SessionRegistry sessionRegistry,
			TransportSecurityValidator validator, DuplexSessionHandler handler, ExecutorService transportExecutor,
			JsonRpcCodec codec, TmcpTransportProperties transportProperties) {
		return new SseServerTransport(identityManager, sessionRegistry, validator, handler, transportExecutor, codec,
				transportProperties.getSsePath(), transportProperties.getMessagePath(),
				transportProperties.getSseTimeout(), transportProperties.getKeepAliveInterval());
	}

	@Bean
	public ServletRegistrationBean<SseServerTransport> sseServletRegistration(SseServerTransport transport,
			TmcpTransportProperties transportProperties) {
		String messagePath = transportProperties.getMessagePath();
		String messageMapping = (messagePath.endsWith("/") ? messagePath : messagePath + "/") + "*";
		ServletRegistrationBean<SseServerTransport> registration = new ServletRegistrationBean<>(transport,
				transportProperties.getSsePath(), messageMapping);
		registration.setName("tmcpSseTransport");
		registration.setAsyncSupported(true);
		return registration;
	}

}
