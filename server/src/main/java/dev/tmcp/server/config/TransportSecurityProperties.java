package dev.tmcp.server.config;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * DNS rebinding protection applied to every transport request. Entries of the form
 * {@code host:*} match any port.
 */
@ConfigurationProperties("tmcp.security")
public record TransportSecurityProperties(Boolean enableDnsRebindingProtection, List<String> allowedHosts,
		List<String> allowedOrigins) {

	public TransportSecurityProperties {
		enableDnsRebindingProtection = enableDnsRebindingProtection == null || enableDnsRebindingProtection;
		allowedHosts = allowedHosts == null || allowedHosts.isEmpty()
				? List.of("localhost:*", "127.0.0.1:*", "[::1]:*") : List.copyOf(allowedHosts);
		allowedOrigins = allowedOrigins == null || allowedOrigins.isEmpty()
				? List.of("http://localhost:*", "http://127.0.0.1:*", "http://[::1]:*") : List.copyOf(allowedOrigins);
	}

	public static TransportSecurityProperties defaults() {
		return new TransportSecurityProperties(null, null, null);
	}

}
