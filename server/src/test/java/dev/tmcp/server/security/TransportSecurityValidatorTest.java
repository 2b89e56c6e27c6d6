package dev.tmcp.server.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import dev.tmcp.server.config.TransportSecurityProperties;

class TransportSecurityValidatorTest {

	private final TransportSecurityValidator validator = new TransportSecurityValidator(
			TransportSecurityProperties.defaults());

	@Test
	void acceptsLocalRequestsOnAnyPort() {
		assertThat(this.validator.validate(headers("localhost:8080", null, null), false)).isEmpty();
		assertThat(this.validator.validate(headers("127.0.0.1:9000", "http://127.0.0.1:9000", null), false)).isEmpty();
		assertThat(this.validator.validate(headers("[::1]:8080", null, null), false)).isEmpty();
		assertThat(this.validator.validate(headers("localhost", null, null), false)).isEmpty();
	}

	@Test
	void foreignHostIsMisdirected() {
		assertThat(this.validator.validate(headers("evil.example", null, null), false))
			.contains(new ValidationFailure(421, "Invalid Host header"));
		assertThat(this.validator.validate(headers("localhost.evil.example:80", null, null), false))
			.contains(new ValidationFailure(421, "Invalid Host header"));
		assertThat(this.validator.validate(new HttpHeaders(), false))
			.contains(new ValidationFailure(421, "Invalid Host header"));
	}

	@Test
	void foreignOriginIsForbidden() {
		assertThat(this.validator.validate(headers("localhost:8080", "http://evil.example", null), false))
			.contains(new ValidationFailure(403, "Invalid Origin header"));
	}

	@Test
	void postRequiresEnvelopeContentType() {
		assertThat(this.validator.validate(headers("localhost:8080", null, "application/json"), true))
			.contains(new ValidationFailure(400, "Invalid Content-Type header"));
		assertThat(this.validator.validate(headers("localhost:8080", null, null), true))
			.contains(new ValidationFailure(400, "Invalid Content-Type header"));
		assertThat(this.validator.validate(headers("localhost:8080", null, "application/tsp; charset=us-ascii"), true))
			.isEmpty();
		assertThat(this.validator.validate(headers("localhost:8080", null, "Application/TSP"), true)).isEmpty();
	}

	@Test
	void contentTypeMustMatchExactly() {
		assertThat(this.validator.validate(headers("localhost:8080", null, "application/tspx"), true))
			.contains(new ValidationFailure(400, "Invalid Content-Type header"));
		assertThat(this.validator.validate(headers("localhost:8080", null, "application/tsp+json"), true))
			.contains(new ValidationFailure(400, "Invalid Content-Type header"));
		assertThat(this.validator.validate(headers("localhost:8080", null, "not a media type"), true))
			.contains(new ValidationFailure(400, "Invalid Content-Type header"));
	}

	@Test
	void contentTypeIsCheckedBeforeHost() {
		assertThat(this.validator.validate(headers("evil.example", null, "text/plain"), true))
			.contains(new ValidationFailure(400, "Invalid Content-Type header"));
	}

	@Test
	void disabledProtectionSkipsHostAndOrigin() {
		TransportSecurityValidator permissive = new TransportSecurityValidator(
				new TransportSecurityProperties(false, null, null));

		assertThat(permissive.validate(headers("evil.example", "http://evil.example", null), false)).isEmpty();
		assertThat(permissive.validate(headers("evil.example", null, "text/plain"), true))
			.contains(new ValidationFailure(400, "Invalid Content-Type header"));
	}

	@Test
	void exactEntriesMatchOnlyThemselves() {
		TransportSecurityValidator strict = new TransportSecurityValidator(
				new TransportSecurityProperties(true, List.of("api.example:443"), List.of("https://app.example")));

		assertThat(strict.validate(headers("api.example:443", "https://app.example", null), false)).isEmpty();
		assertThat(strict.validate(headers("api.example:8443", null, null), false)).isPresent();
		assertThat(strict.validate(headers("api.example:443", "https://app.example:8443", null), false))
			.contains(new ValidationFailure(403, "Invalid Origin header"));
	}

	private static HttpHeaders headers(String host, String origin, String contentType) {
		HttpHeaders headers = new HttpHeaders();
		if (host != null) {
			headers.set(HttpHeaders.HOST, host);
		}
		if (origin != null) {
			headers.set(HttpHeaders.ORIGIN, origin);
		}
		if (contentType != null) {
			headers.set(HttpHeaders.CONTENT_TYPE, contentType);
		}
		return headers;
	}

}
