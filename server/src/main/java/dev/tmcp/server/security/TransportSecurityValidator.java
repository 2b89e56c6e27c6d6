package dev.tmcp.server.security;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;

import dev.tmcp.server.config.TransportSecurityProperties;
import dev.tmcp.transport.TmcpProtocol;

/**
 * Request checks applied before a transport touches any state: content type of POSTed envelopes and,
 * unless disabled, Host and Origin allow-lists against DNS rebinding.
 */
public class TransportSecurityValidator {

	private static final Logger logger = LoggerFactory.getLogger(TransportSecurityValidator.class);

	private static final MediaType ENVELOPE_TYPE = MediaType.parseMediaType(TmcpProtocol.CONTENT_TYPE);

	private final TransportSecurityProperties properties;

	public TransportSecurityValidator(TransportSecurityProperties properties) {
		this.properties = properties;
	}

	/**
	 * @param headers request headers
	 * @param isPost whether the request carries an envelope body
	 * @return the failure to answer with, or empty when the request may proceed
	 */
	public Optional<ValidationFailure> validate(HttpHeaders headers, boolean isPost) {
		if (isPost) {
			String contentType = headers.getFirst(HttpHeaders.CONTENT_TYPE);
			if (!isEnvelopeType(contentType)) {
				logger.warn("Invalid Content-Type header: {}", contentType);
				return Optional.of(new ValidationFailure(400, "Invalid Content-Type header"));
			}
		}
		if (!this.properties.enableDnsRebindingProtection()) {
			return Optional.empty();
		}
		String host = headers.getFirst(HttpHeaders.HOST);
		if (!matches(host, this.properties.allowedHosts())) {
			logger.warn("Invalid Host header: {}", host);
			return Optional.of(new ValidationFailure(421, "Invalid Host header"));
		}
		String origin = headers.getFirst(HttpHeaders.ORIGIN);
		if (origin != null && !matches(origin, this.properties.allowedOrigins())) {
			logger.warn("Invalid Origin header: {}", origin);
			return Optional.of(new ValidationFailure(403, "Invalid Origin header"));
		}
		return Optional.empty();
	}

	private static boolean matches(String value, List<String> allowed) {
		if (value == null || value.isEmpty()) {
			return false;
		}
		for (String candidate : allowed) {
			if (candidate.equals(value)) {
				return true;
			}
			if (candidate.endsWith(":*")) {
				String prefix = candidate.substring(0, candidate.length() - 2);
				if (value.equals(prefix) || value.startsWith(prefix + ":")) {
					return true;
				}
			}
		}
		return false;
	}

	private static boolean isEnvelopeType(String contentType) {
		if (contentType == null) {
			return false;
		}
		try {
			return ENVELOPE_TYPE.equalsTypeAndSubtype(MediaType.parseMediaType(contentType));
		}
		catch (InvalidMediaTypeException ex) {
			return false;
		}
	}

}
