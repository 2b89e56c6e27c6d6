package dev.tmcp.client;

import java.time.Duration;
import lombok.Builder;

/**
 * Timeouts and framing of the client transports.
 *
 * @param timeout HTTP timeout for connecting, the endpoint handshake and every POST
 * @param sseReadTimeout longest silence tolerated on an SSE stream
 * @param binaryFrames send WebSocket envelopes as binary frames instead of base64 text
 */
@Builder(toBuilder = true)
public record ClientTransportSettings(Duration timeout, Duration sseReadTimeout, boolean binaryFrames) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    public static final Duration DEFAULT_SSE_READ_TIMEOUT = Duration.ofMinutes(5);

    public static ClientTransportSettings defaults() {
        return new ClientTransportSettings(DEFAULT_TIMEOUT, DEFAULT_SSE_READ_TIMEOUT, false);
    }
}
