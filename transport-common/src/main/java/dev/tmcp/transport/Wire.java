package dev.tmcp.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs sealed traffic in the same format on both ends so that client and server logs line up.
 * Enabled per connection through the verbose flag.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private static final int MAX_LOGGED = 200;

    private Wire() {
    }

    public static void sealed(String local, String peer, String plaintext, int envelopeBytes) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("SEAL from={} to={} bytes={} json={}", local, peer, envelopeBytes,
                truncate(plaintext, MAX_LOGGED));
        }
    }

    public static void opened(String sender, String receiver, int envelopeBytes, String plaintext) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("OPEN from={} to={} bytes={} json={}", sender, receiver, envelopeBytes,
                truncate(plaintext, MAX_LOGGED));
        }
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "…";
    }
}
