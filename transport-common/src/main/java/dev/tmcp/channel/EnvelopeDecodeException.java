package dev.tmcp.channel;

import dev.tmcp.TmcpException;

/**
 * Ciphertext or payload that could not be decoded, opened or parsed. Transports deliver it as a value
 * on the inbound channel rather than dropping the connection.
 */
public class EnvelopeDecodeException extends TmcpException {

    public EnvelopeDecodeException(String message) {
        super(message);
    }

    public EnvelopeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
