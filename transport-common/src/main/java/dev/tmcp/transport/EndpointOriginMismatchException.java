package dev.tmcp.transport;

import dev.tmcp.TmcpException;

/**
 * Raised by an SSE client when the endpoint announced by the server points at a different origin
 * than the stream it was announced on.
 */
public class EndpointOriginMismatchException extends TmcpException {

    public EndpointOriginMismatchException(String endpoint) {
        super("Endpoint origin does not match connection origin: " + endpoint);
    }
}
