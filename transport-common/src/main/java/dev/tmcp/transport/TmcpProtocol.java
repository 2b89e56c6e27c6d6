package dev.tmcp.transport;

import java.net.URI;

/**
 * Wire-level constants shared by the client and server transports.
 */
public final class TmcpProtocol {

    /** WebSocket subprotocol both sides must agree on. */
    public static final String SUBPROTOCOL = "mcp";

    /** Content type of POSTed envelopes. */
    public static final String CONTENT_TYPE = "application/tsp";

    /** Query parameter carrying the connecting party's DID. */
    public static final String DID_PARAMETER = "did";

    private TmcpProtocol() {
    }

    /**
     * Map an {@code sse://} or {@code sses://} transport URL onto the HTTP URL it is served from.
     * @param transportUrl URL published in the server's identity document
     * @return the equivalent {@code http} or {@code https} URI
     * @throws IllegalArgumentException when the URL does not name an SSE transport
     */
    public static URI sseToHttp(String transportUrl) {
        if (transportUrl.startsWith("sse://")) {
            return URI.create("http://" + transportUrl.substring("sse://".length()));
        }
        if (transportUrl.startsWith("sses://")) {
            return URI.create("https://" + transportUrl.substring("sses://".length()));
        }
        throw new IllegalArgumentException("Server does not use SSE for transport: " + transportUrl);
    }

    public static URI requireWebSocket(String transportUrl) {
        if (!transportUrl.startsWith("ws://") && !transportUrl.startsWith("wss://")) {
            throw new IllegalArgumentException("Server does not use WebSockets for transport: " + transportUrl);
        }
        return URI.create(transportUrl);
    }
}
