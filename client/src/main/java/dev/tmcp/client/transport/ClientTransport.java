package dev.tmcp.client.transport;

import dev.tmcp.transport.DuplexStreams;

/**
 * Opens a secure duplex session to a server identified by its DID.
 */
public interface ClientTransport {

    /**
     * Resolve the server, open the transport and wait until it is ready to carry messages.
     *
     * @param serverDid DID of the server
     * @return the streams of the new session; closing them ends the session
     */
    DuplexStreams connect(String serverDid) throws InterruptedException;
}
