package dev.tmcp.transport;

import dev.tmcp.TmcpException;

public class SubprotocolMismatchException extends TmcpException {

    public SubprotocolMismatchException(String negotiated) {
        super("Expected WebSocket subprotocol '" + TmcpProtocol.SUBPROTOCOL + "' but server selected '" + negotiated + "'");
    }
}
