package dev.tmcp.transport;

import io.modelcontextprotocol.spec.McpSchema;

/**
 * Element of an inbound channel: either a decoded JSON-RPC message or the failure that prevented one
 * from being decoded. Failures are delivered in-line so the consumer can log or correlate them without
 * the stream being torn down.
 */
public sealed interface InboundMessage permits InboundMessage.Delivered, InboundMessage.Failed {

    static InboundMessage delivered(McpSchema.JSONRPCMessage message) {
        return new Delivered(message);
    }

    static InboundMessage failed(Exception error) {
        return new Failed(error);
    }

    /**
     * A message that was opened and parsed successfully.
     * @param message the decoded JSON-RPC message
     */
    record Delivered(McpSchema.JSONRPCMessage message) implements InboundMessage {
    }

    /**
     * A frame, event or POST body that could not be opened or parsed.
     * @param error the decoding failure
     */
    record Failed(Exception error) implements InboundMessage {
    }

}
