package dev.tmcp.server.handler;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.tmcp.transport.DuplexStreams;
import dev.tmcp.transport.InboundMessage;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * Minimal handler answering {@code ping} and rejecting every other request as unknown.
 */
public class PingSessionHandler implements DuplexSessionHandler {

	private static final Logger logger = LoggerFactory.getLogger(PingSessionHandler.class);

	static final int METHOD_NOT_FOUND = -32601;

	@Override
	public void handle(DuplexStreams streams) throws InterruptedException {
		logger.info("Session opened for {}", streams.peerDid());
		while (true) {
			InboundMessage inbound = streams.inbound().receive();
			if (inbound instanceof InboundMessage.Failed failed) {
				logger.warn("Undecodable message from {}: {}", streams.peerDid(), failed.error().getMessage());
				continue;
			}
			McpSchema.JSONRPCMessage message = ((InboundMessage.Delivered) inbound).message();
			if (message instanceof McpSchema.JSONRPCRequest request) {
				streams.outbound().send(respond(request));
			}
			else {
				logger.debug("Ignoring {} from {}", message, streams.peerDid());
			}
		}
	}

	McpSchema.JSONRPCResponse respond(McpSchema.JSONRPCRequest request) {
		if (McpSchema.METHOD_PING.equals(request.method())) {
			return new McpSchema.JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), Map.of(), null);
		}
		logger.debug("Unknown method {}", request.method());
		return new McpSchema.JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), null,
				new McpSchema.JSONRPCResponse.JSONRPCError(METHOD_NOT_FOUND, "Method not found: " + request.method(),
						null));
	}

}
