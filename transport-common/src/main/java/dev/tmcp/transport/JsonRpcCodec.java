package dev.tmcp.transport;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.tmcp.channel.EnvelopeDecodeException;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * JSON encoding of JSON-RPC messages and SSE session events as they appear inside sealed envelopes.
 */
public final class JsonRpcCodec {

    private final ObjectMapper mapper;

    public JsonRpcCodec() {
        this(new ObjectMapper());
    }

    public JsonRpcCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Parse a JSON-RPC request, notification or response.
     * @throws EnvelopeDecodeException when the text is not a JSON-RPC message
     */
    public McpSchema.JSONRPCMessage parse(String json) {
        try {
            return McpSchema.deserializeJsonRpcMessage(this.mapper, json);
        }
        catch (IOException | IllegalArgumentException ex) {
            throw new EnvelopeDecodeException("Could not parse message", ex);
        }
    }

    public String serialize(McpSchema.JSONRPCMessage message) {
        try {
            return this.mapper.writeValueAsString(message);
        }
        catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialise MCP message", ex);
        }
    }

    public String encodeEvent(SessionEvent event) {
        ObjectNode node = this.mapper.createObjectNode();
        node.put("event", event.type().wireName());
        node.put("data", event.data());
        return node.toString();
    }

    /**
     * @throws EnvelopeDecodeException when the text is not an event object of a known kind
     */
    public SessionEvent decodeEvent(String json) {
        try {
            JsonNode node = this.mapper.readTree(json);
            JsonNode event = node.path("event");
            JsonNode data = node.path("data");
            if (!event.isTextual() || !data.isTextual()) {
                throw new EnvelopeDecodeException("SSE event requires textual 'event' and 'data' fields");
            }
            return new SessionEvent(SessionEventType.fromWireName(event.asText()), data.asText());
        }
        catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new EnvelopeDecodeException("Could not parse SSE event", ex);
        }
    }

    public ObjectMapper mapper() {
        return this.mapper;
    }

}
