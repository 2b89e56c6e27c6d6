package dev.tmcp.client;

import dev.tmcp.transport.ChannelClosedException;
import dev.tmcp.transport.DuplexStreams;
import dev.tmcp.transport.InboundMessage;
import io.modelcontextprotocol.spec.McpSchema;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request/response correlation on top of a secure session: sends JSON-RPC requests on the outbound
 * stream and completes them from responses read off the inbound stream.
 */
public class TmcpClientSession implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TmcpClientSession.class);

    private static final int METHOD_NOT_FOUND = -32601;

    private final DuplexStreams streams;
    private final AtomicInteger requestCounter = new AtomicInteger();
    private final Map<Object, CompletableFuture<McpSchema.JSONRPCResponse>> pending = new ConcurrentHashMap<>();
    private final Thread readerThread;

    public TmcpClientSession(DuplexStreams streams) {
        this.streams = streams;
        this.readerThread = new Thread(this::readLoop, "tmcp-client-reader");
        this.readerThread.setDaemon(true);
        this.readerThread.start();
    }

    private void readLoop() {
        try {
            while (true) {
                InboundMessage inbound = streams.inbound().receive();
                if (inbound instanceof InboundMessage.Failed failed) {
                    LOGGER.warn("Undecodable message from {}: {}", streams.peerDid(), failed.error().getMessage());
                    continue;
                }
                McpSchema.JSONRPCMessage message = ((InboundMessage.Delivered) inbound).message();
                if (message instanceof McpSchema.JSONRPCResponse response) {
                    handleResponse(response);
                } else if (message instanceof McpSchema.JSONRPCRequest request) {
                    LOGGER.warn("Unhandled server method {}", request.method());
                    streams.outbound().send(new McpSchema.JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), null,
                        new McpSchema.JSONRPCResponse.JSONRPCError(METHOD_NOT_FOUND,
                            "Method not found: " + request.method(), null)));
                } else {
                    LOGGER.info("Notification: {}", message);
                }
            }
        } catch (ChannelClosedException e) {
            LOGGER.debug("Session with {} closed", streams.peerDid());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            for (CompletableFuture<McpSchema.JSONRPCResponse> future : pending.values()) {
                future.completeExceptionally(new IOException("Connection closed"));
            }
            pending.clear();
        }
    }

    private void handleResponse(McpSchema.JSONRPCResponse response) {
        CompletableFuture<McpSchema.JSONRPCResponse> future = pending.remove(response.id());
        if (future == null) {
            LOGGER.warn("No pending request for {}", response.id());
            return;
        }
        future.complete(response);
    }

    /**
     * Send a request and wait for its response.
     *
     * @param params request parameters, serialised with Jackson; may be {@code null}
     * @return the response, which may carry a JSON-RPC error
     */
    public McpSchema.JSONRPCResponse request(String method, Object params, Duration timeout) throws Exception {
        String id = "cli-" + requestCounter.incrementAndGet();
        CompletableFuture<McpSchema.JSONRPCResponse> future = new CompletableFuture<>();
        pending.put(id, future);
        try {
            streams.outbound().send(new McpSchema.JSONRPCRequest(McpSchema.JSONRPC_VERSION, method, id, params));
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.remove(id);
            throw e;
        }
    }

    public McpSchema.JSONRPCResponse ping(Duration timeout) throws Exception {
        return request(McpSchema.METHOD_PING, null, timeout);
    }

    public DuplexStreams streams() {
        return streams;
    }

    @Override
    public void close() {
        streams.close();
        readerThread.interrupt();
    }
}
