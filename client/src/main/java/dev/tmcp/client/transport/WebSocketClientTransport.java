package dev.tmcp.client.transport;

import dev.tmcp.TmcpException;
import dev.tmcp.channel.EnvelopeDecodeException;
import dev.tmcp.client.ClientTransportSettings;
import dev.tmcp.identity.Connection;
import dev.tmcp.identity.IdentityManager;
import dev.tmcp.transport.ChannelClosedException;
import dev.tmcp.transport.ConnectionScope;
import dev.tmcp.transport.DuplexStreams;
import dev.tmcp.transport.InboundMessage;
import dev.tmcp.transport.JsonRpcCodec;
import dev.tmcp.transport.SubprotocolMismatchException;
import dev.tmcp.transport.TmcpProtocol;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakeException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;

/**
 * Client side of the WebSocket transport. Negotiates the {@code mcp} subprotocol and carries one
 * sealed envelope per frame in each direction.
 */
public class WebSocketClientTransport implements ClientTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClientTransport.class);

    private final IdentityManager identityManager;
    private final ClientTransportSettings settings;
    private final ExecutorService executor;
    private final JsonRpcCodec codec = new JsonRpcCodec();
    private final ReactorNettyWebSocketClient webSocketClient;

    public WebSocketClientTransport(IdentityManager identityManager, ClientTransportSettings settings) {
        this(identityManager, settings, ClientExecutors.daemonPool("tmcp-ws-client-"));
    }

    public WebSocketClientTransport(IdentityManager identityManager, ClientTransportSettings settings,
                                    ExecutorService executor) {
        this.identityManager = identityManager;
        this.settings = settings;
        this.executor = executor;
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) settings.timeout().toMillis());
        this.webSocketClient = new ReactorNettyWebSocketClient(httpClient);
    }

    /**
     * @throws SubprotocolMismatchException when the server does not agree to the {@code mcp} subprotocol
     * @throws IllegalArgumentException when the server does not publish a WebSocket transport
     */
    @Override
    public DuplexStreams connect(String serverDid) throws InterruptedException {
        Connection connection = identityManager.connect(serverDid);
        URI uri = TmcpProtocol.requireWebSocket(connection.resolveEndpoint(true));
        ConnectionScope scope = new ConnectionScope("ws-client-" + UUID.randomUUID().toString().substring(0, 8),
            executor);
        DuplexStreams streams = DuplexStreams.open(serverDid, scope);
        CompletableFuture<Void> opened = new CompletableFuture<>();
        scope.onClose(() -> opened.completeExceptionally(new ChannelClosedException(scope.name())));

        LOGGER.info("Connecting to WebSocket endpoint {}", uri);
        Disposable subscription = webSocketClient.execute(uri, new SessionHandler(connection, streams, opened))
            .doFinally(signal -> scope.close())
            .subscribe(null, error -> {
                Throwable failure = translate(error);
                if (!opened.completeExceptionally(failure)) {
                    LOGGER.warn("WebSocket {} failed: {}", uri, failure.toString());
                }
            });
        scope.onClose(subscription::dispose);

        try {
            opened.get(settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            scope.close();
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new TmcpException("WebSocket connection to " + uri + " failed", e.getCause());
        } catch (TimeoutException e) {
            scope.close();
            throw new TmcpException("WebSocket handshake with " + uri + " timed out");
        }
        LOGGER.info("WebSocket session {} open", scope.name());
        return streams;
    }

    private static Throwable translate(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof WebSocketClientHandshakeException handshake && handshake.getMessage() != null
                && handshake.getMessage().contains("subprotocol")) {
                return new SubprotocolMismatchException(selectedSubprotocol(handshake));
            }
        }
        return error;
    }

    private static String selectedSubprotocol(WebSocketClientHandshakeException handshake) {
        HttpResponse response = handshake.response();
        String selected = response == null ? null : response.headers().get(HttpHeaderNames.SEC_WEBSOCKET_PROTOCOL);
        return selected == null || selected.isBlank() ? "none" : selected.trim();
    }

    private final class SessionHandler implements WebSocketHandler {

        private final Connection connection;
        private final DuplexStreams streams;
        private final CompletableFuture<Void> opened;

        private SessionHandler(Connection connection, DuplexStreams streams, CompletableFuture<Void> opened) {
            this.connection = connection;
            this.streams = streams;
            this.opened = opened;
        }

        @Override
        public List<String> getSubProtocols() {
            return List.of(TmcpProtocol.SUBPROTOCOL);
        }

        @Override
        public Mono<Void> handle(WebSocketSession session) {
            String negotiated = session.getHandshakeInfo().getSubProtocol();
            if (!TmcpProtocol.SUBPROTOCOL.equals(negotiated)) {
                opened.completeExceptionally(new SubprotocolMismatchException(negotiated == null ? "none" : negotiated));
                return session.close(CloseStatus.PROTOCOL_ERROR);
            }
            opened.complete(null);

            // frame buffers are released after emission
            Mono<Void> input = session.receive()
                .map(RawFrame::copyOf)
                .publishOn(Schedulers.boundedElastic())
                .doOnNext(this::receive)
                .then();
            Flux<WebSocketMessage> frames = Flux.<String>generate(sink -> {
                try {
                    sink.next(codec.serialize(streams.outbound().receive()));
                } catch (ChannelClosedException e) {
                    sink.complete();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    sink.complete();
                }
            })
                .subscribeOn(Schedulers.boundedElastic())
                .map(json -> toFrame(session, json));
            Mono<Void> output = session.send(frames);
            return Mono.firstWithSignal(input, output);
        }

        private WebSocketMessage toFrame(WebSocketSession session, String json) {
            if (settings.binaryFrames()) {
                byte[] envelope = connection.sealToBytes(json);
                return session.binaryMessage(factory -> factory.wrap(envelope));
            }
            return session.textMessage(connection.seal(json));
        }

        private void receive(RawFrame frame) {
            InboundMessage inbound;
            try {
                String plaintext = frame.binary() != null
                    ? connection.open(frame.binary())
                    : connection.open(frame.text());
                inbound = InboundMessage.delivered(codec.parse(plaintext));
            } catch (EnvelopeDecodeException e) {
                LOGGER.warn("Undecodable frame from {}: {}", streams.peerDid(), e.getMessage());
                inbound = InboundMessage.failed(e);
            }
            try {
                streams.inbound().send(inbound);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                streams.close();
            }
        }
    }

    private record RawFrame(String text, byte[] binary) {

        static RawFrame copyOf(WebSocketMessage frame) {
            if (frame.getType() == WebSocketMessage.Type.BINARY) {
                byte[] envelope = new byte[frame.getPayload().readableByteCount()];
                frame.getPayload().read(envelope);
                return new RawFrame(null, envelope);
            }
            return new RawFrame(frame.getPayloadAsText(StandardCharsets.US_ASCII), null);
        }
    }
}
