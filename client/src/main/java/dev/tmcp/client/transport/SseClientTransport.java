package dev.tmcp.client.transport;

import dev.tmcp.TmcpException;
import dev.tmcp.channel.EnvelopeDecodeException;
import dev.tmcp.client.ClientTransportSettings;
import dev.tmcp.identity.Connection;
import dev.tmcp.identity.IdentityManager;
import dev.tmcp.transport.ChannelClosedException;
import dev.tmcp.transport.ConnectionScope;
import dev.tmcp.transport.DuplexStreams;
import dev.tmcp.transport.EndpointOriginMismatchException;
import dev.tmcp.transport.InboundMessage;
import dev.tmcp.transport.JsonRpcCodec;
import dev.tmcp.transport.SessionEvent;
import dev.tmcp.transport.TmcpProtocol;
import io.modelcontextprotocol.spec.McpSchema;
import io.netty.channel.ChannelOption;
import java.net.URI;
import java.util.Iterator;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.netty.http.client.HttpClient;

/**
 * Client side of the SSE transport. Opens the event stream of a server, learns the callback endpoint
 * from the first sealed event and POSTs sealed messages to it.
 */
public class SseClientTransport implements ClientTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(SseClientTransport.class);

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
        new ParameterizedTypeReference<>() {
        };

    private final IdentityManager identityManager;
    private final ClientTransportSettings settings;
    private final ExecutorService executor;
    private final JsonRpcCodec codec = new JsonRpcCodec();
    private final WebClient webClient;

    public SseClientTransport(IdentityManager identityManager, ClientTransportSettings settings) {
        this(identityManager, settings, ClientExecutors.daemonPool("tmcp-sse-client-"));
    }

    public SseClientTransport(IdentityManager identityManager, ClientTransportSettings settings,
                              ExecutorService executor) {
        this.identityManager = identityManager;
        this.settings = settings;
        this.executor = executor;
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) settings.timeout().toMillis());
        this.webClient = WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }

    /**
     * @throws EndpointOriginMismatchException when the server announces an endpoint on another origin
     * @throws IllegalArgumentException when the server does not publish an SSE transport
     */
    @Override
    public DuplexStreams connect(String serverDid) throws InterruptedException {
        Connection connection = identityManager.connect(serverDid);
        URI streamUrl = TmcpProtocol.sseToHttp(connection.resolveEndpoint(true));
        ConnectionScope scope = new ConnectionScope("sse-client-" + UUID.randomUUID().toString().substring(0, 8),
            executor);
        DuplexStreams streams = DuplexStreams.open(serverDid, scope);
        CompletableFuture<URI> endpoint = new CompletableFuture<>();
        scope.onClose(() -> endpoint.completeExceptionally(new ChannelClosedException(scope.name())));

        LOGGER.info("Connecting to SSE endpoint {}", streamUrl);
        Flux<ServerSentEvent<String>> events = webClient.get()
            .uri(streamUrl)
            .accept(MediaType.TEXT_EVENT_STREAM)
            .retrieve()
            .bodyToFlux(SSE_TYPE)
            .timeout(settings.sseReadTimeout());
        scope.launch("sse-reader", () -> readEvents(events, connection, streamUrl, endpoint, streams));

        URI postUrl = awaitEndpoint(endpoint, scope, streamUrl);
        LOGGER.info("Endpoint URL: {}", postUrl);
        scope.launch("sse-writer", () -> postMessages(postUrl, connection, streams));
        return streams;
    }

    private URI awaitEndpoint(CompletableFuture<URI> endpoint, ConnectionScope scope, URI streamUrl)
        throws InterruptedException {
        try {
            return endpoint.get(settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            scope.close();
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new TmcpException("SSE connection to " + streamUrl + " failed", cause);
        } catch (TimeoutException e) {
            scope.close();
            throw new TmcpException("No endpoint event from " + streamUrl + " within " + settings.timeout());
        } catch (InterruptedException e) {
            scope.close();
            throw e;
        }
    }

    private void readEvents(Flux<ServerSentEvent<String>> events, Connection connection, URI streamUrl,
                            CompletableFuture<URI> endpoint, DuplexStreams streams) throws InterruptedException {
        try (Stream<ServerSentEvent<String>> stream = events.toStream(1)) {
            streams.scope().onClose(stream::close);
            Iterator<ServerSentEvent<String>> iterator = stream.iterator();
            while (iterator.hasNext()) {
                ServerSentEvent<String> sse = iterator.next();
                if (sse.data() == null) {
                    continue;
                }
                handleEvent(sse, connection, streamUrl, endpoint, streams);
            }
            LOGGER.info("SSE stream from {} ended", streamUrl);
            endpoint.completeExceptionally(new TmcpException("SSE stream ended before the endpoint event"));
        } catch (TmcpException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable error = Exceptions.unwrap(e);
            if (error instanceof InterruptedException interrupted) {
                throw interrupted;
            }
            if (!endpoint.completeExceptionally(error)) {
                LOGGER.error("SSE stream from {} failed: {}", streamUrl, error.toString());
                Exception failure = error instanceof Exception exception ? exception : new TmcpException(error.toString(), error);
                streams.inbound().send(InboundMessage.failed(failure));
            }
        }
    }

    private void handleEvent(ServerSentEvent<String> sse, Connection connection, URI streamUrl,
                             CompletableFuture<URI> endpoint, DuplexStreams streams) throws InterruptedException {
        SessionEvent event;
        try {
            event = codec.decodeEvent(connection.open(sse.data()));
        } catch (EnvelopeDecodeException e) {
            LOGGER.warn("Could not open {} event: {}", sse.event(), e.getMessage());
            if (!endpoint.isDone()) {
                endpoint.completeExceptionally(e);
                throw e;
            }
            streams.inbound().send(InboundMessage.failed(e));
            return;
        }
        switch (event.type()) {
            case ENDPOINT -> {
                URI resolved = streamUrl.resolve(event.data());
                if (!sameOrigin(streamUrl, resolved)) {
                    EndpointOriginMismatchException mismatch = new EndpointOriginMismatchException(resolved.toString());
                    LOGGER.error(mismatch.getMessage());
                    endpoint.completeExceptionally(mismatch);
                    throw mismatch;
                }
                endpoint.complete(resolved);
            }
            case MESSAGE -> {
                if (!endpoint.isDone()) {
                    TmcpException early = new TmcpException("Received a message event before the endpoint event");
                    LOGGER.error(early.getMessage());
                    endpoint.completeExceptionally(early);
                    throw early;
                }
                InboundMessage inbound;
                try {
                    inbound = InboundMessage.delivered(codec.parse(event.data()));
                } catch (EnvelopeDecodeException e) {
                    LOGGER.warn("Error parsing server message: {}", e.getMessage());
                    inbound = InboundMessage.failed(e);
                }
                streams.inbound().send(inbound);
            }
        }
    }

    private void postMessages(URI postUrl, Connection connection, DuplexStreams streams) throws InterruptedException {
        MediaType contentType = MediaType.parseMediaType(TmcpProtocol.CONTENT_TYPE);
        while (true) {
            McpSchema.JSONRPCMessage message = streams.outbound().receive();
            String body = connection.seal(codec.serialize(message));
            try {
                webClient.post()
                    .uri(postUrl)
                    .contentType(contentType)
                    .bodyValue(body)
                    .retrieve()
                    .toBodilessEntity()
                    .block(settings.timeout());
            } catch (WebClientResponseException e) {
                LOGGER.error("POST to {} rejected with {}: {}", postUrl, e.getStatusCode().value(),
                    e.getResponseBodyAsString());
                return;
            }
            LOGGER.debug("Client message sent successfully");
        }
    }

    static boolean sameOrigin(URI expected, URI actual) {
        return expected.getScheme().equalsIgnoreCase(actual.getScheme())
            && expected.getHost() != null
            && expected.getHost().equalsIgnoreCase(actual.getHost())
            && effectivePort(expected) == effectivePort(actual);
    }

    private static int effectivePort(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }
}
