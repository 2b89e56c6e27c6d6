package dev.tmcp.directory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import dev.tmcp.identity.IdentityDocument;
import dev.tmcp.identity.IdentityUnreachableException;
import dev.tmcp.identity.PublishFailedException;
import dev.tmcp.identity.TmcpSettings;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

class HttpDirectoryClientTest {

    private MockWebServer server;

    private HttpDirectoryClient client;

    @BeforeEach
    void setUp() throws IOException {
        this.server = new MockWebServer();
        this.server.start();
        TmcpSettings settings = TmcpSettings.defaults().toBuilder()
            .didPublishUrl(this.server.url("/add-vid").toString())
            .didPublishHistoryUrl(this.server.url("/add-history/").toString() + "{did}")
            .didResolveUrl(this.server.url("/resolve/").toString() + "{did}")
            .build();
        this.client = HttpDirectoryClient.create(settings, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws IOException {
        this.server.shutdown();
    }

    @Test
    void publishesDocumentAsJson() throws Exception {
        this.server.enqueue(new MockResponse().setResponseCode(200));

        this.client.publishDocument(new IdentityDocument("did:web:example.com:a", "sse://example.com/sse", "key"));

        RecordedRequest request = this.server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/add-vid");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(request.getBody().readUtf8())
            .contains("\"id\":\"did:web:example.com:a\"")
            .contains("\"transport\":\"sse://example.com/sse\"");
    }

    @Test
    void publishesHistoryToPerDidUrl() throws Exception {
        this.server.enqueue(new MockResponse().setResponseCode(201));

        this.client.publishHistory("did:webvh:scid:example.com", "{\"versionId\":\"1-scid\"}");

        RecordedRequest request = this.server.takeRequest();
        assertThat(request.getRequestUrl().encodedPath()).startsWith("/add-history/did");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"versionId\":\"1-scid\"}");
    }

    @Test
    void nonSuccessfulPublishFails() {
        this.server.enqueue(new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> this.client.publishDocument(new IdentityDocument("did:web:x", "t", "k")))
            .isInstanceOf(PublishFailedException.class)
            .hasMessageContaining("500");
    }

    @Test
    void resolvesPublishedDocument() {
        this.server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"id\":\"did:web:x\",\"transport\":\"sse://x/sse\",\"publicKey\":\"k\",\"extra\":true}"));

        assertThat(this.client.resolve("did:web:x"))
            .contains(new IdentityDocument("did:web:x", "sse://x/sse", "k"));
    }

    @Test
    void notFoundIsAnAnswer() {
        this.server.enqueue(new MockResponse().setResponseCode(404));

        assertThat(this.client.resolve("did:web:missing")).isEmpty();
    }

    @Test
    void unsupportedDidMethodIsNotFoundWithoutARequest() {
        HttpDirectoryClient derived = new HttpDirectoryClient(RestClient.create(),
            this.server.url("/add-vid").toString(), this.server.url("/add-history/").toString() + "{did}", null);

        assertThat(derived.resolve("did:key:z6MkhaXgBZDvotDkL5257faiztiGiC2QtKLGpbnnEGta2doK")).isEmpty();
        assertThat(this.server.getRequestCount()).isZero();
    }

    @Test
    void serverErrorIsUnreachable() {
        this.server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> this.client.resolve("did:web:x")).isInstanceOf(IdentityUnreachableException.class);
    }
}
