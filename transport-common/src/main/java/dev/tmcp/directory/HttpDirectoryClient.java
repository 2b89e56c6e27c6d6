package dev.tmcp.directory;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import dev.tmcp.identity.IdentityDocument;
import dev.tmcp.identity.IdentityUnreachableException;
import dev.tmcp.identity.PublishFailedException;
import dev.tmcp.identity.TmcpSettings;

/**
 * {@link DirectoryClient} speaking plain HTTP: documents are POSTed to a publish URL, history entries
 * to a per-DID history URL, and resolved with a GET on the did:web location (or a configured resolve
 * template).
 */
public class HttpDirectoryClient implements DirectoryClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpDirectoryClient.class);

    private final RestClient restClient;

    private final String publishUrl;

    private final String historyUrlTemplate;

    private final String resolveUrlTemplate;

    /**
     * @param resolveUrlTemplate URL with a {@code {did}} placeholder, or {@code null} to derive the
     * location from the DID itself; DIDs of other methods then resolve to nothing
     */
    public HttpDirectoryClient(RestClient restClient, String publishUrl, String historyUrlTemplate,
            String resolveUrlTemplate) {
        this.restClient = restClient;
        this.publishUrl = publishUrl;
        this.historyUrlTemplate = historyUrlTemplate;
        this.resolveUrlTemplate = resolveUrlTemplate;
    }

    public static HttpDirectoryClient create(TmcpSettings settings, Duration timeout) {
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);
        RestClient restClient = RestClient.builder().requestFactory(requestFactory).build();
        return new HttpDirectoryClient(restClient, settings.didPublishUrl(), settings.didPublishHistoryUrl(),
                settings.didResolveUrl());
    }

    @Override
    public Optional<IdentityDocument> resolve(String did) {
        RestClient.RequestHeadersSpec<?> request;
        if (this.resolveUrlTemplate != null) {
            request = this.restClient.get().uri(this.resolveUrlTemplate, did);
        }
        else {
            URI location;
            try {
                location = DidUrls.documentUrl(did);
            }
            catch (IllegalArgumentException ex) {
                logger.debug("Cannot locate {}: {}", did, ex.getMessage());
                return Optional.empty();
            }
            request = this.restClient.get().uri(location);
        }
        IdentityDocument document;
        try {
            document = request.accept(MediaType.APPLICATION_JSON).retrieve().body(IdentityDocument.class);
        }
        catch (HttpClientErrorException.NotFound ex) {
            logger.debug("Directory does not know {}", did);
            return Optional.empty();
        }
        catch (RestClientException ex) {
            throw new IdentityUnreachableException(did, ex);
        }
        if (document == null || !did.equals(document.id())) {
            throw new IdentityUnreachableException(did,
                    new IllegalStateException("Directory returned no document for the requested DID"));
        }
        return Optional.of(document);
    }

    @Override
    public void publishDocument(IdentityDocument document) {
        try {
            this.restClient.post()
                .uri(this.publishUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .body(document)
                .retrieve()
                .toBodilessEntity();
        }
        catch (RestClientResponseException ex) {
            throw new PublishFailedException(this.publishUrl, ex.getStatusCode().value());
        }
        catch (RestClientException ex) {
            throw new PublishFailedException(this.publishUrl, ex);
        }
    }

    @Override
    public void publishHistory(String did, String history) {
        try {
            this.restClient.post()
                .uri(this.historyUrlTemplate, did)
                .contentType(MediaType.APPLICATION_JSON)
                .body(history)
                .retrieve()
                .toBodilessEntity();
        }
        catch (RestClientResponseException ex) {
            throw new PublishFailedException(this.historyUrlTemplate, ex.getStatusCode().value());
        }
        catch (RestClientException ex) {
            throw new PublishFailedException(this.historyUrlTemplate, ex);
        }
    }
}
