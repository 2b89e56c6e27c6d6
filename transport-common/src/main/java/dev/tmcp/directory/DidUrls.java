package dev.tmcp.directory;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Maps web DIDs onto the HTTPS location of their document.
 */
public final class DidUrls {

    private static final String WEB_PREFIX = "did:web:";

    private static final String WEBVH_PREFIX = "did:webvh:";

    private DidUrls() {
    }

    /**
     * {@code did:web:host%3A8080:a:b} maps to {@code https://host:8080/a/b/did.json}; a DID without a
     * path maps to {@code /.well-known/did.json}. For {@code did:webvh} the leading SCID segment is
     * skipped.
     * @throws IllegalArgumentException for any other DID method
     */
    public static URI documentUrl(String did) {
        String methodSpecificId;
        if (did.startsWith(WEB_PREFIX)) {
            methodSpecificId = did.substring(WEB_PREFIX.length());
        }
        else if (did.startsWith(WEBVH_PREFIX)) {
            String rest = did.substring(WEBVH_PREFIX.length());
            int colon = rest.indexOf(':');
            if (colon < 0) {
                throw new IllegalArgumentException("did:webvh requires an SCID and a host: " + did);
            }
            methodSpecificId = rest.substring(colon + 1);
        }
        else {
            throw new IllegalArgumentException("Unsupported DID method: " + did);
        }
        String[] segments = methodSpecificId.split(":");
        if (segments[0].isEmpty()) {
            throw new IllegalArgumentException("DID has no host: " + did);
        }
        StringBuilder url = new StringBuilder("https://")
            .append(URLDecoder.decode(segments[0], StandardCharsets.UTF_8));
        if (segments.length == 1) {
            url.append("/.well-known");
        }
        for (int i = 1; i < segments.length; i++) {
            url.append('/').append(segments[i]);
        }
        return URI.create(url.append("/did.json").toString());
    }
}
