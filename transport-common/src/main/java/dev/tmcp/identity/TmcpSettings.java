package dev.tmcp.identity;

import lombok.Builder;

/**
 * Identity and directory settings shared by clients and servers. Start from {@link #defaults()} and
 * override through {@link #toBuilder()}.
 * @param didPublishUrl where new identity documents are POSTed
 * @param didPublishHistoryUrl where history entries are POSTed, with a {@code {did}} placeholder
 * @param didResolveUrl resolve template with a {@code {did}} placeholder, {@code null} to use the
 * did:web location
 * @param didFormat DID path template with a {@code {name}} placeholder
 * @param transport transport URL published for new identities
 * @param identityFormat DID method for new identities
 * @param maxNameLength cap on generated identity names
 * @param mismatchPolicy handling of envelopes not addressed from the peer to us
 * @param verbose log every sealed and opened envelope through the {@code WIRE} logger
 */
@Builder(toBuilder = true)
public record TmcpSettings(
    String didPublishUrl,
    String didPublishHistoryUrl,
    String didResolveUrl,
    String didFormat,
    String transport,
    IdentityFormat identityFormat,
    int maxNameLength,
    MismatchPolicy mismatchPolicy,
    boolean verbose
) {

    public static final String DEFAULT_PUBLISH_URL = "https://did.teaspoon.world/add-vid";

    public static final String DEFAULT_PUBLISH_HISTORY_URL = "https://did.teaspoon.world/add-history/{did}";

    public static final String DEFAULT_DID_FORMAT = "did.teaspoon.world/endpoint/{name}";

    public static final String DEFAULT_TRANSPORT = "tmcpclient://";

    public static final int DEFAULT_MAX_NAME_LENGTH = 63;

    public static TmcpSettings defaults() {
        return builder()
            .didPublishUrl(DEFAULT_PUBLISH_URL)
            .didPublishHistoryUrl(DEFAULT_PUBLISH_HISTORY_URL)
            .didFormat(DEFAULT_DID_FORMAT)
            .transport(DEFAULT_TRANSPORT)
            .identityFormat(IdentityFormat.WEBVH)
            .maxNameLength(DEFAULT_MAX_NAME_LENGTH)
            .mismatchPolicy(MismatchPolicy.WARN)
            .verbose(false)
            .build();
    }
}
