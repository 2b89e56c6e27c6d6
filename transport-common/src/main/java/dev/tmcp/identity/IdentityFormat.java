package dev.tmcp.identity;

/**
 * DID methods an identity can be created for.
 */
public enum IdentityFormat {

    /** {@code did:web}: a single published document. */
    WEB(false),

    /** {@code did:webvh}: a document plus a verifiable history log. */
    WEBVH(true);

    private final boolean historyChain;

    IdentityFormat(boolean historyChain) {
        this.historyChain = historyChain;
    }

    /**
     * @return {@code true} when creating an identity also produces a history artifact to publish
     */
    public boolean hasHistory() {
        return this.historyChain;
    }
}
