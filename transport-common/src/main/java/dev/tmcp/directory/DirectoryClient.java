package dev.tmcp.directory;

import java.util.Optional;

import dev.tmcp.identity.IdentityDocument;

/**
 * Remote registry where identity documents are published and resolved.
 */
public interface DirectoryClient {

    /**
     * @return the published document, or empty when the directory does not know the DID
     * @throws dev.tmcp.identity.IdentityUnreachableException when the directory cannot be asked
     */
    Optional<IdentityDocument> resolve(String did);

    /**
     * @throws dev.tmcp.identity.PublishFailedException on any non-2xx reply or transport failure
     */
    void publishDocument(IdentityDocument document);

    /**
     * @throws dev.tmcp.identity.PublishFailedException on any non-2xx reply or transport failure
     */
    void publishHistory(String did, String history);

}
