package dev.tmcp.testing;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import dev.tmcp.directory.DirectoryClient;
import dev.tmcp.identity.IdentityDocument;
import dev.tmcp.identity.IdentityUnreachableException;

/**
 * Directory shared by every party of a test. Records what was published and can be switched offline.
 */
public class InMemoryDirectoryClient implements DirectoryClient {

    private final Map<String, IdentityDocument> documents = new ConcurrentHashMap<>();

    private final List<IdentityDocument> publishedDocuments = new CopyOnWriteArrayList<>();

    private final List<String> publishedHistories = new CopyOnWriteArrayList<>();

    private volatile boolean offline;

    @Override
    public Optional<IdentityDocument> resolve(String did) {
        if (this.offline) {
            throw new IdentityUnreachableException(did, new IOException("directory offline"));
        }
        return Optional.ofNullable(this.documents.get(did));
    }

    @Override
    public void publishDocument(IdentityDocument document) {
        this.publishedDocuments.add(document);
        this.documents.put(document.id(), document);
    }

    @Override
    public void publishHistory(String did, String history) {
        this.publishedHistories.add(history);
    }

    /**
     * Point an already published identity at a new transport URL.
     */
    public void updateTransport(String did, String transport) {
        this.documents.computeIfPresent(did, (key, doc) -> new IdentityDocument(doc.id(), transport, doc.publicKey()));
    }

    public void forget(String did) {
        this.documents.remove(did);
    }

    public void setOffline(boolean offline) {
        this.offline = offline;
    }

    public List<IdentityDocument> publishedDocuments() {
        return new ArrayList<>(this.publishedDocuments);
    }

    public List<String> publishedHistories() {
        return new ArrayList<>(this.publishedHistories);
    }
}
