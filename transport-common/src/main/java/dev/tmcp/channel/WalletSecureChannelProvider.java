package dev.tmcp.channel;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.tmcp.directory.DirectoryClient;
import dev.tmcp.identity.CreatedIdentity;
import dev.tmcp.identity.Identity;
import dev.tmcp.identity.IdentityDocument;
import dev.tmcp.identity.IdentityFormat;
import dev.tmcp.identity.IdentityNotFoundException;
import dev.tmcp.identity.IdentityStore;
import dev.tmcp.identity.IdentityUnreachableException;
import dev.tmcp.identity.VerificationResult;

/**
 * {@link SecureChannelProvider} backed by a local {@link IdentityStore}, a remote
 * {@link DirectoryClient} and {@link EnvelopeCipher}. Verified peer documents are cached for the
 * lifetime of the provider.
 */
public class WalletSecureChannelProvider implements SecureChannelProvider {

    private static final Logger logger = LoggerFactory.getLogger(WalletSecureChannelProvider.class);

    private static final String WEBVH_METHOD = "did:webvh:0.5";

    private final IdentityStore store;

    private final DirectoryClient directory;

    private final EnvelopeCipher cipher;

    private final ObjectMapper mapper;

    private final Map<String, IdentityDocument> verified = new ConcurrentHashMap<>();

    public WalletSecureChannelProvider(IdentityStore store, DirectoryClient directory) {
        this(store, directory, new ObjectMapper());
    }

    public WalletSecureChannelProvider(IdentityStore store, DirectoryClient directory, ObjectMapper mapper) {
        this.store = store;
        this.directory = directory;
        this.mapper = mapper;
        this.cipher = new EnvelopeCipher(mapper);
    }

    @Override
    public byte[] seal(String localDid, String peerDid, byte[] payload) {
        Identity local = this.store.findByDid(localDid).orElseThrow(() -> new IdentityNotFoundException(localDid));
        return this.cipher.seal(local, document(peerDid), payload);
    }

    @Override
    public OpenedEnvelope open(byte[] envelope) {
        EnvelopeAddress address = this.cipher.peek(envelope);
        Identity receiver = this.store.findByDid(address.receiver())
            .orElseThrow(() -> new EnvelopeDecodeException("No private identity for receiver " + address.receiver()));
        IdentityDocument sender;
        try {
            sender = document(address.sender());
        }
        catch (IdentityNotFoundException | IdentityUnreachableException ex) {
            throw new EnvelopeDecodeException("Unable to verify sender " + address.sender(), ex);
        }
        return this.cipher.open(envelope, receiver, sender);
    }

    @Override
    public EnvelopeAddress peek(byte[] envelope) {
        return this.cipher.peek(envelope);
    }

    @Override
    public VerificationResult verifyIdentity(String did) {
        try {
            Optional<IdentityDocument> document = this.directory.resolve(did);
            if (document.isEmpty()) {
                this.verified.remove(did);
                return new VerificationResult.NotFound(did);
            }
            this.verified.put(did, document.get());
            return new VerificationResult.Resolved(did, document.get().transport());
        }
        catch (IdentityUnreachableException ex) {
            return new VerificationResult.Unreachable(did, ex);
        }
    }

    @Override
    public Optional<Identity> resolveAlias(String alias) {
        return this.store.findByAlias(alias);
    }

    @Override
    public CreatedIdentity createIdentity(String didPath, String transport, IdentityFormat format) {
        KeyPair keyPair = this.cipher.generateKeyPair();
        String publicKey = EnvelopeCipher.encodeKey(keyPair.getPublic());
        String privateKey = EnvelopeCipher.encodeKey(keyPair.getPrivate());
        String methodSpecificId = methodSpecificId(didPath);
        if (format == IdentityFormat.WEB) {
            Identity identity = new Identity("did:web:" + methodSpecificId, null, transport, publicKey, privateKey);
            return new CreatedIdentity(identity, Optional.empty());
        }
        String scid = selfCertifyingId(publicKey, methodSpecificId);
        Identity identity = new Identity("did:webvh:" + scid + ":" + methodSpecificId, null, transport, publicKey,
                privateKey);
        return new CreatedIdentity(identity, Optional.of(historyEntry(identity, scid)));
    }

    @Override
    public void publishIdentity(Identity identity) {
        this.directory.publishDocument(identity.document());
        logger.info("Published identity {}", identity.did());
    }

    @Override
    public void publishHistory(String did, String history) {
        this.directory.publishHistory(did, history);
        logger.info("Published history for {}", did);
    }

    @Override
    public void addPrivateIdentity(Identity identity, String alias) {
        this.store.save(identity.withAlias(alias));
    }

    private IdentityDocument document(String did) {
        IdentityDocument cached = this.verified.get(did);
        if (cached != null) {
            return cached;
        }
        VerificationResult result = verifyIdentity(did);
        if (result instanceof VerificationResult.Unreachable unreachable) {
            throw new IdentityUnreachableException(did, unreachable.cause());
        }
        IdentityDocument document = this.verified.get(did);
        if (document == null) {
            throw new IdentityNotFoundException(did);
        }
        return document;
    }

    private String historyEntry(Identity identity, String scid) {
        ObjectNode entry = this.mapper.createObjectNode();
        entry.put("versionId", "1-" + scid);
        entry.put("versionTime", Instant.now().toString());
        ObjectNode parameters = entry.putObject("parameters");
        parameters.put("method", WEBVH_METHOD);
        parameters.put("scid", scid);
        parameters.putArray("updateKeys").add(identity.publicKey());
        entry.set("state", this.mapper.valueToTree(identity.document()));
        return entry.toString();
    }

    // host "example.com:8080/a/b" becomes "example.com%3A8080:a:b"
    static String methodSpecificId(String didPath) {
        String path = didPath.replaceFirst("^[a-z]+://", "");
        int slash = path.indexOf('/');
        String host = slash < 0 ? path : path.substring(0, slash);
        String rest = slash < 0 ? "" : path.substring(slash + 1);
        StringBuilder id = new StringBuilder(host.replace(":", "%3A"));
        for (String segment : rest.split("/")) {
            if (!segment.isEmpty()) {
                id.append(':').append(segment);
            }
        }
        return id.toString();
    }

    private static String selfCertifyingId(String publicKey, String methodSpecificId) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(publicKey.getBytes(StandardCharsets.UTF_8));
            digest.update(methodSpecificId.getBytes(StandardCharsets.UTF_8));
            byte[] hash = digest.digest();
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash).substring(0, 22);
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 not supported", e);
        }
    }
}
