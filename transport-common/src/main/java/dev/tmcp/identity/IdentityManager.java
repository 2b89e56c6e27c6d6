package dev.tmcp.identity;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import dev.tmcp.channel.SecureChannelProvider;
import dev.tmcp.transport.TmcpProtocol;

/**
 * Owns the local identity of a process and hands out {@link Connection}s to verified peers. Call
 * {@link #init(String)} once before anything else.
 */
public class IdentityManager {

    private static final Logger logger = LoggerFactory.getLogger(IdentityManager.class);

    private final SecureChannelProvider provider;

    private final TmcpSettings settings;

    private volatile Identity local;

    public IdentityManager(SecureChannelProvider provider, TmcpSettings settings) {
        this.provider = provider;
        this.settings = settings;
    }

    /**
     * Load the identity stored under {@code alias} if it still resolves, otherwise create, publish and
     * store a new one.
     * @throws IdentityUnreachableException when the directory cannot be asked about the stored identity
     * @throws PublishFailedException when publishing a new identity fails
     */
    public Identity init(String alias) {
        Optional<Identity> stored = this.provider.resolveAlias(alias);
        if (stored.isPresent()) {
            Identity identity = stored.get();
            VerificationResult result = this.provider.verifyIdentity(identity.did());
            if (result instanceof VerificationResult.Resolved) {
                logger.info("Using stored identity {} for {}", identity.did(), alias);
                this.local = identity;
                return identity;
            }
            if (result instanceof VerificationResult.Unreachable unreachable) {
                throw new IdentityUnreachableException(identity.did(), unreachable.cause());
            }
            logger.warn("Stored identity {} for {} no longer resolves, creating a new one", identity.did(), alias);
        }
        Identity created = create(alias);
        this.local = created;
        return created;
    }

    private Identity create(String alias) {
        String name = alias + "-" + UUID.randomUUID();
        if (name.length() > this.settings.maxNameLength()) {
            name = name.substring(0, this.settings.maxNameLength());
        }
        String didPath = this.settings.didFormat().replace("{name}", name);
        CreatedIdentity created = this.provider.createIdentity(didPath, this.settings.transport(),
                this.settings.identityFormat());
        Identity identity = created.identity();
        this.provider.publishIdentity(identity);
        if (this.settings.identityFormat().hasHistory()) {
            String history = created.history()
                .orElseThrow(() -> new IllegalStateException("No history created for " + identity.did()));
            this.provider.publishHistory(identity.did(), history);
        }
        this.provider.addPrivateIdentity(identity, alias);
        logger.info("Created identity {} for {}", identity.did(), alias);
        return identity.withAlias(alias);
    }

    /**
     * @throws IdentityNotFoundException when the peer does not resolve
     * @throws IdentityUnreachableException when the directory cannot be asked
     */
    public Connection connect(String peerDid) {
        requireResolved(peerDid);
        return new Connection(this, peerDid, this.settings.verbose(), this.settings.mismatchPolicy());
    }

    /**
     * Resolve a peer's transport URL.
     * @param includeLocalId set the {@code did} query parameter to the local DID
     */
    public String resolveEndpoint(String peerDid, boolean includeLocalId) {
        String endpoint = requireResolved(peerDid).endpoint();
        if (!includeLocalId) {
            return endpoint;
        }
        return UriComponentsBuilder.fromUriString(endpoint)
            .replaceQueryParam(TmcpProtocol.DID_PARAMETER,
                    UriUtils.encodeQueryParam(localDid(), StandardCharsets.UTF_8))
            .build()
            .toUriString();
    }

    private VerificationResult.Resolved requireResolved(String peerDid) {
        VerificationResult result = this.provider.verifyIdentity(peerDid);
        if (result instanceof VerificationResult.Resolved resolved) {
            return resolved;
        }
        if (result instanceof VerificationResult.Unreachable unreachable) {
            throw new IdentityUnreachableException(peerDid, unreachable.cause());
        }
        throw new IdentityNotFoundException(peerDid);
    }

    public Identity localIdentity() {
        Identity identity = this.local;
        if (identity == null) {
            throw new IllegalStateException("IdentityManager has not been initialised");
        }
        return identity;
    }

    public String localDid() {
        return localIdentity().did();
    }

    public SecureChannelProvider provider() {
        return this.provider;
    }

    public TmcpSettings settings() {
        return this.settings;
    }
}
