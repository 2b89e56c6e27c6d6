package dev.tmcp.channel;

import java.util.Optional;

import dev.tmcp.identity.CreatedIdentity;
import dev.tmcp.identity.Identity;
import dev.tmcp.identity.IdentityFormat;
import dev.tmcp.identity.VerificationResult;

/**
 * Identity wallet and envelope cryptography behind the transports. Implementations must be safe for
 * concurrent use.
 */
public interface SecureChannelProvider {

    /**
     * Seal a payload from a local private identity to a verified peer.
     */
    byte[] seal(String localDid, String peerDid, byte[] payload);

    /**
     * Decrypt an envelope addressed to one of the local private identities.
     * @throws EnvelopeDecodeException when the envelope cannot be opened
     */
    OpenedEnvelope open(byte[] envelope);

    /**
     * Read who sealed an envelope and for whom, without decrypting it.
     * @throws EnvelopeDecodeException when the bytes are not an envelope
     */
    EnvelopeAddress peek(byte[] envelope);

    VerificationResult verifyIdentity(String did);

    Optional<Identity> resolveAlias(String alias);

    CreatedIdentity createIdentity(String didPath, String transport, IdentityFormat format);

    /**
     * @throws dev.tmcp.identity.PublishFailedException when the directory refuses the document
     */
    void publishIdentity(Identity identity);

    /**
     * @throws dev.tmcp.identity.PublishFailedException when the directory refuses the history entry
     */
    void publishHistory(String did, String history);

    void addPrivateIdentity(Identity identity, String alias);

}
