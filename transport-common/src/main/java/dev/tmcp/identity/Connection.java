package dev.tmcp.identity;

import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.tmcp.channel.EnvelopeAddress;
import dev.tmcp.channel.EnvelopeEncoding;
import dev.tmcp.channel.EnvelopeMismatchException;
import dev.tmcp.channel.OpenedEnvelope;
import dev.tmcp.transport.Wire;

/**
 * Secure association between the local identity and one verified peer. Seals outgoing text for the
 * peer and opens text the peer sealed for us.
 */
public final class Connection {

    private static final Logger logger = LoggerFactory.getLogger(Connection.class);

    private final IdentityManager identities;

    private final String localDid;

    private final String peerDid;

    private final boolean verbose;

    private final MismatchPolicy mismatchPolicy;

    Connection(IdentityManager identities, String peerDid, boolean verbose, MismatchPolicy mismatchPolicy) {
        this.identities = identities;
        this.localDid = identities.localDid();
        this.peerDid = peerDid;
        this.verbose = verbose;
        this.mismatchPolicy = mismatchPolicy;
    }

    public String localDid() {
        return this.localDid;
    }

    public String peerDid() {
        return this.peerDid;
    }

    /**
     * @return URL-safe base64 envelope
     */
    public String seal(String plaintext) {
        return EnvelopeEncoding.encode(sealToBytes(plaintext));
    }

    public byte[] sealToBytes(String plaintext) {
        byte[] envelope = this.identities.provider()
            .seal(this.localDid, this.peerDid, plaintext.getBytes(StandardCharsets.UTF_8));
        if (this.verbose) {
            Wire.sealed(this.localDid, this.peerDid, plaintext, envelope.length);
        }
        return envelope;
    }

    /**
     * @throws dev.tmcp.channel.EnvelopeDecodeException when the envelope cannot be decoded or opened
     * @throws EnvelopeMismatchException when it is not addressed from the peer to us and the policy
     * is {@link MismatchPolicy#REJECT}
     */
    public String open(String wire) {
        return open(EnvelopeEncoding.decode(wire));
    }

    public String open(byte[] envelope) {
        OpenedEnvelope opened = this.identities.provider().open(envelope);
        if (!this.localDid.equals(opened.receiver()) || !this.peerDid.equals(opened.sender())) {
            EnvelopeAddress address = opened.address();
            if (this.mismatchPolicy == MismatchPolicy.REJECT) {
                throw new EnvelopeMismatchException(address, this.peerDid, this.localDid);
            }
            logger.warn("Envelope addressed {} -> {} on connection {} -> {}", address.sender(), address.receiver(),
                    this.peerDid, this.localDid);
        }
        String plaintext = opened.payloadText();
        if (this.verbose) {
            Wire.opened(opened.sender(), opened.receiver(), envelope.length, plaintext);
        }
        return plaintext;
    }

    public String resolveEndpoint(boolean includeLocalId) {
        return this.identities.resolveEndpoint(this.peerDid, includeLocalId);
    }

    @Override
    public String toString() {
        return "Connection[" + this.localDid + " -> " + this.peerDid + "]";
    }
}
