package dev.tmcp.channel;

import java.nio.charset.StandardCharsets;

/**
 * A decrypted envelope.
 * @param sender DID that sealed the envelope
 * @param receiver DID the envelope was sealed for
 * @param payload plaintext bytes
 */
public record OpenedEnvelope(String sender, String receiver, byte[] payload) {

    public EnvelopeAddress address() {
        return new EnvelopeAddress(this.sender, this.receiver);
    }

    public String payloadText() {
        return new String(this.payload, StandardCharsets.UTF_8);
    }
}
