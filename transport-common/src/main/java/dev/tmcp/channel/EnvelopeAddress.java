package dev.tmcp.channel;

/**
 * Addressing header of an envelope, readable without decrypting it.
 */
public record EnvelopeAddress(String sender, String receiver) {
}
