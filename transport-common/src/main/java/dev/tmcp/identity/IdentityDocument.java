package dev.tmcp.identity;

/**
 * Public part of an identity as published to and resolved from the directory.
 * @param id the DID
 * @param transport URL peers use to reach the identity's owner
 * @param publicKey URL-safe base64 X.509 encoding of the X25519 public key
 */
public record IdentityDocument(String id, String transport, String publicKey) {
}
