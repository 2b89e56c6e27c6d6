package dev.tmcp.identity;

/**
 * A private identity held in the local wallet.
 * @param did stable identifier
 * @param alias local lookup name, {@code null} until the identity is stored
 * @param transport URL published for this identity
 * @param publicKey URL-safe base64 X.509 encoding of the public key
 * @param privateKey URL-safe base64 PKCS#8 encoding of the private key
 */
public record Identity(String did, String alias, String transport, String publicKey, String privateKey) {

    public IdentityDocument document() {
        return new IdentityDocument(this.did, this.transport, this.publicKey);
    }

    public Identity withAlias(String newAlias) {
        return new Identity(this.did, newAlias, this.transport, this.publicKey, this.privateKey);
    }

    @Override
    public String toString() {
        return "Identity[did=" + this.did + ", alias=" + this.alias + ", transport=" + this.transport + "]";
    }
}
