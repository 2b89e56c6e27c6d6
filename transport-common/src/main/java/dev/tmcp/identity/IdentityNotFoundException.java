package dev.tmcp.identity;

import dev.tmcp.TmcpException;

public class IdentityNotFoundException extends TmcpException {

    private final String did;

    public IdentityNotFoundException(String did) {
        super("Identity not found: " + did);
        this.did = did;
    }

    public String did() {
        return this.did;
    }
}
