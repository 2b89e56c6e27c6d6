package dev.tmcp.identity;

import dev.tmcp.TmcpException;

/**
 * The directory could not be asked about an identity: network failure or an unexpected response.
 */
public class IdentityUnreachableException extends TmcpException {

    public IdentityUnreachableException(String did, Throwable cause) {
        super("Could not resolve identity " + did + ": " + cause.getMessage(), cause);
    }
}
