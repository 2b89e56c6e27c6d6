package dev.tmcp.identity;

import dev.tmcp.TmcpException;

public class PublishFailedException extends TmcpException {

    public PublishFailedException(String url, int status) {
        super("Publishing to " + url + " failed with status " + status);
    }

    public PublishFailedException(String url, Throwable cause) {
        super("Publishing to " + url + " failed: " + cause.getMessage(), cause);
    }
}
