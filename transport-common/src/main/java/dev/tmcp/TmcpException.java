package dev.tmcp;

/**
 * Base type for failures raised by the TMCP identity and transport layer.
 */
public class TmcpException extends RuntimeException {

    public TmcpException(String message) {
        super(message);
    }

    public TmcpException(String message, Throwable cause) {
        super(message, cause);
    }
}
