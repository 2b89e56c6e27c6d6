package dev.tmcp.server.security;

/**
 * Rejection produced by {@link TransportSecurityValidator}.
 * @param status HTTP status to answer with
 * @param message plain text response body
 */
public record ValidationFailure(int status, String message) {
}
