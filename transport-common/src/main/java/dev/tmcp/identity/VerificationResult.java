package dev.tmcp.identity;

/**
 * Outcome of asking the directory whether an identity resolves. {@link NotFound} is an expected
 * answer; {@link Unreachable} means the question could not be answered.
 */
public sealed interface VerificationResult
        permits VerificationResult.Resolved, VerificationResult.NotFound, VerificationResult.Unreachable {

    String did();

    /**
     * @param did the verified identity
     * @param endpoint transport URL published for it
     */
    record Resolved(String did, String endpoint) implements VerificationResult {
    }

    record NotFound(String did) implements VerificationResult {
    }

    record Unreachable(String did, Exception cause) implements VerificationResult {
    }

}
