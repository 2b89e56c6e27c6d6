package dev.tmcp.identity;

import java.util.Optional;

/**
 * Result of creating an identity: the identity itself and, for history-chain formats, the history
 * artifact that has to be published next to the document.
 */
public record CreatedIdentity(Identity identity, Optional<String> history) {
}
