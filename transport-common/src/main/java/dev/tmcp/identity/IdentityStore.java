package dev.tmcp.identity;

import java.util.Optional;

/**
 * Local wallet of private identities, keyed by alias.
 */
public interface IdentityStore {

    Optional<Identity> findByAlias(String alias);

    Optional<Identity> findByDid(String did);

    /**
     * Store an identity under its alias, replacing whatever was stored there before.
     */
    void save(Identity identity);

}
