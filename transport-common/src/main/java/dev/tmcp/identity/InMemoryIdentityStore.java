package dev.tmcp.identity;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ephemeral wallet; identities are lost when the process exits.
 */
public class InMemoryIdentityStore implements IdentityStore {

    private final Map<String, Identity> byAlias = new ConcurrentHashMap<>();

    @Override
    public Optional<Identity> findByAlias(String alias) {
        return Optional.ofNullable(this.byAlias.get(alias));
    }

    @Override
    public Optional<Identity> findByDid(String did) {
        return this.byAlias.values().stream().filter(identity -> identity.did().equals(did)).findFirst();
    }

    @Override
    public void save(Identity identity) {
        Objects.requireNonNull(identity.alias(), "alias");
        this.byAlias.put(identity.alias(), identity);
    }

}
