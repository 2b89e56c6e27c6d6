package dev.tmcp.identity;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Wallet persisted as one JSON file per alias inside a directory. Identities found by DID are kept in
 * memory, since sealing and opening look the local identity up for every message.
 */
public class FileIdentityStore implements IdentityStore {

    private static final Logger logger = LoggerFactory.getLogger(FileIdentityStore.class);

    private static final Pattern ALIAS = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path directory;

    private final ObjectMapper mapper;

    private final Map<String, Identity> byDid = new ConcurrentHashMap<>();

    public FileIdentityStore(Path directory) {
        this(directory, new ObjectMapper());
    }

    public FileIdentityStore(Path directory, ObjectMapper mapper) {
        this.directory = directory.toAbsolutePath().normalize();
        this.mapper = mapper;
    }

    @Override
    public Optional<Identity> findByAlias(String alias) {
        Path file = fileFor(alias);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    @Override
    public Optional<Identity> findByDid(String did) {
        Identity cached = this.byDid.get(did);
        if (cached != null) {
            return Optional.of(cached);
        }
        if (!Files.isDirectory(this.directory)) {
            return Optional.empty();
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(this.directory, "*.json")) {
            for (Path file : files) {
                Identity identity = read(file);
                this.byDid.putIfAbsent(identity.did(), identity);
                if (did.equals(identity.did())) {
                    return Optional.of(identity);
                }
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException("Unable to list identity store " + this.directory, e);
        }
        return Optional.empty();
    }

    @Override
    public void save(Identity identity) {
        Objects.requireNonNull(identity.alias(), "alias");
        Path target = fileFor(identity.alias());
        try {
            Files.createDirectories(this.directory);
            Path temp = Files.createTempFile(this.directory, identity.alias(), ".tmp");
            this.mapper.writeValue(temp.toFile(), identity);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Unable to store identity " + identity.did(), e);
        }
        this.byDid.put(identity.did(), identity);
        logger.debug("Stored identity {} as {}", identity.did(), target);
    }

    private Identity read(Path file) {
        try {
            return this.mapper.readValue(file.toFile(), Identity.class);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Unable to read identity file " + file, e);
        }
    }

    private Path fileFor(String alias) {
        if (!ALIAS.matcher(alias).matches()) {
            throw new IllegalArgumentException("Alias may only contain letters, digits, '.', '_' and '-': " + alias);
        }
        return this.directory.resolve(alias + ".json");
    }

}
