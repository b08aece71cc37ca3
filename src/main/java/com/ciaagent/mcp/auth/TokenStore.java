package com.ciaagent.mcp.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * One JSON file per server under the token directory. Writes go to a temp file
 * that is moved over the target, so readers see either the old or the new record.
 */
public class TokenStore {

    private static final Logger log = LoggerFactory.getLogger(TokenStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path dir;

    public TokenStore(Path dir) {
        this.dir = dir;
    }

    public Path dir() { return dir; }

    /** @return the stored record, or null when absent or unreadable */
    public OAuthTokens load(String serverId) {
        var path = pathFor(serverId);
        if (!Files.exists(path)) return null;
        try {
            var tokens = MAPPER.readValue(path.toFile(), OAuthTokens.class);
            return tokens.accessToken() != null ? tokens : null;
        } catch (IOException e) {
            log.warn("Unreadable token file for '{}': {}", serverId, e.getMessage());
            return null;
        }
    }

    public void save(String serverId, OAuthTokens tokens) {
        var target = pathFor(serverId);
        try {
            Files.createDirectories(dir);
            var tmp = Files.createTempFile(dir, sanitize(serverId), ".tmp");
            restrictToOwner(tmp);
            MAPPER.writeValue(tmp.toFile(), tokens);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store tokens for " + serverId, e);
        }
    }

    public boolean clear(String serverId) {
        try {
            return Files.deleteIfExists(pathFor(serverId));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear tokens for " + serverId, e);
        }
    }

    public boolean has(String serverId) {
        return load(serverId) != null;
    }

    Path pathFor(String serverId) {
        return dir.resolve(sanitize(serverId) + ".json");
    }

    private static String sanitize(String serverId) {
        return serverId.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static void restrictToOwner(Path file) {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException | IOException e) {
            log.debug("Could not restrict permissions on {}: {}", file, e.getMessage());
        }
    }
}
