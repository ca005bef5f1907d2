package org.panes.service.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.panes.config.ArchiveProperties;
import org.panes.util.FileKeys;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;

/**
 * In-memory store keyed by the SHA-256 of the normalized absolute archive path, so plain paths are never held.
 * Entries expire after the configured idle time.
 */
@Slf4j
@Service
public class CachingPasswordStore implements PasswordStore {

    private final Cache<String, String> passwords;

    public CachingPasswordStore(ArchiveProperties archiveProperties) {
        this.passwords = Caffeine.newBuilder()
                .expireAfterAccess(archiveProperties.getPasswordCacheTtl())
                .maximumSize(10_000)
                .build();
    }

    @Override
    public Optional<String> get(Path archivePath) {
        return Optional.ofNullable(passwords.getIfPresent(keyFor(archivePath)));
    }

    @Override
    public void save(Path archivePath, String password) {
        passwords.put(keyFor(archivePath), password);
        log.debug("Stored password for {}", archivePath.getFileName());
    }

    @Override
    public void delete(Path archivePath) {
        passwords.invalidate(keyFor(archivePath));
        log.debug("Removed stored password for {}", archivePath.getFileName());
    }

    static String keyFor(Path archivePath) {
        return FileKeys.sha256Hex(archivePath.toAbsolutePath().normalize().toString());
    }
}
