package org.panes.service.security;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Remembers archive passwords by archive location.
 */
public interface PasswordStore {

    Optional<String> get(Path archivePath);

    void save(Path archivePath, String password);

    void delete(Path archivePath);
}
