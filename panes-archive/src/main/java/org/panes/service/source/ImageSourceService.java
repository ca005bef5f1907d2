package org.panes.service.source;

import lombok.extern.slf4j.Slf4j;
import org.panes.config.ArchiveProperties;
import org.panes.exception.ArchiveError;
import org.panes.exception.ArchiveException;
import org.panes.service.image.ImageDecoder;
import org.panes.service.reader.ArchiveReader;
import org.panes.service.reader.ArchiveReaderFactory;
import org.panes.service.reader.OpenPhaseListener;
import org.panes.service.security.PasswordStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Entry point for opening whatever the user dropped on the viewer: a single archive, loose images or folders.
 */
@Slf4j
@Service
public class ImageSourceService {

    private final ArchiveReaderFactory archiveReaderFactory;
    private final NestedArchiveBuilder nestedArchiveBuilder;
    private final PasswordStore passwordStore;
    private final ImageDecoder imageDecoder;
    private final ArchiveProperties archiveProperties;
    private final Executor openExecutor;

    public ImageSourceService(ArchiveReaderFactory archiveReaderFactory,
                              NestedArchiveBuilder nestedArchiveBuilder,
                              PasswordStore passwordStore,
                              ImageDecoder imageDecoder,
                              ArchiveProperties archiveProperties,
                              @Qualifier("archiveOpenExecutor") Executor openExecutor) {
        this.archiveReaderFactory = archiveReaderFactory;
        this.nestedArchiveBuilder = nestedArchiveBuilder;
        this.passwordStore = passwordStore;
        this.imageDecoder = imageDecoder;
        this.archiveProperties = archiveProperties;
        this.openExecutor = openExecutor;
    }

    public ImageSource open(Path path, String password, OpenPhaseListener listener) {
        return open(List.of(path), password, listener);
    }

    /**
     * Opens the given paths as one image source. When {@code password} is null a remembered password for the archive
     * is tried; a remembered password that turns out wrong is forgotten.
     *
     * @throws ArchiveException {@link ArchiveError#PASSWORD_REQUIRED} or {@link ArchiveError#WRONG_PASSWORD} when the
     *                          caller should prompt and retry, or a terminal error
     */
    public ImageSource open(List<Path> paths, String password, OpenPhaseListener listener) {
        if (paths == null || paths.isEmpty()) {
            throw ArchiveError.NO_CONTENT_FOUND.createException("empty selection");
        }
        try {
            if (paths.size() == 1 && Files.isRegularFile(paths.get(0)) && archiveReaderFactory.supports(paths.get(0))) {
                return openArchive(paths.get(0), password, listener);
            }
            return FileSystemImageSource.create(paths, imageDecoder, archiveProperties.getFileKeySampleBytes());
        } catch (ArchiveException e) {
            if (!e.isRecoverable()) {
                log.error("Failed to open {}: {}", paths.get(0).getFileName(), e.getMessage());
            }
            throw e;
        }
    }

    public CompletableFuture<ImageSource> openAsync(List<Path> paths, String password, OpenPhaseListener listener) {
        return CompletableFuture.supplyAsync(() -> open(paths, password, listener), openExecutor);
    }

    private ImageSource openArchive(Path archivePath, String password, OpenPhaseListener listener) {
        Optional<String> remembered = password == null ? passwordStore.get(archivePath) : Optional.empty();
        String effectivePassword = password != null ? password : remembered.orElse(null);

        ArchiveReader reader = archiveReaderFactory.open(archivePath, effectivePassword, listener);
        if (reader.wrongPassword()) {
            reader.close();
            if (remembered.isPresent()) {
                log.info("Stored password for {} no longer matches, removing it", archivePath.getFileName());
                passwordStore.delete(archivePath);
            }
            throw ArchiveError.WRONG_PASSWORD.createException(archivePath.getFileName());
        }
        if (reader.needsPassword()) {
            reader.close();
            throw ArchiveError.PASSWORD_REQUIRED.createException(archivePath.getFileName());
        }
        if (password != null && archiveProperties.isRememberPasswords() && reader.hasEncryptedEntries()) {
            passwordStore.save(archivePath, password);
        }

        try {
            return nestedArchiveBuilder.build(reader);
        } catch (RuntimeException e) {
            reader.close();
            throw e;
        }
    }
}
