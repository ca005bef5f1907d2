package org.panes.service.reader;

import lombok.extern.slf4j.Slf4j;
import org.panes.config.ArchiveProperties;
import org.panes.exception.ArchiveError;
import org.panes.exception.ArchiveException;
import org.panes.service.image.ImageDecoder;
import org.panes.util.ArchiveUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Slf4j
@Service
public class ArchiveReaderFactory {

    private final ArchiveProperties archiveProperties;
    private final ImageDecoder imageDecoder;
    private final Executor openExecutor;

    public ArchiveReaderFactory(ArchiveProperties archiveProperties,
                                ImageDecoder imageDecoder,
                                @Qualifier("archiveOpenExecutor") Executor openExecutor) {
        this.archiveProperties = archiveProperties;
        this.imageDecoder = imageDecoder;
        this.openExecutor = openExecutor;
    }

    public boolean supports(Path path) {
        return ArchiveUtils.isArchive(path);
    }

    /**
     * Opens a container with the reader matching its format. A non-null {@code password} is used for
     * encrypted entries; the returned reader reports password problems through its flags, not by throwing.
     *
     * @throws ArchiveException with {@link ArchiveError#CANNOT_OPEN}, {@link ArchiveError#UNSUPPORTED_COMPRESSION}
     *                          or {@link ArchiveError#NO_CONTENT_FOUND}
     */
    public ArchiveReader open(Path path, String password, OpenPhaseListener listener) {
        ArchiveUtils.ArchiveType type = ArchiveUtils.detectArchiveType(path);
        log.debug("Opening {} as {}", path.getFileName(), type);
        return switch (type) {
            case ZIP -> ZipArchiveReader.open(path, password, listener, archiveProperties, imageDecoder);
            case RAR -> RarArchiveReader.open(path, password, listener, imageDecoder);
            case SEVEN_ZIP -> SevenZipArchiveReader.open(path, password, listener, imageDecoder);
            case UNKNOWN -> throw ArchiveError.CANNOT_OPEN.createException(path.getFileName());
        };
    }

    public CompletableFuture<ArchiveReader> openAsync(Path path, String password, OpenPhaseListener listener) {
        return CompletableFuture.supplyAsync(() -> open(path, password, listener), openExecutor);
    }
}
