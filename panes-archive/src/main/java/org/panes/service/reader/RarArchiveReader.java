package org.panes.service.reader;

import com.github.junrar.Archive;
import com.github.junrar.exception.CrcErrorException;
import com.github.junrar.exception.RarException;
import com.github.junrar.exception.UnsupportedRarEncryptedException;
import com.github.junrar.exception.UnsupportedRarV5Exception;
import com.github.junrar.rarfile.FileHeader;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.panes.exception.ArchiveError;
import org.panes.model.dto.ArchiveEntry;
import org.panes.model.enums.OpenPhase;
import org.panes.service.image.ImageDecoder;
import org.panes.util.ArchiveUtils;
import org.panes.util.EntryClassifier;

import java.io.ByteArrayOutputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
public final class RarArchiveReader extends AbstractArchiveReader {

    private final Archive archive;
    private final Map<String, FileHeader> headersByPath = new HashMap<>();

    private RarArchiveReader(Path archivePath, ImageDecoder imageDecoder, Archive archive) {
        super(archivePath, imageDecoder);
        this.archive = archive;
    }

    public static RarArchiveReader open(Path path, String password, OpenPhaseListener listener, ImageDecoder imageDecoder) {
        OpenPhaseListener phases = OpenPhaseListener.nullSafe(listener);
        phases.onPhase(OpenPhase.OPENING);
        if (!Files.isRegularFile(path)) {
            throw ArchiveError.CANNOT_OPEN.createException(path.getFileName());
        }
        boolean passwordSupplied = password != null;
        boolean headersEncrypted = ArchiveUtils.isRarHeaderEncrypted(path);
        if (headersEncrypted && !passwordSupplied) {
            return passwordFailure(path, imageDecoder, false);
        }

        Archive archive;
        try {
            archive = new Archive(path.toFile(), password);
        } catch (UnsupportedRarV5Exception e) {
            throw ArchiveError.UNSUPPORTED_COMPRESSION.createException(e, path.getFileName());
        } catch (UnsupportedRarEncryptedException e) {
            return passwordFailure(path, imageDecoder, passwordSupplied);
        } catch (RarException | IOException e) {
            if (headersEncrypted || mentionsPassword(e)) {
                return passwordFailure(path, imageDecoder, passwordSupplied);
            }
            throw ArchiveError.CANNOT_OPEN.createException(e, path.getFileName());
        }

        phases.onPhase(OpenPhase.BUILDING_IMAGE_LIST);
        RarArchiveReader reader = new RarArchiveReader(path, imageDecoder, archive);
        try {
            reader.catalogHeaders(passwordSupplied);
        } catch (RuntimeException e) {
            reader.close();
            throw e;
        }
        return reader;
    }

    private static RarArchiveReader passwordFailure(Path path, ImageDecoder imageDecoder, boolean passwordSupplied) {
        RarArchiveReader reader = new RarArchiveReader(path, imageDecoder, null);
        reader.markEncryptedEntries(true);
        if (passwordSupplied) {
            log.info("Password rejected for {}", path.getFileName());
            reader.markWrongPassword();
        } else {
            log.info("{} requires a password", path.getFileName());
            reader.markPasswordRequired();
        }
        return reader;
    }

    private void catalogHeaders(boolean passwordSupplied) {
        List<ArchiveEntry> accessible = new ArrayList<>();
        int locked = 0;
        for (FileHeader header : archive.getFileHeaders()) {
            if (header.isDirectory()) {
                continue;
            }
            if (header.isEncrypted() && !passwordSupplied) {
                locked++;
                continue;
            }
            String name = EntryClassifier.normalize(header.getFileName());
            headersByPath.putIfAbsent(name, header);
            accessible.add(ArchiveEntry.builder()
                    .path(name)
                    .uncompressedSize(header.getFullUnpackSize())
                    .modifiedAt(header.getMTime() != null ? header.getMTime().toInstant() : null)
                    .encrypted(header.isEncrypted())
                    .build());
        }
        catalogEntries(accessible);
        markEncryptedEntries(locked > 0 || accessible.stream().anyMatch(ArchiveEntry::isEncrypted));

        if (locked > 0 && getImageCount() == 0) {
            log.info("{} holds {} encrypted entries and no readable images", archivePath.getFileName(), locked);
            markPasswordRequired();
            return;
        }
        if (passwordSupplied && !verifyPassword()) {
            log.info("Password rejected for {}", archivePath.getFileName());
            markWrongPassword();
            return;
        }
        requireContent();
    }

    private boolean verifyPassword() {
        Optional<ArchiveEntry> sample = getImageEntries().stream().filter(ArchiveEntry::isEncrypted).findFirst()
                .or(() -> getNestedArchiveEntries().stream().filter(ArchiveEntry::isEncrypted).findFirst());
        if (sample.isEmpty()) {
            return true;
        }
        try {
            readEntry(sample.get());
            return true;
        } catch (IOException e) {
            if (ExceptionUtils.indexOfType(e, CrcErrorException.class) >= 0 || mentionsPassword(e) || mentionsChecksum(e)) {
                return false;
            }
            throw ArchiveError.UNSUPPORTED_COMPRESSION.createException(e, archivePath.getFileName());
        }
    }

    /**
     * Last resort for errors junrar does not type: match the message text.
     */
    static boolean mentionsPassword(Throwable error) {
        return anyMessageContains(error, "password") || anyMessageContains(error, "encrypted");
    }

    /**
     * A checksum failure only points at the password while verifying one that was supplied;
     * when opening, it means the archive is damaged.
     */
    static boolean mentionsChecksum(Throwable error) {
        return anyMessageContains(error, "crc");
    }

    private static boolean anyMessageContains(Throwable error, String text) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (StringUtils.containsIgnoreCase(t.getMessage(), text)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected byte[] readEntry(ArchiveEntry entry) throws IOException {
        FileHeader header = archive != null ? headersByPath.get(entry.getPath()) : null;
        if (header == null) {
            throw new FileNotFoundException(entry.getPath());
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            archive.extractFile(header, out);
        } catch (RarException e) {
            throw new IOException("Failed to extract from RAR archive: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }

    @Override
    public void close() {
        if (archive == null) {
            return;
        }
        try {
            archive.close();
        } catch (IOException e) {
            log.warn("Failed to close RAR archive {}: {}", archivePath.getFileName(), e.getMessage());
        }
    }
}
