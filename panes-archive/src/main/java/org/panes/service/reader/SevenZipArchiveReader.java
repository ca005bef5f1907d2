package org.panes.service.reader;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.PasswordRequiredException;
import org.apache.commons.compress.archivers.sevenz.SevenZArchiveEntry;
import org.apache.commons.compress.archivers.sevenz.SevenZFile;
import org.apache.commons.compress.archivers.sevenz.SevenZMethod;
import org.apache.commons.compress.archivers.sevenz.SevenZMethodConfiguration;
import org.panes.exception.ArchiveError;
import org.panes.model.dto.ArchiveEntry;
import org.panes.model.enums.OpenPhase;
import org.panes.service.image.ImageDecoder;
import org.panes.util.EntryClassifier;

import java.io.ByteArrayOutputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 7z/CB7 reader. Solid 7z blocks make random access expensive, so every kept entry is decompressed once during
 * open into an in-memory cache and served from there.
 */
@Slf4j
public final class SevenZipArchiveReader extends AbstractArchiveReader {

    private final Map<String, byte[]> extractedData = new HashMap<>();

    private SevenZipArchiveReader(Path archivePath, ImageDecoder imageDecoder) {
        super(archivePath, imageDecoder);
    }

    public static SevenZipArchiveReader open(Path path, String password, OpenPhaseListener listener, ImageDecoder imageDecoder) {
        OpenPhaseListener phases = OpenPhaseListener.nullSafe(listener);
        phases.onPhase(OpenPhase.OPENING);
        if (!Files.isRegularFile(path)) {
            throw ArchiveError.CANNOT_OPEN.createException(path.getFileName());
        }
        boolean passwordSupplied = password != null;

        SevenZFile.Builder builder = SevenZFile.builder().setPath(path);
        if (passwordSupplied) {
            builder.setPassword(password.toCharArray());
        }

        try (SevenZFile sevenZFile = builder.get()) {
            return load(path, sevenZFile, passwordSupplied, phases, imageDecoder);
        } catch (PasswordRequiredException e) {
            log.info("{} has encrypted headers and requires a password", path.getFileName());
            return passwordFailure(path, imageDecoder, false);
        } catch (IOException e) {
            if (passwordSupplied && headersRequirePassword(path)) {
                log.info("Password rejected for {}", path.getFileName());
                return passwordFailure(path, imageDecoder, true);
            }
            throw ArchiveError.CANNOT_OPEN.createException(e, path.getFileName());
        }
    }

    /**
     * Catalogs and eagerly extracts an already opened container. Without a password, encrypted entries are left
     * out and the readable rest stays available.
     */
    static SevenZipArchiveReader load(Path path, SevenZFile sevenZFile, boolean passwordSupplied,
                                      OpenPhaseListener phases, ImageDecoder imageDecoder) {
        long start = System.nanoTime();
        SevenZipArchiveReader reader = new SevenZipArchiveReader(path, imageDecoder);
        phases.onPhase(OpenPhase.BUILDING_IMAGE_LIST);
        int locked = reader.catalog(sevenZFile, passwordSupplied);
        if (locked > 0 && reader.getImageCount() == 0) {
            log.info("{} holds {} encrypted entries and no readable images", path.getFileName(), locked);
            reader.markPasswordRequired();
            return reader;
        }
        reader.requireContent();

        phases.onPhase(OpenPhase.EXTRACTING);
        try {
            reader.extractAll(sevenZFile);
        } catch (PasswordRequiredException e) {
            log.info("{} requires a password", path.getFileName());
            reader.markEncryptedEntries(true);
            reader.markPasswordRequired();
            return reader;
        } catch (IOException e) {
            if (passwordSupplied && reader.hasEncryptedEntries()) {
                log.info("Password rejected for {}", path.getFileName());
                reader.markWrongPassword();
                return reader;
            }
            throw ArchiveError.UNSUPPORTED_COMPRESSION.createException(e, path.getFileName());
        }

        log.debug("Extracted {} entries from {} in {} ms", reader.extractedData.size(), path.getFileName(),
                (System.nanoTime() - start) / 1_000_000);
        return reader;
    }

    private static SevenZipArchiveReader passwordFailure(Path path, ImageDecoder imageDecoder, boolean passwordSupplied) {
        SevenZipArchiveReader reader = new SevenZipArchiveReader(path, imageDecoder);
        reader.markEncryptedEntries(true);
        if (passwordSupplied) {
            reader.markWrongPassword();
        } else {
            reader.markPasswordRequired();
        }
        return reader;
    }

    /**
     * @return the number of encrypted entries left out because no password was supplied
     */
    private int catalog(SevenZFile sevenZFile, boolean passwordSupplied) {
        List<ArchiveEntry> entries = new ArrayList<>();
        int locked = 0;
        boolean anyEncrypted = false;
        for (SevenZArchiveEntry entry : sevenZFile.getEntries()) {
            if (entry.isDirectory() || entry.isAntiItem() || !entry.hasStream()) {
                continue;
            }
            boolean encrypted = isEncrypted(entry);
            if (encrypted && !passwordSupplied) {
                locked++;
                continue;
            }
            anyEncrypted |= encrypted;
            entries.add(ArchiveEntry.builder()
                    .path(EntryClassifier.normalize(entry.getName()))
                    .uncompressedSize(entry.getSize())
                    .modifiedAt(entry.getHasLastModifiedDate() ? entry.getLastModifiedDate().toInstant() : null)
                    .encrypted(encrypted)
                    .build());
        }
        catalogEntries(entries);
        markEncryptedEntries(locked > 0 || anyEncrypted);
        return locked;
    }

    private void extractAll(SevenZFile sevenZFile) throws IOException {
        Set<String> wanted = new HashSet<>(getAllSortedEntryNames());
        SevenZArchiveEntry entry;
        while ((entry = sevenZFile.getNextEntry()) != null) {
            if (entry.isDirectory() || !entry.hasStream()) {
                continue;
            }
            String name = EntryClassifier.normalize(entry.getName());
            if (!wanted.contains(name) || extractedData.containsKey(name)) {
                continue;
            }
            extractedData.put(name, readCurrentEntry(sevenZFile, entry));
        }
    }

    private static byte[] readCurrentEntry(SevenZFile sevenZFile, SevenZArchiveEntry entry) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        int bytesRead;
        while ((bytesRead = sevenZFile.read(buffer)) != -1) {
            out.write(buffer, 0, bytesRead);
        }
        return out.toByteArray();
    }

    private static boolean isEncrypted(SevenZArchiveEntry entry) {
        Iterable<? extends SevenZMethodConfiguration> methods = entry.getContentMethods();
        if (methods == null) {
            return false;
        }
        for (SevenZMethodConfiguration method : methods) {
            if (method.getMethod() == SevenZMethod.AES256SHA256) {
                return true;
            }
        }
        return false;
    }

    private static boolean headersRequirePassword(Path path) {
        try (SevenZFile ignored = SevenZFile.builder().setPath(path).get()) {
            return false;
        } catch (PasswordRequiredException e) {
            return true;
        } catch (IOException e) {
            log.debug("Reopening {} without password failed: {}", path.getFileName(), e.getMessage());
            return false;
        }
    }

    @Override
    protected byte[] readEntry(ArchiveEntry entry) throws IOException {
        byte[] data = extractedData.get(entry.getPath());
        if (data == null) {
            throw new FileNotFoundException(entry.getPath());
        }
        return data;
    }

    @Override
    public void close() {
        extractedData.clear();
    }
}
