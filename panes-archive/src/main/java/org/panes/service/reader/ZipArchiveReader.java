package org.panes.service.reader;

import lombok.extern.slf4j.Slf4j;
import net.lingala.zip4j.ZipFile;
import net.lingala.zip4j.exception.ZipException;
import net.lingala.zip4j.io.inputstream.ZipInputStream;
import net.lingala.zip4j.model.FileHeader;
import net.lingala.zip4j.model.LocalFileHeader;
import net.lingala.zip4j.model.enums.EncryptionMethod;
import org.panes.config.ArchiveProperties;
import org.panes.exception.ArchiveError;
import org.panes.model.dto.ArchiveEntry;
import org.panes.model.dto.ZipProbeResult;
import org.panes.model.enums.EntryKind;
import org.panes.model.enums.OpenPhase;
import org.panes.service.image.ImageDecoder;
import org.panes.util.EntryClassifier;
import org.panes.util.ZipEncryptionProbe;

import java.io.BufferedInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ZIP/CBZ reader. Without a password only unencrypted entries are catalogued; the EOCD probe then tells whether
 * anything was held back. Archives whose central directory cannot be parsed are salvaged by streaming their
 * local headers.
 */
@Slf4j
public final class ZipArchiveReader extends AbstractArchiveReader {

    private static final char REPLACEMENT_CHARACTER = '�';

    private final ZipFile zipFile;
    private final Map<String, FileHeader> headersByPath = new HashMap<>();
    private final Map<String, byte[]> salvagedData = new HashMap<>();
    private ZipProbeResult probeResult;

    private ZipArchiveReader(Path archivePath, ImageDecoder imageDecoder, ZipFile zipFile) {
        super(archivePath, imageDecoder);
        this.zipFile = zipFile;
    }

    public static ZipArchiveReader open(Path path, String password, OpenPhaseListener listener,
                                        ArchiveProperties archiveProperties, ImageDecoder imageDecoder) {
        OpenPhaseListener phases = OpenPhaseListener.nullSafe(listener);
        long start = System.nanoTime();
        phases.onPhase(OpenPhase.OPENING);
        if (!Files.isRegularFile(path)) {
            throw ArchiveError.CANNOT_OPEN.createException(path.getFileName());
        }
        char[] secret = password != null ? password.toCharArray() : null;

        ZipFile zipFile;
        List<FileHeader> headers;
        try {
            zipFile = openWithCharsetFallback(path, secret, archiveProperties.getZipCharsets());
            headers = zipFile.getFileHeaders();
        } catch (ZipException e) {
            log.info("Central directory of {} unreadable ({}), salvaging local headers", path.getFileName(), e.getMessage());
            phases.onPhase(OpenPhase.BUILDING_IMAGE_LIST);
            return salvage(path, secret, imageDecoder, e);
        }

        phases.onPhase(OpenPhase.BUILDING_IMAGE_LIST);
        ZipArchiveReader reader = new ZipArchiveReader(path, imageDecoder, zipFile);
        try {
            reader.catalogHeaders(headers, secret != null);
        } catch (RuntimeException e) {
            reader.close();
            throw e;
        }
        log.debug("Opened {} with {} images, {} nested archives in {} ms", path.getFileName(),
                reader.getImageCount(), reader.getNestedArchiveCount(), (System.nanoTime() - start) / 1_000_000);
        return reader;
    }

    /**
     * Names flagged as UTF-8 are trusted. Otherwise each configured charset is tried in order and the first one that
     * decodes every name without replacement characters wins; if none does, zip4j's default decoding stays.
     */
    private static ZipFile openWithCharsetFallback(Path path, char[] secret, List<Charset> charsets) throws ZipException {
        ZipFile defaultDecoding = new ZipFile(path.toFile(), secret);
        List<FileHeader> headers = defaultDecoding.getFileHeaders();
        if (headers.stream().allMatch(FileHeader::isFileNameUTF8Encoded)) {
            return defaultDecoding;
        }
        for (Charset charset : charsets) {
            ZipFile candidate = new ZipFile(path.toFile(), secret);
            candidate.setCharset(charset);
            if (decodesCleanly(candidate.getFileHeaders())) {
                log.debug("Decoding entry names of {} as {}", path.getFileName(), charset);
                closeQuietly(defaultDecoding);
                return candidate;
            }
            closeQuietly(candidate);
        }
        return defaultDecoding;
    }

    private static boolean decodesCleanly(List<FileHeader> headers) {
        for (FileHeader header : headers) {
            if (header.getFileName().indexOf(REPLACEMENT_CHARACTER) >= 0) {
                return false;
            }
        }
        return true;
    }

    private void catalogHeaders(List<FileHeader> headers, boolean passwordSupplied) {
        List<ArchiveEntry> accessible = new ArrayList<>();
        for (FileHeader header : headers) {
            if (header.isEncrypted() && !passwordSupplied) {
                continue;
            }
            ArchiveEntry entry = toEntry(header);
            headersByPath.putIfAbsent(entry.getPath(), header);
            accessible.add(entry);
        }

        ZipProbeResult probe = ZipEncryptionProbe.probe(archivePath, accessible.size());
        if (probe.declaredEntries() < 0) {
            // No usable EOCD count (missing or ZIP64): fall back to what the central directory listed
            probe = new ZipProbeResult(headers.size(), accessible.size());
        }
        this.probeResult = probe;
        catalogEntries(accessible);
        markEncryptedEntries(probe.hasEncryptedEntries() || accessible.stream().anyMatch(ArchiveEntry::isEncrypted));

        if (probe.hasEncryptedEntries() && getImageCount() == 0) {
            log.info("{} declares {} entries but only {} are readable without a password",
                    archivePath.getFileName(), probe.declaredEntries(), probe.accessibleEntries());
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

    /**
     * Decrypts the first encrypted image (or nested archive) end to end. ZipCrypto only checks a single byte
     * up front, so for that method any read failure counts as a rejected password.
     */
    private boolean verifyPassword() {
        Optional<ArchiveEntry> sample = getImageEntries().stream().filter(ArchiveEntry::isEncrypted).findFirst()
                .or(() -> getNestedArchiveEntries().stream().filter(ArchiveEntry::isEncrypted).findFirst());
        if (sample.isEmpty()) {
            return true;
        }
        FileHeader header = headersByPath.get(sample.get().getPath());
        try {
            readEntry(sample.get());
            return true;
        } catch (ZipException e) {
            if (e.getType() == ZipException.Type.WRONG_PASSWORD || e.getType() == ZipException.Type.CHECKSUM_MISMATCH
                    || header.getEncryptionMethod() == EncryptionMethod.ZIP_STANDARD) {
                return false;
            }
            throw ArchiveError.UNSUPPORTED_COMPRESSION.createException(e, archivePath.getFileName());
        } catch (IOException e) {
            if (header.getEncryptionMethod() == EncryptionMethod.ZIP_STANDARD) {
                return false;
            }
            throw ArchiveError.UNSUPPORTED_COMPRESSION.createException(e, archivePath.getFileName());
        }
    }

    private static ZipArchiveReader salvage(Path path, char[] secret, ImageDecoder imageDecoder, ZipException cause) {
        ZipArchiveReader reader = new ZipArchiveReader(path, imageDecoder, null);
        List<ArchiveEntry> recovered = new ArrayList<>();
        try (InputStream raw = new BufferedInputStream(Files.newInputStream(path));
             ZipInputStream zis = new ZipInputStream(raw, secret)) {
            LocalFileHeader header;
            while ((header = zis.getNextEntry()) != null) {
                String name = EntryClassifier.normalize(header.getFileName());
                if (header.isDirectory() || EntryClassifier.classify(name) == EntryKind.IGNORED) {
                    continue;
                }
                byte[] data = zis.readAllBytes();
                if (reader.salvagedData.putIfAbsent(name, data) == null) {
                    recovered.add(ArchiveEntry.builder()
                            .path(name)
                            .uncompressedSize(data.length)
                            .modifiedAt(toInstant(header.getLastModifiedTimeEpoch()))
                            .encrypted(header.isEncrypted())
                            .build());
                }
            }
        } catch (ZipException e) {
            if (e.getType() == ZipException.Type.WRONG_PASSWORD && recovered.isEmpty()) {
                if (secret == null) {
                    reader.markPasswordRequired();
                } else {
                    reader.markWrongPassword();
                }
                return reader;
            }
            log.warn("Salvage of {} stopped after {} entries: {}", path.getFileName(), recovered.size(), e.getMessage());
        } catch (IOException e) {
            log.warn("Salvage of {} stopped after {} entries: {}", path.getFileName(), recovered.size(), e.getMessage());
        }

        if (recovered.isEmpty()) {
            throw ArchiveError.CANNOT_OPEN.createException(cause, path.getFileName());
        }
        reader.catalogEntries(recovered);
        reader.requireContent();
        log.info("Salvaged {} entries from {}", recovered.size(), path.getFileName());
        return reader;
    }

    private static ArchiveEntry toEntry(FileHeader header) {
        return ArchiveEntry.builder()
                .path(EntryClassifier.normalize(header.getFileName()))
                .directory(header.isDirectory())
                .uncompressedSize(header.getUncompressedSize())
                .modifiedAt(toInstant(header.getLastModifiedTimeEpoch()))
                .encrypted(header.isEncrypted())
                .build();
    }

    private static Instant toInstant(long epochMillis) {
        return epochMillis > 0 ? Instant.ofEpochMilli(epochMillis) : null;
    }

    @Override
    protected byte[] readEntry(ArchiveEntry entry) throws IOException {
        if (zipFile == null) {
            byte[] data = salvagedData.get(entry.getPath());
            if (data == null) {
                throw new FileNotFoundException(entry.getPath());
            }
            return data;
        }
        FileHeader header = headersByPath.get(entry.getPath());
        if (header == null) {
            throw new FileNotFoundException(entry.getPath());
        }
        try (InputStream in = zipFile.getInputStream(header)) {
            return in.readAllBytes();
        }
    }

    public Optional<ZipProbeResult> getProbeResult() {
        return Optional.ofNullable(probeResult);
    }

    public boolean isSalvaged() {
        return zipFile == null;
    }

    @Override
    public void close() {
        salvagedData.clear();
        if (zipFile != null) {
            closeQuietly(zipFile);
        }
    }

    private static void closeQuietly(ZipFile zipFile) {
        try {
            zipFile.close();
        } catch (IOException e) {
            log.warn("Failed to close ZIP file {}: {}", zipFile.getFile().getName(), e.getMessage());
        }
    }
}
