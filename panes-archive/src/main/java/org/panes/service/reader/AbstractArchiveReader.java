package org.panes.service.reader;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.panes.exception.ArchiveError;
import org.panes.model.dto.ArchiveEntry;
import org.panes.model.dto.ImageDimensions;
import org.panes.model.enums.EntryKind;
import org.panes.service.image.ImageDecoder;
import org.panes.util.EntryClassifier;
import org.panes.util.FileKeys;
import org.panes.util.NaturalOrderComparator;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;

/**
 * Catalog and accessor logic shared by all container families. Subclasses enumerate their entries,
 * hand them to {@link #catalogEntries(Collection)} and supply the raw bytes of a single entry.
 */
@Slf4j
public abstract sealed class AbstractArchiveReader implements ArchiveReader
        permits ZipArchiveReader, RarArchiveReader, SevenZipArchiveReader {

    private static final Comparator<ArchiveEntry> BY_PATH =
            Comparator.comparing(ArchiveEntry::getPath, NaturalOrderComparator.INSTANCE);

    protected final Path archivePath;
    private final ImageDecoder imageDecoder;

    private List<ArchiveEntry> imageEntries = List.of();
    private List<ArchiveEntry> nestedArchiveEntries = List.of();
    private List<String> allSortedEntryNames = List.of();
    private Map<String, Integer> imageIndexByName = Map.of();
    private Map<String, Integer> nestedIndexByName = Map.of();
    private final Map<Integer, String> imageKeys = new HashMap<>();

    private boolean passwordRequired;
    private boolean passwordWrong;
    private boolean encryptedEntries;

    protected AbstractArchiveReader(Path archivePath, ImageDecoder imageDecoder) {
        this.archivePath = archivePath;
        this.imageDecoder = imageDecoder;
    }

    protected abstract byte[] readEntry(ArchiveEntry entry) throws IOException;

    /**
     * Splits enumerated entries into images and nested archives, each sorted naturally, and builds the merged list.
     * Directories and ignored names are dropped; a repeated path keeps its first occurrence.
     */
    protected void catalogEntries(Collection<ArchiveEntry> entries) {
        List<ArchiveEntry> kept = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ArchiveEntry entry : entries) {
            if (entry.isDirectory()) {
                continue;
            }
            switch (EntryClassifier.classify(entry.getPath())) {
                case IMAGE, NESTED_ARCHIVE -> {
                    if (seen.add(entry.getPath())) {
                        kept.add(entry);
                    } else {
                        log.debug("Duplicate entry {} in {}", entry.getPath(), archivePath.getFileName());
                    }
                }
                case IGNORED -> {
                }
            }
        }
        kept.sort(BY_PATH);

        List<ArchiveEntry> images = new ArrayList<>();
        List<ArchiveEntry> nested = new ArrayList<>();
        List<String> merged = new ArrayList<>(kept.size());
        Map<String, Integer> imageIndex = new HashMap<>();
        Map<String, Integer> nestedIndex = new HashMap<>();
        for (ArchiveEntry entry : kept) {
            merged.add(entry.getPath());
            if (EntryClassifier.classify(entry.getPath()) == EntryKind.IMAGE) {
                imageIndex.put(entry.getPath(), images.size());
                images.add(entry);
            } else {
                nestedIndex.put(entry.getPath(), nested.size());
                nested.add(entry);
            }
        }
        this.imageEntries = List.copyOf(images);
        this.nestedArchiveEntries = List.copyOf(nested);
        this.allSortedEntryNames = List.copyOf(merged);
        this.imageIndexByName = Map.copyOf(imageIndex);
        this.nestedIndexByName = Map.copyOf(nestedIndex);
    }

    protected void markPasswordRequired() {
        this.passwordRequired = true;
        clearCatalog();
    }

    protected void markWrongPassword() {
        this.passwordWrong = true;
        clearCatalog();
    }

    protected void markEncryptedEntries(boolean encrypted) {
        this.encryptedEntries = encrypted;
    }

    /**
     * A usable container must hold at least one image or nested archive, unless a password flag explains the gap.
     */
    protected void requireContent() {
        if (!passwordRequired && !passwordWrong && imageEntries.isEmpty() && nestedArchiveEntries.isEmpty()) {
            throw ArchiveError.NO_CONTENT_FOUND.createException(archivePath.getFileName());
        }
    }

    protected List<ArchiveEntry> getImageEntries() {
        return imageEntries;
    }

    protected List<ArchiveEntry> getNestedArchiveEntries() {
        return nestedArchiveEntries;
    }

    private void clearCatalog() {
        imageEntries = List.of();
        nestedArchiveEntries = List.of();
        allSortedEntryNames = List.of();
        imageIndexByName = Map.of();
        nestedIndexByName = Map.of();
    }

    @Override
    public Path getArchivePath() {
        return archivePath;
    }

    @Override
    public int getImageCount() {
        return imageEntries.size();
    }

    @Override
    public Optional<String> getImageName(int index) {
        return imageEntry(index).map(ArchiveEntry::getPath);
    }

    @Override
    public Optional<byte[]> getImageData(int index) {
        return imageEntry(index).flatMap(this::readQuietly);
    }

    @Override
    public Optional<BufferedImage> loadImage(int index) {
        return getImageData(index).flatMap(imageDecoder::decode);
    }

    @Override
    public Optional<ImageDimensions> getImageDimensions(int index) {
        return getImageData(index).flatMap(imageDecoder::readDimensions);
    }

    @Override
    public Optional<Long> getImageByteSize(int index) {
        return imageEntry(index)
                .map(ArchiveEntry::getUncompressedSize)
                .filter(size -> size >= 0);
    }

    @Override
    public Optional<String> getImageFormatLabel(int index) {
        return imageEntry(index).map(entry -> EntryClassifier.formatLabel(entry.getPath()));
    }

    @Override
    public Optional<Instant> getImageModifiedAt(int index) {
        return imageEntry(index).map(ArchiveEntry::getModifiedAt);
    }

    @Override
    public Optional<String> getImageFileKey(int index) {
        String cached = imageKeys.get(index);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<String> key = getImageData(index).map(FileKeys::fromBytes);
        key.ifPresent(value -> imageKeys.put(index, value));
        return key;
    }

    @Override
    public int getNestedArchiveCount() {
        return nestedArchiveEntries.size();
    }

    @Override
    public Optional<String> getNestedArchiveName(int index) {
        if (index < 0 || index >= nestedArchiveEntries.size()) {
            return Optional.empty();
        }
        return Optional.of(nestedArchiveEntries.get(index).getPath());
    }

    @Override
    public Optional<Path> extractNestedArchive(int index, Path targetDirectory) {
        if (index < 0 || index >= nestedArchiveEntries.size()) {
            return Optional.empty();
        }
        ArchiveEntry entry = nestedArchiveEntries.get(index);
        Path workDirectory = targetDirectory.resolve(UUID.randomUUID().toString());
        try {
            Files.createDirectories(workDirectory);
            Path target = workDirectory.resolve(EntryClassifier.baseName(entry.getPath()));
            Files.write(target, readEntry(entry));
            log.debug("Extracted nested archive {} to {}", entry.getPath(), target);
            return Optional.of(target);
        } catch (IOException e) {
            log.warn("Failed to extract nested archive {} from {}: {}", entry.getPath(), archivePath.getFileName(), e.getMessage());
            FileUtils.deleteQuietly(workDirectory.toFile());
            return Optional.empty();
        }
    }

    @Override
    public List<String> getAllSortedEntryNames() {
        return allSortedEntryNames;
    }

    @Override
    public OptionalInt findImageIndex(String entryName) {
        Integer index = imageIndexByName.get(entryName);
        return index != null ? OptionalInt.of(index) : OptionalInt.empty();
    }

    @Override
    public OptionalInt findNestedArchiveIndex(String entryName) {
        Integer index = nestedIndexByName.get(entryName);
        return index != null ? OptionalInt.of(index) : OptionalInt.empty();
    }

    @Override
    public boolean needsPassword() {
        return passwordRequired;
    }

    @Override
    public boolean wrongPassword() {
        return passwordWrong;
    }

    @Override
    public boolean hasEncryptedEntries() {
        return encryptedEntries;
    }

    private Optional<ArchiveEntry> imageEntry(int index) {
        if (index < 0 || index >= imageEntries.size()) {
            return Optional.empty();
        }
        return Optional.of(imageEntries.get(index));
    }

    private Optional<byte[]> readQuietly(ArchiveEntry entry) {
        try {
            return Optional.of(readEntry(entry));
        } catch (IOException e) {
            log.warn("Failed to read {} from {}: {}", entry.getPath(), archivePath.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }
}
