package org.panes.service.reader;

import org.panes.model.dto.ImageDimensions;

import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * An opened archive container. Images and nested archives are exposed as two independently indexed lists,
 * each in natural filename order. Index-based accessors return empty for out-of-range indices.
 * <p>
 * A reader whose {@link #needsPassword()} or {@link #wrongPassword()} flag is set has an empty catalog;
 * the caller is expected to reopen with a (different) password.
 * <p>
 * Not safe for concurrent use; callers serialize access to one reader.
 */
public sealed interface ArchiveReader extends Closeable permits AbstractArchiveReader {

    Path getArchivePath();

    int getImageCount();

    /**
     * Full in-archive path of the image.
     */
    Optional<String> getImageName(int index);

    Optional<byte[]> getImageData(int index);

    Optional<BufferedImage> loadImage(int index);

    Optional<ImageDimensions> getImageDimensions(int index);

    Optional<Long> getImageByteSize(int index);

    Optional<String> getImageFormatLabel(int index);

    Optional<Instant> getImageModifiedAt(int index);

    /**
     * Content key of the image bytes, computed once per image.
     */
    Optional<String> getImageFileKey(int index);

    int getNestedArchiveCount();

    Optional<String> getNestedArchiveName(int index);

    /**
     * Writes the nested archive to a fresh private directory below {@code targetDirectory}.
     *
     * @return the written file, or empty when the entry could not be extracted
     */
    Optional<Path> extractNestedArchive(int index, Path targetDirectory);

    /**
     * Images and nested archives merged into one natural-order list of in-archive paths.
     */
    List<String> getAllSortedEntryNames();

    OptionalInt findImageIndex(String entryName);

    OptionalInt findNestedArchiveIndex(String entryName);

    boolean needsPassword();

    boolean wrongPassword();

    boolean hasEncryptedEntries();

    @Override
    void close();
}
