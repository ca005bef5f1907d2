package org.panes.service.source;

import org.panes.model.dto.ImageDimensions;

import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * An indexed sequence of images the viewer pages through. Indices run from 0 to {@link #getImageCount()} - 1;
 * every accessor returns empty outside that range.
 */
public interface ImageSource extends Closeable {

    String getSourceName();

    int getImageCount();

    Optional<Path> getSourcePath();

    /**
     * True when the source is a single loose image file rather than a container or folder.
     */
    boolean isStandalone();

    Optional<BufferedImage> loadImage(int index);

    Optional<byte[]> imageData(int index);

    Optional<String> fileName(int index);

    Optional<ImageDimensions> imageSize(int index);

    Optional<Long> fileSize(int index);

    Optional<String> imageFormat(int index);

    Optional<Instant> fileDate(int index);

    Optional<String> imageRelativePath(int index);

    /**
     * Identity of the whole source, stable across renames and moves.
     */
    Optional<String> generateFileKey();

    Optional<String> generateImageFileKey(int index);

    default OptionalInt findImageIndex(String relativePath) {
        for (int i = 0; i < getImageCount(); i++) {
            if (imageRelativePath(i).filter(relativePath::equals).isPresent()) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    @Override
    default void close() {
    }
}
