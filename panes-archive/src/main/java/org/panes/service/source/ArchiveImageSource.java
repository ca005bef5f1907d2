package org.panes.service.source;

import org.panes.model.dto.ImageDimensions;
import org.panes.service.reader.ArchiveReader;
import org.panes.util.EntryClassifier;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Every image of one archive, in catalog order. Owns the reader.
 */
public class ArchiveImageSource implements ImageSource {

    private final ArchiveReader reader;
    private final ContainerFileKey fileKey;

    public ArchiveImageSource(ArchiveReader reader, int fileKeySampleBytes) {
        this.reader = reader;
        this.fileKey = new ContainerFileKey(reader.getArchivePath(), fileKeySampleBytes);
    }

    @Override
    public String getSourceName() {
        return reader.getArchivePath().getFileName().toString();
    }

    @Override
    public int getImageCount() {
        return reader.getImageCount();
    }

    @Override
    public Optional<Path> getSourcePath() {
        return Optional.of(reader.getArchivePath());
    }

    @Override
    public boolean isStandalone() {
        return false;
    }

    @Override
    public Optional<BufferedImage> loadImage(int index) {
        return reader.loadImage(index);
    }

    @Override
    public Optional<byte[]> imageData(int index) {
        return reader.getImageData(index);
    }

    @Override
    public Optional<String> fileName(int index) {
        return reader.getImageName(index).map(EntryClassifier::baseName);
    }

    @Override
    public Optional<ImageDimensions> imageSize(int index) {
        return reader.getImageDimensions(index);
    }

    @Override
    public Optional<Long> fileSize(int index) {
        return reader.getImageByteSize(index);
    }

    @Override
    public Optional<String> imageFormat(int index) {
        return reader.getImageFormatLabel(index);
    }

    @Override
    public Optional<Instant> fileDate(int index) {
        return reader.getImageModifiedAt(index);
    }

    @Override
    public Optional<String> imageRelativePath(int index) {
        return reader.getImageName(index);
    }

    @Override
    public Optional<String> generateFileKey() {
        return fileKey.get();
    }

    @Override
    public Optional<String> generateImageFileKey(int index) {
        return reader.getImageFileKey(index);
    }

    @Override
    public OptionalInt findImageIndex(String relativePath) {
        return reader.findImageIndex(relativePath);
    }

    @Override
    public void close() {
        reader.close();
    }
}
