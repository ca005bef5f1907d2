package org.panes.service.source;

import org.panes.model.dto.ImageDimensions;
import org.panes.service.reader.ArchiveReader;
import org.panes.util.EntryClassifier;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A window onto a subset of a shared reader's images. Local index {@code i} maps to reader index
 * {@code indices.get(i)}. The reader belongs to the enclosing composite, so closing this view leaves it open.
 */
public class PartialImageSource implements ImageSource {

    private final ArchiveReader reader;
    private final List<Integer> indices;
    private final ContainerFileKey fileKey;

    public PartialImageSource(ArchiveReader reader, List<Integer> indices, int fileKeySampleBytes) {
        this.reader = reader;
        this.indices = List.copyOf(indices);
        this.fileKey = new ContainerFileKey(reader.getArchivePath(), fileKeySampleBytes);
    }

    private OptionalInt readerIndex(int index) {
        if (index < 0 || index >= indices.size()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(indices.get(index));
    }

    @Override
    public String getSourceName() {
        return reader.getArchivePath().getFileName().toString();
    }

    @Override
    public int getImageCount() {
        return indices.size();
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
        OptionalInt target = readerIndex(index);
        return target.isPresent() ? reader.loadImage(target.getAsInt()) : Optional.empty();
    }

    @Override
    public Optional<byte[]> imageData(int index) {
        OptionalInt target = readerIndex(index);
        return target.isPresent() ? reader.getImageData(target.getAsInt()) : Optional.empty();
    }

    @Override
    public Optional<String> fileName(int index) {
        return imageRelativePath(index).map(EntryClassifier::baseName);
    }

    @Override
    public Optional<ImageDimensions> imageSize(int index) {
        OptionalInt target = readerIndex(index);
        return target.isPresent() ? reader.getImageDimensions(target.getAsInt()) : Optional.empty();
    }

    @Override
    public Optional<Long> fileSize(int index) {
        OptionalInt target = readerIndex(index);
        return target.isPresent() ? reader.getImageByteSize(target.getAsInt()) : Optional.empty();
    }

    @Override
    public Optional<String> imageFormat(int index) {
        OptionalInt target = readerIndex(index);
        return target.isPresent() ? reader.getImageFormatLabel(target.getAsInt()) : Optional.empty();
    }

    @Override
    public Optional<Instant> fileDate(int index) {
        OptionalInt target = readerIndex(index);
        return target.isPresent() ? reader.getImageModifiedAt(target.getAsInt()) : Optional.empty();
    }

    @Override
    public Optional<String> imageRelativePath(int index) {
        OptionalInt target = readerIndex(index);
        return target.isPresent() ? reader.getImageName(target.getAsInt()) : Optional.empty();
    }

    @Override
    public Optional<String> generateFileKey() {
        return fileKey.get();
    }

    @Override
    public Optional<String> generateImageFileKey(int index) {
        OptionalInt target = readerIndex(index);
        return target.isPresent() ? reader.getImageFileKey(target.getAsInt()) : Optional.empty();
    }

    @Override
    public OptionalInt findImageIndex(String relativePath) {
        OptionalInt readerIndex = reader.findImageIndex(relativePath);
        if (readerIndex.isEmpty()) {
            return OptionalInt.empty();
        }
        int local = indices.indexOf(readerIndex.getAsInt());
        return local >= 0 ? OptionalInt.of(local) : OptionalInt.empty();
    }
}
