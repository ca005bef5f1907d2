package org.panes.service.source;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.panes.model.dto.ImageDimensions;
import org.panes.model.dto.SegmentInfo;

import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.BiFunction;

/**
 * Concatenation of segments, each an image source of its own, presented as one global index space.
 * Segment {@code k} starts at the sum of the counts of segments {@code 0..k-1}.
 * <p>
 * The composite owns its segments, the temp files they were opened from and any shared reader registered through
 * {@link #own(Closeable)}; all of them are released by {@link #close()}.
 */
@Slf4j
public class CompositeImageSource implements ImageSource {

    private final Path archivePath;
    private final ContainerFileKey fileKey;
    private final List<Segment> segments = new ArrayList<>();
    private final List<Closeable> ownedResources = new ArrayList<>();
    private final List<String> passwordRequiredArchives = new ArrayList<>();
    private int[] segmentStarts = new int[0];
    private int totalCount;
    private boolean sealed;
    private boolean closed;

    public CompositeImageSource(Path archivePath, int fileKeySampleBytes) {
        this.archivePath = archivePath;
        this.fileKey = new ContainerFileKey(archivePath, fileKeySampleBytes);
    }

    void addSegment(ImageSource source, String name, Path tempFile, boolean nested) {
        if (sealed || closed) {
            throw new IllegalStateException("Composite source no longer accepts segments");
        }
        segments.add(new Segment(source, name, tempFile, nested));
        segmentStarts = Arrays.copyOf(segmentStarts, segments.size());
        segmentStarts[segments.size() - 1] = totalCount;
        totalCount += source.getImageCount();
    }

    /**
     * Freezes the segment table; the offsets handed out afterwards never change.
     */
    CompositeImageSource seal() {
        sealed = true;
        return this;
    }

    void own(Closeable resource) {
        ownedResources.add(resource);
    }

    void markPasswordRequired(String archiveName) {
        passwordRequiredArchives.add(archiveName);
    }

    /**
     * True when at least one nested archive was skipped because it is encrypted.
     */
    public boolean needsPassword() {
        return !passwordRequiredArchives.isEmpty();
    }

    public List<String> getPasswordRequiredArchives() {
        return List.copyOf(passwordRequiredArchives);
    }

    public List<SegmentInfo> getSegments() {
        List<SegmentInfo> infos = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            Segment segment = segments.get(i);
            infos.add(new SegmentInfo(segment.name, segmentStarts[i], segment.source.getImageCount(), segment.nested));
        }
        return infos;
    }

    private int segmentFor(int globalIndex) {
        int position = Arrays.binarySearch(segmentStarts, globalIndex);
        if (position < 0) {
            return -position - 2;
        }
        // Equal starts only arise from empty segments; step to the last one sharing this start
        while (position + 1 < segmentStarts.length && segmentStarts[position + 1] == globalIndex) {
            position++;
        }
        return position;
    }

    private <T> Optional<T> delegate(int index, BiFunction<Segment, Integer, Optional<T>> accessor) {
        if (index < 0 || index >= totalCount) {
            return Optional.empty();
        }
        int segmentIndex = segmentFor(index);
        return accessor.apply(segments.get(segmentIndex), index - segmentStarts[segmentIndex]);
    }

    @Override
    public String getSourceName() {
        return archivePath.getFileName().toString();
    }

    @Override
    public int getImageCount() {
        return totalCount;
    }

    @Override
    public Optional<Path> getSourcePath() {
        return Optional.of(archivePath);
    }

    @Override
    public boolean isStandalone() {
        return false;
    }

    @Override
    public Optional<BufferedImage> loadImage(int index) {
        return delegate(index, (segment, local) -> segment.source.loadImage(local));
    }

    @Override
    public Optional<byte[]> imageData(int index) {
        return delegate(index, (segment, local) -> segment.source.imageData(local));
    }

    @Override
    public Optional<String> fileName(int index) {
        return delegate(index, (segment, local) -> segment.source.fileName(local).map(segment::prefixed));
    }

    @Override
    public Optional<ImageDimensions> imageSize(int index) {
        return delegate(index, (segment, local) -> segment.source.imageSize(local));
    }

    @Override
    public Optional<Long> fileSize(int index) {
        return delegate(index, (segment, local) -> segment.source.fileSize(local));
    }

    @Override
    public Optional<String> imageFormat(int index) {
        return delegate(index, (segment, local) -> segment.source.imageFormat(local));
    }

    @Override
    public Optional<Instant> fileDate(int index) {
        return delegate(index, (segment, local) -> segment.source.fileDate(local));
    }

    @Override
    public Optional<String> imageRelativePath(int index) {
        return delegate(index, (segment, local) -> segment.source.imageRelativePath(local).map(segment::relativePath));
    }

    @Override
    public Optional<String> generateFileKey() {
        return fileKey.get();
    }

    @Override
    public Optional<String> generateImageFileKey(int index) {
        return delegate(index, (segment, local) -> segment.source.generateImageFileKey(local));
    }

    @Override
    public OptionalInt findImageIndex(String relativePath) {
        for (int i = 0; i < segments.size(); i++) {
            Segment segment = segments.get(i);
            String local = segment.unprefixed(relativePath);
            if (local == null) {
                continue;
            }
            OptionalInt found = segment.source.findImageIndex(local);
            if (found.isPresent()) {
                return OptionalInt.of(segmentStarts[i] + found.getAsInt());
            }
        }
        return OptionalInt.empty();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Segment segment : segments) {
            segment.close();
        }
        for (Closeable resource : ownedResources) {
            try {
                resource.close();
            } catch (IOException e) {
                log.warn("Failed to release resource of {}: {}", archivePath.getFileName(), e.getMessage());
            }
        }
        log.debug("Closed composite source {} ({} segments)", archivePath.getFileName(), segments.size());
    }

    /**
     * Deletes an extracted nested archive together with the private directory it was written into.
     */
    static void deleteTempFile(Path tempFile) {
        try {
            Files.deleteIfExists(tempFile);
            Path parent = tempFile.getParent();
            if (parent != null) {
                Files.deleteIfExists(parent);
            }
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}: {}", tempFile, e.getMessage());
        }
    }

    private static final class Segment {
        private final ImageSource source;
        private final String name;
        private final Path tempFile;
        private final boolean nested;

        private Segment(ImageSource source, String name, Path tempFile, boolean nested) {
            this.source = source;
            this.name = name;
            this.tempFile = tempFile;
            this.nested = nested;
        }

        private boolean hasPrefix() {
            return StringUtils.isNotEmpty(name) && !"/".equals(name);
        }

        private String prefixed(String value) {
            return hasPrefix() ? name + "/" + value : value;
        }

        // Directory segments already report full in-archive paths
        private String relativePath(String value) {
            return nested ? prefixed(value) : value;
        }

        // Nested segments report paths relative to their own archive, so the segment name has to come off first
        private String unprefixed(String value) {
            if (!nested || !hasPrefix()) {
                return value;
            }
            String prefix = name + "/";
            return value.startsWith(prefix) ? value.substring(prefix.length()) : null;
        }

        private void close() {
            source.close();
            if (tempFile != null) {
                deleteTempFile(tempFile);
            }
        }
    }
}
