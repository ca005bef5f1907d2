package org.panes.service.source;

import lombok.extern.slf4j.Slf4j;
import org.panes.exception.ArchiveError;
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
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Loose image files, given directly or found by walking folders. Hidden files and folders are skipped.
 */
@Slf4j
public class FileSystemImageSource implements ImageSource {

    private final List<Path> imageFiles;
    private final Path rootDirectory;
    private final String sourceName;
    private final boolean standalone;
    private final ImageDecoder imageDecoder;
    private final int fileKeySampleBytes;
    private final Map<Integer, String> imageKeys = new ConcurrentHashMap<>();
    private volatile String fileKey;

    private FileSystemImageSource(List<Path> imageFiles, Path rootDirectory, String sourceName, boolean standalone,
                                  ImageDecoder imageDecoder, int fileKeySampleBytes) {
        this.imageFiles = imageFiles;
        this.rootDirectory = rootDirectory;
        this.sourceName = sourceName;
        this.standalone = standalone;
        this.imageDecoder = imageDecoder;
        this.fileKeySampleBytes = fileKeySampleBytes;
    }

    /**
     * @throws org.panes.exception.ArchiveException {@link ArchiveError#NO_CONTENT_FOUND} when no image was found,
     *                                              {@link ArchiveError#CANNOT_OPEN} when a folder cannot be walked
     */
    public static FileSystemImageSource create(List<Path> paths, ImageDecoder imageDecoder, int fileKeySampleBytes) {
        List<Path> collected = new ArrayList<>();
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                collected.addAll(walk(path));
            } else if (Files.isRegularFile(path) && isVisibleImage(path.getFileName().toString())) {
                collected.add(path);
            }
        }
        String label = paths.size() == 1 ? paths.get(0).getFileName().toString() : "selection";
        if (collected.isEmpty()) {
            throw ArchiveError.NO_CONTENT_FOUND.createException(label);
        }
        collected.sort(Comparator.comparing((Path p) -> p.toAbsolutePath().toString(), NaturalOrderComparator.INSTANCE));

        Path rootDirectory = paths.size() == 1 && Files.isDirectory(paths.get(0)) ? paths.get(0) : null;
        boolean standalone = paths.size() == 1 && Files.isRegularFile(paths.get(0));
        String sourceName;
        if (paths.size() == 1) {
            sourceName = label;
        } else {
            Path parent = collected.get(0).toAbsolutePath().getParent();
            sourceName = parent != null && parent.getFileName() != null ? parent.getFileName().toString() : label;
        }
        log.debug("Collected {} images for {}", collected.size(), sourceName);
        return new FileSystemImageSource(List.copyOf(collected), rootDirectory, sourceName, standalone, imageDecoder, fileKeySampleBytes);
    }

    private static List<Path> walk(Path directory) {
        try (Stream<Path> stream = Files.walk(directory)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(file -> isVisibleImage(directory.relativize(file).toString()))
                    .toList();
        } catch (IOException e) {
            throw ArchiveError.CANNOT_OPEN.createException(e, directory.getFileName());
        }
    }

    private static boolean isVisibleImage(String relativePath) {
        return EntryClassifier.classify(relativePath) == EntryKind.IMAGE;
    }

    private Optional<Path> file(int index) {
        if (index < 0 || index >= imageFiles.size()) {
            return Optional.empty();
        }
        return Optional.of(imageFiles.get(index));
    }

    @Override
    public String getSourceName() {
        return sourceName;
    }

    @Override
    public int getImageCount() {
        return imageFiles.size();
    }

    @Override
    public Optional<Path> getSourcePath() {
        if (rootDirectory != null) {
            return Optional.of(rootDirectory);
        }
        return standalone ? Optional.of(imageFiles.get(0)) : Optional.ofNullable(imageFiles.get(0).toAbsolutePath().getParent());
    }

    @Override
    public boolean isStandalone() {
        return standalone;
    }

    @Override
    public Optional<BufferedImage> loadImage(int index) {
        return imageData(index).flatMap(imageDecoder::decode);
    }

    @Override
    public Optional<byte[]> imageData(int index) {
        return file(index).flatMap(path -> {
            try {
                return Optional.of(Files.readAllBytes(path));
            } catch (IOException e) {
                log.warn("Failed to read image {}: {}", path, e.getMessage());
                return Optional.empty();
            }
        });
    }

    @Override
    public Optional<String> fileName(int index) {
        return file(index).map(path -> path.getFileName().toString());
    }

    @Override
    public Optional<ImageDimensions> imageSize(int index) {
        return imageData(index).flatMap(imageDecoder::readDimensions);
    }

    @Override
    public Optional<Long> fileSize(int index) {
        return file(index).flatMap(path -> {
            try {
                return Optional.of(Files.size(path));
            } catch (IOException e) {
                log.warn("Failed to read size of {}: {}", path, e.getMessage());
                return Optional.empty();
            }
        });
    }

    @Override
    public Optional<String> imageFormat(int index) {
        return file(index).map(path -> EntryClassifier.formatLabel(path.getFileName().toString()));
    }

    @Override
    public Optional<Instant> fileDate(int index) {
        return file(index).flatMap(path -> {
            try {
                return Optional.of(Files.getLastModifiedTime(path).toInstant());
            } catch (IOException e) {
                log.warn("Failed to read modification time of {}: {}", path, e.getMessage());
                return Optional.empty();
            }
        });
    }

    @Override
    public Optional<String> imageRelativePath(int index) {
        return file(index).map(path -> rootDirectory != null
                ? EntryClassifier.normalize(rootDirectory.relativize(path).toString())
                : path.getFileName().toString());
    }

    /**
     * A single file is identified by its content. A folder, or a set of loose files, by the folder's identity on its
     * volume, which survives renames of the folder.
     */
    @Override
    public Optional<String> generateFileKey() {
        String current = fileKey;
        if (current != null) {
            return Optional.of(current);
        }
        try {
            if (standalone) {
                current = FileKeys.fromLeadingBytes(imageFiles.get(0), fileKeySampleBytes);
            } else {
                Path folder = getSourcePath().orElseThrow();
                current = FileKeys.folderKey(folder);
            }
        } catch (IOException e) {
            log.warn("Failed to compute file key for {}: {}", sourceName, e.getMessage());
            return Optional.empty();
        }
        fileKey = current;
        return Optional.of(current);
    }

    @Override
    public Optional<String> generateImageFileKey(int index) {
        Optional<Path> path = file(index);
        if (path.isEmpty()) {
            return Optional.empty();
        }
        String cached = imageKeys.get(index);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            String key = FileKeys.fromLeadingBytes(path.get(), fileKeySampleBytes);
            imageKeys.put(index, key);
            return Optional.of(key);
        } catch (IOException e) {
            log.warn("Failed to compute image key for {}: {}", path.get(), e.getMessage());
            return Optional.empty();
        }
    }
}
