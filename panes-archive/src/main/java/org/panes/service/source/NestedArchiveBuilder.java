package org.panes.service.source;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.panes.config.ArchiveProperties;
import org.panes.exception.ArchiveError;
import org.panes.exception.ArchiveException;
import org.panes.service.reader.ArchiveReader;
import org.panes.service.reader.ArchiveReaderFactory;
import org.panes.util.EntryClassifier;
import org.panes.util.NaturalOrderComparator;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Turns an opened reader into the image source the viewer pages through. Containers holding nested archives become a
 * composite that interleaves runs of the parent's images with each nested archive's images, in the order the entries
 * sort. Containers spread over several directories become a composite of per-directory segments. Anything else is a
 * plain archive source.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NestedArchiveBuilder {

    static final String PARENT_SEGMENT_NAME = "";

    private final ArchiveReaderFactory archiveReaderFactory;
    private final ArchiveProperties archiveProperties;

    /**
     * Takes ownership of {@code reader}; it is closed with the returned source, or right away on failure.
     */
    public ImageSource build(ArchiveReader reader) {
        return build(reader, 1);
    }

    ImageSource build(ArchiveReader reader, int depth) {
        int sampleBytes = archiveProperties.getFileKeySampleBytes();
        if (depth >= archiveProperties.getMaxNestingDepth()) {
            return new ArchiveImageSource(reader, sampleBytes);
        }
        if (reader.getNestedArchiveCount() > 0) {
            return buildNested(reader, depth);
        }
        if (archiveProperties.isDirectorySegmentation()) {
            Optional<CompositeImageSource> segmented = buildDirectorySegments(reader);
            if (segmented.isPresent()) {
                return segmented.get();
            }
        }
        return new ArchiveImageSource(reader, sampleBytes);
    }

    private CompositeImageSource buildNested(ArchiveReader reader, int depth) {
        CompositeImageSource composite = new CompositeImageSource(reader.getArchivePath(), archiveProperties.getFileKeySampleBytes());
        composite.own(reader);
        try {
            List<Integer> pendingImages = new ArrayList<>();
            for (String entryName : reader.getAllSortedEntryNames()) {
                OptionalInt imageIndex = reader.findImageIndex(entryName);
                if (imageIndex.isPresent()) {
                    pendingImages.add(imageIndex.getAsInt());
                    continue;
                }
                OptionalInt nestedIndex = reader.findNestedArchiveIndex(entryName);
                if (nestedIndex.isEmpty()) {
                    continue;
                }
                flushParentImages(composite, reader, pendingImages);
                addNestedSegment(composite, reader, nestedIndex.getAsInt(), entryName, depth);
            }
            flushParentImages(composite, reader, pendingImages);
        } catch (RuntimeException e) {
            composite.close();
            throw e;
        }
        log.info("Built composite source for {}: {} images in {} segments", reader.getArchivePath().getFileName(),
                composite.getImageCount(), composite.getSegments().size());
        log.debug("Segments of {}: {}", reader.getArchivePath().getFileName(), composite.getSegments());
        return composite.seal();
    }

    private void flushParentImages(CompositeImageSource composite, ArchiveReader reader, List<Integer> pendingImages) {
        if (pendingImages.isEmpty()) {
            return;
        }
        PartialImageSource partial = new PartialImageSource(reader, pendingImages, archiveProperties.getFileKeySampleBytes());
        composite.addSegment(partial, PARENT_SEGMENT_NAME, null, false);
        pendingImages.clear();
    }

    private void addNestedSegment(CompositeImageSource composite, ArchiveReader reader, int nestedIndex, String entryName, int depth) {
        Optional<Path> extracted = reader.extractNestedArchive(nestedIndex, archiveProperties.getTempDirectoryPath());
        if (extracted.isEmpty()) {
            log.warn("{}, skipping it", ArchiveError.NESTED_ARCHIVE_OPEN_FAILED.createException(entryName).getMessage());
            return;
        }
        Path tempFile = extracted.get();
        ArchiveReader nestedReader = null;
        try {
            nestedReader = archiveReaderFactory.open(tempFile, null, null);
            if (nestedReader.needsPassword() || nestedReader.wrongPassword()) {
                log.info("Nested archive {} requires a password, skipping it", entryName);
                composite.markPasswordRequired(entryName);
                nestedReader.close();
                CompositeImageSource.deleteTempFile(tempFile);
                return;
            }
            ImageSource nestedSource = build(nestedReader, depth + 1);
            if (nestedSource.getImageCount() == 0) {
                log.debug("Nested archive {} holds no images, skipping it", entryName);
                nestedSource.close();
                CompositeImageSource.deleteTempFile(tempFile);
                return;
            }
            composite.addSegment(nestedSource, FilenameUtils.getBaseName(entryName), tempFile, true);
        } catch (ArchiveException e) {
            ArchiveException failure = ArchiveError.NESTED_ARCHIVE_OPEN_FAILED.createException(e, entryName);
            log.warn("{}, skipping it: {}", failure.getMessage(), e.getMessage());
            if (nestedReader != null) {
                nestedReader.close();
            }
            CompositeImageSource.deleteTempFile(tempFile);
        } catch (RuntimeException e) {
            if (nestedReader != null) {
                nestedReader.close();
            }
            CompositeImageSource.deleteTempFile(tempFile);
            throw e;
        }
    }

    private Optional<CompositeImageSource> buildDirectorySegments(ArchiveReader reader) {
        Map<String, List<Integer>> imagesByDirectory = new LinkedHashMap<>();
        for (String entryName : reader.getAllSortedEntryNames()) {
            OptionalInt imageIndex = reader.findImageIndex(entryName);
            if (imageIndex.isPresent()) {
                imagesByDirectory.computeIfAbsent(EntryClassifier.directoryOf(entryName), key -> new ArrayList<>())
                        .add(imageIndex.getAsInt());
            }
        }
        if (imagesByDirectory.size() <= 1) {
            return Optional.empty();
        }

        List<String> directories = new ArrayList<>(imagesByDirectory.keySet());
        directories.sort(NaturalOrderComparator.INSTANCE);
        int sampleBytes = archiveProperties.getFileKeySampleBytes();
        CompositeImageSource composite = new CompositeImageSource(reader.getArchivePath(), sampleBytes);
        composite.own(reader);
        for (String directory : directories) {
            composite.addSegment(new PartialImageSource(reader, imagesByDirectory.get(directory), sampleBytes), directory, null, false);
        }
        log.debug("Split {} into {} directory segments", reader.getArchivePath().getFileName(), directories.size());
        return Optional.of(composite.seal());
    }
}
