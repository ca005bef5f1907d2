package org.panes.service.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.panes.exception.ArchiveError;
import org.panes.exception.ArchiveException;
import org.panes.service.image.ImageIoImageDecoder;
import org.panes.support.TestArchives;
import org.panes.util.FileKeys;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemImageSourceTest {

    @TempDir
    Path tempDir;

    private final ImageIoImageDecoder imageDecoder = new ImageIoImageDecoder();

    private FileSystemImageSource create(Path... paths) {
        return FileSystemImageSource.create(List.of(paths), imageDecoder, FileKeys.DEFAULT_SAMPLE_BYTES);
    }

    @Test
    void walksFolderSkippingHiddenAndNonImageFiles() throws IOException {
        Path folder = Files.createDirectory(tempDir.resolve("scans"));
        TestArchives.writeFile(folder.resolve("b.png"), TestArchives.png(1));
        TestArchives.writeFile(folder.resolve("a10.png"), TestArchives.png(2));
        TestArchives.writeFile(folder.resolve("a2.png"), TestArchives.png(3));
        TestArchives.writeFile(folder.resolve(".hidden.png"), TestArchives.png(4));
        TestArchives.writeFile(folder.resolve(".cache/x.png"), TestArchives.png(5));
        TestArchives.writeFile(folder.resolve("sub/c.png"), TestArchives.png(6));
        TestArchives.writeFile(folder.resolve("notes.txt"), new byte[]{1});

        FileSystemImageSource source = create(folder);

        assertEquals(4, source.getImageCount());
        assertEquals("a2.png", source.fileName(0).orElseThrow());
        assertEquals("a10.png", source.fileName(1).orElseThrow());
        assertEquals("b.png", source.fileName(2).orElseThrow());
        assertEquals("sub/c.png", source.imageRelativePath(3).orElseThrow());
        assertEquals("scans", source.getSourceName());
        assertEquals(folder, source.getSourcePath().orElseThrow());
        assertFalse(source.isStandalone());
    }

    @Test
    void singleImageIsStandaloneAndKeyedByContent() throws IOException {
        byte[] data = TestArchives.png(7);
        Path image = TestArchives.writeFile(tempDir.resolve("cover.png"), data);

        FileSystemImageSource source = create(image);

        assertTrue(source.isStandalone());
        assertEquals(1, source.getImageCount());
        assertEquals("cover.png", source.getSourceName());
        assertEquals(FileKeys.fromLeadingBytes(image, FileKeys.DEFAULT_SAMPLE_BYTES), source.generateFileKey().orElseThrow());
        assertEquals((long) data.length, source.fileSize(0).orElseThrow());
        assertEquals("PNG", source.imageFormat(0).orElseThrow());
        assertEquals(17, source.imageSize(0).orElseThrow().width());
        assertTrue(source.fileDate(0).isPresent());
    }

    @Test
    void folderKeySurvivesRenamingTheFolder() throws IOException {
        Path folder = Files.createDirectory(tempDir.resolve("scans"));
        TestArchives.writeFile(folder.resolve("p1.png"), TestArchives.png(1));
        String before = create(folder).generateFileKey().orElseThrow();

        Path renamed = Files.move(folder, tempDir.resolve("scans-2024"));

        assertEquals(before, create(renamed).generateFileKey().orElseThrow());
    }

    @Test
    void looseFilesShareTheirParentFolderKey() throws IOException {
        Path folder = Files.createDirectory(tempDir.resolve("loose"));
        Path first = TestArchives.writeFile(folder.resolve("p2.png"), TestArchives.png(1));
        Path second = TestArchives.writeFile(folder.resolve("p1.png"), TestArchives.png(2));

        FileSystemImageSource source = create(first, second);

        assertEquals("p1.png", source.fileName(0).orElseThrow());
        assertEquals("loose", source.getSourceName());
        assertEquals(FileKeys.folderKey(folder), source.generateFileKey().orElseThrow());
    }

    @Test
    void imageKeysAreContentBasedAndStable() throws IOException {
        Path folder = Files.createDirectory(tempDir.resolve("scans"));
        Path image = TestArchives.writeFile(folder.resolve("p1.png"), TestArchives.png(1));
        FileSystemImageSource source = create(folder);

        String key = source.generateImageFileKey(0).orElseThrow();

        assertEquals(FileKeys.fromLeadingBytes(image, FileKeys.DEFAULT_SAMPLE_BYTES), key);
        assertEquals(key, source.generateImageFileKey(0).orElseThrow());
        assertTrue(source.generateImageFileKey(1).isEmpty());
    }

    @Test
    void emptyFolderHasNoContent() throws IOException {
        Path folder = Files.createDirectory(tempDir.resolve("empty"));
        TestArchives.writeFile(folder.resolve("readme.txt"), new byte[]{1});

        ArchiveException e = assertThrows(ArchiveException.class, () -> create(folder));

        assertEquals(ArchiveError.NO_CONTENT_FOUND, e.getError());
    }
}
