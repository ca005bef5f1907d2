package org.panes.service.source;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.panes.config.ArchiveProperties;
import org.panes.service.image.ImageIoImageDecoder;
import org.panes.service.reader.ArchiveReader;
import org.panes.service.reader.ArchiveReaderFactory;
import org.panes.support.TestArchives;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PartialImageSourceTest {

    @TempDir
    Path tempDir;

    private ArchiveReader reader;
    private byte[] fourth;

    @BeforeEach
    void setUp() throws IOException {
        fourth = TestArchives.png(4);
        Path zip = TestArchives.zip(tempDir.resolve("book.cbz"), TestArchives.entries(
                "a/p1.png", TestArchives.png(1),
                "a/p2.png", TestArchives.png(2),
                "b/p1.png", TestArchives.png(3),
                "b/p2.png", fourth));
        reader = new ArchiveReaderFactory(new ArchiveProperties(), new ImageIoImageDecoder(), Runnable::run).open(zip, null, null);
    }

    @AfterEach
    void tearDown() {
        reader.close();
    }

    @Test
    void mapsLocalIndicesThroughTheIndexList() {
        PartialImageSource partial = new PartialImageSource(reader, List.of(2, 3), 1024);

        assertThat(partial.getImageCount()).isEqualTo(2);
        assertThat(partial.imageRelativePath(0)).hasValue("b/p1.png");
        assertThat(partial.fileName(1)).hasValue("p2.png");
        assertThat(partial.imageData(1)).hasValueSatisfying(data -> assertThat(data).isEqualTo(fourth));
        assertThat(partial.imageFormat(0)).hasValue("PNG");
        assertThat(partial.fileSize(1)).hasValue((long) fourth.length);
        assertThat(partial.generateImageFileKey(1)).isEqualTo(reader.getImageFileKey(3));
        assertThat(partial.getSourceName()).isEqualTo("book.cbz");
        assertThat(partial.isStandalone()).isFalse();
    }

    @Test
    void outOfRangeIsEmpty() {
        PartialImageSource partial = new PartialImageSource(reader, List.of(0), 1024);

        assertThat(partial.imageData(1)).isEmpty();
        assertThat(partial.fileName(-1)).isEmpty();
        assertThat(partial.imageSize(5)).isEmpty();
    }

    @Test
    void findImageIndex_onlyWithinTheWindow() {
        PartialImageSource partial = new PartialImageSource(reader, List.of(2, 3), 1024);

        assertThat(partial.findImageIndex("b/p2.png")).hasValue(1);
        assertThat(partial.findImageIndex("a/p1.png")).isEmpty();
    }

    @Test
    void closingTheViewLeavesTheSharedReaderOpen() {
        PartialImageSource partial = new PartialImageSource(reader, List.of(0, 1), 1024);

        partial.close();

        assertThat(reader.getImageData(3)).isPresent();
    }
}
