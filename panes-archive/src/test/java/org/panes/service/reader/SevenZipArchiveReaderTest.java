package org.panes.service.reader;

import org.apache.commons.compress.archivers.sevenz.SevenZArchiveEntry;
import org.apache.commons.compress.archivers.sevenz.SevenZFile;
import org.apache.commons.compress.archivers.sevenz.SevenZMethod;
import org.apache.commons.compress.archivers.sevenz.SevenZMethodConfiguration;
import org.apache.commons.compress.archivers.sevenz.SevenZOutputFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.panes.exception.ArchiveError;
import org.panes.exception.ArchiveException;
import org.panes.model.enums.OpenPhase;
import org.panes.service.image.ImageIoImageDecoder;
import org.panes.support.TestArchives;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SevenZipArchiveReaderTest {

    @TempDir
    Path tempDir;

    private final ImageIoImageDecoder imageDecoder = new ImageIoImageDecoder();

    @Test
    void extractsEverythingUpFrontAndServesFromMemory() throws IOException {
        byte[] second = TestArchives.png(2);
        Instant modified = Instant.parse("2021-03-04T05:06:07Z");
        Path archive = TestArchives.sevenZip(tempDir.resolve("book.cb7"), TestArchives.entries(
                "p10.png", TestArchives.png(1),
                "p2.png", second,
                "readme.txt", new byte[]{1}), Date.from(modified));
        List<OpenPhase> phases = new ArrayList<>();

        try (SevenZipArchiveReader reader = SevenZipArchiveReader.open(archive, null, phases::add, imageDecoder)) {
            assertThat(phases).containsExactly(OpenPhase.OPENING, OpenPhase.BUILDING_IMAGE_LIST, OpenPhase.EXTRACTING);
            assertThat(reader.getImageCount()).isEqualTo(2);
            assertThat(reader.getImageName(0)).hasValue("p2.png");

            Files.delete(archive);

            assertThat(reader.getImageData(0)).hasValueSatisfying(data -> assertThat(data).isEqualTo(second));
            assertThat(reader.getImageModifiedAt(0)).hasValue(modified);
            assertThat(reader.getImageByteSize(0)).hasValue((long) second.length);
        }
    }

    @Test
    void nestedArchivesAreCachedToo() throws IOException {
        byte[] inner = TestArchives.zipBytes(TestArchives.entries("x.png", TestArchives.png(3)));
        Path archive = TestArchives.sevenZip(tempDir.resolve("book.7z"), TestArchives.entries(
                "p1.png", TestArchives.png(1), "bonus.cbz", inner), null);

        try (SevenZipArchiveReader reader = SevenZipArchiveReader.open(archive, null, null, imageDecoder)) {
            Path extracted = reader.extractNestedArchive(0, tempDir.resolve("nested")).orElseThrow();

            assertThat(Files.readAllBytes(extracted)).isEqualTo(inner);
        }
    }

    @Test
    void repeatedPathKeepsItsFirstOccurrence() throws IOException {
        byte[] first = TestArchives.png(1);
        Path archive = tempDir.resolve("repeated.cb7");
        try (SevenZOutputFile out = new SevenZOutputFile(archive.toFile())) {
            out.setContentCompression(SevenZMethod.COPY);
            String[] names = {"p1.png", "p1.png", "p2.png"};
            byte[][] contents = {first, TestArchives.png(2), TestArchives.png(3)};
            for (int i = 0; i < names.length; i++) {
                SevenZArchiveEntry entry = new SevenZArchiveEntry();
                entry.setName(names[i]);
                out.putArchiveEntry(entry);
                out.write(contents[i]);
                out.closeArchiveEntry();
            }
        }

        try (SevenZipArchiveReader reader = SevenZipArchiveReader.open(archive, null, null, imageDecoder)) {
            assertThat(reader.getImageCount()).isEqualTo(2);
            assertThat(reader.getAllSortedEntryNames()).containsExactly("p1.png", "p2.png");
            assertThat(reader.getImageName(0)).hasValue("p1.png");
            assertThat(reader.getImageData(0)).hasValueSatisfying(data -> assertThat(data).isEqualTo(first));
        }
    }

    @Test
    void encryptedEntriesAreLeftOutWithoutPasswordWhileThePlainOnesStayReadable() throws IOException {
        byte[] page = TestArchives.png(1);
        SevenZArchiveEntry plain = streamEntry("p1.png", page.length);
        SevenZArchiveEntry locked = streamEntry("p2.png", 64);
        locked.setContentMethods(List.of(new SevenZMethodConfiguration(SevenZMethod.AES256SHA256)));
        ByteArrayInputStream content = new ByteArrayInputStream(page);
        SevenZFile sevenZFile = mock(SevenZFile.class);
        when(sevenZFile.getEntries()).thenReturn(List.of(plain, locked));
        when(sevenZFile.getNextEntry()).thenReturn(plain, locked, null);
        when(sevenZFile.read(any(byte[].class))).thenAnswer(invocation -> content.read(invocation.getArgument(0)));

        SevenZipArchiveReader reader = SevenZipArchiveReader.load(tempDir.resolve("mixed.cb7"), sevenZFile, false,
                OpenPhaseListener.NONE, imageDecoder);

        assertThat(reader.needsPassword()).isFalse();
        assertThat(reader.hasEncryptedEntries()).isTrue();
        assertThat(reader.getImageCount()).isEqualTo(1);
        assertThat(reader.getImageData(0)).hasValueSatisfying(data -> assertThat(data).isEqualTo(page));
    }

    @Test
    void onlyEncryptedImagesWithoutPasswordNeedAPassword() throws IOException {
        SevenZArchiveEntry locked = streamEntry("p1.png", 64);
        locked.setContentMethods(List.of(new SevenZMethodConfiguration(SevenZMethod.AES256SHA256)));
        SevenZFile sevenZFile = mock(SevenZFile.class);
        when(sevenZFile.getEntries()).thenReturn(List.of(locked));

        SevenZipArchiveReader reader = SevenZipArchiveReader.load(tempDir.resolve("locked.cb7"), sevenZFile, false,
                OpenPhaseListener.NONE, imageDecoder);

        assertThat(reader.needsPassword()).isTrue();
        assertThat(reader.hasEncryptedEntries()).isTrue();
        assertThat(reader.getImageCount()).isZero();
        verify(sevenZFile, never()).read(any(byte[].class));
    }

    private static SevenZArchiveEntry streamEntry(String name, long size) {
        SevenZArchiveEntry entry = new SevenZArchiveEntry();
        entry.setName(name);
        entry.setHasStream(true);
        entry.setSize(size);
        return entry;
    }

    @Test
    void damagedStreamIsReportedAsUnsupportedCompression() throws IOException {
        byte[] page = TestArchives.png(1);
        Path archive = TestArchives.sevenZip(tempDir.resolve("damaged.cb7"), TestArchives.entries("p1.png", page), null);
        byte[] bytes = Files.readAllBytes(archive);
        int offset = TestArchives.indexOf(bytes, page);
        bytes[offset + page.length / 2] ^= (byte) 0xFF;
        Files.write(archive, bytes);

        assertThatThrownBy(() -> SevenZipArchiveReader.open(archive, null, null, imageDecoder))
                .isInstanceOf(ArchiveException.class)
                .extracting(e -> ((ArchiveException) e).getError())
                .isEqualTo(ArchiveError.UNSUPPORTED_COMPRESSION);
    }

    @Test
    void archiveWithoutImagesHasNoContent() throws IOException {
        Path archive = TestArchives.sevenZip(tempDir.resolve("docs.7z"), TestArchives.entries("a.txt", new byte[]{1}), null);

        assertThatThrownBy(() -> SevenZipArchiveReader.open(archive, null, null, imageDecoder))
                .isInstanceOf(ArchiveException.class)
                .extracting(e -> ((ArchiveException) e).getError())
                .isEqualTo(ArchiveError.NO_CONTENT_FOUND);
    }

    @Test
    void garbageCannotBeOpened() throws IOException {
        Path file = Files.writeString(tempDir.resolve("fake.cb7"), "not a 7z archive at all");

        assertThatThrownBy(() -> SevenZipArchiveReader.open(file, null, null, imageDecoder))
                .isInstanceOf(ArchiveException.class)
                .extracting(e -> ((ArchiveException) e).getError())
                .isEqualTo(ArchiveError.CANNOT_OPEN);
    }
}
