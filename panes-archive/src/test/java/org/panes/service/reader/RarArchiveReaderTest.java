package org.panes.service.reader;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.panes.exception.ArchiveError;
import org.panes.exception.ArchiveException;
import org.panes.model.enums.OpenPhase;
import org.panes.service.image.ImageIoImageDecoder;
import org.panes.support.TestArchives;
import org.panes.util.ArchiveUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RarArchiveReaderTest {

    @TempDir
    Path tempDir;

    private final ImageIoImageDecoder imageDecoder = new ImageIoImageDecoder();

    @Test
    void storedArchiveIsListedInNaturalOrderAndExtractedLazily() throws IOException {
        byte[] second = TestArchives.png(2);
        Path archive = TestArchives.rar(tempDir.resolve("book.cbr"), TestArchives.entries(
                "p10.png", TestArchives.png(1),
                "p2.png", second,
                "notes.txt", new byte[]{1, 2, 3}));
        List<OpenPhase> phases = new ArrayList<>();

        try (RarArchiveReader reader = RarArchiveReader.open(archive, null, phases::add, imageDecoder)) {
            assertThat(phases).containsExactly(OpenPhase.OPENING, OpenPhase.BUILDING_IMAGE_LIST);
            assertThat(reader.getImageCount()).isEqualTo(2);
            assertThat(reader.getImageName(0)).hasValue("p2.png");
            assertThat(reader.getImageName(1)).hasValue("p10.png");
            assertThat(reader.getImageData(0)).hasValueSatisfying(data -> assertThat(data).isEqualTo(second));
            assertThat(reader.getImageByteSize(0)).hasValue((long) second.length);
            assertThat(reader.getImageModifiedAt(0)).isPresent();
            assertThat(reader.needsPassword()).isFalse();
            assertThat(reader.hasEncryptedEntries()).isFalse();
        }
    }

    @Test
    void truncatedArchiveCannotBeOpened() throws IOException {
        byte[] bytes = TestArchives.rarBytes(TestArchives.entries("p1.png", TestArchives.png(1)), 0, false);
        // marker (7) + main header (13) + part of the first file header
        Path archive = Files.write(tempDir.resolve("truncated.cbr"), Arrays.copyOf(bytes, 7 + 13 + 12));

        ArchiveException e = assertThrows(ArchiveException.class,
                () -> RarArchiveReader.open(archive, null, null, imageDecoder));

        assertEquals(ArchiveError.CANNOT_OPEN, e.getError());
    }

    @Test
    void damagedEntryDataIsNotMistakenForEncryption() throws IOException {
        byte[] page = TestArchives.png(1);
        byte[] bytes = TestArchives.rarBytes(TestArchives.entries("p1.png", page), 0, false);
        int offset = TestArchives.indexOf(bytes, page);
        bytes[offset + page.length / 2] ^= (byte) 0xFF;
        Path archive = Files.write(tempDir.resolve("damaged.cbr"), bytes);

        try (RarArchiveReader reader = RarArchiveReader.open(archive, null, null, imageDecoder)) {
            assertFalse(reader.needsPassword());
            assertFalse(reader.hasEncryptedEntries());
            assertEquals(1, reader.getImageCount());
            assertThat(reader.getImageData(0)).isEmpty();
        }
    }

    @Test
    void encryptedHeadersNeedAPassword() throws IOException {
        byte[] bytes = TestArchives.rarBytes(TestArchives.entries("p1.png", TestArchives.png(1)),
                TestArchives.RAR_HEADERS_ENCRYPTED, false);
        Path archive = Files.write(tempDir.resolve("locked.cbr"), bytes);

        assertTrue(ArchiveUtils.isRarHeaderEncrypted(archive));
        try (RarArchiveReader reader = RarArchiveReader.open(archive, null, null, imageDecoder)) {
            assertTrue(reader.needsPassword());
            assertFalse(reader.wrongPassword());
            assertTrue(reader.hasEncryptedEntries());
            assertEquals(0, reader.getImageCount());
        }
    }

    @Test
    void encryptedEntriesWithoutPasswordNeedAPassword() throws IOException {
        Path archive = Files.write(tempDir.resolve("locked.cbr"),
                TestArchives.rarBytes(TestArchives.entries("p1.png", TestArchives.png(1)), 0, true));

        try (RarArchiveReader reader = RarArchiveReader.open(archive, null, null, imageDecoder)) {
            assertTrue(reader.needsPassword());
            assertFalse(reader.wrongPassword());
            assertTrue(reader.hasEncryptedEntries());
            assertEquals(0, reader.getImageCount());
            assertThat(reader.getAllSortedEntryNames()).isEmpty();
        }
    }

    @Test
    void passwordThatDoesNotDecryptTheEntriesIsWrong() throws IOException {
        byte[] data = new byte[32];
        Arrays.fill(data, (byte) 7);
        Path archive = Files.write(tempDir.resolve("locked.cbr"),
                TestArchives.rarBytes(TestArchives.entries("p1.png", data), 0, true));

        try (RarArchiveReader reader = RarArchiveReader.open(archive, "wrong", null, imageDecoder)) {
            assertTrue(reader.wrongPassword());
            assertFalse(reader.needsPassword());
            assertEquals(0, reader.getImageCount());
        }
    }

    @Test
    void missingFileCannotBeOpened() {
        ArchiveException e = assertThrows(ArchiveException.class,
                () -> RarArchiveReader.open(tempDir.resolve("absent.cbr"), null, null, imageDecoder));

        assertEquals(ArchiveError.CANNOT_OPEN, e.getError());
    }

    @Test
    void nonRarContentFailsTerminally() throws IOException {
        Path file = Files.writeString(tempDir.resolve("fake.cbr"), "this file only pretends to be a comic archive");

        ArchiveException e = assertThrows(ArchiveException.class,
                () -> RarArchiveReader.open(file, null, null, imageDecoder));

        assertFalse(e.isRecoverable());
    }

    @Test
    void mentionsPassword_matchesMessagesAcrossTheCauseChain() {
        assertTrue(RarArchiveReader.mentionsPassword(new IOException("wrapped", new IllegalStateException("missingPassword"))));
        assertTrue(RarArchiveReader.mentionsPassword(new IOException("File is Encrypted")));
        assertFalse(RarArchiveReader.mentionsPassword(new IOException("CRC error in p1.jpg")));
        assertFalse(RarArchiveReader.mentionsPassword(new IOException("unexpected end of archive")));
        assertFalse(RarArchiveReader.mentionsPassword(new IOException((String) null)));
    }

    @Test
    void mentionsChecksum_onlyMatchesCrcFailures() {
        assertTrue(RarArchiveReader.mentionsChecksum(new IOException("extract failed", new IOException("CRC error in p1.jpg"))));
        assertFalse(RarArchiveReader.mentionsChecksum(new IOException("File is Encrypted")));
    }
}
