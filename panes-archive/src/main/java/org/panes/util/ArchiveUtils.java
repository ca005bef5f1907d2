package org.panes.util;

import lombok.Getter;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

@Slf4j
@UtilityClass
public class ArchiveUtils {

    @Getter
    public enum ArchiveType {
        ZIP(Set.of("zip", "cbz")),
        RAR(Set.of("rar", "cbr")),
        SEVEN_ZIP(Set.of("7z", "cb7")),
        UNKNOWN(Set.of());

        private final Set<String> extensions;

        ArchiveType(Set<String> extensions) {
            this.extensions = extensions;
        }
    }

    private static final byte[] ZIP_MAGIC = {0x50, 0x4B, 0x03, 0x04};
    // Empty archive: the file is nothing but an end-of-central-directory record
    private static final byte[] ZIP_EMPTY_MAGIC = {0x50, 0x4B, 0x05, 0x06};
    // RAR 5.0 signature: 0x52 0x61 0x72 0x21 0x1A 0x07 0x01 0x00
    private static final byte[] RAR_MAGIC_V5 = {0x52, 0x61, 0x72, 0x21, 0x1A, 0x07, 0x01, 0x00};
    // RAR 4.x signature: 0x52 0x61 0x72 0x21 0x1A 0x07 0x00
    private static final byte[] RAR_MAGIC_V4 = {0x52, 0x61, 0x72, 0x21, 0x1A, 0x07, 0x00};
    private static final byte[] SEVEN_ZIP_MAGIC = {0x37, 0x7A, (byte) 0xBC, (byte) 0xAF, 0x27, 0x1C};

    /**
     * Picks the container family for a file. The extension decides whether the file is a container at all;
     * when the leading bytes carry another family's signature, the signature wins.
     */
    public static ArchiveType detectArchiveType(Path file) {
        if (file == null) {
            return ArchiveType.UNKNOWN;
        }
        ArchiveType byExtension = detectArchiveTypeByExtension(file.getFileName().toString());
        if (byExtension == ArchiveType.UNKNOWN || !Files.isRegularFile(file)) {
            return byExtension;
        }

        try (InputStream is = new BufferedInputStream(Files.newInputStream(file))) {
            byte[] buffer = new byte[8];
            int bytesRead = is.readNBytes(buffer, 0, buffer.length);
            if (bytesRead < 4) {
                return byExtension;
            }

            if (startsWith(buffer, ZIP_MAGIC) || startsWith(buffer, ZIP_EMPTY_MAGIC)) {
                return ArchiveType.ZIP;
            }
            if (startsWith(buffer, RAR_MAGIC_V5) || startsWith(buffer, RAR_MAGIC_V4)) {
                return ArchiveType.RAR;
            }
            if (startsWith(buffer, SEVEN_ZIP_MAGIC)) {
                return ArchiveType.SEVEN_ZIP;
            }
        } catch (IOException e) {
            log.warn("Failed to detect archive type by content for file: {}", file.toAbsolutePath());
        }

        return byExtension;
    }

    public static ArchiveType detectArchiveTypeByExtension(String fileName) {
        if (fileName == null) {
            return ArchiveType.UNKNOWN;
        }
        String extension = EntryClassifier.extension(fileName);
        for (ArchiveType type : ArchiveType.values()) {
            if (type.getExtensions().contains(extension)) {
                return type;
            }
        }
        return ArchiveType.UNKNOWN;
    }

    public static boolean isArchive(Path file) {
        return file != null && detectArchiveTypeByExtension(file.getFileName().toString()) != ArchiveType.UNKNOWN;
    }

    /**
     * Reads the RAR 4.x main archive header flags and reports whether the block headers themselves are encrypted
     * (MHD_PASSWORD). Such an archive cannot even be listed without a password.
     */
    public static boolean isRarHeaderEncrypted(Path file) {
        try (InputStream is = new BufferedInputStream(Files.newInputStream(file))) {
            byte[] buffer = new byte[12];
            if (is.readNBytes(buffer, 0, buffer.length) < buffer.length || !startsWith(buffer, RAR_MAGIC_V4)) {
                return false;
            }
            // marker block (7) | HEAD_CRC (2) | HEAD_TYPE (1) | HEAD_FLAGS (2, little-endian)
            if ((buffer[9] & 0xFF) != 0x73) {
                return false;
            }
            int flags = (buffer[10] & 0xFF) | ((buffer[11] & 0xFF) << 8);
            return (flags & 0x0080) != 0;
        } catch (IOException e) {
            log.debug("Failed to read RAR main header of {}: {}", file, e.getMessage());
            return false;
        }
    }

    private static boolean startsWith(byte[] buffer, byte[] magic) {
        if (buffer.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (buffer[i] != magic[i]) {
                return false;
            }
        }
        return true;
    }
}
