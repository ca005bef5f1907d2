package org.panes.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.panes.model.dto.ZipProbeResult;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;
import java.util.OptionalInt;

/**
 * Reads the declared entry count straight from a ZIP's end-of-central-directory record, independently of any
 * ZIP library. Comparing it with the entries a library can deliver reveals entries that were left out because
 * they are encrypted.
 */
@Slf4j
@UtilityClass
public class ZipEncryptionProbe {

    private static final int EOCD_LENGTH = 22;
    private static final int MAX_COMMENT_LENGTH = 0xFFFF;
    static final int SEARCH_WINDOW = EOCD_LENGTH + MAX_COMMENT_LENGTH;
    private static final int TOTAL_ENTRIES_OFFSET = 10;
    private static final int ZIP64_MARKER = 0xFFFF;

    public static ZipProbeResult probe(Path zipPath, int accessibleEntries) {
        OptionalInt declared;
        try {
            declared = readDeclaredEntryCount(zipPath);
        } catch (IOException e) {
            log.debug("Could not read end of central directory of {}: {}", zipPath.getFileName(), e.getMessage());
            declared = OptionalInt.empty();
        }
        return new ZipProbeResult(declared.orElse(-1), accessibleEntries);
    }

    /**
     * @return the total-entries field, or empty when no EOCD signature exists in the trailing window or the
     * archive defers the count to a ZIP64 record
     */
    public static OptionalInt readDeclaredEntryCount(Path zipPath) throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(zipPath.toFile(), "r")) {
            long fileLength = raf.length();
            int window = (int) Math.min(fileLength, SEARCH_WINDOW);
            if (window < EOCD_LENGTH) {
                return OptionalInt.empty();
            }
            byte[] tail = new byte[window];
            raf.seek(fileLength - window);
            raf.readFully(tail);

            for (int i = window - EOCD_LENGTH; i >= 0; i--) {
                if (tail[i] == 0x50 && tail[i + 1] == 0x4B && tail[i + 2] == 0x05 && tail[i + 3] == 0x06) {
                    int totalEntries = (tail[i + TOTAL_ENTRIES_OFFSET] & 0xFF)
                            | ((tail[i + TOTAL_ENTRIES_OFFSET + 1] & 0xFF) << 8);
                    if (totalEntries == ZIP64_MARKER) {
                        return OptionalInt.empty();
                    }
                    return OptionalInt.of(totalEntries);
                }
            }
        }
        return OptionalInt.empty();
    }
}
