package org.panes.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "panes.archive")
@Getter
@Setter
public class ArchiveProperties {

    /**
     * Parent directory for nested archives extracted while building a composite source.
     * Every extraction gets its own random sub-directory.
     */
    private String tempDirectory = Path.of(System.getProperty("java.io.tmpdir"), "panes-nested").toString();

    /**
     * Candidate charsets for ZIP entry names that are not flagged as UTF-8, tried in order.
     */
    private List<String> zipFilenameCharsets = new ArrayList<>(List.of("UTF-8", "Shift_JIS", "MS932", "ISO-8859-1"));

    private int fileKeySampleBytes = 32 * 1024;

    /**
     * Level 1 is the opened container. Containers found at the last level are opened without composite expansion.
     */
    private int maxNestingDepth = 2;

    private boolean directorySegmentation = true;

    private boolean rememberPasswords = true;

    private Duration passwordCacheTtl = Duration.ofHours(12);

    private OpenExecutor openExecutor = new OpenExecutor();

    public Path getTempDirectoryPath() {
        return Path.of(tempDirectory);
    }

    public List<Charset> getZipCharsets() {
        List<Charset> charsets = new ArrayList<>();
        for (String name : zipFilenameCharsets) {
            if (Charset.isSupported(name)) {
                charsets.add(Charset.forName(name));
            }
        }
        return charsets;
    }

    @Getter
    @Setter
    public static class OpenExecutor {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private String threadNamePrefix = "archive-open-";
    }
}
