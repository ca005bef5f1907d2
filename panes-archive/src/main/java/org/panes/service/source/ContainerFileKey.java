package org.panes.service.source;

import lombok.extern.slf4j.Slf4j;
import org.panes.util.FileKeys;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Lazily computed, memoized content key of a container file.
 */
@Slf4j
final class ContainerFileKey {

    private final Path file;
    private final int sampleBytes;
    private volatile String key;

    ContainerFileKey(Path file, int sampleBytes) {
        this.file = file;
        this.sampleBytes = sampleBytes;
    }

    Optional<String> get() {
        String current = key;
        if (current == null) {
            try {
                current = FileKeys.fromLeadingBytes(file, sampleBytes);
                key = current;
            } catch (IOException e) {
                log.warn("Failed to compute file key for {}: {}", file.getFileName(), e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }
}
