package org.panes.model.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ArchiveEntry {
    String path;
    boolean directory;
    long uncompressedSize;
    Instant modifiedAt;
    boolean encrypted;
}
