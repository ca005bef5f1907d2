package org.panes.exception;

import lombok.Getter;

@Getter
public enum ArchiveError {
    CANNOT_OPEN("Cannot open file: %s", true),
    PASSWORD_REQUIRED("Archive is password protected: %s", false),
    WRONG_PASSWORD("Incorrect password for archive: %s", false),
    UNSUPPORTED_COMPRESSION("Unsupported or damaged compressed data in %s", true),
    NO_CONTENT_FOUND("No images found in %s", true),
    NESTED_ARCHIVE_OPEN_FAILED("Failed to open nested archive: %s", false);

    private final String message;
    private final boolean terminal;

    ArchiveError(String message, boolean terminal) {
        this.message = message;
        this.terminal = terminal;
    }

    public ArchiveException createException(Object... details) {
        return new ArchiveException(this, String.format(message, details));
    }

    public ArchiveException createException(Throwable cause, Object... details) {
        return new ArchiveException(this, String.format(message, details), cause);
    }
}
