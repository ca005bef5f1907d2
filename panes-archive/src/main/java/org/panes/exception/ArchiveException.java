package org.panes.exception;

import lombok.Getter;

@Getter
public class ArchiveException extends RuntimeException {

    private final ArchiveError error;

    public ArchiveException(ArchiveError error, String message) {
        super(message);
        this.error = error;
    }

    public ArchiveException(ArchiveError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public boolean isRecoverable() {
        return !error.isTerminal();
    }
}
