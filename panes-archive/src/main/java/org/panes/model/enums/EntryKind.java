package org.panes.model.enums;

public enum EntryKind {
    IMAGE,
    NESTED_ARCHIVE,
    IGNORED
}
