package de.mirkosertic.archiveindexer.archive;

public enum ChangeType {
    PUT,
    DELETE
}
