package de.mirkosertic.archiveindexer.archive;

/**
 * One change to a file path, recorded at a given archive version.
 */
public record HistoryEntry(String path, ChangeType type, long version) {
}
