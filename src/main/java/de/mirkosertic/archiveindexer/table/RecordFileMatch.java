package de.mirkosertic.archiveindexer.table;

/**
 * A record currently stored by {@code table} under the key {@code recordUrl}.
 */
public record RecordFileMatch(Table table, String recordUrl) {
}
