package de.mirkosertic.archiveindexer.table;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Stored representation of one source file.
 *
 * @param url       key of the record: archive URL followed by the file path
 * @param origin    URL of the archive the file was read from
 * @param indexedAt epoch millis of the indexing pass that wrote the record
 * @param record    validated and preprocessed payload
 */
public record IndexedRecord(String url, String origin, long indexedAt, JsonNode record) {
}
