package de.mirkosertic.archiveindexer.table;

import de.mirkosertic.archiveindexer.store.RecordStore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A named destination index. Owns the store its records are written to, the glob patterns
 * of the archive files it reads records from, and the schema hooks applied to each record.
 */
public class Table {

    private final String name;
    private final PathPatternMatcher matcher;
    private final TableSchema schema;
    private final RecordStore<IndexedRecord> store;

    public Table(final String name, final List<String> filePatterns, final TableSchema schema,
                 final RecordStore<IndexedRecord> store) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Table name must not be empty");
        }
        if (filePatterns == null || filePatterns.isEmpty()) {
            throw new IllegalArgumentException("Table " + name + " needs at least one file pattern");
        }
        this.name = name;
        this.matcher = new PathPatternMatcher(filePatterns);
        this.schema = schema;
        this.store = store;
    }

    public String getName() {
        return name;
    }

    public List<String> getFilePatterns() {
        return matcher.getPatterns();
    }

    public TableSchema getSchema() {
        return schema;
    }

    public RecordStore<IndexedRecord> getStore() {
        return store;
    }

    /**
     * Whether the archive file at {@code path} produces records of this table.
     */
    public boolean isRecordFile(final String path) {
        return matcher.matches(path);
    }

    /**
     * Records of this table that originate from the given archive.
     */
    public List<RecordFileMatch> listRecordFiles(final String archiveUrl) throws IOException {
        final List<RecordFileMatch> matches = new ArrayList<>();
        for (final Map.Entry<String, IndexedRecord> entry : store.entries().entrySet()) {
            if (archiveUrl.equals(entry.getValue().origin())) {
                matches.add(new RecordFileMatch(this, entry.getKey()));
            }
        }
        return matches;
    }

    @Override
    public String toString() {
        return "Table[" + name + "]";
    }
}
