package de.mirkosertic.archiveindexer.store;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value store holding the values of one table or of the index metadata.
 * <p>
 * Writes are idempotent overwrites keyed by string. A write is only guaranteed to be
 * durable after {@link #flush()} returned.
 *
 * @param <V> value type
 */
public interface RecordStore<V> extends Closeable {

    Optional<V> get(String key) throws IOException;

    void put(String key, V value) throws IOException;

    /**
     * Remove the value stored at {@code key}. Removing an absent key is not an error.
     */
    void delete(String key) throws IOException;

    /**
     * Remove every value of this store.
     */
    void clear() throws IOException;

    /**
     * Snapshot of all entries, ordered by key.
     */
    Map<String, V> entries() throws IOException;

    /**
     * Make all previous writes durable.
     */
    void flush() throws IOException;

    /**
     * Whether the store can currently serve reads and writes.
     */
    boolean isOpen();

    /**
     * Whether the persisted data was written with a different schema version and must be regenerated.
     */
    boolean isSchemaUpgradeRequired();
}
