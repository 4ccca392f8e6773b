package de.mirkosertic.archiveindexer.store;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Non-persistent {@link RecordStore}. Every write is immediately visible and there is nothing to flush.
 */
public class InMemoryRecordStore<V> implements RecordStore<V> {

    private final ConcurrentSkipListMap<String, V> values = new ConcurrentSkipListMap<>();
    private volatile boolean open = true;

    @Override
    public Optional<V> get(final String key) throws IOException {
        ensureOpen();
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void put(final String key, final V value) throws IOException {
        ensureOpen();
        values.put(key, value);
    }

    @Override
    public void delete(final String key) throws IOException {
        ensureOpen();
        values.remove(key);
    }

    @Override
    public void clear() throws IOException {
        ensureOpen();
        values.clear();
    }

    @Override
    public Map<String, V> entries() throws IOException {
        ensureOpen();
        return new LinkedHashMap<>(values);
    }

    @Override
    public void flush() throws IOException {
        ensureOpen();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public boolean isSchemaUpgradeRequired() {
        return false;
    }

    @Override
    public void close() {
        open = false;
    }

    private void ensureOpen() throws IOException {
        if (!open) {
            throw new IOException("Store is closed");
        }
    }
}
