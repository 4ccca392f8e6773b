package de.mirkosertic.archiveindexer.indexer;

import de.mirkosertic.archiveindexer.IndexListener;
import de.mirkosertic.archiveindexer.archive.Archive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers indexing signals to the registered {@link IndexListener}s.
 * A failing listener is logged and does not prevent delivery to the others.
 */
public class IndexEvents {

    private static final Logger logger = LoggerFactory.getLogger(IndexEvents.class);

    private final List<IndexListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(final IndexListener listener) {
        listeners.add(listener);
    }

    public void removeListener(final IndexListener listener) {
        listeners.remove(listener);
    }

    void indexUpdated(final String tableName, final Archive archive, final long version) {
        fire("index-updated", listener -> listener.onIndexUpdated(tableName, archive, version));
    }

    void indexesUpdated(final Archive archive, final long version) {
        fire("indexes-updated", listener -> listener.onIndexesUpdated(archive, version));
    }

    void sourceMissing(final String archiveUrl) {
        fire("source-missing", listener -> listener.onSourceMissing(archiveUrl));
    }

    void sourceFound(final String archiveUrl) {
        fire("source-found", listener -> listener.onSourceFound(archiveUrl));
    }

    void sourceError(final String archiveUrl, final Throwable error) {
        fire("source-error", listener -> listener.onSourceError(archiveUrl, error));
    }

    void indexError(final String fileUrl, final Throwable error) {
        fire("index-error", listener -> listener.onIndexError(fileUrl, error));
    }

    private void fire(final String signal, final Consumer<IndexListener> delivery) {
        for (final IndexListener listener : listeners) {
            try {
                delivery.accept(listener);
            } catch (final RuntimeException e) {
                logger.error("Listener {} failed to handle {}", listener, signal, e);
            }
        }
    }
}
