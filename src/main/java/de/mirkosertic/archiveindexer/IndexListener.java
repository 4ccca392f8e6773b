package de.mirkosertic.archiveindexer;

import de.mirkosertic.archiveindexer.archive.Archive;

/**
 * Observer of indexing activity. All methods default to no-ops so implementations only
 * override the signals they care about.
 * <p>
 * Callbacks run on indexer threads and must not block.
 */
public interface IndexListener {

    /**
     * Records of {@code tableName} changed while indexing {@code archive} up to {@code version}.
     */
    default void onIndexUpdated(final String tableName, final Archive archive, final long version) {
    }

    /**
     * An indexing pass of {@code archive} completed at {@code version}.
     */
    default void onIndexesUpdated(final Archive archive, final long version) {
    }

    /**
     * The archive could not be reached for its first indexing pass. Indexing is retried periodically.
     */
    default void onSourceMissing(final String archiveUrl) {
    }

    /**
     * A previously unreachable archive was indexed successfully.
     */
    default void onSourceFound(final String archiveUrl) {
    }

    default void onSourceError(final String archiveUrl, final Throwable error) {
    }

    /**
     * A single file could not be read or parsed. Other files are not affected.
     */
    default void onIndexError(final String fileUrl, final Throwable error) {
    }
}
