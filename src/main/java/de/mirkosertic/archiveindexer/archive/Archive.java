package de.mirkosertic.archiveindexer.archive;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * A versioned, append-only file tree that serves as a source of indexable records.
 * <p>
 * Implementations own the storage and replication protocol. The indexer only reads
 * through this contract. Any method may block on network I/O; timeouts are reported
 * as {@link ArchiveUnreachableException}.
 */
public interface Archive {

    /**
     * Stable, URL-like identifier of this archive. Record keys are built as {@code url + path}.
     */
    String getUrl();

    /**
     * Local storage location, if the archive is backed by a local directory.
     */
    Optional<String> getLocalPath();

    /**
     * Fetch the live info of the archive, most importantly its current version.
     */
    ArchiveInfo getInfo() throws IOException;

    /**
     * Ordered changes with {@code start <= version < end}.
     */
    List<HistoryEntry> history(long start, long end) throws IOException;

    /**
     * Read the content of a file as UTF-8 text.
     */
    String readFile(String path) throws IOException;

    /**
     * Fetch the given path from remote peers into local storage. Returns when the download completed.
     */
    void download(String path) throws IOException;

    /**
     * Subscribe to live file activity restricted to the given glob patterns.
     *
     * @param patterns glob patterns a path must match to be reported
     * @param listener receives invalidation and change events
     * @return a handle to close the subscription
     */
    FileActivityStream createFileActivityStream(List<String> patterns, FileActivityListener listener) throws IOException;
}
