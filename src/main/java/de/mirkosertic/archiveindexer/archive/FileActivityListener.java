package de.mirkosertic.archiveindexer.archive;

/**
 * Receives live file activity of an archive.
 */
public interface FileActivityListener {

    /**
     * Data for the path exists remotely but is not available locally.
     */
    void onInvalidated(String path);

    /**
     * The path was changed by a new archive version.
     */
    void onChanged(String path);
}
