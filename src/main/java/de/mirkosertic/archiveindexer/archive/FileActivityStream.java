package de.mirkosertic.archiveindexer.archive;

/**
 * Handle of an active file activity subscription.
 */
public interface FileActivityStream extends AutoCloseable {

    /**
     * Unsubscribe. Calling this more than once has no effect.
     */
    @Override
    void close();
}
