package de.mirkosertic.archiveindexer.archive;

import java.io.IOException;

/**
 * Signals that an archive is temporarily unavailable, e.g. because no peer answered in time.
 * Callers treat this as transient and may retry later.
 */
public class ArchiveUnreachableException extends IOException {

    public ArchiveUnreachableException(final String message) {
        super(message);
    }

    public ArchiveUnreachableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
