package de.mirkosertic.archiveindexer.archive;

import org.jspecify.annotations.Nullable;

import java.io.IOException;

/**
 * Reconstructs archive handles from persisted index metadata on startup.
 */
@FunctionalInterface
public interface ArchiveFactory {

    Archive open(String url, @Nullable String localPath) throws IOException;
}
