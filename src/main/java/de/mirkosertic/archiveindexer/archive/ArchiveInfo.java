package de.mirkosertic.archiveindexer.archive;

/**
 * Live information about an archive.
 *
 * @param version current version, monotonically increasing
 * @param owner   whether the local node may write to the archive
 */
public record ArchiveInfo(long version, boolean owner) {
}
