package de.mirkosertic.archiveindexer.indexer;

import de.mirkosertic.archiveindexer.archive.Archive;
import de.mirkosertic.archiveindexer.archive.FileActivityStream;
import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * An archive under management, together with the state the indexer tracks for it.
 */
public class ManagedArchive {

    private final Archive archive;
    private final @Nullable String localPath;
    private volatile boolean writable;

    // guarded by this
    private @Nullable FileActivityStream activityStream;

    public ManagedArchive(final Archive archive, final boolean writable, final @Nullable String localPath) {
        this.archive = archive;
        this.writable = writable;
        this.localPath = localPath;
    }

    public Archive getArchive() {
        return archive;
    }

    public String getUrl() {
        return archive.getUrl();
    }

    public boolean isWritable() {
        return writable;
    }

    public void setWritable(final boolean writable) {
        this.writable = writable;
    }

    public Optional<String> getLocalPath() {
        return Optional.ofNullable(localPath);
    }

    public synchronized boolean isWatched() {
        return activityStream != null;
    }

    synchronized @Nullable FileActivityStream getActivityStream() {
        return activityStream;
    }

    synchronized void setActivityStream(final @Nullable FileActivityStream activityStream) {
        this.activityStream = activityStream;
    }

    @Override
    public String toString() {
        return "ManagedArchive[" + getUrl() + "]";
    }
}
