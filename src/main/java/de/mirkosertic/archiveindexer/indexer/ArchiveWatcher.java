package de.mirkosertic.archiveindexer.indexer;

import de.mirkosertic.archiveindexer.archive.Archive;
import de.mirkosertic.archiveindexer.archive.FileActivityListener;
import de.mirkosertic.archiveindexer.archive.FileActivityStream;
import de.mirkosertic.archiveindexer.table.TableRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.RejectedExecutionException;

/**
 * Keeps the tables live by reacting to file activity of watched archives.
 * <p>
 * An invalidated path is downloaded through the {@link DownloadScheduler}. A changed path
 * triggers a full incremental pass of the archive, since changes may span several paths.
 */
public class ArchiveWatcher {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveWatcher.class);

    private final TableRegistry tables;
    private final ArchiveIndexer indexer;
    private final DownloadScheduler downloads;
    private final IndexExecutorService archiveExecutor;
    private final IndexEvents events;

    public ArchiveWatcher(final TableRegistry tables, final ArchiveIndexer indexer, final DownloadScheduler downloads,
                          final IndexExecutorService archiveExecutor, final IndexEvents events) {
        this.tables = tables;
        this.indexer = indexer;
        this.downloads = downloads;
        this.archiveExecutor = archiveExecutor;
        this.events = events;
    }

    /**
     * Subscribe to the archive's file activity for all table patterns. Watching an archive
     * twice logs a warning and keeps the existing subscription.
     */
    public void watchArchive(final ManagedArchive managedArchive) throws IOException {
        synchronized (managedArchive) {
            if (managedArchive.getActivityStream() != null) {
                logger.warn("Archive {} is already being watched", managedArchive.getUrl());
                return;
            }
            final FileActivityStream stream = managedArchive.getArchive()
                    .createFileActivityStream(tables.getAllFilePatterns(), new ActivityListener(managedArchive));
            managedArchive.setActivityStream(stream);
        }
        logger.info("Watching archive {}", managedArchive.getUrl());
    }

    /**
     * Close the activity subscription, if any, and drop pending downloads of the archive.
     */
    public void unwatchArchive(final ManagedArchive managedArchive) {
        final FileActivityStream stream;
        synchronized (managedArchive) {
            stream = managedArchive.getActivityStream();
            managedArchive.setActivityStream(null);
        }
        downloads.cancelPending(managedArchive.getUrl());
        if (stream != null) {
            stream.close();
            logger.info("Stopped watching archive {}", managedArchive.getUrl());
        }
    }

    private class ActivityListener implements FileActivityListener {

        private final ManagedArchive managedArchive;

        ActivityListener(final ManagedArchive managedArchive) {
            this.managedArchive = managedArchive;
        }

        @Override
        public void onInvalidated(final String path) {
            logger.debug("Path {} of {} invalidated", path, managedArchive.getUrl());
            downloads.requestDownload(managedArchive.getArchive(), path);
        }

        @Override
        public void onChanged(final String path) {
            logger.debug("Path {} of {} changed, scheduling index pass", path, managedArchive.getUrl());
            final Archive archive = managedArchive.getArchive();
            try {
                archiveExecutor.execute(() -> {
                    try {
                        indexer.indexArchive(managedArchive, false);
                    } catch (final IOException | RuntimeException e) {
                        logger.warn("Index pass of {} after change failed: {}", archive.getUrl(), e.getMessage());
                        events.sourceError(archive.getUrl(), e);
                    }
                });
            } catch (final RejectedExecutionException e) {
                logger.debug("Indexer is shut down, ignoring change of {} in {}", path, archive.getUrl());
            }
        }
    }
}
