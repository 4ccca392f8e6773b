package de.mirkosertic.archiveindexer.indexer;

import de.mirkosertic.archiveindexer.archive.ArchiveUnreachableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Handles archives whose initial index pass failed.
 * <p>
 * An unreachable archive is reported as missing and retried at a fixed interval until a pass
 * succeeds, a pass fails for another reason, the archive is no longer managed or the database
 * is closed. Any other failure is reported once as a source error and not retried.
 * <p>
 * The scheduler thread only keeps time. Attempts run on the archive worker pool, so an archive
 * whose reads hang occupies one worker and never delays the attempts of other archives.
 */
public class SourceRetryService {

    private static final Logger logger = LoggerFactory.getLogger(SourceRetryService.class);

    private final IndexContext context;
    private final ArchiveIndexer indexer;
    private final ArchiveWatcher watcher;
    private final IndexExecutorService archiveExecutor;
    private final IndexEvents events;
    private final long retryIntervalMs;
    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledFuture<?>> retryTasks = new ConcurrentHashMap<>();

    public SourceRetryService(final IndexContext context, final ArchiveIndexer indexer, final ArchiveWatcher watcher,
                              final IndexExecutorService archiveExecutor, final IndexEvents events,
                              final long retryIntervalMs) {
        this.context = context;
        this.indexer = indexer;
        this.watcher = watcher;
        this.archiveExecutor = archiveExecutor;
        this.events = events;
        this.retryIntervalMs = retryIntervalMs;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread thread = new Thread(r, "source-retry");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void onInitialIndexFailure(final ManagedArchive managedArchive, final Exception error) {
        if (error instanceof ArchiveUnreachableException) {
            logger.info("Archive {} is unreachable, retrying every {} ms", managedArchive.getUrl(), retryIntervalMs);
            events.sourceMissing(managedArchive.getUrl());
            scheduleAttempt(managedArchive);
        } else {
            logger.error("Initial index pass of {} failed", managedArchive.getUrl(), error);
            events.sourceError(managedArchive.getUrl(), error);
        }
    }

    public boolean isRetrying(final String archiveUrl) {
        return retryTasks.containsKey(archiveUrl);
    }

    private void scheduleAttempt(final ManagedArchive managedArchive) {
        try {
            retryTasks.put(managedArchive.getUrl(),
                    scheduler.schedule(() -> dispatchAttempt(managedArchive), retryIntervalMs, TimeUnit.MILLISECONDS));
        } catch (final RejectedExecutionException e) {
            logger.debug("Retry scheduler is shut down, not retrying {}", managedArchive.getUrl());
            retryTasks.remove(managedArchive.getUrl());
        }
    }

    private void dispatchAttempt(final ManagedArchive managedArchive) {
        try {
            archiveExecutor.execute(() -> attempt(managedArchive));
        } catch (final RejectedExecutionException e) {
            logger.debug("Archive workers are shut down, not retrying {}", managedArchive.getUrl());
            retryTasks.remove(managedArchive.getUrl());
        }
    }

    private void attempt(final ManagedArchive managedArchive) {
        final String url = managedArchive.getUrl();
        if (!context.isOpenOrOpening() || !context.isManaged(managedArchive)) {
            logger.debug("Archive {} is no longer wanted, stopping retries", url);
            retryTasks.remove(url);
            return;
        }

        logger.debug("Retrying index pass of {}", url);
        try {
            indexer.indexArchive(managedArchive, false);
        } catch (final ArchiveUnreachableException e) {
            logger.debug("Archive {} is still unreachable", url);
            scheduleAttempt(managedArchive);
            return;
        } catch (final IOException | RuntimeException e) {
            logger.debug("Retry of {} failed with a non-recoverable error, giving up", url, e);
            retryTasks.remove(url);
            return;
        }

        retryTasks.remove(url);
        logger.info("Archive {} is reachable again", url);
        events.sourceFound(url);
        try {
            watcher.watchArchive(managedArchive);
        } catch (final IOException e) {
            logger.warn("Failed to watch archive {}", url, e);
            events.sourceError(url, e);
        }
    }

    public void shutdown() {
        retryTasks.values().forEach(task -> task.cancel(false));
        retryTasks.clear();
        scheduler.shutdownNow();
    }
}
