package de.mirkosertic.archiveindexer.indexer;

import de.mirkosertic.archiveindexer.archive.Archive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Debounced downloads of invalidated archive paths.
 * <p>
 * A request arms a timer for its {@code (archive, path)} key. Repeated requests for the same key
 * while the timer is pending re-arm it, so a burst collapses into one download once the key has
 * been quiet for the debounce window. Requests for a key whose download is running are dropped.
 */
public class DownloadScheduler {

    private static final Logger logger = LoggerFactory.getLogger(DownloadScheduler.class);

    record DownloadKey(String archiveUrl, String path) {
    }

    private static final class PendingDownload {
        private volatile ScheduledFuture<?> timer;

        void cancel() {
            final ScheduledFuture<?> current = timer;
            if (current != null) {
                current.cancel(false);
            }
        }
    }

    private final IndexEvents events;
    private final long debounceMs;
    private final ScheduledExecutorService scheduler;
    private final Map<DownloadKey, PendingDownload> pending = new ConcurrentHashMap<>();
    private final Set<DownloadKey> inFlight = ConcurrentHashMap.newKeySet();

    public DownloadScheduler(final IndexEvents events, final long debounceMs) {
        this(events, debounceMs, newScheduler());
    }

    DownloadScheduler(final IndexEvents events, final long debounceMs, final ScheduledExecutorService scheduler) {
        this.events = events;
        this.debounceMs = debounceMs;
        this.scheduler = scheduler;
    }

    private static ScheduledExecutorService newScheduler() {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        return Executors.newScheduledThreadPool(2, r -> {
            final Thread thread = new Thread(r, "archive-download-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Schedule a download of {@code path}, or postpone the already scheduled one.
     */
    public void requestDownload(final Archive archive, final String path) {
        final DownloadKey key = new DownloadKey(archive.getUrl(), path);
        if (inFlight.contains(key)) {
            logger.debug("Download of {}{} already running, ignoring request", archive.getUrl(), path);
            return;
        }
        try {
            pending.compute(key, (k, previous) -> {
                if (previous != null) {
                    previous.cancel();
                }
                final PendingDownload next = new PendingDownload();
                next.timer = scheduler.schedule(() -> runDownload(archive, key, next), debounceMs, TimeUnit.MILLISECONDS);
                return next;
            });
        } catch (final RejectedExecutionException e) {
            logger.debug("Download scheduler is shut down, dropping request for {}{}", archive.getUrl(), path);
        }
    }

    /**
     * Drop all downloads of the archive that have not started yet.
     */
    public void cancelPending(final String archiveUrl) {
        pending.entrySet().removeIf(entry -> {
            if (entry.getKey().archiveUrl().equals(archiveUrl)) {
                entry.getValue().cancel();
                return true;
            }
            return false;
        });
    }

    public boolean isPending(final String archiveUrl, final String path) {
        return pending.containsKey(new DownloadKey(archiveUrl, path));
    }

    private void runDownload(final Archive archive, final DownloadKey key, final PendingDownload download) {
        // A request that re-armed the key after this timer fired owns the entry now.
        if (!pending.remove(key, download)) {
            logger.debug("Download of {}{} was re-armed, skipping superseded run", key.archiveUrl(), key.path());
            return;
        }
        if (!inFlight.add(key)) {
            return;
        }
        try {
            logger.debug("Downloading {}{}", key.archiveUrl(), key.path());
            archive.download(key.path());
        } catch (final IOException | RuntimeException e) {
            logger.warn("Download of {}{} failed: {}", key.archiveUrl(), key.path(), e.getMessage());
            events.sourceError(key.archiveUrl(), e);
        } finally {
            inFlight.remove(key);
        }
    }

    public void shutdown() {
        pending.values().forEach(PendingDownload::cancel);
        pending.clear();
        scheduler.shutdownNow();
    }
}
