package de.mirkosertic.archiveindexer.indexer;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One exclusive lock per archive URL.
 * <p>
 * Locks are created on first use and shared by all callers asking for the same URL. Values are
 * held weakly: a lock that nobody holds or waits for may be collected and is recreated on demand.
 * Passes on different archives never contend.
 */
public class ArchiveLocks {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(url -> new ReentrantLock());

    /**
     * Run {@code section} while holding the lock of {@code archiveUrl}. The lock is released on every exit path.
     */
    public <T> T withLock(final String archiveUrl, final LockedSection<T> section) throws IOException {
        final ReentrantLock lock = locks.get(archiveUrl);
        try {
            lock.lockInterruptibly();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for the index lock of " + archiveUrl);
        }
        try {
            return section.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether some thread currently holds the lock of {@code archiveUrl}.
     */
    public boolean isLocked(final String archiveUrl) {
        final ReentrantLock lock = locks.getIfPresent(archiveUrl);
        return lock != null && lock.isLocked();
    }

    @FunctionalInterface
    public interface LockedSection<T> {
        T run() throws IOException;
    }
}
