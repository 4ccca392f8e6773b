package de.mirkosertic.archiveindexer.indexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size worker pool for indexing tasks.
 * When the queue is full, the submitting thread runs the task itself.
 */
public class IndexExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(IndexExecutorService.class);

    private final String name;
    private final ThreadPoolExecutor executor;

    public IndexExecutorService(final String name, final int threadPoolSize) {
        this.name = name;
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, name + "-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                threadPoolSize,
                threadPoolSize,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(10000),
                threadFactory,
                (task, pool) -> {
                    if (pool.isShutdown()) {
                        throw new RejectedExecutionException("Executor " + name + " is shut down");
                    }
                    task.run();
                }
        );

        logger.info("IndexExecutorService {} initialized with {} threads", name, threadPoolSize);
    }

    public <T> Future<T> submit(final Callable<T> task) {
        return executor.submit(task);
    }

    public Future<?> submit(final Runnable task) {
        return executor.submit(task);
    }

    public void execute(final Runnable task) {
        executor.execute(task);
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Wait for a task and unwrap its failure.
     */
    public static <T> T await(final Future<T> future) throws IOException {
        try {
            return future.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for an indexing task");
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException("Indexing task failed", cause);
        }
    }

    /**
     * Stop accepting tasks and wait up to ten seconds for running ones.
     */
    public void shutdown() {
        logger.info("Shutting down IndexExecutorService {}", name);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("IndexExecutorService {} did not terminate in time, forcing shutdown", name);
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for IndexExecutorService {} to terminate", name, e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
