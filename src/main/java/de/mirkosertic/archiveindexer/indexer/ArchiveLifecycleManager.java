package de.mirkosertic.archiveindexer.indexer;

import de.mirkosertic.archiveindexer.archive.Archive;
import de.mirkosertic.archiveindexer.archive.ArchiveFactory;
import de.mirkosertic.archiveindexer.archive.ArchiveInfo;
import de.mirkosertic.archiveindexer.store.RecordStore;
import de.mirkosertic.archiveindexer.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Future;

/**
 * Brings archives under management and releases them again.
 * <p>
 * Every archive under management goes through the same initial path: an index pass followed
 * by attaching the {@link ArchiveWatcher}. If the initial pass fails the archive stays managed
 * and the failure is handed to the {@link SourceRetryService}.
 */
public class ArchiveLifecycleManager {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveLifecycleManager.class);

    private final IndexContext context;
    private final ArchiveFactory archiveFactory;
    private final ArchiveIndexer indexer;
    private final ArchiveWatcher watcher;
    private final SourceRetryService retryService;
    private final IndexExecutorService archiveExecutor;

    public ArchiveLifecycleManager(final IndexContext context, final ArchiveFactory archiveFactory,
                                   final ArchiveIndexer indexer, final ArchiveWatcher watcher,
                                   final SourceRetryService retryService, final IndexExecutorService archiveExecutor) {
        this.context = context;
        this.archiveFactory = archiveFactory;
        this.indexer = indexer;
        this.watcher = watcher;
        this.retryService = retryService;
        this.archiveExecutor = archiveExecutor;
    }

    /**
     * Manage every archive that has persisted {@link IndexMeta} and run their initial passes
     * concurrently. Returns when all initial passes settled. A failing archive does not affect
     * the others.
     */
    public void loadArchives(final boolean needsRebuild) throws IOException {
        logger.info("Loading archives (needsRebuild={})", needsRebuild);
        final List<Future<?>> initialPasses = new ArrayList<>();
        for (final IndexMeta indexMeta : context.getMetaStore().entries().values()) {
            final Archive archive;
            try {
                archive = archiveFactory.open(indexMeta.url(), indexMeta.localPath());
            } catch (final IOException | RuntimeException e) {
                logger.error("Failed to open archive {}", indexMeta.url(), e);
                context.getEvents().sourceError(indexMeta.url(), e);
                continue;
            }
            logger.debug("Loaded archive {} (localPath={})", indexMeta.url(), indexMeta.localPath());

            final ManagedArchive managedArchive = new ManagedArchive(archive, indexMeta.writable(), indexMeta.localPath());
            context.manage(managedArchive);
            initialPasses.add(archiveExecutor.submit(() -> runInitialIndex(managedArchive, needsRebuild)));
        }
        for (final Future<?> initialPass : initialPasses) {
            IndexExecutorService.await(initialPass);
        }
        logger.info("Loaded {} archives", initialPasses.size());
    }

    /**
     * Start managing {@code archive}: persist a fresh {@link IndexMeta} with watermark 0 and run the
     * initial pass. Failures of the initial pass are handled like those of a loaded archive.
     *
     * @throws IOException if the archive info cannot be fetched or the meta record cannot be written
     */
    public ManagedArchive addArchive(final Archive archive) throws IOException {
        logger.info("Adding archive {}", archive.getUrl());
        final ArchiveInfo info = archive.getInfo();
        final String localPath = archive.getLocalPath().orElse(null);

        final RecordStore<IndexMeta> metaStore = context.getMetaStore();
        metaStore.put(archive.getUrl(), new IndexMeta(archive.getUrl(), 0, info.owner(), localPath));
        metaStore.flush();

        final ManagedArchive managedArchive = context.manageIfAbsent(archive.getUrl(),
                () -> new ManagedArchive(archive, info.owner(), localPath));
        managedArchive.setWritable(info.owner());
        runInitialIndex(managedArchive, false);
        return managedArchive;
    }

    /**
     * Stop managing {@code archive}: remove its records and {@link IndexMeta} and detach the
     * watcher. Works for archives that were never indexed.
     */
    public void removeArchive(final Archive archive) throws IOException {
        logger.info("Removing archive {}", archive.getUrl());
        final Optional<ManagedArchive> managedArchive = context.unmanage(archive.getUrl());
        try {
            indexer.unindexArchive(archive);
        } finally {
            managedArchive.ifPresent(watcher::unwatchArchive);
        }
    }

    /**
     * Clear all tables and reset every watermark to 0 if any table needs a rebuild.
     * The rebuild is always global, even if only some tables are outdated.
     *
     * @param tablesNeedingRebuild names of the outdated tables
     * @return whether a reset happened
     */
    public boolean resetOutdatedIndexes(final List<String> tablesNeedingRebuild) throws IOException {
        if (tablesNeedingRebuild.isEmpty()) {
            return false;
        }
        logger.info("Tables {} need a rebuild, resetting all indexes", tablesNeedingRebuild);

        for (final Table table : context.getTables().getTables()) {
            logger.debug("Clearing table {}", table.getName());
            table.getStore().clear();
        }

        final RecordStore<IndexMeta> metaStore = context.getMetaStore();
        for (final Map.Entry<String, IndexMeta> entry : metaStore.entries().entrySet()) {
            metaStore.put(entry.getKey(), entry.getValue().withVersion(0));
        }
        metaStore.flush();
        return true;
    }

    private void runInitialIndex(final ManagedArchive managedArchive, final boolean needsRebuild) {
        try {
            indexer.indexArchive(managedArchive, needsRebuild);
            watcher.watchArchive(managedArchive);
        } catch (final IOException | RuntimeException e) {
            retryService.onInitialIndexFailure(managedArchive, e);
        }
    }
}
