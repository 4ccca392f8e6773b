package de.mirkosertic.archiveindexer.indexer;

import de.mirkosertic.archiveindexer.archive.Archive;
import de.mirkosertic.archiveindexer.archive.ArchiveInfo;
import de.mirkosertic.archiveindexer.archive.ChangeType;
import de.mirkosertic.archiveindexer.archive.HistoryEntry;
import de.mirkosertic.archiveindexer.store.RecordStore;
import de.mirkosertic.archiveindexer.table.RecordFileMatch;
import de.mirkosertic.archiveindexer.table.Table;
import de.mirkosertic.archiveindexer.table.TableRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Future;

/**
 * Brings the tables up to date with the history of an archive.
 * <p>
 * Every archive carries a watermark in its {@link IndexMeta}: the highest archive version whose
 * changes are reflected in all tables. A pass reads the history between the watermark and the
 * current archive version, keeps the latest change of each path, applies those changes through
 * the {@link RecordDispatcher} and only then advances the watermark. Writes are keyed overwrites,
 * so a pass interrupted before the watermark write is repaired by re-applying the same range.
 * <p>
 * Passes on the same archive are serialized by {@link ArchiveLocks}; passes on different
 * archives run in parallel.
 */
public class ArchiveIndexer {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveIndexer.class);

    private final IndexContext context;
    private final ArchiveLocks locks;
    private final RecordDispatcher dispatcher;
    private final IndexExecutorService executor;

    public ArchiveIndexer(final IndexContext context, final ArchiveLocks locks,
                          final RecordDispatcher dispatcher, final IndexExecutorService executor) {
        this.context = context;
        this.locks = locks;
        this.dispatcher = dispatcher;
        this.executor = executor;
    }

    /**
     * Index all changes of the archive that are newer than its watermark.
     * <p>
     * Does nothing if the database is neither open nor being opened, if the meta store is
     * unavailable, or if {@code managedArchive} is no longer the managed handle of its archive.
     * Only archives with a meta record are indexed; a pass never creates one. Failures to reach the archive propagate to the caller; failures of single
     * files are reported as index errors and do not abort the pass.
     *
     * @param managedArchive the archive to index
     * @param needsRebuild   whether the pass runs as part of a rebuild after a reset
     */
    public void indexArchive(final ManagedArchive managedArchive, final boolean needsRebuild) throws IOException {
        final Archive archive = managedArchive.getArchive();
        logger.debug("Indexing archive {} (needsRebuild={})", archive.getUrl(), needsRebuild);

        locks.withLock(archive.getUrl(), () -> {
            if (!context.isOpenOrOpening()) {
                logger.debug("Database is not open, skipping index pass of {}", archive.getUrl());
                return null;
            }
            if (!context.isManaged(managedArchive)) {
                logger.debug("Archive {} is no longer managed, skipping index pass", archive.getUrl());
                return null;
            }
            final RecordStore<IndexMeta> metaStore = context.getMetaStore();
            if (metaStore == null || !metaStore.isOpen()) {
                logger.warn("Index pass of {} called on corrupted database, meta store is not available", archive.getUrl());
                return null;
            }

            final Future<Optional<IndexMeta>> metaFuture = executor.submit(() -> readIndexMeta(metaStore, archive.getUrl()));
            final ArchiveInfo archiveInfo = archive.getInfo();
            final Optional<IndexMeta> indexMeta = IndexExecutorService.await(metaFuture);
            if (indexMeta.isEmpty()) {
                logger.warn("No meta record for managed archive {}, skipping index pass", archive.getUrl());
                return null;
            }

            final long watermark = indexMeta.get().version();
            if (watermark >= archiveInfo.version()) {
                logger.debug("No index needed for {} (watermark={}, version={})",
                        archive.getUrl(), watermark, archiveInfo.version());
                return null;
            }
            logger.debug("Indexing {} from version {} to {}", archive.getUrl(), watermark + 1, archiveInfo.version());

            final Map<String, HistoryEntry> updates =
                    scanArchiveHistoryForUpdates(archive, watermark + 1, archiveInfo.version() + 1);
            final Set<String> touchedTables = applyUpdates(archive, archiveInfo, updates);
            logger.debug("Applied {} updates from {}, touching tables {}", updates.size(), archive.getUrl(), touchedTables);

            for (final String tableName : touchedTables) {
                final Optional<Table> table = context.getTables().getTable(tableName);
                if (table.isPresent()) {
                    table.get().getStore().flush();
                }
            }

            metaStore.put(archive.getUrl(), indexMeta.get().withVersion(archiveInfo.version()));
            metaStore.flush();

            for (final String tableName : touchedTables) {
                context.getEvents().indexUpdated(tableName, archive, archiveInfo.version());
            }
            context.getEvents().indexesUpdated(archive, archiveInfo.version());
            return null;
        });
    }

    /**
     * Remove every record the archive contributed to any table, then its {@link IndexMeta}.
     * Safe to call for archives that were never fully indexed.
     *
     * @return number of removed records
     */
    public int unindexArchive(final Archive archive) throws IOException {
        return locks.withLock(archive.getUrl(), () -> {
            final List<RecordFileMatch> matches = scanArchiveForRecords(archive);
            for (final RecordFileMatch match : matches) {
                match.table().getStore().delete(match.recordUrl());
            }
            for (final Table table : context.getTables().getTables()) {
                table.getStore().flush();
            }
            context.getMetaStore().delete(archive.getUrl());
            context.getMetaStore().flush();
            logger.info("Removed {} records of archive {}", matches.size(), archive.getUrl());
            return matches.size();
        });
    }

    /**
     * The latest change of every path in {@code [start, end)} that matches any table pattern,
     * in the order the paths were first changed.
     */
    Map<String, HistoryEntry> scanArchiveHistoryForUpdates(final Archive archive, final long start, final long end) throws IOException {
        final TableRegistry tables = context.getTables();
        final Map<String, HistoryEntry> updates = new LinkedHashMap<>();
        for (final HistoryEntry entry : archive.history(start, end)) {
            if (tables.matchesAnyPattern(entry.path())) {
                updates.put(entry.path(), entry);
            }
        }
        return updates;
    }

    /**
     * Apply all updates concurrently and wait until every one of them resolved.
     *
     * @return names of the tables that were touched
     */
    Set<String> applyUpdates(final Archive archive, final ArchiveInfo archiveInfo,
                             final Map<String, HistoryEntry> updates) throws IOException {
        final List<Future<Optional<String>>> futures = new ArrayList<>(updates.size());
        for (final HistoryEntry update : updates.values()) {
            if (update.type() == ChangeType.DELETE) {
                futures.add(executor.submit(() -> dispatcher.unindexFile(archive, update.path())));
            } else {
                futures.add(executor.submit(() -> dispatcher.readAndIndexFile(archive, archiveInfo, update.path())));
            }
        }

        final Set<String> touchedTables = new LinkedHashSet<>();
        IOException firstFailure = null;
        for (final Future<Optional<String>> future : futures) {
            try {
                IndexExecutorService.await(future).ifPresent(touchedTables::add);
            } catch (final IOException e) {
                if (firstFailure == null) {
                    firstFailure = e;
                } else {
                    firstFailure.addSuppressed(e);
                }
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
        return touchedTables;
    }

    private List<RecordFileMatch> scanArchiveForRecords(final Archive archive) throws IOException {
        final List<RecordFileMatch> matches = new ArrayList<>();
        for (final Table table : context.getTables().getTables()) {
            matches.addAll(table.listRecordFiles(archive.getUrl()));
        }
        return matches;
    }

    private Optional<IndexMeta> readIndexMeta(final RecordStore<IndexMeta> metaStore, final String url) {
        try {
            return metaStore.get(url);
        } catch (final IOException e) {
            logger.warn("Failed to read index meta of {}, starting from version 0", url, e);
            return Optional.empty();
        }
    }
}
