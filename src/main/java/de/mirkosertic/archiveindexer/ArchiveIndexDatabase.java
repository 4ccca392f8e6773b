package de.mirkosertic.archiveindexer;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.archiveindexer.archive.Archive;
import de.mirkosertic.archiveindexer.archive.ArchiveFactory;
import de.mirkosertic.archiveindexer.config.IndexerConfig;
import de.mirkosertic.archiveindexer.indexer.ArchiveIndexer;
import de.mirkosertic.archiveindexer.indexer.ArchiveLifecycleManager;
import de.mirkosertic.archiveindexer.indexer.ArchiveLocks;
import de.mirkosertic.archiveindexer.indexer.ArchiveWatcher;
import de.mirkosertic.archiveindexer.indexer.DownloadScheduler;
import de.mirkosertic.archiveindexer.indexer.IndexContext;
import de.mirkosertic.archiveindexer.indexer.IndexEvents;
import de.mirkosertic.archiveindexer.indexer.IndexExecutorService;
import de.mirkosertic.archiveindexer.indexer.IndexMeta;
import de.mirkosertic.archiveindexer.indexer.ManagedArchive;
import de.mirkosertic.archiveindexer.indexer.RecordDispatcher;
import de.mirkosertic.archiveindexer.indexer.SourceRetryService;
import de.mirkosertic.archiveindexer.store.LuceneRecordStore;
import de.mirkosertic.archiveindexer.store.RecordStore;
import de.mirkosertic.archiveindexer.table.IndexedRecord;
import de.mirkosertic.archiveindexer.table.Table;
import de.mirkosertic.archiveindexer.table.TableRegistry;
import de.mirkosertic.archiveindexer.table.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point of the archive indexer.
 * <p>
 * Tables are defined first, then the database is opened. Opening resets outdated indexes and
 * brings every archive with persisted metadata back under management. Archives are added and
 * removed while the database is open; all indexing after that happens in the background and
 * is reported to registered {@link IndexListener}s.
 * <p>
 * A closed database cannot be opened again.
 */
public class ArchiveIndexDatabase implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveIndexDatabase.class);

    static final int META_SCHEMA_VERSION = 1;

    private final IndexerConfig config;
    private final ObjectMapper objectMapper;
    private final TableRegistry tables;
    private final IndexEvents events;
    private final IndexContext context;
    private final IndexExecutorService recordExecutor;
    private final IndexExecutorService archiveExecutor;
    private final DownloadScheduler downloads;
    private final ArchiveIndexer indexer;
    private final ArchiveWatcher watcher;
    private final SourceRetryService retryService;
    private final ArchiveLifecycleManager lifecycle;

    private volatile boolean closed;

    public ArchiveIndexDatabase(final IndexerConfig config, final RecordStore<IndexMeta> metaStore,
                                final ArchiveFactory archiveFactory) {
        this.config = config;
        this.objectMapper = new ObjectMapper();
        this.tables = new TableRegistry();
        this.events = new IndexEvents();
        this.context = new IndexContext(tables, metaStore, events);

        this.recordExecutor = new IndexExecutorService("record-indexer", config.getThreadPoolSize());
        this.archiveExecutor = new IndexExecutorService("archive-loader", config.getArchivePoolSize());
        this.downloads = new DownloadScheduler(events, config.getDownloadDebounceMs());

        final RecordDispatcher dispatcher = new RecordDispatcher(tables, events, objectMapper, Clock.systemUTC());
        this.indexer = new ArchiveIndexer(context, new ArchiveLocks(), dispatcher, recordExecutor);
        this.watcher = new ArchiveWatcher(tables, indexer, downloads, archiveExecutor, events);
        this.retryService = new SourceRetryService(context, indexer, watcher, archiveExecutor, events,
                config.getRetryIntervalMs());
        this.lifecycle = new ArchiveLifecycleManager(context, archiveFactory, indexer, watcher, retryService, archiveExecutor);
    }

    /**
     * Persistent database configured by {@link IndexerConfig#load()}.
     */
    public static ArchiveIndexDatabase persistent(final ArchiveFactory archiveFactory) throws IOException {
        return persistent(IndexerConfig.load(), archiveFactory);
    }

    /**
     * Database persisting its metadata and tables in Lucene indexes below the configured store path.
     */
    public static ArchiveIndexDatabase persistent(final IndexerConfig config, final ArchiveFactory archiveFactory) throws IOException {
        final LuceneRecordStore<IndexMeta> metaStore = new LuceneRecordStore<>(
                Paths.get(config.getStorePath(), "meta"), IndexMeta.class, new ObjectMapper(), META_SCHEMA_VERSION);
        metaStore.init();
        return new ArchiveIndexDatabase(config, metaStore, archiveFactory);
    }

    /**
     * Define a table persisted in its own Lucene index. Tables must be defined before {@link #open()};
     * their definition order decides which table owns a path matched by several tables.
     *
     * @param schemaVersion version of the record shape; changing it rebuilds all tables on the next open
     */
    public Table defineTable(final String name, final int schemaVersion, final List<String> filePatterns,
                             final TableSchema schema) throws IOException {
        final Path tablePath = Paths.get(config.getStorePath(), "tables", name);
        final LuceneRecordStore<IndexedRecord> store =
                new LuceneRecordStore<>(tablePath, IndexedRecord.class, objectMapper, schemaVersion);
        store.init();
        final Table table = new Table(name, filePatterns, schema, store);
        try {
            registerTable(table);
        } catch (final RuntimeException e) {
            store.close();
            throw e;
        }
        return table;
    }

    /**
     * Register a table backed by a caller supplied store.
     */
    public void registerTable(final Table table) {
        if (context.getState() != IndexContext.State.CLOSED || closed) {
            throw new IllegalStateException("Tables must be registered before the database is opened");
        }
        tables.register(table);
        logger.info("Registered table {} with patterns {}", table.getName(), table.getFilePatterns());
    }

    public void open() throws IOException {
        if (closed || context.getState() != IndexContext.State.CLOSED) {
            throw new IllegalStateException("Database is already open or was closed");
        }
        context.setState(IndexContext.State.OPENING);
        try {
            final List<String> tablesNeedingRebuild = new ArrayList<>();
            for (final Table table : tables.getTables()) {
                if (table.getStore().isSchemaUpgradeRequired()) {
                    tablesNeedingRebuild.add(table.getName());
                }
            }
            final boolean needsRebuild = lifecycle.resetOutdatedIndexes(tablesNeedingRebuild);
            lifecycle.loadArchives(needsRebuild);
            context.setState(IndexContext.State.OPEN);
            logger.info("Archive index database opened with {} tables and {} archives",
                    tables.getTables().size(), context.getManagedArchives().size());
        } catch (final IOException | RuntimeException e) {
            context.setState(IndexContext.State.CLOSED);
            throw e;
        }
    }

    public ManagedArchive addArchive(final Archive archive) throws IOException {
        ensureOpen();
        return lifecycle.addArchive(archive);
    }

    public void removeArchive(final Archive archive) throws IOException {
        ensureOpen();
        lifecycle.removeArchive(archive);
    }

    /**
     * Run an index pass of a managed archive now instead of waiting for its next change.
     *
     * @return whether the archive is managed
     */
    public boolean indexArchive(final String archiveUrl) throws IOException {
        ensureOpen();
        final Optional<ManagedArchive> managedArchive = context.getManagedArchive(archiveUrl);
        if (managedArchive.isEmpty()) {
            return false;
        }
        indexer.indexArchive(managedArchive.get(), false);
        return true;
    }

    public List<Table> getTables() {
        return tables.getTables();
    }

    public Optional<Table> getTable(final String name) {
        return tables.getTable(name);
    }

    public Optional<IndexMeta> getIndexMeta(final String archiveUrl) throws IOException {
        return context.getMetaStore().get(archiveUrl);
    }

    public List<String> getManagedArchiveUrls() {
        return context.getManagedArchives().stream().map(ManagedArchive::getUrl).sorted().toList();
    }

    public boolean isWatched(final String archiveUrl) {
        return context.getManagedArchive(archiveUrl).map(ManagedArchive::isWatched).orElse(false);
    }

    public void addListener(final IndexListener listener) {
        events.addListener(listener);
    }

    public void removeListener(final IndexListener listener) {
        events.removeListener(listener);
    }

    public boolean isOpen() {
        return context.isOpen();
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        context.setState(IndexContext.State.CLOSED);
        logger.info("Closing archive index database");

        for (final ManagedArchive managedArchive : context.getManagedArchives()) {
            watcher.unwatchArchive(managedArchive);
        }
        retryService.shutdown();
        downloads.shutdown();
        archiveExecutor.shutdown();
        recordExecutor.shutdown();

        IOException failure = null;
        for (final Table table : tables.getTables()) {
            failure = closeStore(table.getStore(), failure);
        }
        failure = closeStore(context.getMetaStore(), failure);
        if (failure != null) {
            throw failure;
        }
    }

    private IOException closeStore(final RecordStore<?> store, final IOException failure) {
        try {
            store.close();
            return failure;
        } catch (final IOException e) {
            logger.error("Failed to close store", e);
            if (failure == null) {
                return e;
            }
            failure.addSuppressed(e);
            return failure;
        }
    }

    private void ensureOpen() {
        if (!context.isOpen()) {
            throw new IllegalStateException("Database is not open");
        }
    }
}
