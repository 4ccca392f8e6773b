package de.mirkosertic.archiveindexer.indexer;

import de.mirkosertic.archiveindexer.store.RecordStore;
import de.mirkosertic.archiveindexer.table.TableRegistry;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Shared state of one index database: its tables, the meta store, the signal fan-out,
 * the open state and the set of managed archives.
 */
public class IndexContext {

    public enum State {
        CLOSED,
        OPENING,
        OPEN
    }

    private final TableRegistry tables;
    private final RecordStore<IndexMeta> metaStore;
    private final IndexEvents events;
    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final Map<String, ManagedArchive> archives = new ConcurrentHashMap<>();

    public IndexContext(final TableRegistry tables, final RecordStore<IndexMeta> metaStore, final IndexEvents events) {
        this.tables = tables;
        this.metaStore = metaStore;
        this.events = events;
    }

    public TableRegistry getTables() {
        return tables;
    }

    public RecordStore<IndexMeta> getMetaStore() {
        return metaStore;
    }

    public IndexEvents getEvents() {
        return events;
    }

    public State getState() {
        return state.get();
    }

    public void setState(final State newState) {
        state.set(newState);
    }

    public boolean isOpen() {
        return state.get() == State.OPEN;
    }

    public boolean isOpenOrOpening() {
        final State current = state.get();
        return current == State.OPEN || current == State.OPENING;
    }

    /**
     * Register an archive, replacing any archive previously managed under the same URL.
     */
    public void manage(final ManagedArchive archive) {
        archives.put(archive.getUrl(), archive);
    }

    /**
     * The archive managed under {@code url}, registering the one from {@code factory} if there is none.
     */
    public ManagedArchive manageIfAbsent(final String url, final Supplier<ManagedArchive> factory) {
        return archives.computeIfAbsent(url, key -> factory.get());
    }

    public Optional<ManagedArchive> unmanage(final String url) {
        return Optional.ofNullable(archives.remove(url));
    }

    public Optional<ManagedArchive> getManagedArchive(final String url) {
        return Optional.ofNullable(archives.get(url));
    }

    /**
     * Whether exactly this instance is still managed. Non-blocking.
     */
    public boolean isManaged(final ManagedArchive archive) {
        return archives.get(archive.getUrl()) == archive;
    }

    public List<ManagedArchive> getManagedArchives() {
        return List.copyOf(archives.values());
    }
}
