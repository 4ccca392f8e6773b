package de.mirkosertic.archiveindexer.table;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered set of tables.
 * <p>
 * Registration order is the dispatch contract: a path matching the patterns of several tables
 * belongs to the table registered first, and only that table ever stores records for it.
 */
public class TableRegistry {

    private final List<Table> tables = new CopyOnWriteArrayList<>();
    private volatile PathPatternMatcher unionMatcher = new PathPatternMatcher(List.of());

    public synchronized void register(final Table table) {
        for (final Table existing : tables) {
            if (existing.getName().equals(table.getName())) {
                throw new IllegalArgumentException("Table already registered: " + table.getName());
            }
        }
        tables.add(table);
        unionMatcher = new PathPatternMatcher(getAllFilePatterns());
    }

    /**
     * All tables in registration order.
     */
    public List<Table> getTables() {
        return List.copyOf(tables);
    }

    public Optional<Table> getTable(final String name) {
        return tables.stream().filter(table -> table.getName().equals(name)).findFirst();
    }

    /**
     * The first registered table that claims {@code path}.
     */
    public Optional<Table> findOwner(final String path) {
        for (final Table table : tables) {
            if (table.isRecordFile(path)) {
                return Optional.of(table);
            }
        }
        return Optional.empty();
    }

    /**
     * Union of all tables' file patterns, without duplicates, in registration order.
     */
    public List<String> getAllFilePatterns() {
        final Set<String> patterns = new LinkedHashSet<>();
        for (final Table table : tables) {
            patterns.addAll(table.getFilePatterns());
        }
        return new ArrayList<>(patterns);
    }

    /**
     * Cheap pre-filter against the union of all patterns. A match does not imply that a table owns the path.
     */
    public boolean matchesAnyPattern(final String path) {
        return unionMatcher.matches(path);
    }
}
