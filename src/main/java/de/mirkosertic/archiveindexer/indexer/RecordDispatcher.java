package de.mirkosertic.archiveindexer.indexer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.archiveindexer.archive.Archive;
import de.mirkosertic.archiveindexer.archive.ArchiveInfo;
import de.mirkosertic.archiveindexer.table.IndexedRecord;
import de.mirkosertic.archiveindexer.table.Table;
import de.mirkosertic.archiveindexer.table.TableRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Optional;

/**
 * Writes or removes the stored record of a single archive file in the table that owns its path.
 * <p>
 * Both operations return the name of the table they touched, or an empty optional if no table
 * was touched. Failures of a single file never propagate to the caller.
 */
public class RecordDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(RecordDispatcher.class);

    private final TableRegistry tables;
    private final IndexEvents events;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RecordDispatcher(final TableRegistry tables, final IndexEvents events,
                            final ObjectMapper objectMapper, final Clock clock) {
        this.tables = tables;
        this.events = events;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Key of the record produced by {@code path} of {@code archive}.
     */
    public static String recordUrl(final Archive archive, final String path) {
        return archive.getUrl() + path;
    }

    /**
     * Read {@code path} from the archive and store its record in the owning table.
     * <p>
     * A record rejected by the table's validator removes the stored entry. Read and parse
     * failures are reported as index errors.
     */
    public Optional<String> readAndIndexFile(final Archive archive, final ArchiveInfo archiveInfo, final String path) {
        final String fileUrl = recordUrl(archive, path);
        try {
            final JsonNode parsed = objectMapper.readTree(archive.readFile(path));
            if (parsed == null || parsed.isMissingNode()) {
                throw new IOException("File is empty: " + path);
            }

            final Optional<Table> owner = tables.findOwner(path);
            if (owner.isEmpty()) {
                return Optional.empty();
            }
            final Table table = owner.get();

            if (!table.getSchema().isValid(parsed)) {
                logger.debug("Record {} failed validation of table {}, removing it", fileUrl, table.getName());
                table.getStore().delete(fileUrl);
                return Optional.of(table.getName());
            }

            final JsonNode record = table.getSchema().preprocess(parsed);
            table.getStore().put(fileUrl, new IndexedRecord(fileUrl, archive.getUrl(), clock.millis(), record));
            logger.debug("Indexed {} into table {} at archive version {}", fileUrl, table.getName(), archiveInfo.version());
            return Optional.of(table.getName());
        } catch (final IOException | RuntimeException e) {
            logger.warn("Failed to index {}: {}", fileUrl, e.getMessage());
            events.indexError(fileUrl, e);
            return Optional.empty();
        }
    }

    /**
     * Remove the stored record of {@code path} from the owning table. Removing a record that
     * does not exist is not an error.
     */
    public Optional<String> unindexFile(final Archive archive, final String path) {
        final Optional<Table> owner = tables.findOwner(path);
        if (owner.isEmpty()) {
            return Optional.empty();
        }
        final String fileUrl = recordUrl(archive, path);
        try {
            owner.get().getStore().delete(fileUrl);
            logger.debug("Removed {} from table {}", fileUrl, owner.get().getName());
            return Optional.of(owner.get().getName());
        } catch (final IOException e) {
            logger.warn("Failed to remove {} from table {}", fileUrl, owner.get().getName(), e);
            return Optional.empty();
        }
    }
}
