package de.mirkosertic.archiveindexer.indexer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.archiveindexer.IndexListener;
import de.mirkosertic.archiveindexer.archive.ArchiveInfo;
import de.mirkosertic.archiveindexer.archive.InMemoryArchive;
import de.mirkosertic.archiveindexer.store.InMemoryRecordStore;
import de.mirkosertic.archiveindexer.store.RecordStore;
import de.mirkosertic.archiveindexer.table.IndexedRecord;
import de.mirkosertic.archiveindexer.table.Table;
import de.mirkosertic.archiveindexer.table.TableRegistry;
import de.mirkosertic.archiveindexer.table.TableSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@DisplayName("RecordDispatcher Tests")
class RecordDispatcherTest {

    private static final String ARCHIVE_URL = "dat://alice";
    private static final long NOW = 1_700_000_000_000L;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private TableRegistry tables;
    private IndexListener listener;
    private RecordDispatcher dispatcher;
    private InMemoryArchive archive;
    private RecordStore<IndexedRecord> posts;
    private RecordStore<IndexedRecord> everything;

    @BeforeEach
    void setUp() {
        tables = new TableRegistry();
        posts = new InMemoryRecordStore<>();
        everything = new InMemoryRecordStore<>();
        tables.register(new Table("posts", List.of("/posts/*.json"),
                new TableSchema(record -> record.hasNonNull("title"),
                        record -> ((ObjectNode) record.deepCopy()).put("normalized", true)),
                posts));
        tables.register(new Table("everything", List.of("/**.json"), TableSchema.none(), everything));

        final IndexEvents events = new IndexEvents();
        listener = mock(IndexListener.class);
        events.addListener(listener);

        dispatcher = new RecordDispatcher(tables, events, objectMapper,
                Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
        archive = new InMemoryArchive(ARCHIVE_URL);
    }

    private ArchiveInfo info() throws IOException {
        return archive.getInfo();
    }

    @Nested
    @DisplayName("readAndIndexFile")
    class ReadAndIndexFile {

        @Test
        @DisplayName("Should store the preprocessed record in the first matching table")
        void shouldStoreInFirstMatchingTable() throws IOException {
            archive.putFile("/posts/1.json", "{\"title\":\"hello\"}");

            assertThat(dispatcher.readAndIndexFile(archive, info(), "/posts/1.json")).contains("posts");

            final IndexedRecord stored = posts.get(ARCHIVE_URL + "/posts/1.json").orElseThrow();
            assertThat(stored.url()).isEqualTo(ARCHIVE_URL + "/posts/1.json");
            assertThat(stored.origin()).isEqualTo(ARCHIVE_URL);
            assertThat(stored.indexedAt()).isEqualTo(NOW);
            assertThat(stored.record().get("title").asText()).isEqualTo("hello");
            assertThat(stored.record().get("normalized").asBoolean()).isTrue();
            assertThat(everything.entries()).isEmpty();
        }

        @Test
        @DisplayName("Should store paths not owned by an earlier table in the later one")
        void shouldFallThroughToLaterTable() throws IOException {
            archive.putFile("/profile.json", "{\"name\":\"alice\"}");

            assertThat(dispatcher.readAndIndexFile(archive, info(), "/profile.json")).contains("everything");
            assertThat(everything.get(ARCHIVE_URL + "/profile.json")).isPresent();
        }

        @Test
        @DisplayName("Should delete a stored record that no longer validates")
        void shouldRetractInvalidRecord() throws IOException {
            archive.putFile("/posts/1.json", "{\"title\":\"hello\"}");
            dispatcher.readAndIndexFile(archive, info(), "/posts/1.json");

            archive.putFile("/posts/1.json", "{\"body\":\"no title\"}");

            assertThat(dispatcher.readAndIndexFile(archive, info(), "/posts/1.json")).contains("posts");
            assertThat(posts.get(ARCHIVE_URL + "/posts/1.json")).isEmpty();
            assertThat(everything.entries()).isEmpty();
        }

        @Test
        @DisplayName("Should report unparseable files as index error and touch no table")
        void shouldReportParseErrors() throws IOException {
            archive.putFile("/posts/broken.json", "{not json");

            assertThat(dispatcher.readAndIndexFile(archive, info(), "/posts/broken.json")).isEmpty();

            verify(listener).onIndexError(eq(ARCHIVE_URL + "/posts/broken.json"), any(IOException.class));
            assertThat(posts.entries()).isEmpty();
        }

        @Test
        @DisplayName("Should report unreadable files as index error")
        void shouldReportReadErrors() throws IOException {
            assertThat(dispatcher.readAndIndexFile(archive, info(), "/posts/missing.json")).isEmpty();

            verify(listener).onIndexError(eq(ARCHIVE_URL + "/posts/missing.json"), any(IOException.class));
        }

        @Test
        @DisplayName("Should ignore files no table claims")
        void shouldIgnoreUnclaimedFiles() throws IOException {
            archive.putFile("/readme.txt", "{\"text\":\"hi\"}");

            assertThat(dispatcher.readAndIndexFile(archive, info(), "/readme.txt")).isEmpty();
            verify(listener, never()).onIndexError(any(), any());
        }
    }

    @Nested
    @DisplayName("unindexFile")
    class UnindexFile {

        @Test
        @DisplayName("Should delete the record from the owning table")
        void shouldDeleteFromOwner() throws IOException {
            archive.putFile("/posts/1.json", "{\"title\":\"hello\"}");
            dispatcher.readAndIndexFile(archive, info(), "/posts/1.json");

            assertThat(dispatcher.unindexFile(archive, "/posts/1.json")).contains("posts");
            assertThat(posts.entries()).isEmpty();
        }

        @Test
        @DisplayName("Should treat absent records as removed")
        void shouldIgnoreAbsentRecords() {
            assertThat(dispatcher.unindexFile(archive, "/posts/never.json")).contains("posts");
        }

        @Test
        @DisplayName("Should touch no table for unclaimed paths")
        void shouldIgnoreUnclaimedPaths() {
            assertThat(dispatcher.unindexFile(archive, "/readme.txt")).isEmpty();
        }

        @Test
        @DisplayName("Should swallow store failures and touch no table")
        void shouldSwallowStoreFailures() throws IOException {
            posts.close();

            assertThat(dispatcher.unindexFile(archive, "/posts/1.json")).isEmpty();
        }
    }
}
