package de.mirkosertic.archiveindexer.table;

import de.mirkosertic.archiveindexer.store.InMemoryRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TableRegistry Tests")
class TableRegistryTest {

    private TableRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TableRegistry();
    }

    private static Table table(final String name, final String... patterns) {
        return new Table(name, List.of(patterns), TableSchema.none(), new InMemoryRecordStore<>());
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("Should keep tables in registration order")
        void shouldKeepRegistrationOrder() {
            registry.register(table("posts", "/posts/*.json"));
            registry.register(table("comments", "/comments/*.json"));
            registry.register(table("likes", "/likes/*.json"));

            assertThat(registry.getTables()).extracting(Table::getName)
                    .containsExactly("posts", "comments", "likes");
        }

        @Test
        @DisplayName("Should reject a second table with the same name")
        void shouldRejectDuplicateName() {
            registry.register(table("posts", "/posts/*.json"));

            assertThatThrownBy(() -> registry.register(table("posts", "/other/*.json")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("posts");
        }

        @Test
        @DisplayName("Should reject tables without name or patterns")
        void shouldRejectInvalidTables() {
            assertThatThrownBy(() -> table(""))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new Table("posts", List.of(), TableSchema.none(), new InMemoryRecordStore<>()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Path ownership")
    class Ownership {

        @Test
        @DisplayName("Should assign a path matched by several tables to the first registered one")
        void shouldPreferFirstRegisteredTable() {
            registry.register(table("specific", "/data/posts/*.json"));
            registry.register(table("catchall", "/data/**"));

            assertThat(registry.findOwner("/data/posts/1.json")).map(Table::getName).contains("specific");
            assertThat(registry.findOwner("/data/other/1.json")).map(Table::getName).contains("catchall");
        }

        @Test
        @DisplayName("Should return empty for paths no table claims")
        void shouldReturnEmptyForUnclaimedPath() {
            registry.register(table("posts", "/posts/*.json"));

            assertThat(registry.findOwner("/readme.md")).isEmpty();
        }

        @Test
        @DisplayName("Should build the union of all patterns without duplicates")
        void shouldBuildPatternUnion() {
            registry.register(table("posts", "/posts/*.json", "/shared/*.json"));
            registry.register(table("comments", "/comments/*.json", "/shared/*.json"));

            assertThat(registry.getAllFilePatterns())
                    .containsExactly("/posts/*.json", "/shared/*.json", "/comments/*.json");
            assertThat(registry.matchesAnyPattern("/comments/1.json")).isTrue();
            assertThat(registry.matchesAnyPattern("/likes/1.json")).isFalse();
        }
    }

    @Test
    @DisplayName("Should list only records originating from the given archive")
    void shouldListRecordFilesByOrigin() throws Exception {
        final Table posts = table("posts", "/posts/*.json");
        posts.getStore().put("dat://a/posts/1.json",
                new IndexedRecord("dat://a/posts/1.json", "dat://a", 1L, null));
        posts.getStore().put("dat://b/posts/1.json",
                new IndexedRecord("dat://b/posts/1.json", "dat://b", 1L, null));

        assertThat(posts.listRecordFiles("dat://a"))
                .containsExactly(new RecordFileMatch(posts, "dat://a/posts/1.json"));
    }
}
