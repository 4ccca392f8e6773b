package de.mirkosertic.archiveindexer.indexer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IndexMeta Tests")
class IndexMetaTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Should persist as url, version, isWritable and localPath")
    void shouldUsePersistedFieldNames() throws IOException {
        final JsonNode json = objectMapper.valueToTree(new IndexMeta("dat://alice", 7, true, "/data/alice"));

        assertThat(json.get("url").asText()).isEqualTo("dat://alice");
        assertThat(json.get("version").asLong()).isEqualTo(7L);
        assertThat(json.get("isWritable").asBoolean()).isTrue();
        assertThat(json.get("localPath").asText()).isEqualTo("/data/alice");
    }

    @Test
    @DisplayName("Should read records without local path")
    void shouldReadWithoutLocalPath() throws IOException {
        final IndexMeta meta = objectMapper.readValue(
                "{\"url\":\"dat://bob\",\"version\":3,\"isWritable\":false}", IndexMeta.class);

        assertThat(meta).isEqualTo(new IndexMeta("dat://bob", 3, false, null));
        assertThat(meta.withVersion(0)).isEqualTo(new IndexMeta("dat://bob", 0, false, null));
    }
}
