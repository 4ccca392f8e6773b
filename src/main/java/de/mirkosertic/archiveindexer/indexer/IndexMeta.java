package de.mirkosertic.archiveindexer.indexer;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Persisted bookkeeping of one managed archive, keyed by its URL.
 *
 * @param url       archive URL
 * @param version   watermark: the highest archive version whose changes are fully reflected in all tables
 * @param writable  whether the local node owns the archive
 * @param localPath local storage location of the archive, if any
 */
public record IndexMeta(String url,
                        long version,
                        @JsonProperty("isWritable") boolean writable,
                        @Nullable String localPath) {

    public IndexMeta withVersion(final long newVersion) {
        return new IndexMeta(url, newVersion, writable, localPath);
    }
}
