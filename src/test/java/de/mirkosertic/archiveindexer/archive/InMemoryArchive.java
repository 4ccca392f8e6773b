package de.mirkosertic.archiveindexer.archive;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Versioned archive held in memory, for tests.
 * <p>
 * Every {@link #putFile} or {@link #deleteFile} creates a new version. Failures of the archive
 * contract can be injected to simulate unreachable or broken archives.
 */
public class InMemoryArchive implements Archive {

    private final String url;
    private final String localPath;
    private final boolean owner;

    private final Map<String, String> files = new HashMap<>();
    private final List<HistoryEntry> history = new ArrayList<>();
    private final List<String> downloads = new CopyOnWriteArrayList<>();
    private final List<Stream> streams = new CopyOnWriteArrayList<>();
    private final AtomicInteger infoCalls = new AtomicInteger();
    private final AtomicInteger historyCalls = new AtomicInteger();

    private long version;
    private volatile IOException infoFailure;
    private volatile IOException downloadFailure;

    public InMemoryArchive(final String url) {
        this(url, null, true);
    }

    public InMemoryArchive(final String url, final String localPath, final boolean owner) {
        this.url = url;
        this.localPath = localPath;
        this.owner = owner;
    }

    public synchronized long putFile(final String path, final String content) {
        version++;
        files.put(path, content);
        history.add(new HistoryEntry(path, ChangeType.PUT, version));
        return version;
    }

    public synchronized long deleteFile(final String path) {
        version++;
        files.remove(path);
        history.add(new HistoryEntry(path, ChangeType.DELETE, version));
        return version;
    }

    /**
     * Make {@link #getInfo()} fail with {@code failure}, or succeed again for {@code null}.
     */
    public void failInfoWith(final IOException failure) {
        this.infoFailure = failure;
    }

    public void failDownloadsWith(final IOException failure) {
        this.downloadFailure = failure;
    }

    public void fireChanged(final String path) {
        for (final Stream stream : streams) {
            if (!stream.closed) {
                stream.listener.onChanged(path);
            }
        }
    }

    public void fireInvalidated(final String path) {
        for (final Stream stream : streams) {
            if (!stream.closed) {
                stream.listener.onInvalidated(path);
            }
        }
    }

    public long openStreamCount() {
        return streams.stream().filter(stream -> !stream.closed).count();
    }

    public List<String> lastStreamPatterns() {
        return streams.isEmpty() ? List.of() : streams.get(streams.size() - 1).patterns;
    }

    public List<String> getDownloads() {
        return downloads;
    }

    public int getInfoCalls() {
        return infoCalls.get();
    }

    public int getHistoryCalls() {
        return historyCalls.get();
    }

    @Override
    public String getUrl() {
        return url;
    }

    @Override
    public Optional<String> getLocalPath() {
        return Optional.ofNullable(localPath);
    }

    @Override
    public synchronized ArchiveInfo getInfo() throws IOException {
        infoCalls.incrementAndGet();
        if (infoFailure != null) {
            throw infoFailure;
        }
        return new ArchiveInfo(version, owner);
    }

    @Override
    public synchronized List<HistoryEntry> history(final long start, final long end) {
        historyCalls.incrementAndGet();
        return history.stream()
                .filter(entry -> entry.version() >= start && entry.version() < end)
                .toList();
    }

    @Override
    public synchronized String readFile(final String path) throws IOException {
        final String content = files.get(path);
        if (content == null) {
            throw new IOException("No such file: " + path);
        }
        return content;
    }

    @Override
    public void download(final String path) throws IOException {
        downloads.add(path);
        if (downloadFailure != null) {
            throw downloadFailure;
        }
    }

    @Override
    public FileActivityStream createFileActivityStream(final List<String> patterns, final FileActivityListener listener) {
        final Stream stream = new Stream(List.copyOf(patterns), listener);
        streams.add(stream);
        return stream;
    }

    private static class Stream implements FileActivityStream {

        private final List<String> patterns;
        private final FileActivityListener listener;
        private volatile boolean closed;

        Stream(final List<String> patterns, final FileActivityListener listener) {
            this.patterns = patterns;
            this.listener = listener;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
