package de.mirkosertic.archiveindexer.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * {@link RecordStore} persisted in a Lucene index.
 * <p>
 * Each entry is one document with the key as an un-analyzed {@code key} field and the value
 * serialized as JSON into a stored {@code value} field. Writes go through
 * {@link IndexWriter#updateDocument(Term, Iterable)} so repeated puts overwrite. Reads use a
 * {@link SearcherManager} on the writer, refreshed before each read so that a read always
 * observes preceding writes of this process.
 * <p>
 * The schema version of the stored data is kept in the commit user data. An existing,
 * non-empty index written with another (or without a) schema version reports
 * {@link #isSchemaUpgradeRequired()}; its version stamp is only updated by {@link #clear()}.
 */
public class LuceneRecordStore<V> implements RecordStore<V> {

    private static final Logger logger = LoggerFactory.getLogger(LuceneRecordStore.class);

    static final String KEY_FIELD = "key";
    static final String VALUE_FIELD = "value";
    static final String SCHEMA_VERSION_KEY = "schema_version";

    private final Path indexPath;
    private final Class<V> valueType;
    private final ObjectMapper objectMapper;
    private final int schemaVersion;

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private volatile boolean schemaUpgradeRequired;

    public LuceneRecordStore(final Path indexPath, final Class<V> valueType,
                             final ObjectMapper objectMapper, final int schemaVersion) {
        this.indexPath = indexPath;
        this.valueType = valueType;
        this.objectMapper = objectMapper;
        this.schemaVersion = schemaVersion;
    }

    /**
     * Open or create the index. Must be called before using the store.
     */
    public void init() throws IOException {
        if (!Files.exists(indexPath)) {
            Files.createDirectories(indexPath);
            logger.info("Created store directory: {}", indexPath.toAbsolutePath());
        }

        directory = FSDirectory.open(indexPath);

        String storedVersion = null;
        if (DirectoryReader.indexExists(directory)) {
            storedVersion = SegmentInfos.readLatestCommit(directory).getUserData().get(SCHEMA_VERSION_KEY);
        }

        final IndexWriterConfig config = new IndexWriterConfig(new StandardAnalyzer());
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        indexWriter = new IndexWriter(directory, config);

        final boolean hasDocuments = indexWriter.getDocStats().numDocs > 0;
        schemaUpgradeRequired = hasDocuments && !String.valueOf(schemaVersion).equals(storedVersion);
        if (schemaUpgradeRequired) {
            logger.warn("Store {} was written with schema version {}, current is {}",
                    indexPath, storedVersion, schemaVersion);
        } else {
            stampSchemaVersion();
        }
        indexWriter.commit();

        searcherManager = new SearcherManager(indexWriter, null);

        logger.info("Record store opened at {} with {} entries", indexPath.toAbsolutePath(),
                indexWriter.getDocStats().numDocs);
    }

    @Override
    public Optional<V> get(final String key) throws IOException {
        final IndexSearcher searcher = acquireFreshSearcher();
        try {
            final TopDocs topDocs = searcher.search(new TermQuery(new Term(KEY_FIELD, key)), 1);
            if (topDocs.scoreDocs.length == 0) {
                return Optional.empty();
            }
            final Document doc = searcher.storedFields().document(topDocs.scoreDocs[0].doc);
            return Optional.of(objectMapper.readValue(doc.get(VALUE_FIELD), valueType));
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public void put(final String key, final V value) throws IOException {
        final Document doc = new Document();
        doc.add(new StringField(KEY_FIELD, key, Field.Store.YES));
        doc.add(new StoredField(VALUE_FIELD, objectMapper.writeValueAsString(value)));
        indexWriter.updateDocument(new Term(KEY_FIELD, key), doc);
    }

    @Override
    public void delete(final String key) throws IOException {
        indexWriter.deleteDocuments(new Term(KEY_FIELD, key));
    }

    @Override
    public void clear() throws IOException {
        indexWriter.deleteAll();
        stampSchemaVersion();
        indexWriter.commit();
        schemaUpgradeRequired = false;
        logger.info("Cleared record store {}", indexPath);
    }

    @Override
    public Map<String, V> entries() throws IOException {
        final Map<String, V> result = new TreeMap<>();
        final IndexSearcher searcher = acquireFreshSearcher();
        try {
            final int numDocs = searcher.getIndexReader().numDocs();
            if (numDocs == 0) {
                return result;
            }
            final TopDocs topDocs = searcher.search(new MatchAllDocsQuery(), numDocs);
            final StoredFields storedFields = searcher.storedFields();
            for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                final Document doc = storedFields.document(scoreDoc.doc);
                result.put(doc.get(KEY_FIELD), objectMapper.readValue(doc.get(VALUE_FIELD), valueType));
            }
            return result;
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public void flush() throws IOException {
        indexWriter.commit();
    }

    @Override
    public boolean isOpen() {
        return indexWriter != null && indexWriter.isOpen();
    }

    @Override
    public boolean isSchemaUpgradeRequired() {
        return schemaUpgradeRequired;
    }

    /**
     * Schema version found in the last commit, or {@code null} for a store without one.
     */
    public String getStoredSchemaVersion() throws IOException {
        return SegmentInfos.readLatestCommit(directory).getUserData().get(SCHEMA_VERSION_KEY);
    }

    @Override
    public void close() throws IOException {
        if (searcherManager != null) {
            searcherManager.close();
        }
        if (indexWriter != null && indexWriter.isOpen()) {
            indexWriter.close();
        }
        if (directory != null) {
            directory.close();
        }
        logger.info("Record store closed: {}", indexPath);
    }

    private IndexSearcher acquireFreshSearcher() throws IOException {
        searcherManager.maybeRefreshBlocking();
        return searcherManager.acquire();
    }

    private void stampSchemaVersion() {
        indexWriter.setLiveCommitData(Map.of(SCHEMA_VERSION_KEY, String.valueOf(schemaVersion)).entrySet());
    }
}
