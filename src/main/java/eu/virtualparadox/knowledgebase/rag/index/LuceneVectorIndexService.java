package eu.virtualparadox.knowledgebase.rag.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.knowledgebase.application.config.KnowledgeProperties;
import eu.virtualparadox.knowledgebase.error.StorageException;
import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import eu.virtualparadox.knowledgebase.rag.index.model.IndexHit;
import eu.virtualparadox.knowledgebase.rag.index.model.IndexedChunk;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchFilters;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.queryparser.classic.QueryParserBase;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.PrefixQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static eu.virtualparadox.knowledgebase.util.LuceneConstants.*;

/**
 * Lucene-backed implementation of {@link VectorIndexService}: one index holding, per chunk,
 * an HNSW vector, a BM25 text field and the denormalized filter fields.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code chunkId}, {@code docId}, {@code documentClass}, {@code language},
 *       {@code knowledgeBase}, {@code origin}: {@link StringField}, stored, used as filters</li>
 *   <li>{@code versionKey}: {@link StringField} {@code docId#version}, the unit of the switch</li>
 *   <li>{@code text}: {@link TextField}, stored, BM25-scored</li>
 *   <li>{@code vector}: {@link KnnFloatVectorField}, cosine similarity</li>
 *   <li>{@code createdAt}: {@link LongPoint} for date-range filters, plus stored copy</li>
 *   <li>{@code lifecycle}: {@link NumericDocValuesField}, pending / live / deleted</li>
 * </ul>
 *
 * <h3>Visibility</h3>
 * Every mutation runs under one lock and ends with a commit followed by a blocking searcher
 * refresh. Searchers only ever match {@code lifecycle = live}, so pending entries of an
 * ingestion attempt stay invisible until {@link #publish(String, int)} flips the new version
 * to live and the old one to deleted in the same commit.
 *
 * <p><b>Vector dimensions:</b> the dimension is recorded in the commit user data. Opening an
 * index built with a different dimension than the configured embedder fails at start-up;
 * reindex into a fresh directory after changing the embedding model.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LuceneVectorIndexService implements VectorIndexService {

    private static final String STAGE = "indexing";
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final Analyzer analyzer;
    private final ObjectMapper objectMapper;
    private final KnowledgeProperties properties;

    private final ReentrantLock writeLock = new ReentrantLock();
    private int dimensions;

    @FunctionalInterface
    private interface IndexMutation {
        void apply() throws IOException;
    }

    @PostConstruct
    public void verifyDimensions() {
        this.dimensions = properties.getEmbedding().getDimensions();
        final Map<String, String> userData = new HashMap<>();
        final Iterable<Map.Entry<String, String>> live = writer.getLiveCommitData();
        if (live != null) {
            live.forEach(e -> userData.put(e.getKey(), e.getValue()));
        }
        final String recorded = userData.get(COMMIT_DIMENSIONS);
        if (recorded != null && Integer.parseInt(recorded) != dimensions) {
            throw new IllegalStateException("Index at " + writer.getDirectory() + " was built with " + recorded
                    + "-dimensional vectors but the embedder is configured for " + dimensions
                    + " (reindex into a fresh index if you changed the embedder)");
        }
        log.info("Chunk index ready: {} entries, {} dimensions", writer.getDocStats().numDocs, dimensions);
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public void writePending(final List<IndexedChunk> chunks) {
        if (chunks.isEmpty()) {
            return;
        }
        for (final IndexedChunk chunk : chunks) {
            if (chunk.vector() == null || chunk.vector().length != dimensions) {
                throw new IllegalArgumentException("Vector of chunk " + chunk.chunkId() + " must have "
                        + dimensions + " dimensions");
            }
        }
        final List<Document> documents = new ArrayList<>(chunks.size());
        for (final IndexedChunk chunk : chunks) {
            documents.add(toDocument(chunk));
        }
        mutate("write pending chunks", () -> {
            for (int i = 0; i < chunks.size(); i++) {
                writer.updateDocument(new Term(FIELD_CHUNK_ID, chunks.get(i).chunkId()), documents.get(i));
            }
        });
        log.debug("Wrote {} pending chunks of {}", chunks.size(),
                versionKey(chunks.get(0).documentId(), chunks.get(0).version()));
    }

    @Override
    public void publish(final String documentId, final int version) {
        mutate("publish version", () -> {
            for (final int live : versionsOf(documentId, LIFECYCLE_LIVE)) {
                if (live != version) {
                    writer.updateNumericDocValue(new Term(FIELD_VERSION_KEY, versionKey(documentId, live)),
                            FIELD_LIFECYCLE, LIFECYCLE_DELETED);
                }
            }
            writer.updateNumericDocValue(new Term(FIELD_VERSION_KEY, versionKey(documentId, version)),
                    FIELD_LIFECYCLE, LIFECYCLE_LIVE);
        });
        log.info("Index switched {} to version {}", documentId, version);
    }

    @Override
    public void discardVersion(final String documentId, final int version) {
        mutate("discard version",
                () -> writer.deleteDocuments(new Term(FIELD_VERSION_KEY, versionKey(documentId, version))));
    }

    @Override
    public void deleteDocument(final String documentId) {
        mutate("delete document", () -> writer.deleteDocuments(new Term(FIELD_DOC_ID, documentId)));
    }

    @Override
    public void deleteChunks(final Collection<String> chunkIds) {
        if (chunkIds.isEmpty()) {
            return;
        }
        final Term[] terms = chunkIds.stream().map(id -> new Term(FIELD_CHUNK_ID, id)).toArray(Term[]::new);
        mutate("delete chunks", () -> writer.deleteDocuments(terms));
    }

    @Override
    public Map<String, Set<Integer>> pendingVersions() {
        final Map<String, Set<Integer>> pending = new TreeMap<>();
        forEachStored(NumericDocValuesField.newSlowExactQuery(FIELD_LIFECYCLE, LIFECYCLE_PENDING),
                d -> pending.computeIfAbsent(d.get(FIELD_DOC_ID), k -> new TreeSet<>())
                        .add(d.getField(FIELD_VERSION).numericValue().intValue()));
        return pending;
    }

    @Override
    public Map<String, Integer> liveVersions() {
        final Map<String, Integer> live = new TreeMap<>();
        forEachStored(NumericDocValuesField.newSlowExactQuery(FIELD_LIFECYCLE, LIFECYCLE_LIVE),
                d -> live.merge(d.get(FIELD_DOC_ID), d.getField(FIELD_VERSION).numericValue().intValue(), Math::max));
        return live;
    }

    @Override
    public int countVersion(final String documentId, final int version) {
        final IndexSearcher searcher = acquire();
        try {
            return searcher.count(new TermQuery(new Term(FIELD_VERSION_KEY, versionKey(documentId, version))));
        } catch (final IOException e) {
            throw new StorageException(STAGE, "count failed", e);
        } finally {
            release(searcher);
        }
    }

    @Override
    public IndexSnapshot openSnapshot() {
        return new LuceneSnapshot(acquire());
    }

    private void mutate(final String action, final IndexMutation mutation) {
        writeLock.lock();
        try {
            mutation.apply();
            writer.setLiveCommitData(Map.of(COMMIT_DIMENSIONS, String.valueOf(dimensions)).entrySet());
            writer.commit();
            searcherManager.maybeRefreshBlocking();
        } catch (final IOException | RuntimeException e) {
            throw new StorageException(STAGE, action + " failed: " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    private Set<Integer> versionsOf(final String documentId, final long lifecycle) {
        final Set<Integer> versions = new TreeSet<>();
        final BooleanQuery query = new BooleanQuery.Builder()
                .add(new TermQuery(new Term(FIELD_DOC_ID, documentId)), BooleanClause.Occur.FILTER)
                .add(NumericDocValuesField.newSlowExactQuery(FIELD_LIFECYCLE, lifecycle), BooleanClause.Occur.FILTER)
                .build();
        forEachStored(query, d -> versions.add(d.getField(FIELD_VERSION).numericValue().intValue()));
        return versions;
    }

    private void forEachStored(final Query query, final Consumer<Document> consumer) {
        final IndexSearcher searcher = acquire();
        try {
            final int total = searcher.count(query);
            if (total == 0) {
                return;
            }
            final TopDocs top = searcher.search(query, total);
            final StoredFields storedFields = searcher.storedFields();
            for (final ScoreDoc sd : top.scoreDocs) {
                consumer.accept(storedFields.document(sd.doc));
            }
        } catch (final IOException e) {
            throw new StorageException(STAGE, "index scan failed", e);
        } finally {
            release(searcher);
        }
    }

    private IndexSearcher acquire() {
        try {
            return searcherManager.acquire();
        } catch (final IOException e) {
            throw new StorageException(STAGE, "unable to open index searcher", e);
        }
    }

    private void release(final IndexSearcher searcher) {
        try {
            searcherManager.release(searcher);
        } catch (final IOException e) {
            log.warn("Unable to release index searcher", e);
        }
    }

    private Document toDocument(final IndexedChunk c) {
        final Document d = new Document();

        // Identifiers
        d.add(new StringField(FIELD_CHUNK_ID, c.chunkId(), Field.Store.YES));
        d.add(new StringField(FIELD_DOC_ID, c.documentId(), Field.Store.YES));
        d.add(new StringField(FIELD_VERSION_KEY, versionKey(c.documentId(), c.version()), Field.Store.NO));
        d.add(new StoredField(FIELD_VERSION, c.version()));
        d.add(new StoredField(FIELD_ORDINAL, c.ordinal()));

        // Filter fields
        d.add(new StringField(FIELD_CLASS, c.documentClass().value(), Field.Store.YES));
        if (c.language() != null) {
            d.add(new StringField(FIELD_LANGUAGE, c.language(), Field.Store.YES));
        }
        d.add(new StringField(FIELD_KNOWLEDGE_BASE, c.knowledgeBase(), Field.Store.YES));
        d.add(new StringField(FIELD_ORIGIN, c.origin() == null ? "" : c.origin(), Field.Store.YES));
        final long createdAt = c.createdAt().toEpochMilli();
        d.add(new LongPoint(FIELD_CREATED_AT, createdAt));
        d.add(new StoredField(FIELD_CREATED_AT, createdAt));

        // Content
        d.add(new TextField(FIELD_TEXT, c.text(), Field.Store.YES));
        d.add(new StoredField(FIELD_START, c.startOffset()));
        d.add(new StoredField(FIELD_END, c.endOffset()));
        d.add(new StoredField(FIELD_METADATA, writeMetadata(c.metadata())));
        d.add(new KnnFloatVectorField(FIELD_VECTOR, c.vector(), VectorSimilarityFunction.COSINE));

        d.add(new NumericDocValuesField(FIELD_LIFECYCLE, LIFECYCLE_PENDING));
        return d;
    }

    private String writeMetadata(final Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException("Chunk metadata is not serializable", e);
        }
    }

    private Map<String, Object> readMetadata(final String json) {
        if (json == null || json.isEmpty()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (final JsonProcessingException e) {
            throw new StorageException(STAGE, "corrupt chunk metadata", e);
        }
    }

    /**
     * Live-only filter plus the caller's restrictions, used as a pre-filter by both searches.
     */
    static Query filterQuery(final SearchFilters filters) {
        final BooleanQuery.Builder b = new BooleanQuery.Builder();
        b.add(NumericDocValuesField.newSlowExactQuery(FIELD_LIFECYCLE, LIFECYCLE_LIVE), BooleanClause.Occur.FILTER);
        anyOf(b, FIELD_CLASS, filters.classes().stream().map(DocumentClass::value).toList());
        anyOf(b, FIELD_LANGUAGE, filters.languages());
        anyOf(b, FIELD_DOC_ID, filters.documentIds());
        anyOf(b, FIELD_KNOWLEDGE_BASE, filters.knowledgeBases());
        if (!filters.pathPrefixes().isEmpty()) {
            final BooleanQuery.Builder prefixes = new BooleanQuery.Builder();
            for (final String prefix : filters.pathPrefixes()) {
                prefixes.add(new PrefixQuery(new Term(FIELD_ORIGIN, prefix)), BooleanClause.Occur.SHOULD);
            }
            b.add(prefixes.setMinimumNumberShouldMatch(1).build(), BooleanClause.Occur.FILTER);
        }
        if (filters.dateFrom() != null || filters.dateTo() != null) {
            final long from = filters.dateFrom() == null ? Long.MIN_VALUE : filters.dateFrom().toEpochMilli();
            final long to = filters.dateTo() == null ? Long.MAX_VALUE : filters.dateTo().toEpochMilli();
            b.add(LongPoint.newRangeQuery(FIELD_CREATED_AT, from, to), BooleanClause.Occur.FILTER);
        }
        return b.build();
    }

    private static void anyOf(final BooleanQuery.Builder b, final String field, final Collection<String> values) {
        if (values.isEmpty()) {
            return;
        }
        final BooleanQuery.Builder any = new BooleanQuery.Builder();
        for (final String value : new TreeSet<>(values)) {
            any.add(new TermQuery(new Term(field, value)), BooleanClause.Occur.SHOULD);
        }
        b.add(any.setMinimumNumberShouldMatch(1).build(), BooleanClause.Occur.FILTER);
    }

    private final class LuceneSnapshot implements IndexSnapshot {

        private final IndexSearcher searcher;

        private LuceneSnapshot(final IndexSearcher searcher) {
            this.searcher = searcher;
        }

        @Override
        public List<IndexHit> knnSearch(final float[] vector, final int k, final SearchFilters filters) {
            if (vector.length != dimensions) {
                throw new IllegalArgumentException("Query vector must have " + dimensions + " dimensions");
            }
            final Query query = new KnnFloatVectorQuery(FIELD_VECTOR, vector, k, filterQuery(filters));
            return run(query, k, "vector search");
        }

        @Override
        public List<IndexHit> lexicalSearch(final String text, final int k, final SearchFilters filters) {
            final Query parsed;
            try {
                parsed = new QueryParser(FIELD_TEXT, analyzer).parse(QueryParserBase.escape(text));
            } catch (final ParseException e) {
                log.warn("Unparseable lexical query, skipping lexical search: {}", e.getMessage());
                return List.of();
            }
            final Query query = new BooleanQuery.Builder()
                    .add(parsed, BooleanClause.Occur.MUST)
                    .add(filterQuery(filters), BooleanClause.Occur.FILTER)
                    .build();
            return run(query, k, "lexical search");
        }

        private List<IndexHit> run(final Query query, final int k, final String action) {
            try {
                final TopDocs top = searcher.search(query, k);
                final StoredFields storedFields = searcher.storedFields();
                final List<IndexHit> hits = new ArrayList<>(top.scoreDocs.length);
                for (final ScoreDoc sd : top.scoreDocs) {
                    hits.add(toHit(storedFields.document(sd.doc), sd.score));
                }
                return hits;
            } catch (final IOException e) {
                throw new StorageException(STAGE, action + " failed", e);
            }
        }

        private IndexHit toHit(final Document d, final float score) {
            final String origin = d.get(FIELD_ORIGIN);
            return new IndexHit(
                    d.get(FIELD_CHUNK_ID),
                    d.get(FIELD_DOC_ID),
                    d.getField(FIELD_VERSION).numericValue().intValue(),
                    d.getField(FIELD_ORDINAL).numericValue().intValue(),
                    d.get(FIELD_TEXT),
                    d.getField(FIELD_START).numericValue().intValue(),
                    d.getField(FIELD_END).numericValue().intValue(),
                    DocumentClass.fromValue(d.get(FIELD_CLASS)),
                    d.get(FIELD_LANGUAGE),
                    d.get(FIELD_KNOWLEDGE_BASE),
                    origin == null || origin.isEmpty() ? null : origin,
                    readMetadata(d.get(FIELD_METADATA)),
                    score);
        }

        @Override
        public void close() {
            release(searcher);
        }
    }
}
