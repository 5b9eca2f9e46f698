package eu.virtualparadox.knowledgebase.application.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.SearcherFactory;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Opens the chunk index (one Lucene index holding vectors, BM25 text and filter fields)
 * and exposes the writer/searcher pair used by the index and retriever services.
 * <p>Resources are closed on shutdown in the reverse order they were opened.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private final Deque<Closeable> opened = new ArrayDeque<>();

    @Bean
    public Directory luceneDirectory(final StorageConfig storage) throws IOException {
        return track(FSDirectory.open(storage.getIndex()));
    }

    /**
     * Analyzer shared by indexing and query parsing so BM25 terms line up.
     */
    @Bean
    public Analyzer analyzer() {
        return track(new StandardAnalyzer());
    }

    @Bean
    public IndexWriter indexWriter(final Directory directory, final Analyzer analyzer) throws IOException {
        final IndexWriterConfig config = new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND)
                .setSimilarity(new BM25Similarity())
                .setCommitOnClose(true);
        final IndexWriter writer = new IndexWriter(directory, config);
        log.info("Opened chunk index with {} documents", writer.getDocStats().numDocs);
        return track(writer);
    }

    /**
     * Near-real-time searcher manager. Searchers only see what the index service has
     * committed and refreshed, which is how version switches become visible at once.
     */
    @Bean
    public SearcherManager searcherManager(final IndexWriter writer) throws IOException {
        return track(new SearcherManager(writer, new SearcherFactory() {
            @Override
            public IndexSearcher newSearcher(final IndexReader reader, final IndexReader previousReader) {
                final IndexSearcher searcher = new IndexSearcher(reader);
                searcher.setSimilarity(new BM25Similarity());
                return searcher;
            }
        }));
    }

    @PreDestroy
    public void close() {
        while (!opened.isEmpty()) {
            final Closeable resource = opened.pop();
            try {
                resource.close();
            } catch (final IOException | RuntimeException e) {
                log.error("Unable to close {}", resource.getClass().getSimpleName(), e);
            }
        }
    }

    private <T extends Closeable> T track(final T resource) {
        opened.push(resource);
        return resource;
    }
}
