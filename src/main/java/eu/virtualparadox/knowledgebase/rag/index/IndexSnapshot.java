package eu.virtualparadox.knowledgebase.rag.index;

import eu.virtualparadox.knowledgebase.rag.index.model.IndexHit;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchFilters;

import java.util.List;

/**
 * A point-in-time view of the index. Searches against one snapshot see the same committed
 * state, so the vector and lexical lists of a query agree on which version is visible.
 * Must be closed to release the underlying reader.
 */
public interface IndexSnapshot extends AutoCloseable {

    /**
     * Nearest neighbours of {@code vector} among visible chunks matching {@code filters}.
     * The filter is applied inside the graph search, not to its output.
     */
    List<IndexHit> knnSearch(float[] vector, int k, SearchFilters filters);

    /**
     * BM25-ranked visible chunks matching {@code filters}.
     */
    List<IndexHit> lexicalSearch(String query, int k, SearchFilters filters);

    @Override
    void close();
}
