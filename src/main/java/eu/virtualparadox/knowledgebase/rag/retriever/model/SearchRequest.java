package eu.virtualparadox.knowledgebase.rag.retriever.model;

import java.time.Duration;

/**
 * A search call. Nullable fields fall back to the configured defaults.
 *
 * @param topK           number of results, {@code null} for the default
 * @param rerank         {@code null} to follow configuration, otherwise forces reranking on or off
 * @param includeContext attach the neighbouring chunks of every result
 * @param timeout        deadline of the call, {@code null} for the configured one
 */
public record SearchRequest(String query,
                            Integer topK,
                            SearchFilters filters,
                            Boolean rerank,
                            boolean includeContext,
                            Duration timeout) {

    public SearchRequest {
        filters = filters == null ? SearchFilters.NONE : filters;
    }

    public static SearchRequest of(final String query, final int topK) {
        return new SearchRequest(query, topK, SearchFilters.NONE, null, false, null);
    }
}
