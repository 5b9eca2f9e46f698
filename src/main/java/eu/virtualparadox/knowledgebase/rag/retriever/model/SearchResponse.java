package eu.virtualparadox.knowledgebase.rag.retriever.model;

import java.util.List;

/**
 * @param partial  the deadline passed before every search list completed; results are
 *                 fused from the lists that did
 * @param reranked whether the final order comes from the reranker
 */
public record SearchResponse(List<SearchResult> results, boolean partial, boolean reranked, long tookMillis) {
}
