package eu.virtualparadox.knowledgebase.rag.rerank.model;

import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchResult;

/**
 * @param result the candidate as it came out of fusion
 * @param score  relevance assigned by the reranker (higher = better)
 */
public record RerankResult(SearchResult result, float score) {

}
