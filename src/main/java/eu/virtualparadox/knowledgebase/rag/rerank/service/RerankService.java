package eu.virtualparadox.knowledgebase.rag.rerank.service;

import eu.virtualparadox.knowledgebase.rag.rerank.model.RerankResult;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchResult;

import java.util.List;

/**
 * Service interface for re-ranking retrieved search results.
 * <p>
 * A re-ranker assigns a refined relevance score to each candidate by looking at the query
 * and the candidate text together, typically with a cross-encoder. Each pair is scored
 * independently of the others.
 */
public interface RerankService {

    /**
     * Rerank the given candidates for the specified query.
     *
     * @param query      the user query string
     * @param candidates the fused candidates
     * @return every candidate with its score, sorted by descending score
     * @throws RuntimeException when the model fails; callers keep the fused order
     */
    List<RerankResult> rerank(String query, List<SearchResult> candidates);
}
