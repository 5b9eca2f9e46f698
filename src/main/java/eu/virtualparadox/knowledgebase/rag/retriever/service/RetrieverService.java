package eu.virtualparadox.knowledgebase.rag.retriever.service;

import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchRequest;
import eu.virtualparadox.knowledgebase.rag.retriever.model.SearchResponse;

public interface RetrieverService {

    /**
     * @throws eu.virtualparadox.knowledgebase.error.ValidationException for a blank query or a bad top-k
     */
    SearchResponse search(SearchRequest request);

}
