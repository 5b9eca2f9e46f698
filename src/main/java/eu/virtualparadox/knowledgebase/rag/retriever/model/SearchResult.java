package eu.virtualparadox.knowledgebase.rag.retriever.model;

import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;

import java.util.Map;

/**
 * @param score         final score: the fused RRF score, or the rerank score when reranked
 * @param vectorScore   RRF contribution of the vector list, 0 if absent from it
 * @param lexicalScore  RRF contribution of the lexical list, 0 if absent from it
 * @param rerankScore   cross-encoder score, {@code null} when not reranked
 * @param previous      preceding chunk, {@code null} unless context was requested and one exists
 * @param next          following chunk, {@code null} unless context was requested and one exists
 */
public record SearchResult(String chunkId,
                           String documentId,
                           int version,
                           int ordinal,
                           String text,
                           int startOffset,
                           int endOffset,
                           DocumentClass documentClass,
                           String language,
                           String knowledgeBase,
                           String origin,
                           Map<String, Object> metadata,
                           double score,
                           double vectorScore,
                           double lexicalScore,
                           Float rerankScore,
                           ContextChunk previous,
                           ContextChunk next) {

    public SearchResult withRerankScore(final float rerank) {
        return new SearchResult(chunkId, documentId, version, ordinal, text, startOffset, endOffset, documentClass,
                language, knowledgeBase, origin, metadata, rerank, vectorScore, lexicalScore, rerank, previous, next);
    }

    public SearchResult withContext(final ContextChunk before, final ContextChunk after) {
        return new SearchResult(chunkId, documentId, version, ordinal, text, startOffset, endOffset, documentClass,
                language, knowledgeBase, origin, metadata, score, vectorScore, lexicalScore, rerankScore, before, after);
    }
}
