package eu.virtualparadox.knowledgebase.rag.index.model;

import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;

import java.util.Map;

/**
 * One ranked hit of a vector or lexical search, read back from stored fields.
 *
 * @param score raw similarity (vector) or BM25 score (lexical); only the rank is used for fusion
 */
public record IndexHit(String chunkId,
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
                       float score) {
}
