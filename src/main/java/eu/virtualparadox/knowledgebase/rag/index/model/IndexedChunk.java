package eu.virtualparadox.knowledgebase.rag.index.model;

import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;

import java.time.Instant;
import java.util.Map;

/**
 * A chunk as written to the index: text, vector and the denormalized filter fields.
 */
public record IndexedChunk(String chunkId,
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
                           Instant createdAt,
                           Map<String, Object> metadata,
                           float[] vector) {
}
