package eu.virtualparadox.knowledgebase.rag.retriever.model;

/**
 * A chunk adjacent to a search result within the same document version.
 */
public record ContextChunk(String chunkId, int ordinal, String text, int startOffset, int endOffset) {
}
