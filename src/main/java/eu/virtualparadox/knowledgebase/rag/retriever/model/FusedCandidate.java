package eu.virtualparadox.knowledgebase.rag.retriever.model;

/**
 * A chunk's fused score with the contribution of each ranked list.
 */
public record FusedCandidate(String chunkId, double score, double vectorScore, double lexicalScore) {
}
