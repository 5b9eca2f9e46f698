package eu.virtualparadox.knowledgebase.ingest.chunker;

/**
 * Size bounds of one chunking strategy.
 *
 * @param minTokens trailing fragments below this size are merged into their predecessor
 * @param maxTokens upper bound of a packed chunk (atomic units such as fenced code may exceed it)
 * @param overlap   declared overlap; tokens for prose, rows for tables, lines for logs
 */
public record ChunkingProfile(int minTokens, int maxTokens, int overlap) {

    public ChunkingProfile {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
        if (minTokens < 0 || minTokens > maxTokens) {
            throw new IllegalArgumentException("minTokens must be within [0, maxTokens]");
        }
        if (overlap < 0 || overlap >= maxTokens) {
            throw new IllegalArgumentException("overlap must be non-negative and less than maxTokens");
        }
    }
}
