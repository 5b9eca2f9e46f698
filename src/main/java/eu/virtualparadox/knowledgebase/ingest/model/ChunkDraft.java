package eu.virtualparadox.knowledgebase.ingest.model;

import java.util.Map;

/**
 * Output of a chunking strategy: a span of the (cleaned) source with its size and
 * class-specific metadata. Ids and versions are assigned later by the orchestrator.
 *
 * @param text        exact source substring {@code [startOffset, endOffset)}
 * @param startOffset inclusive start, in chars
 * @param endOffset   exclusive end, in chars
 * @param tokenCount  token estimate of {@code text}
 * @param metadata    class-specific attributes (language, symbol, line range, header path ...)
 */
public record ChunkDraft(String text,
                         int startOffset,
                         int endOffset,
                         int tokenCount,
                         Map<String, Object> metadata) {

    public ChunkDraft {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isPrimary() {
        return !Boolean.FALSE.equals(metadata.get(ChunkMetadata.PRIMARY));
    }
}
