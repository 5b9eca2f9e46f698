package eu.virtualparadox.knowledgebase.api.dto;

import eu.virtualparadox.knowledgebase.catalog.entity.ChunkEntity;

import java.util.Map;

public record ChunkView(String id,
                        int version,
                        int ordinal,
                        String text,
                        int startOffset,
                        int endOffset,
                        int tokenCount,
                        Map<String, Object> metadata,
                        boolean deleted) {

    public static ChunkView of(final ChunkEntity chunk) {
        return new ChunkView(chunk.getId(), chunk.getVersion(), chunk.getOrdinal(), chunk.getText(),
                chunk.getStartOffset(), chunk.getEndOffset(), chunk.getTokenCount(), chunk.getMetadata(),
                chunk.isDeleted());
    }
}
