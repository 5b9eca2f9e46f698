package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkDraft;

import java.util.List;

/**
 * Class-specific way of cutting a region into chunks.
 * <p>
 * Contract: emitted spans are exact substrings of the source, ordered by start offset,
 * and together with their overlaps they cover every non-whitespace character of the region.
 */
public interface ChunkingStrategy {

    /**
     * @return the class this strategy handles, or {@code null} for the generic fallback
     */
    DocumentClass documentClass();

    /**
     * Stored in chunk metadata.
     */
    String strategyName();

    List<ChunkDraft> chunk(TextRegion region, ChunkingProfile profile);
}
