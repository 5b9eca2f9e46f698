package eu.virtualparadox.knowledgebase.rag.index;

import eu.virtualparadox.knowledgebase.application.config.KnowledgeProperties;
import eu.virtualparadox.knowledgebase.catalog.entity.ChunkEntity;
import eu.virtualparadox.knowledgebase.catalog.entity.DocumentEntity;
import eu.virtualparadox.knowledgebase.catalog.service.DocumentCatalogService;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkMetadata;
import eu.virtualparadox.knowledgebase.rag.embed.EmbeddingService;
import eu.virtualparadox.knowledgebase.rag.index.model.IndexedChunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds the index entries of a document from the catalog:
 * <ol>
 *     <li>Load the chunks of the document's current version</li>
 *     <li>Embed them in batches via {@link EmbeddingService}</li>
 *     <li>Write them pending and switch the version live</li>
 * </ol>
 * <p>
 * Used by garbage collection when the catalog committed a version the index never made
 * visible. The catalog is not modified.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReindexService {

    private final DocumentCatalogService catalogService;
    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndexService;
    private final KnowledgeProperties properties;

    /**
     * @return number of chunks written
     * @throws eu.virtualparadox.knowledgebase.error.NotFoundException if the document is unknown
     */
    public int reindex(final String documentId) {
        final DocumentEntity document = catalogService.getDocument(documentId);
        final int version = document.getCurrentVersion();
        final List<ChunkEntity> chunks = catalogService.liveChunks(documentId, version);

        // leftovers of an earlier attempt would otherwise be published alongside
        vectorIndexService.discardVersion(documentId, version);
        try {
            final int batchSize = Math.max(1, properties.getEmbedding().getBatchSize());
            final List<IndexedChunk> indexed = new ArrayList<>(chunks.size());
            for (int from = 0; from < chunks.size(); from += batchSize) {
                final List<ChunkEntity> batch = chunks.subList(from, Math.min(chunks.size(), from + batchSize));
                final List<float[]> vectors = embeddingService.embedBatch(batch.stream().map(ChunkEntity::getText).toList());
                for (int i = 0; i < batch.size(); i++) {
                    indexed.add(toIndexed(document, batch.get(i), vectors.get(i)));
                }
            }
            vectorIndexService.writePending(indexed);
            vectorIndexService.publish(documentId, version);
        } catch (final RuntimeException e) {
            vectorIndexService.discardVersion(documentId, version);
            throw e;
        }
        log.info("Reindexed version {} of document {} ({} chunks)", version, documentId, chunks.size());
        return chunks.size();
    }

    private static IndexedChunk toIndexed(final DocumentEntity document, final ChunkEntity chunk, final float[] vector) {
        final Object language = chunk.getMetadata() == null ? null : chunk.getMetadata().get(ChunkMetadata.LANGUAGE);
        return new IndexedChunk(chunk.getId(), chunk.getDocumentId(), chunk.getVersion(), chunk.getOrdinal(),
                chunk.getText(), chunk.getStartOffset(), chunk.getEndOffset(), document.getDocumentClass(),
                language == null ? null : language.toString(), document.getKnowledgeBase(), document.getOrigin(),
                chunk.getCreatedAt(), chunk.getMetadata(), vector);
    }
}
