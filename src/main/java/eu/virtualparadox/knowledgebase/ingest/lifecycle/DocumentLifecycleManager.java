package eu.virtualparadox.knowledgebase.ingest.lifecycle;

import eu.virtualparadox.knowledgebase.catalog.service.DocumentCatalogService;
import eu.virtualparadox.knowledgebase.error.ConflictException;
import eu.virtualparadox.knowledgebase.error.NotFoundException;
import eu.virtualparadox.knowledgebase.rag.index.VectorIndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes documents from both stores:
 * <ul>
 *   <li>Catalog (documents, versions, chunks)</li>
 *   <li>Vector index</li>
 * </ul>
 * The catalog goes first; index entries of a document the catalog no longer knows are
 * swept by garbage collection if the second step fails.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentLifecycleManager {

    private final DocumentCatalogService catalogService;
    private final VectorIndexService vectorIndexService;
    private final InFlightDocuments inFlight;

    /**
     * Deletes a document and all associated artifacts.
     *
     * @throws ConflictException if a job for the document is running
     * @throws NotFoundException if the document does not exist
     */
    public void removeDocument(final String documentId) {
        if (!inFlight.tryClaim(documentId)) {
            throw new ConflictException("document " + documentId + " is being ingested");
        }
        try {
            if (!catalogService.removeDocument(documentId)) {
                throw new NotFoundException("document", documentId);
            }
            vectorIndexService.deleteDocument(documentId);
            log.info("Deleted document {} from catalog and index", documentId);
        } finally {
            inFlight.release(documentId);
        }
    }

    /**
     * Removes every document of a knowledge base. Documents with a running job are skipped.
     *
     * @return number of documents removed
     * @throws ConflictException after removing the others, if any document was skipped
     */
    public int clearKnowledgeBase(final String knowledgeBase) {
        final List<String> busy = new ArrayList<>();
        int removed = 0;
        for (final String documentId : catalogService.documentIds(knowledgeBase)) {
            try {
                removeDocument(documentId);
                removed++;
            } catch (final ConflictException e) {
                busy.add(documentId);
            } catch (final NotFoundException e) {
                log.debug("Document {} vanished while clearing {}", documentId, knowledgeBase);
            }
        }
        log.info("Cleared knowledge base {}: {} documents removed", knowledgeBase, removed);
        if (!busy.isEmpty()) {
            throw new ConflictException("removed " + removed + " documents of " + knowledgeBase
                    + " but " + busy.size() + " are being ingested: " + busy);
        }
        return removed;
    }
}
