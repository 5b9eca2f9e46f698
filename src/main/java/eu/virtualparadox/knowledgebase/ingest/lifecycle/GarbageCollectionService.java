package eu.virtualparadox.knowledgebase.ingest.lifecycle;

import eu.virtualparadox.knowledgebase.application.config.KnowledgeProperties;
import eu.virtualparadox.knowledgebase.catalog.service.DocumentCatalogService;
import eu.virtualparadox.knowledgebase.rag.index.ReindexService;
import eu.virtualparadox.knowledgebase.rag.index.VectorIndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brings the index back in line with the catalog and purges expired data.
 * <p>
 * Each pass:
 * <ol>
 *   <li>purges soft-deleted chunks older than the retention from both stores</li>
 *   <li>publishes pending versions the catalog committed, discards the other pending ones</li>
 *   <li>reindexes documents whose current version is not live in the index</li>
 *   <li>deletes index entries of documents the catalog no longer knows</li>
 * </ol>
 * Documents claimed by a running job are left alone. A failure on one document is logged
 * and the pass moves on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GarbageCollectionService {

    private final DocumentCatalogService catalogService;
    private final VectorIndexService vectorIndexService;
    private final ReindexService reindexService;
    private final InFlightDocuments inFlight;
    private final KnowledgeProperties properties;

    @Scheduled(initialDelayString = "${knowledge.ingestion.gc-interval:PT1H}",
            fixedDelayString = "${knowledge.ingestion.gc-interval:PT1H}")
    public void scheduledCollect() {
        final GcReport report = collect();
        log.info("Garbage collection: {}", report);
    }

    public GcReport collect() {
        final int purged = purge();

        int published = 0;
        int discarded = 0;
        final Map<String, Integer> current = catalogService.currentVersions();
        for (final Map.Entry<String, Set<Integer>> entry : vectorIndexService.pendingVersions().entrySet()) {
            final String documentId = entry.getKey();
            if (!inFlight.tryClaim(documentId)) {
                continue;
            }
            try {
                for (final int version : entry.getValue()) {
                    if (Integer.valueOf(version).equals(current.get(documentId))) {
                        vectorIndexService.publish(documentId, version);
                        published++;
                    } else {
                        vectorIndexService.discardVersion(documentId, version);
                        discarded++;
                    }
                }
            } catch (final RuntimeException e) {
                log.error("Could not reconcile pending entries of {}", documentId, e);
            } finally {
                inFlight.release(documentId);
            }
        }

        int reindexed = 0;
        int orphans = 0;
        final Map<String, Integer> live = vectorIndexService.liveVersions();
        for (final Map.Entry<String, Integer> entry : current.entrySet()) {
            final String documentId = entry.getKey();
            if (entry.getValue().equals(live.get(documentId)) || !inFlight.tryClaim(documentId)) {
                continue;
            }
            try {
                // re-read: an ingestion may have finished since the snapshot
                if (catalogService.findDocument(documentId).isPresent()
                        && !Integer.valueOf(catalogService.latestVersion(documentId))
                        .equals(vectorIndexService.liveVersions().get(documentId))) {
                    reindexService.reindex(documentId);
                    reindexed++;
                }
            } catch (final RuntimeException e) {
                log.error("Could not reindex document {}", documentId, e);
            } finally {
                inFlight.release(documentId);
            }
        }
        for (final String documentId : live.keySet()) {
            if (current.containsKey(documentId) || !inFlight.tryClaim(documentId)) {
                continue;
            }
            try {
                if (catalogService.findDocument(documentId).isEmpty()) {
                    vectorIndexService.deleteDocument(documentId);
                    orphans++;
                }
            } catch (final RuntimeException e) {
                log.error("Could not delete orphaned index entries of {}", documentId, e);
            } finally {
                inFlight.release(documentId);
            }
        }
        return new GcReport(purged, published, discarded, reindexed, orphans);
    }

    private int purge() {
        final Instant cutoff = Instant.now().minus(properties.getIngestion().getRetention());
        try {
            final List<String> ids = catalogService.purgeableChunkIds(cutoff);
            // index first, the catalog rows are what a failed pass retries from
            vectorIndexService.deleteChunks(ids);
            catalogService.purgeChunks(ids);
            if (!ids.isEmpty()) {
                log.info("Purged {} chunks deleted before {}", ids.size(), cutoff);
            }
            return ids.size();
        } catch (final RuntimeException e) {
            log.error("Purging deleted chunks failed", e);
            return 0;
        }
    }
}
